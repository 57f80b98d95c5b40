/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.evaluation;

import com.threatreg.patternengine.api.ThreatPatternCatalog;
import com.threatreg.patternengine.api.exceptions.ErrorCode;
import com.threatreg.patternengine.api.exceptions.PatternEvaluationException;
import com.threatreg.patternengine.api.exceptions.RecordNotFoundException;
import com.threatreg.patternengine.api.exceptions.StorageException;
import com.threatreg.patternengine.api.model.Entity;
import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.ThreatPattern;
import com.threatreg.patternengine.api.model.ThreatPatternMatch;
import com.threatreg.patternengine.compiler.ConditionCompiler;
import com.threatreg.patternengine.runtime.InMemoryInventory;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.threatreg.patternengine.api.model.ConditionType.RELATIONSHIP_TARGET_TAG;
import static com.threatreg.patternengine.api.model.ConditionType.TAG;
import static com.threatreg.patternengine.api.model.PatternOperator.CONTAINS;
import static com.threatreg.patternengine.api.model.PatternOperator.EXISTS;
import static com.threatreg.patternengine.api.model.PatternOperator.HAS_RELATIONSHIP_WITH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class PatternMatchingEngineTest {

    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    private InMemoryInventory inventory;
    private PatternMatchingEngine engine;

    private Entity exposedApi;
    private Entity ordersDb;

    @BeforeEach
    void setUp() {
        inventory = new InMemoryInventory();
        engine = new PatternMatchingEngine(inventory, inventory, inventory, inventory, inventory, TRACER);

        exposedApi = inventory.addEntity("exposed-api");
        ordersDb = inventory.addEntity("orders-db");
        inventory.tagEntity(exposedApi.id(), "internet-facing");
        inventory.tagEntity(ordersDb.id(), "database");
        inventory.relate(exposedApi.id(), "connects_to", ordersDb.id());
    }

    private static ThreatPattern pattern(String name, boolean active, PatternCondition... conditions) {
        return new ThreatPattern(UUID.randomUUID(), name, null, UUID.randomUUID(), active, List.of(conditions));
    }

    private static ThreatPattern exposedDatabasePattern(boolean active) {
        return pattern("exposed-database", active,
                PatternCondition.draft(TAG, CONTAINS, "internet-facing"),
                PatternCondition.draft(RELATIONSHIP_TARGET_TAG, HAS_RELATIONSHIP_WITH, "database", "connects_to"));
    }

    @Nested
    @DisplayName("Single evaluations")
    class SingleEvaluations {

        @Test
        @DisplayName("Should match an internet-facing entity connected to a database")
        void shouldMatchExposedDatabase() {
            // given
            ThreatPattern pattern = exposedDatabasePattern(true);

            // when
            List<ThreatPatternMatch> matches = engine.evaluate(exposedApi, pattern);

            // then
            assertThat(matches).hasSize(1);
            ThreatPatternMatch match = matches.get(0);
            assertThat(match.entityId()).isEqualTo(exposedApi.id());
            assertThat(match.patternId()).isEqualTo(pattern.id());
            assertThat(match.threatId()).isEqualTo(pattern.threatId());
            assertThat(match.pattern()).isEqualTo(pattern);
        }

        @Test
        @DisplayName("Should not match when a required tag is missing")
        void shouldNotMatchMissingTag() {
            ThreatPattern pattern = pattern("privileged-database", true,
                    PatternCondition.draft(TAG, CONTAINS, "privileged"),
                    PatternCondition.draft(RELATIONSHIP_TARGET_TAG, HAS_RELATIONSHIP_WITH, "database", "connects_to"));

            assertThat(engine.evaluate(exposedApi, pattern)).isEmpty();
        }

        @Test
        @DisplayName("Should match EXISTS on tags only for tagged entities")
        void shouldMatchTagExistence() {
            Entity untagged = inventory.addEntity("bare");
            ThreatPattern pattern = pattern("any-tag", true, PatternCondition.draft(TAG, EXISTS, ""));

            assertThat(engine.evaluate(untagged, pattern)).isEmpty();
            assertThat(engine.evaluate(ordersDb, pattern)).hasSize(1);
        }

        @Test
        @DisplayName("Should never match an inactive pattern")
        void shouldNotMatchInactivePattern() {
            ThreatPattern pattern = exposedDatabasePattern(false);

            assertThat(engine.evaluate(exposedApi, pattern)).isEmpty();
            assertThat(engine.evaluate(ordersDb, pattern)).isEmpty();
        }

        @Test
        @DisplayName("Should load entity and pattern by id")
        void shouldEvaluateOneById() {
            ThreatPattern pattern = inventory.addPattern(exposedDatabasePattern(true));

            assertThat(engine.evaluateOne(exposedApi.id(), pattern.id())).hasSize(1);
            assertThat(engine.evaluateOne(ordersDb.id(), pattern.id())).isEmpty();
        }

        @Test
        @DisplayName("Should report unknown entities and patterns as not found")
        void shouldReportUnknownIds() {
            ThreatPattern pattern = inventory.addPattern(exposedDatabasePattern(true));
            UUID unknown = UUID.randomUUID();

            assertThatThrownBy(() -> engine.evaluateOne(unknown, pattern.id()))
                    .isInstanceOf(RecordNotFoundException.class)
                    .hasMessageContaining("entity");
            assertThatThrownBy(() -> engine.evaluateOne(exposedApi.id(), unknown))
                    .isInstanceOf(RecordNotFoundException.class)
                    .hasMessageContaining("threat pattern");
        }

        @Test
        @DisplayName("Should evaluate an entity against active patterns in pattern order")
        void shouldEvaluateEntityAgainstActivePatterns() {
            // given
            ThreatPattern first = inventory.addPattern(exposedDatabasePattern(true));
            inventory.addPattern(exposedDatabasePattern(false));
            ThreatPattern catchAll = inventory.addPattern(pattern("catch-all", true));

            // when
            List<ThreatPatternMatch> matches = engine.evaluateEntityAgainstActivePatterns(exposedApi.id());

            // then
            assertThat(matches).extracting(ThreatPatternMatch::patternId)
                    .containsExactly(first.id(), catchAll.id());
        }
    }

    @Nested
    @DisplayName("Batch evaluation")
    class BatchEvaluation {

        private ExecutorService executor;

        @AfterEach
        void tearDown() {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should return only entities with matches, in inventory order")
        void shouldReturnMatchingEntitiesOnly() {
            // given
            Entity isolated = inventory.addEntity("isolated");
            inventory.tagEntity(isolated.id(), "internet-facing");
            ThreatPattern exposed = inventory.addPattern(exposedDatabasePattern(true));
            ThreatPattern anyTag = inventory.addPattern(pattern("any-tag", true, PatternCondition.draft(TAG, EXISTS, "")));
            inventory.addEntity("untagged");

            // when
            Map<UUID, List<ThreatPatternMatch>> results = engine.evaluateAllAgainstActivePatterns();

            // then
            assertThat(results.keySet()).containsExactly(exposedApi.id(), ordersDb.id(), isolated.id());
            assertThat(results.get(exposedApi.id())).extracting(ThreatPatternMatch::patternId)
                    .containsExactly(exposed.id(), anyTag.id());
            assertThat(results.get(ordersDb.id())).extracting(ThreatPatternMatch::patternId)
                    .containsExactly(anyTag.id());
        }

        @Test
        @DisplayName("Should return an empty map without active patterns")
        void shouldReturnEmptyWithoutActivePatterns() {
            inventory.addPattern(exposedDatabasePattern(false));

            assertThat(engine.evaluateAllAgainstActivePatterns()).isEmpty();
        }

        @Test
        @DisplayName("Should produce the same result when run twice")
        void shouldBeRepeatable() {
            inventory.addPattern(exposedDatabasePattern(true));

            assertThat(engine.evaluateAllAgainstActivePatterns())
                    .isEqualTo(engine.evaluateAllAgainstActivePatterns());
        }

        @Test
        @DisplayName("Should keep inventory and pattern order when evaluating in parallel")
        void shouldKeepOrderInParallel() {
            // given
            List<UUID> expectedOrder = new ArrayList<>();
            expectedOrder.add(exposedApi.id());
            expectedOrder.add(ordersDb.id());
            for (int i = 0; i < 50; i++) {
                Entity entity = inventory.addEntity("host-" + i);
                inventory.tagEntity(entity.id(), "managed");
                expectedOrder.add(entity.id());
            }
            ThreatPattern anyTag = inventory.addPattern(pattern("any-tag", true, PatternCondition.draft(TAG, EXISTS, "")));
            ThreatPattern catchAll = inventory.addPattern(pattern("catch-all", true));
            executor = Executors.newFixedThreadPool(4);
            PatternMatchingEngine parallelEngine = new PatternMatchingEngine(
                    inventory, inventory, inventory, inventory, inventory,
                    new ConditionCompiler(), TRACER,
                    EvaluationSettings.builder().parallelism(4).build(), executor);

            // when
            Map<UUID, List<ThreatPatternMatch>> results = parallelEngine.evaluateAllAgainstActivePatterns();

            // then
            assertThat(results.keySet()).containsExactlyElementsOf(expectedOrder);
            assertThat(results.values()).allSatisfy(matches ->
                    assertThat(matches).extracting(ThreatPatternMatch::patternId)
                            .containsExactly(anyTag.id(), catchAll.id()));
        }

        @Test
        @DisplayName("Should share lookups across a batch run")
        void shouldCacheLookupsWithinRun() {
            // given
            for (int i = 0; i < 3; i++) {
                inventory.addPattern(pattern("tagged-" + i, true, PatternCondition.draft(TAG, EXISTS, "")));
            }

            // when
            engine.evaluateAllAgainstActivePatterns();

            // then: exposedApi and ordersDb looked up once each
            assertThat(inventory.entityTagLookups.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should go to the inventory for every lookup with caching disabled")
        void shouldBypassCacheWhenDisabled() {
            // given
            for (int i = 0; i < 3; i++) {
                inventory.addPattern(pattern("tagged-" + i, true, PatternCondition.draft(TAG, EXISTS, "")));
            }
            PatternMatchingEngine uncached = new PatternMatchingEngine(
                    inventory, inventory, inventory, inventory, inventory,
                    new ConditionCompiler(), TRACER,
                    EvaluationSettings.builder().lookupCacheSize(0).build(), null);

            // when
            uncached.evaluateAllAgainstActivePatterns();

            // then
            assertThat(inventory.entityTagLookups.get()).isEqualTo(6);
        }

        @Test
        @DisplayName("Should treat failing lookups as non-matching and carry on")
        void shouldContinuePastLookupFailures() {
            // given
            ThreatPattern anyTag = inventory.addPattern(pattern("any-tag", true, PatternCondition.draft(TAG, EXISTS, "")));
            inventory.failTagLookupsFor(exposedApi.id());

            // when
            Map<UUID, List<ThreatPatternMatch>> results = engine.evaluateAllAgainstActivePatterns();

            // then
            assertThat(results).containsOnlyKeys(ordersDb.id());
            assertThat(results.get(ordersDb.id())).extracting(ThreatPatternMatch::patternId)
                    .containsExactly(anyTag.id());
        }
    }

    @Nested
    @DisplayName("Load failures")
    class LoadFailures {

        @Test
        @DisplayName("Should fail the run when the inventory cannot be listed")
        void shouldFailOnInventory() {
            inventory.addPattern(exposedDatabasePattern(true));
            inventory.failInventory();

            assertThatThrownBy(() -> engine.evaluateAllAgainstActivePatterns())
                    .isInstanceOf(PatternEvaluationException.class)
                    .satisfies(e -> assertThat(((PatternEvaluationException) e).getErrorCode())
                            .isEqualTo(ErrorCode.EVALUATION_FAILED));
            assertThatThrownBy(() -> engine.evaluateEntityAgainstActivePatterns(exposedApi.id()))
                    .isInstanceOf(PatternEvaluationException.class);
        }

        @Test
        @DisplayName("Should fail the run when active patterns cannot be listed")
        void shouldFailOnPatternCatalog() {
            inventory.failPatternCatalog();

            assertThatThrownBy(() -> engine.evaluateAllAgainstActivePatterns())
                    .isInstanceOf(PatternEvaluationException.class)
                    .hasCauseInstanceOf(StorageException.class);
            assertThatThrownBy(() -> engine.evaluateEntityAgainstActivePatterns(exposedApi))
                    .isInstanceOf(PatternEvaluationException.class);
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Pattern lookup by id")
    class PatternLookup {

        @Mock
        ThreatPatternCatalog catalog;

        @Test
        @DisplayName("Should wrap a storage failure while loading the pattern")
        void shouldWrapStorageFailure() {
            // given
            when(catalog.findById(any())).thenThrow(new StorageException("boom", new SQLException("down")));
            PatternMatchingEngine failing = new PatternMatchingEngine(
                    inventory, catalog, inventory, inventory, inventory, TRACER);

            // when / then
            assertThatThrownBy(() -> failing.evaluateOne(exposedApi.id(), UUID.randomUUID()))
                    .isInstanceOf(PatternEvaluationException.class)
                    .hasCauseInstanceOf(StorageException.class);
        }
    }
}
