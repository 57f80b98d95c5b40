/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.evaluation;

import com.threatreg.patternengine.api.IPatternMatchingEngine;
import com.threatreg.patternengine.api.ThreatPatternCatalog;
import com.threatreg.patternengine.api.exceptions.LookupException;
import com.threatreg.patternengine.api.exceptions.PatternEvaluationException;
import com.threatreg.patternengine.api.exceptions.RecordNotFoundException;
import com.threatreg.patternengine.api.exceptions.StorageException;
import com.threatreg.patternengine.api.inventory.EntityInventory;
import com.threatreg.patternengine.api.inventory.ProductCatalog;
import com.threatreg.patternengine.api.inventory.RelationshipStore;
import com.threatreg.patternengine.api.inventory.TagAssignments;
import com.threatreg.patternengine.api.model.Entity;
import com.threatreg.patternengine.api.model.ThreatPattern;
import com.threatreg.patternengine.api.model.ThreatPatternMatch;
import com.threatreg.patternengine.compiler.ConditionCompiler;
import com.threatreg.patternengine.compiler.model.CompiledPattern;
import com.threatreg.patternengine.runtime.lookup.LookupCache;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Evaluates inventory entities against threat patterns.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Load the entity (or whole inventory) and the pattern (or active pattern set).</li>
 *   <li>Compile every pattern once with {@link ConditionCompiler}.</li>
 *   <li>Run {@link PatternEvaluator} for each entity/pattern pair and collect a
 *       {@link ThreatPatternMatch} for every pair that matches.</li>
 * </ol>
 *
 * <h2>Failures</h2>
 * <p>
 * A lookup failure inside a condition is fail-closed (see {@link ConditionEvaluator}).
 * Failing to load the inventory or the active pattern set raises
 * {@link PatternEvaluationException}; nothing is returned for that run.
 *
 * <h2>Batch Runs</h2>
 * <p>
 * {@link #evaluateAllAgainstActivePatterns()} wraps the lookups in a {@link LookupCache}
 * that lives only for the run. With an executor and a parallelism above 1, entities are
 * evaluated concurrently; the result map still follows inventory order and each entity's
 * matches still follow pattern order.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Thread-safe. The engine holds no mutable state.
 */
public final class PatternMatchingEngine implements IPatternMatchingEngine {
    private static final Logger logger = LoggerFactory.getLogger(PatternMatchingEngine.class);

    private final EntityInventory entityInventory;
    private final ThreatPatternCatalog patternCatalog;
    private final ProductCatalog productCatalog;
    private final TagAssignments tagAssignments;
    private final RelationshipStore relationshipStore;
    private final ConditionCompiler compiler;
    private final Tracer tracer;
    private final EvaluationSettings settings;
    private final ExecutorService executor;

    /**
     * Creates an engine that evaluates batches on the calling thread.
     */
    public PatternMatchingEngine(EntityInventory entityInventory,
                                 ThreatPatternCatalog patternCatalog,
                                 ProductCatalog productCatalog,
                                 TagAssignments tagAssignments,
                                 RelationshipStore relationshipStore,
                                 Tracer tracer) {
        this(entityInventory, patternCatalog, productCatalog, tagAssignments, relationshipStore,
                new ConditionCompiler(), tracer, EvaluationSettings.defaults(), null);
    }

    /**
     * Creates an engine with full configuration.
     *
     * @param executor runs batch evaluations when {@code settings.parallelism() > 1};
     *                 may be {@code null}, in which case batches run on the calling thread.
     *                 The engine never shuts it down.
     */
    public PatternMatchingEngine(EntityInventory entityInventory,
                                 ThreatPatternCatalog patternCatalog,
                                 ProductCatalog productCatalog,
                                 TagAssignments tagAssignments,
                                 RelationshipStore relationshipStore,
                                 ConditionCompiler compiler,
                                 Tracer tracer,
                                 EvaluationSettings settings,
                                 ExecutorService executor) {
        this.entityInventory = entityInventory;
        this.patternCatalog = patternCatalog;
        this.productCatalog = productCatalog;
        this.tagAssignments = tagAssignments;
        this.relationshipStore = relationshipStore;
        this.compiler = compiler;
        this.tracer = tracer;
        this.settings = settings;
        this.executor = executor;
        logger.info("PatternMatchingEngine initialized: {}, executor={}", settings, executor != null);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SINGLE EVALUATIONS
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public List<ThreatPatternMatch> evaluate(Entity entity, ThreatPattern pattern) {
        PatternEvaluator evaluator = directEvaluator();
        CompiledPattern compiled = compiler.compile(pattern);
        return evaluator.matches(entity, compiled)
                ? List.of(ThreatPatternMatch.of(entity, pattern))
                : List.of();
    }

    @Override
    public List<ThreatPatternMatch> evaluateOne(UUID entityId, UUID patternId) {
        Entity entity = loadEntity(entityId);
        ThreatPattern pattern;
        try {
            pattern = patternCatalog.findById(patternId)
                    .orElseThrow(() -> new RecordNotFoundException("threat pattern", patternId));
        } catch (StorageException e) {
            throw new PatternEvaluationException("Failed to load threat pattern " + patternId, e);
        }
        return evaluate(entity, pattern);
    }

    @Override
    public List<ThreatPatternMatch> evaluateEntityAgainstActivePatterns(UUID entityId) {
        return evaluateEntityAgainstActivePatterns(loadEntity(entityId));
    }

    @Override
    public List<ThreatPatternMatch> evaluateEntityAgainstActivePatterns(Entity entity) {
        Span span = tracer.spanBuilder("evaluate-entity").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("entityId", entity.id().toString());

            List<CompiledPattern> patterns = loadActivePatterns();
            List<ThreatPatternMatch> matches = matchEntity(entity, patterns, directEvaluator());

            span.setAttribute("patternCount", patterns.size());
            span.setAttribute("matchCount", matches.size());
            return matches;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // BATCH EVALUATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public Map<UUID, List<ThreatPatternMatch>> evaluateAllAgainstActivePatterns() {
        Span span = tracer.spanBuilder("evaluate-all").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();

            List<Entity> entities = loadInventory();
            List<CompiledPattern> patterns = loadActivePatterns();
            span.setAttribute("entityCount", entities.size());
            span.setAttribute("patternCount", patterns.size());

            PatternEvaluator evaluator = batchEvaluator();
            List<List<ThreatPatternMatch>> perEntity = settings.isParallel() && executor != null
                    ? evaluateParallel(entities, patterns, evaluator)
                    : evaluateSequential(entities, patterns, evaluator);

            Map<UUID, List<ThreatPatternMatch>> results = new LinkedHashMap<>();
            int matchCount = 0;
            for (int i = 0; i < entities.size(); i++) {
                List<ThreatPatternMatch> matches = perEntity.get(i);
                if (!matches.isEmpty()) {
                    results.put(entities.get(i).id(), matches);
                    matchCount += matches.size();
                }
            }

            span.setAttribute("exposedEntityCount", results.size());
            span.setAttribute("matchCount", matchCount);
            logger.debug("Evaluated {} entities against {} active patterns in {}ms: {} matches",
                    entities.size(), patterns.size(), (System.nanoTime() - start) / 1_000_000, matchCount);
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<List<ThreatPatternMatch>> evaluateSequential(List<Entity> entities,
                                                              List<CompiledPattern> patterns,
                                                              PatternEvaluator evaluator) {
        List<List<ThreatPatternMatch>> perEntity = new ArrayList<>(entities.size());
        for (Entity entity : entities) {
            perEntity.add(matchEntity(entity, patterns, evaluator));
        }
        return perEntity;
    }

    private List<List<ThreatPatternMatch>> evaluateParallel(List<Entity> entities,
                                                            List<CompiledPattern> patterns,
                                                            PatternEvaluator evaluator) {
        List<CompletableFuture<List<ThreatPatternMatch>>> futures = new ArrayList<>(entities.size());
        for (Entity entity : entities) {
            futures.add(CompletableFuture.supplyAsync(() -> matchEntity(entity, patterns, evaluator), executor));
        }

        List<List<ThreatPatternMatch>> perEntity = new ArrayList<>(entities.size());
        try {
            for (CompletableFuture<List<ThreatPatternMatch>> future : futures) {
                perEntity.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return perEntity;
    }

    private static List<ThreatPatternMatch> matchEntity(Entity entity,
                                                        List<CompiledPattern> patterns,
                                                        PatternEvaluator evaluator) {
        List<ThreatPatternMatch> matches = new ArrayList<>();
        for (CompiledPattern pattern : patterns) {
            if (evaluator.matches(entity, pattern)) {
                matches.add(ThreatPatternMatch.of(entity, pattern.source()));
            }
        }
        return matches;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LOADING
    // ════════════════════════════════════════════════════════════════════════════════

    private Entity loadEntity(UUID entityId) {
        try {
            return entityInventory.getEntity(entityId)
                    .orElseThrow(() -> new RecordNotFoundException("entity", entityId));
        } catch (LookupException e) {
            throw new PatternEvaluationException("Failed to load entity " + entityId, e);
        }
    }

    private List<Entity> loadInventory() {
        try {
            return entityInventory.listEntities();
        } catch (LookupException e) {
            throw new PatternEvaluationException("Failed to load entity inventory", e);
        }
    }

    private List<CompiledPattern> loadActivePatterns() {
        List<ThreatPattern> active;
        try {
            active = patternCatalog.listActive();
        } catch (StorageException e) {
            throw new PatternEvaluationException("Failed to load active threat patterns", e);
        }
        return compiler.compileAll(active);
    }

    private PatternEvaluator directEvaluator() {
        return new PatternEvaluator(new ConditionEvaluator(productCatalog, tagAssignments, relationshipStore));
    }

    private PatternEvaluator batchEvaluator() {
        if (!settings.isLookupCacheEnabled()) {
            return directEvaluator();
        }
        LookupCache cache = new LookupCache(productCatalog, tagAssignments, relationshipStore,
                settings.lookupCacheSize());
        return new PatternEvaluator(new ConditionEvaluator(cache, cache, cache));
    }
}
