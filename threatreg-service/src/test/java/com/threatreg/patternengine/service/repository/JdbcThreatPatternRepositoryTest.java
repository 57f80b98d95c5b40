/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import com.threatreg.patternengine.api.exceptions.StorageException;
import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.ThreatPattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.threatreg.patternengine.api.model.ConditionType.RELATIONSHIP;
import static com.threatreg.patternengine.api.model.ConditionType.TAG;
import static com.threatreg.patternengine.api.model.PatternOperator.CONTAINS;
import static com.threatreg.patternengine.api.model.PatternOperator.EXISTS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcThreatPatternRepositoryTest {

    private TestDatabase db;
    private JdbcThreatPatternRepository patterns;
    private JdbcPatternConditionRepository conditions;
    private UUID threatId;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        patterns = db.patternRepository();
        conditions = db.conditionRepository();
        threatId = db.insertThreat("SQL injection");
    }

    @AfterEach
    void tearDown() {
        db.drop();
    }

    private ThreatPattern store(String name, boolean active, PatternCondition... drafts) {
        return db.transactions().inTransaction("store pattern", conn -> {
            ThreatPattern pattern = patterns.insert(conn,
                    new ThreatPattern(null, name, "desc", threatId, active, List.of()));
            for (PatternCondition draft : drafts) {
                conditions.insert(conn, pattern.id(), draft);
            }
            return pattern;
        });
    }

    @Test
    @DisplayName("Should store a pattern and read it back with conditions in order")
    void shouldRoundTripPatternWithConditions() {
        // given
        ThreatPattern stored = store("exposed-db", true,
                PatternCondition.draft(TAG, CONTAINS, "internet-facing"),
                PatternCondition.draft(RELATIONSHIP, EXISTS, null, "connects_to"));

        // when
        ThreatPattern loaded = patterns.findById(stored.id()).orElseThrow();

        // then
        assertThat(loaded.name()).isEqualTo("exposed-db");
        assertThat(loaded.threatId()).isEqualTo(threatId);
        assertThat(loaded.active()).isTrue();
        assertThat(loaded.conditions()).extracting(PatternCondition::conditionType)
                .containsExactly("TAG", "RELATIONSHIP");
        assertThat(loaded.conditions()).allSatisfy(c -> assertThat(c.patternId()).isEqualTo(stored.id()));
        assertThat(loaded.conditions().get(1).relationshipType()).isEqualTo("connects_to");
    }

    @Test
    @DisplayName("Should list active patterns only")
    void shouldListActivePatterns() {
        ThreatPattern active = store("active", true, PatternCondition.draft(TAG, EXISTS, ""));
        store("inactive", false);

        assertThat(patterns.listAll()).hasSize(2);
        assertThat(patterns.listActive()).extracting(ThreatPattern::id).containsExactly(active.id());
        assertThat(patterns.listActive().get(0).conditions()).hasSize(1);
    }

    @Test
    @DisplayName("Should list patterns by threat")
    void shouldListByThreat() {
        store("first", true);
        UUID otherThreat = db.insertThreat("XSS");

        assertThat(patterns.listByThreat(threatId)).hasSize(1);
        assertThat(patterns.listByThreat(otherThreat)).isEmpty();
    }

    @Test
    @DisplayName("Should toggle the active flag and report missing rows")
    void shouldSetActive() {
        ThreatPattern stored = store("toggle", true);

        boolean updated = db.transactions().inTransaction("deactivate",
                conn -> patterns.setActive(conn, stored.id(), false));
        boolean missing = db.transactions().inTransaction("deactivate missing",
                conn -> patterns.setActive(conn, UUID.randomUUID(), false));

        assertThat(updated).isTrue();
        assertThat(missing).isFalse();
        assertThat(patterns.findById(stored.id()).orElseThrow().active()).isFalse();
    }

    @Test
    @DisplayName("Should remove conditions together with their pattern")
    void shouldCascadeDelete() {
        ThreatPattern stored = store("doomed", true, PatternCondition.draft(TAG, EXISTS, ""));

        boolean deleted = db.transactions().inTransaction("delete", conn -> patterns.delete(conn, stored.id()));

        assertThat(deleted).isTrue();
        assertThat(patterns.findById(stored.id())).isEmpty();
        assertThat(db.countRows("pattern_conditions")).isZero();
    }

    @Test
    @DisplayName("Should group conditions by pattern")
    void shouldGroupConditions() {
        ThreatPattern first = store("first", true,
                PatternCondition.draft(TAG, EXISTS, ""), PatternCondition.draft(TAG, CONTAINS, "pii"));
        ThreatPattern second = store("second", true, PatternCondition.draft(TAG, CONTAINS, "pci"));

        Map<UUID, List<PatternCondition>> grouped = db.transactions().withConnection("group",
                conditions::findAllGroupedByPattern);

        assertThat(grouped.get(first.id())).extracting(PatternCondition::value).containsExactly("", "pii");
        assertThat(grouped.get(second.id())).extracting(PatternCondition::value).containsExactly("pci");
    }

    @Test
    @DisplayName("Should roll back every write when the transaction fails")
    void shouldRollBackOnFailure() {
        // when
        assertThatThrownBy(() -> db.transactions().inTransaction("failing write", conn -> {
            patterns.insert(conn, new ThreatPattern(null, "half", null, threatId, true, List.of()));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        // then
        assertThat(db.countRows("threat_patterns")).isZero();
    }

    @Test
    @DisplayName("Should wrap SQL failures in a storage exception")
    void shouldWrapSqlFailures() {
        // given: a threat id with no row behind it
        ThreatPattern orphan = new ThreatPattern(null, "orphan", null, UUID.randomUUID(), true, List.of());

        // when / then
        assertThatThrownBy(() -> db.transactions().inTransaction("store orphan pattern",
                conn -> patterns.insert(conn, orphan)))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("store orphan pattern");
        assertThat(db.countRows("threat_patterns")).isZero();
    }
}
