/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.service;

import com.threatreg.patternengine.api.exceptions.ConditionValidationException;
import com.threatreg.patternengine.api.exceptions.RecordNotFoundException;
import com.threatreg.patternengine.api.exceptions.ReferenceNotFoundException;
import com.threatreg.patternengine.api.model.ConditionUpdate;
import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.PatternUpdate;
import com.threatreg.patternengine.api.model.ThreatPattern;
import com.threatreg.patternengine.compiler.ConditionValidator;
import com.threatreg.patternengine.service.repository.JdbcPatternConditionRepository;
import com.threatreg.patternengine.service.repository.JdbcThreatPatternRepository;
import com.threatreg.patternengine.service.repository.TransactionRunner;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Transactional management of threat patterns and their conditions.
 *
 * <p>This service enforces:
 * <ul>
 *   <li>the referenced threat exists when a pattern is created, and whenever an update
 *       changes it</li>
 *   <li>conditions are only added to existing patterns</li>
 *   <li>every condition passes {@link ConditionValidator} before it is written</li>
 * </ul>
 *
 * <p>Each write runs in one database transaction; a failure leaves no partial state.
 */
@ApplicationScoped
public class ThreatPatternService {

    private static final Logger logger = Logger.getLogger(ThreatPatternService.class.getName());

    @Inject
    TransactionRunner transactions;

    @Inject
    JdbcThreatPatternRepository patternRepository;

    @Inject
    JdbcPatternConditionRepository conditionRepository;

    @Inject
    ConditionValidator validator;

    @Inject
    Tracer tracer;

    // ========================================
    // Patterns
    // ========================================

    /**
     * Creates a pattern without conditions.
     *
     * @throws ReferenceNotFoundException if the threat does not exist
     */
    public ThreatPattern createPattern(String name, String description, UUID threatId, boolean active) {
        return createPatternWithConditions(name, description, threatId, active, List.of());
    }

    /**
     * Creates a pattern and all of its conditions atomically. Conditions keep the given
     * order. If the threat is missing or any condition is invalid, nothing is stored.
     *
     * @throws ReferenceNotFoundException   if the threat does not exist
     * @throws ConditionValidationException naming the index of the first invalid condition
     */
    public ThreatPattern createPatternWithConditions(String name, String description, UUID threatId,
                                                     boolean active, List<PatternCondition> conditions) {
        return traced("create-threat-pattern", span -> {
            span.setAttribute("threatId", String.valueOf(threatId));
            span.setAttribute("conditionCount", conditions.size());

            ThreatPattern created = transactions.inTransaction("create threat pattern", conn -> {
                requireThreat(conn, threatId);
                ThreatPattern pattern = patternRepository.insert(conn,
                        new ThreatPattern(null, name, description, threatId, active, List.of()));

                List<PatternCondition> stored = new ArrayList<>(conditions.size());
                for (int i = 0; i < conditions.size(); i++) {
                    try {
                        validator.validateOrThrow(conditions.get(i));
                    } catch (ConditionValidationException e) {
                        throw e.atIndex(i);
                    }
                    stored.add(conditionRepository.insert(conn, pattern.id(), conditions.get(i)));
                }
                return pattern.withConditions(stored);
            });

            span.setAttribute("patternId", created.id().toString());
            logger.info("Created threat pattern " + created.id() + " (" + name + ") with "
                    + created.conditions().size() + " conditions");
            return created;
        });
    }

    /**
     * @throws RecordNotFoundException if the pattern does not exist
     */
    public ThreatPattern getPattern(UUID patternId) {
        return patternRepository.findById(patternId)
                .orElseThrow(() -> new RecordNotFoundException("threat pattern", patternId));
    }

    /**
     * Applies the non-null fields of {@code update} and returns the stored result.
     *
     * @throws RecordNotFoundException    if the pattern does not exist
     * @throws ReferenceNotFoundException if the update points at a missing threat
     */
    public ThreatPattern updatePattern(UUID patternId, PatternUpdate update) {
        return traced("update-threat-pattern", span -> {
            span.setAttribute("patternId", patternId.toString());

            ThreatPattern updated = transactions.inTransaction("update threat pattern " + patternId, conn -> {
                ThreatPattern existing = loadPattern(conn, patternId);
                if (update.changesThreat()) {
                    requireThreat(conn, update.threatId());
                }
                patternRepository.update(conn, existing.merge(update));
                return loadPattern(conn, patternId);
            });
            logger.info("Updated threat pattern " + patternId);
            return updated;
        });
    }

    /**
     * Deletes a pattern and its conditions. Deleting a missing pattern is not an error.
     */
    public void deletePattern(UUID patternId) {
        traced("delete-threat-pattern", span -> {
            span.setAttribute("patternId", patternId.toString());
            boolean deleted = transactions.inTransaction("delete threat pattern " + patternId, conn -> {
                conditionRepository.deleteByPattern(conn, patternId);
                return patternRepository.delete(conn, patternId);
            });
            if (deleted) {
                logger.info("Deleted threat pattern " + patternId);
            } else {
                logger.fine("Threat pattern " + patternId + " already absent");
            }
            return null;
        });
    }

    /**
     * @throws RecordNotFoundException if the pattern does not exist
     */
    public ThreatPattern setPatternActive(UUID patternId, boolean active) {
        ThreatPattern pattern = transactions.inTransaction("set threat pattern active " + patternId, conn -> {
            if (!patternRepository.setActive(conn, patternId, active)) {
                throw new RecordNotFoundException("threat pattern", patternId);
            }
            return loadPattern(conn, patternId);
        });
        logger.info("Threat pattern " + patternId + (active ? " activated" : " deactivated"));
        return pattern;
    }

    public List<ThreatPattern> listPatterns() {
        return patternRepository.listAll();
    }

    public List<ThreatPattern> listActivePatterns() {
        return patternRepository.listActive();
    }

    public List<ThreatPattern> listPatternsByThreat(UUID threatId) {
        return patternRepository.listByThreat(threatId);
    }

    // ========================================
    // Conditions
    // ========================================

    /**
     * Appends a validated condition to an existing pattern.
     *
     * @throws ReferenceNotFoundException   if the pattern does not exist
     * @throws ConditionValidationException if the condition is malformed
     */
    public PatternCondition createCondition(UUID patternId, PatternCondition draft) {
        return traced("create-pattern-condition", span -> {
            span.setAttribute("patternId", patternId.toString());
            PatternCondition created = transactions.inTransaction("create pattern condition", conn -> {
                if (!patternRepository.exists(conn, patternId)) {
                    throw ReferenceNotFoundException.pattern(patternId);
                }
                validator.validateOrThrow(draft);
                return conditionRepository.insert(conn, patternId, draft);
            });
            logger.info("Added " + created.conditionType() + " condition " + created.id()
                    + " to threat pattern " + patternId);
            return created;
        });
    }

    /**
     * @throws RecordNotFoundException if the condition does not exist
     */
    public PatternCondition getCondition(UUID conditionId) {
        return transactions.withConnection("load pattern condition " + conditionId,
                conn -> conditionRepository.findById(conn, conditionId))
                .orElseThrow(() -> new RecordNotFoundException("pattern condition", conditionId));
    }

    /**
     * Applies the non-null fields of {@code update}; the merged condition must validate.
     *
     * @throws RecordNotFoundException      if the condition does not exist
     * @throws ConditionValidationException if the merged condition is malformed
     */
    public PatternCondition updateCondition(UUID conditionId, ConditionUpdate update) {
        PatternCondition updated = transactions.inTransaction("update pattern condition " + conditionId, conn -> {
            PatternCondition existing = conditionRepository.findById(conn, conditionId)
                    .orElseThrow(() -> new RecordNotFoundException("pattern condition", conditionId));
            PatternCondition merged = existing.merge(update);
            validator.validateOrThrow(merged);
            conditionRepository.update(conn, merged);
            return merged;
        });
        logger.info("Updated pattern condition " + conditionId);
        return updated;
    }

    /**
     * Deleting a missing condition is not an error.
     */
    public void deleteCondition(UUID conditionId) {
        boolean deleted = transactions.inTransaction("delete pattern condition " + conditionId,
                conn -> conditionRepository.delete(conn, conditionId));
        if (deleted) {
            logger.info("Deleted pattern condition " + conditionId);
        }
    }

    public List<PatternCondition> listConditionsByPattern(UUID patternId) {
        return transactions.withConnection("list conditions of threat pattern " + patternId,
                conn -> conditionRepository.findByPattern(conn, patternId));
    }

    public List<PatternCondition> listAllConditions() {
        return transactions.withConnection("list pattern conditions", conditionRepository::findAll);
    }

    /**
     * @return number of conditions removed
     */
    public int deleteConditionsByPattern(UUID patternId) {
        int removed = transactions.inTransaction("delete conditions of threat pattern " + patternId,
                conn -> conditionRepository.deleteByPattern(conn, patternId));
        logger.info("Deleted " + removed + " conditions of threat pattern " + patternId);
        return removed;
    }

    // ========================================
    // Helpers
    // ========================================

    private void requireThreat(Connection conn, UUID threatId) throws SQLException {
        if (threatId == null || !patternRepository.threatExists(conn, threatId)) {
            throw ReferenceNotFoundException.threat(threatId);
        }
    }

    private ThreatPattern loadPattern(Connection conn, UUID patternId) throws SQLException {
        return patternRepository.findById(conn, patternId)
                .orElseThrow(() -> new RecordNotFoundException("threat pattern", patternId));
    }

    @FunctionalInterface
    private interface SpanWork<T> {
        T run(Span span);
    }

    private <T> T traced(String spanName, SpanWork<T> work) {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return work.run(span);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }
}
