/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api;

import com.threatreg.patternengine.api.model.Entity;
import com.threatreg.patternengine.api.model.ThreatPattern;
import com.threatreg.patternengine.api.model.ThreatPatternMatch;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Contract for evaluating inventory entities against threat patterns.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IPatternMatchingEngine engine = // obtain from DI
 *
 * Map<UUID, List<ThreatPatternMatch>> exposure = engine.evaluateAllAgainstActivePatterns();
 * exposure.forEach((entityId, matches) ->
 *     matches.forEach(m -> System.out.println(entityId + " -> " + m.threatId())));
 * }</pre>
 *
 * <h2>Failure Semantics</h2>
 * <ul>
 *   <li>A collaborator lookup that fails while a single condition is evaluated makes that
 *       condition evaluate to {@code false}. It never aborts the run.</li>
 *   <li>Failing to load the inventory or the active pattern set aborts the run with a
 *       {@link com.threatreg.patternengine.api.exceptions.PatternEvaluationException}.</li>
 * </ul>
 *
 * <p>All operations are read-only.
 */
public interface IPatternMatchingEngine {

    /**
     * Evaluates one entity against one pattern.
     *
     * @return a single match, or an empty list
     */
    List<ThreatPatternMatch> evaluate(Entity entity, ThreatPattern pattern);

    /**
     * Loads an entity and a pattern by identifier and evaluates the pair.
     *
     * @throws com.threatreg.patternengine.api.exceptions.RecordNotFoundException if either is absent
     */
    List<ThreatPatternMatch> evaluateOne(UUID entityId, UUID patternId);

    /**
     * Evaluates an entity against every active pattern.
     *
     * @return matches in pattern listing order
     */
    List<ThreatPatternMatch> evaluateEntityAgainstActivePatterns(Entity entity);

    /**
     * Loads an entity by identifier and evaluates it against every active pattern.
     *
     * @throws com.threatreg.patternengine.api.exceptions.RecordNotFoundException if the entity is absent
     */
    List<ThreatPatternMatch> evaluateEntityAgainstActivePatterns(UUID entityId);

    /**
     * Evaluates the whole inventory against every active pattern.
     *
     * @return entity id to matches; entities without matches are absent. Iteration follows
     * inventory order.
     */
    Map<UUID, List<ThreatPatternMatch>> evaluateAllAgainstActivePatterns();
}
