/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.service;

import com.threatreg.patternengine.api.IPatternMatchingEngine;
import com.threatreg.patternengine.api.model.ThreatPatternMatch;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Entry point for threat exposure queries.
 * Delegates to the {@link IPatternMatchingEngine} and logs a summary of each run.
 */
@ApplicationScoped
public class PatternEvaluationService {

    private static final Logger logger = Logger.getLogger(PatternEvaluationService.class.getName());

    @Inject
    IPatternMatchingEngine engine;

    /**
     * @return entity id to matches, for exposed entities only, in inventory order
     */
    public Map<UUID, List<ThreatPatternMatch>> evaluateInventory() {
        long start = System.currentTimeMillis();
        Map<UUID, List<ThreatPatternMatch>> exposure = engine.evaluateAllAgainstActivePatterns();
        logger.info(String.format("Inventory evaluation finished in %dms: %d exposed entities",
                System.currentTimeMillis() - start, exposure.size()));
        return exposure;
    }

    public List<ThreatPatternMatch> evaluateEntity(UUID entityId) {
        List<ThreatPatternMatch> matches = engine.evaluateEntityAgainstActivePatterns(entityId);
        logger.fine("Entity " + entityId + " matched " + matches.size() + " active patterns");
        return matches;
    }

    public List<ThreatPatternMatch> evaluateEntityAgainstPattern(UUID entityId, UUID patternId) {
        return engine.evaluateOne(entityId, patternId);
    }
}
