/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * The derived fact that an entity satisfies an active pattern.
 *
 * <p>Matches are produced fresh by every evaluation run and are never persisted.
 */
public record ThreatPatternMatch(
        @JsonProperty("entity_id") UUID entityId,
        @JsonProperty("threat_id") UUID threatId,
        @JsonProperty("pattern_id") UUID patternId,
        @JsonProperty("pattern") ThreatPattern pattern) {

    public static ThreatPatternMatch of(Entity entity, ThreatPattern pattern) {
        return new ThreatPatternMatch(entity.id(), pattern.threatId(), pattern.id(), pattern);
    }
}
