/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * A named, activatable rule associating a {@link Threat} with a conjunction of conditions.
 *
 * <p>Conditions are kept in insertion order. An active pattern with no conditions matches
 * every entity.
 *
 * @param id          pattern identifier ({@code null} before insertion)
 * @param name        display name
 * @param description free text
 * @param threatId    referenced threat; must exist in the threat catalog
 * @param active      inactive patterns never match
 * @param conditions  ordered conditions, all of which must hold
 */
public record ThreatPattern(
        @JsonProperty("id") UUID id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("threat_id") UUID threatId,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("conditions") List<PatternCondition> conditions) {

    public ThreatPattern {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public ThreatPattern withConditions(List<PatternCondition> newConditions) {
        return new ThreatPattern(id, name, description, threatId, active, newConditions);
    }

    /**
     * Applies the non-null fields of {@code update} on top of this pattern.
     */
    public ThreatPattern merge(PatternUpdate update) {
        return new ThreatPattern(
                id,
                update.name() != null ? update.name() : name,
                update.description() != null ? update.description() : description,
                update.threatId() != null ? update.threatId() : threatId,
                update.active() != null ? update.active() : active,
                conditions);
    }
}
