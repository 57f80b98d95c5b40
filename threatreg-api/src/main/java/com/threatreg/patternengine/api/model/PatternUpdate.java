/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Partial update of a {@link ThreatPattern}. Null fields are left unchanged; a non-null
 * {@code threatId} is re-validated against the threat catalog.
 */
public record PatternUpdate(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("threat_id") UUID threatId,
        @JsonProperty("is_active") Boolean active) {

    public boolean changesThreat() {
        return threatId != null;
    }
}
