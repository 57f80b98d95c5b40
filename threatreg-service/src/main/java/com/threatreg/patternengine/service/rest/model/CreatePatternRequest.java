/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.threatreg.patternengine.api.model.PatternCondition;

import java.util.List;
import java.util.UUID;

/**
 * Body of {@code POST /patterns}. A missing {@code is_active} defaults to true; conditions
 * are optional and created in the same transaction as the pattern.
 */
public record CreatePatternRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("threat_id") UUID threatId,
        @JsonProperty("is_active") Boolean active,
        @JsonProperty("conditions") List<PatternCondition> conditions) {

    public CreatePatternRequest {
        if (active == null) {
            active = true;
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
