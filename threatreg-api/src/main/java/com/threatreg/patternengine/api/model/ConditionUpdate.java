/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update of a {@link PatternCondition}. Null fields are left unchanged.
 */
public record ConditionUpdate(
        @JsonProperty("condition_type") String conditionType,
        @JsonProperty("operator") String operator,
        @JsonProperty("value") String value,
        @JsonProperty("relationship_type") String relationshipType) {
}
