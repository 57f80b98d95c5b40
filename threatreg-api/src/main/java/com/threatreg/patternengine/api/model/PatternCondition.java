/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * One atomic predicate of a {@link ThreatPattern}, in its persisted string form.
 *
 * <p>{@code conditionType} and {@code operator} hold the persisted names of
 * {@link ConditionType} and {@link PatternOperator}. They are validated on write and
 * parsed into a typed condition once when a pattern is loaded for evaluation.
 *
 * @param id               condition identifier ({@code null} before insertion)
 * @param patternId        owning pattern ({@code null} until assigned)
 * @param conditionType    persisted condition type name
 * @param operator         persisted operator name
 * @param value            value to match (tag name, target id, product name...)
 * @param relationshipType relationship type for relationship conditions
 */
public record PatternCondition(
        @JsonProperty("id") UUID id,
        @JsonProperty("pattern_id") UUID patternId,
        @JsonProperty("condition_type") String conditionType,
        @JsonProperty("operator") String operator,
        @JsonProperty("value") String value,
        @JsonProperty("relationship_type") String relationshipType) {

    /**
     * Creates an unsaved condition draft.
     */
    public static PatternCondition draft(String conditionType, String operator, String value, String relationshipType) {
        return new PatternCondition(null, null, conditionType, operator, value, relationshipType);
    }

    public static PatternCondition draft(ConditionType conditionType, PatternOperator operator, String value) {
        return draft(conditionType.persistedName(), operator.persistedName(), value, null);
    }

    public static PatternCondition draft(ConditionType conditionType, PatternOperator operator,
                                         String value, String relationshipType) {
        return draft(conditionType.persistedName(), operator.persistedName(), value, relationshipType);
    }

    public PatternCondition withIds(UUID newId, UUID newPatternId) {
        return new PatternCondition(newId, newPatternId, conditionType, operator, value, relationshipType);
    }

    /**
     * Applies the non-null fields of {@code update} on top of this condition.
     */
    public PatternCondition merge(ConditionUpdate update) {
        return new PatternCondition(
                id,
                patternId,
                update.conditionType() != null ? update.conditionType() : conditionType,
                update.operator() != null ? update.operator() : operator,
                update.value() != null ? update.value() : value,
                update.relationshipType() != null ? update.relationshipType() : relationshipType);
    }
}
