/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler;

import com.threatreg.patternengine.api.exceptions.ErrorCode;
import com.threatreg.patternengine.api.model.ConditionType;
import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.PatternOperator;

import java.util.Optional;

/**
 * Validates the shape of a pattern condition before it is persisted.
 *
 * <p>Rules are checked in order and the first failure wins:
 * <ol>
 *   <li>condition type and operator are present and parse to recognised values
 *       ({@link ErrorCode#INVALID_ENUM})</li>
 *   <li>relationship condition types name a relationship type
 *       ({@link ErrorCode#MISSING_RELATIONSHIP_TYPE})</li>
 *   <li>value-bearing condition types carry a value unless the operator is
 *       {@code EXISTS} or {@code NOT_EXISTS} ({@link ErrorCode#MISSING_VALUE})</li>
 * </ol>
 *
 * <p>Operator/type pairings are not checked here; a pairing the evaluator does not
 * handle simply never matches.
 *
 * <p><b>Thread Safety:</b> Stateless and thread-safe.
 */
public class ConditionValidator {

    public ValidationResult validate(PatternCondition condition) {
        if (isEmpty(condition.conditionType())) {
            return ValidationResult.failure(ErrorCode.INVALID_ENUM, "condition_type is required");
        }
        if (isEmpty(condition.operator())) {
            return ValidationResult.failure(ErrorCode.INVALID_ENUM, "operator is required");
        }

        Optional<ConditionType> conditionType = ConditionType.parse(condition.conditionType());
        if (conditionType.isEmpty()) {
            return ValidationResult.failure(ErrorCode.INVALID_ENUM,
                    "invalid condition_type: " + condition.conditionType());
        }
        Optional<PatternOperator> operator = PatternOperator.parse(condition.operator());
        if (operator.isEmpty()) {
            return ValidationResult.failure(ErrorCode.INVALID_ENUM,
                    "invalid operator: " + condition.operator());
        }

        ConditionType type = conditionType.get();
        if (type.requiresRelationshipType() && isEmpty(condition.relationshipType())) {
            return ValidationResult.failure(ErrorCode.MISSING_RELATIONSHIP_TYPE,
                    "relationship_type is required for " + type + " condition");
        }

        if (type.isValueBearing() && !operator.get().isExistenceCheck() && isEmpty(condition.value())) {
            return ValidationResult.failure(ErrorCode.MISSING_VALUE,
                    "value is required for " + type + " condition with " + operator.get() + " operator");
        }

        return ValidationResult.ok();
    }

    /**
     * @throws com.threatreg.patternengine.api.exceptions.ConditionValidationException on the first failed rule
     */
    public void validateOrThrow(PatternCondition condition) {
        ValidationResult result = validate(condition);
        if (!result.valid()) {
            throw result.toException();
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
