/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler;

import com.threatreg.patternengine.api.exceptions.ConditionValidationException;
import com.threatreg.patternengine.api.exceptions.ErrorCode;

/**
 * Outcome of validating a single pattern condition.
 *
 * @param valid   whether the condition passed every rule
 * @param reason  failure code, {@code null} when valid
 * @param message human readable failure reason, {@code null} when valid
 */
public record ValidationResult(boolean valid, ErrorCode reason, String message) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult failure(ErrorCode reason, String message) {
        return new ValidationResult(false, reason, message);
    }

    public ConditionValidationException toException() {
        if (valid) {
            throw new IllegalStateException("Valid result has no exception");
        }
        return new ConditionValidationException(reason, message);
    }
}
