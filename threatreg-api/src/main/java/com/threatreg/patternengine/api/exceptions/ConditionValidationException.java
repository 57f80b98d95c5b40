/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.exceptions;

/**
 * A pattern condition failed validation. The error code is one of
 * {@link ErrorCode#INVALID_ENUM}, {@link ErrorCode#MISSING_RELATIONSHIP_TYPE} or
 * {@link ErrorCode#MISSING_VALUE}.
 */
public class ConditionValidationException extends ThreatRegistryException {

    public ConditionValidationException(ErrorCode reason, String message) {
        super(reason, message);
    }

    /**
     * Re-labels a failure with the position of the condition inside a batch.
     */
    public ConditionValidationException atIndex(int index) {
        ConditionValidationException indexed = new ConditionValidationException(
                getErrorCode(), "invalid pattern condition " + index + ": " + getMessage());
        indexed.setStackTrace(getStackTrace());
        return indexed;
    }
}
