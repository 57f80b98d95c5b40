/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.exceptions;

/**
 * An evaluation run could not load its inputs. No partial results are returned.
 */
public class PatternEvaluationException extends ThreatRegistryException {

    public PatternEvaluationException(String message, Throwable cause) {
        super(ErrorCode.EVALUATION_FAILED, message, cause);
    }
}
