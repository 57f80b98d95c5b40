/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.exceptions;

/**
 * Raised by inventory collaborators when a lookup cannot be served.
 *
 * <p>Condition evaluation treats this as a non-match for the affected condition.
 */
public class LookupException extends ThreatRegistryException {

    public LookupException(String message, Throwable cause) {
        super(ErrorCode.LOOKUP_FAILED, message, cause);
    }

    public LookupException(String message) {
        super(ErrorCode.LOOKUP_FAILED, message);
    }
}
