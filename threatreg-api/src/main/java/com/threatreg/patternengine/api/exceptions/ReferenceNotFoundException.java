/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.exceptions;

import java.util.UUID;

/**
 * A write operation referred to a threat or pattern that does not exist.
 */
public class ReferenceNotFoundException extends ThreatRegistryException {

    public ReferenceNotFoundException(String message) {
        super(ErrorCode.REFERENCE_NOT_FOUND, message);
    }

    public static ReferenceNotFoundException threat(UUID threatId) {
        return new ReferenceNotFoundException("threat not found: " + threatId);
    }

    public static ReferenceNotFoundException pattern(UUID patternId) {
        return new ReferenceNotFoundException("threat pattern not found: " + patternId);
    }
}
