/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.exceptions;

import java.util.UUID;

/**
 * A record requested by identifier does not exist.
 */
public class RecordNotFoundException extends ThreatRegistryException {

    public RecordNotFoundException(String kind, UUID id) {
        super(ErrorCode.RECORD_NOT_FOUND, kind + " not found: " + id);
    }
}
