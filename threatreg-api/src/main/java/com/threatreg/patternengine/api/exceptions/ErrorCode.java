/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.exceptions;

/**
 * Stable error codes surfaced to callers of the registry.
 */
public enum ErrorCode {
    /** A write referred to a threat or pattern that does not exist. */
    REFERENCE_NOT_FOUND,
    /** A condition type or operator is empty or not one of the recognised values. */
    INVALID_ENUM,
    /** A relationship condition has no relationship type. */
    MISSING_RELATIONSHIP_TYPE,
    /** A value-bearing condition has no value. */
    MISSING_VALUE,
    /** A pattern, condition or entity requested by identifier does not exist. */
    RECORD_NOT_FOUND,
    /** A collaborator lookup failed. Only ever fail-closed inside condition evaluation. */
    LOOKUP_FAILED,
    /** The inventory or active pattern set could not be loaded for an evaluation run. */
    EVALUATION_FAILED,
    /** The underlying store rejected or failed an operation. */
    STORAGE_FAILURE
}
