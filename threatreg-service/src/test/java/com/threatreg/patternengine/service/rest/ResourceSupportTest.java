/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest;

import com.threatreg.patternengine.api.exceptions.ErrorCode;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceSupportTest {

    @ParameterizedTest
    @CsvSource({
            "REFERENCE_NOT_FOUND, NOT_FOUND",
            "RECORD_NOT_FOUND, NOT_FOUND",
            "INVALID_ENUM, BAD_REQUEST",
            "MISSING_RELATIONSHIP_TYPE, BAD_REQUEST",
            "MISSING_VALUE, BAD_REQUEST",
            "EVALUATION_FAILED, INTERNAL_SERVER_ERROR",
            "STORAGE_FAILURE, INTERNAL_SERVER_ERROR",
            "LOOKUP_FAILED, INTERNAL_SERVER_ERROR"
    })
    void shouldMapErrorCodesToStatus(ErrorCode code, Response.Status expected) {
        assertThat(ResourceSupport.statusOf(code)).isEqualTo(expected);
    }
}
