/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest;

import com.threatreg.patternengine.api.exceptions.ErrorCode;
import com.threatreg.patternengine.api.exceptions.ThreatRegistryException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.ws.rs.core.Response;

import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared request handling for the JAX-RS resources: one span per request and the
 * mapping of registry errors to HTTP responses.
 *
 * <p>Errors are returned as {@code {"error": <code>, "message": <text>}}. Missing records
 * and references map to 404, validation failures to 400, everything else to 500.
 */
final class ResourceSupport {

    private static final Logger logger = Logger.getLogger(ResourceSupport.class.getName());

    private ResourceSupport() {
    }

    static Response respond(Tracer tracer, String spanName, Supplier<Response> action) {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return action.get();
        } catch (ThreatRegistryException e) {
            Response response = fromException(e);
            if (response.getStatus() >= 500) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
            }
            return response;
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            logger.log(Level.SEVERE, "Unhandled error in " + spanName, e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", e.getMessage());
        } finally {
            span.end();
        }
    }

    static Response fromException(ThreatRegistryException e) {
        return error(statusOf(e.getErrorCode()), e.getErrorCode().name(), e.getMessage());
    }

    static Response.Status statusOf(ErrorCode code) {
        switch (code) {
            case REFERENCE_NOT_FOUND:
            case RECORD_NOT_FOUND:
                return Response.Status.NOT_FOUND;
            case INVALID_ENUM:
            case MISSING_RELATIONSHIP_TYPE:
            case MISSING_VALUE:
                return Response.Status.BAD_REQUEST;
            default:
                return Response.Status.INTERNAL_SERVER_ERROR;
        }
    }

    static Response badRequest(String message) {
        return error(Response.Status.BAD_REQUEST, "BAD_REQUEST", message);
    }

    private static Response error(Response.Status status, String code, String message) {
        return Response.status(status)
                .entity(Map.of("error", code, "message", message != null ? message : ""))
                .build();
    }
}
