/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest;

import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.PatternUpdate;
import com.threatreg.patternengine.api.model.ThreatPattern;
import com.threatreg.patternengine.service.rest.model.ActivationRequest;
import com.threatreg.patternengine.service.rest.model.CreatePatternRequest;
import com.threatreg.patternengine.service.service.ThreatPatternService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.UUID;

/**
 * JAX-RS resource for threat pattern management.
 * Provides CRUD operations for patterns and for the conditions of a pattern.
 */
@Path("/patterns")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ThreatPatternResource {

    @Inject
    ThreatPatternService patternService;

    @Inject
    Tracer tracer;

    // ========================================
    // Patterns
    // ========================================

    /**
     * Create a pattern, optionally together with its conditions.
     */
    @POST
    public Response createPattern(CreatePatternRequest request) {
        return ResourceSupport.respond(tracer, "http-create-pattern", () -> {
            if (request == null) {
                return ResourceSupport.badRequest("request body is required");
            }
            ThreatPattern created = patternService.createPatternWithConditions(
                    request.name(), request.description(), request.threatId(), request.active(),
                    request.conditions());
            return Response.status(Response.Status.CREATED).entity(created).build();
        });
    }

    /**
     * List patterns. {@code active=true} restricts to active patterns; {@code threatId}
     * restricts to one threat. When both are given, the threat filter wins.
     */
    @GET
    public Response listPatterns(@QueryParam("active") Boolean active, @QueryParam("threatId") UUID threatId) {
        return ResourceSupport.respond(tracer, "http-list-patterns", () -> {
            List<ThreatPattern> patterns;
            if (threatId != null) {
                patterns = patternService.listPatternsByThreat(threatId);
            } else if (Boolean.TRUE.equals(active)) {
                patterns = patternService.listActivePatterns();
            } else {
                patterns = patternService.listPatterns();
            }
            Span.current().setAttribute("patternCount", patterns.size());
            return Response.ok(patterns).build();
        });
    }

    @GET
    @Path("/{id}")
    public Response getPattern(@PathParam("id") UUID id) {
        return ResourceSupport.respond(tracer, "http-get-pattern",
                () -> Response.ok(patternService.getPattern(id)).build());
    }

    /**
     * Partially update a pattern; absent fields are left unchanged.
     */
    @PATCH
    @Path("/{id}")
    public Response updatePattern(@PathParam("id") UUID id, PatternUpdate update) {
        return ResourceSupport.respond(tracer, "http-update-pattern", () -> {
            if (update == null) {
                return ResourceSupport.badRequest("request body is required");
            }
            return Response.ok(patternService.updatePattern(id, update)).build();
        });
    }

    @DELETE
    @Path("/{id}")
    public Response deletePattern(@PathParam("id") UUID id) {
        return ResourceSupport.respond(tracer, "http-delete-pattern", () -> {
            patternService.deletePattern(id);
            return Response.noContent().build();
        });
    }

    @PUT
    @Path("/{id}/active")
    public Response setActive(@PathParam("id") UUID id, ActivationRequest request) {
        return ResourceSupport.respond(tracer, "http-set-pattern-active", () -> {
            if (request == null) {
                return ResourceSupport.badRequest("request body is required");
            }
            return Response.ok(patternService.setPatternActive(id, request.active())).build();
        });
    }

    // ========================================
    // Conditions of a pattern
    // ========================================

    @GET
    @Path("/{id}/conditions")
    public Response listConditions(@PathParam("id") UUID id) {
        return ResourceSupport.respond(tracer, "http-list-pattern-conditions",
                () -> Response.ok(patternService.listConditionsByPattern(id)).build());
    }

    @POST
    @Path("/{id}/conditions")
    public Response addCondition(@PathParam("id") UUID id, PatternCondition condition) {
        return ResourceSupport.respond(tracer, "http-create-pattern-condition", () -> {
            if (condition == null) {
                return ResourceSupport.badRequest("request body is required");
            }
            PatternCondition created = patternService.createCondition(id, condition);
            return Response.status(Response.Status.CREATED).entity(created).build();
        });
    }

    @DELETE
    @Path("/{id}/conditions")
    public Response deleteConditions(@PathParam("id") UUID id) {
        return ResourceSupport.respond(tracer, "http-delete-pattern-conditions", () -> {
            patternService.deleteConditionsByPattern(id);
            return Response.noContent().build();
        });
    }
}
