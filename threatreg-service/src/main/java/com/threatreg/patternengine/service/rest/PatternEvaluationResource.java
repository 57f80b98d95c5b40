/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest;

import com.threatreg.patternengine.api.model.ThreatPatternMatch;
import com.threatreg.patternengine.service.service.PatternEvaluationService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JAX-RS resource for threat exposure queries.
 * Evaluates inventory entities against the active threat patterns.
 */
@Path("/evaluations")
@Produces(MediaType.APPLICATION_JSON)
public class PatternEvaluationResource {

    @Inject
    PatternEvaluationService evaluationService;

    @Inject
    Tracer tracer;

    /**
     * Evaluate the whole inventory.
     *
     * @return entity id to matches, for exposed entities only
     */
    @GET
    public Response evaluateInventory() {
        return ResourceSupport.respond(tracer, "http-evaluate-inventory", () -> {
            Map<UUID, List<ThreatPatternMatch>> exposure = evaluationService.evaluateInventory();
            Span.current().setAttribute("exposedEntities", exposure.size());
            return Response.ok(exposure).build();
        });
    }

    @GET
    @Path("/entities/{entityId}")
    public Response evaluateEntity(@PathParam("entityId") UUID entityId) {
        return ResourceSupport.respond(tracer, "http-evaluate-entity",
                () -> Response.ok(evaluationService.evaluateEntity(entityId)).build());
    }

    @GET
    @Path("/entities/{entityId}/patterns/{patternId}")
    public Response evaluateEntityAgainstPattern(@PathParam("entityId") UUID entityId,
                                                 @PathParam("patternId") UUID patternId) {
        return ResourceSupport.respond(tracer, "http-evaluate-entity-pattern",
                () -> Response.ok(evaluationService.evaluateEntityAgainstPattern(entityId, patternId)).build());
    }
}
