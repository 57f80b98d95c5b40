/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest;

import com.threatreg.patternengine.api.model.ConditionUpdate;
import com.threatreg.patternengine.service.service.ThreatPatternService;
import io.opentelemetry.api.trace.Tracer;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.UUID;

/**
 * JAX-RS resource for individual pattern conditions.
 */
@Path("/conditions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PatternConditionResource {

    @Inject
    ThreatPatternService patternService;

    @Inject
    Tracer tracer;

    @GET
    public Response listConditions() {
        return ResourceSupport.respond(tracer, "http-list-conditions",
                () -> Response.ok(patternService.listAllConditions()).build());
    }

    @GET
    @Path("/{id}")
    public Response getCondition(@PathParam("id") UUID id) {
        return ResourceSupport.respond(tracer, "http-get-condition",
                () -> Response.ok(patternService.getCondition(id)).build());
    }

    @PATCH
    @Path("/{id}")
    public Response updateCondition(@PathParam("id") UUID id, ConditionUpdate update) {
        return ResourceSupport.respond(tracer, "http-update-condition", () -> {
            if (update == null) {
                return ResourceSupport.badRequest("request body is required");
            }
            return Response.ok(patternService.updateCondition(id, update)).build();
        });
    }

    @DELETE
    @Path("/{id}")
    public Response deleteCondition(@PathParam("id") UUID id) {
        return ResourceSupport.respond(tracer, "http-delete-condition", () -> {
            patternService.deleteCondition(id);
            return Response.noContent().build();
        });
    }
}
