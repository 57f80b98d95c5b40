/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.lifecycle;

import com.threatreg.patternengine.service.repository.SchemaInitializer;
import com.threatreg.patternengine.service.telemetry.TracingService;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prepares storage when Quarkus boots and flushes tracing when it stops.
 */
@ApplicationScoped
public class ThreatRegistryLifecycle {

    private static final Logger logger = Logger.getLogger(ThreatRegistryLifecycle.class.getName());

    @Inject
    SchemaInitializer schemaInitializer;

    @Inject
    TracingService tracingService;

    /**
     * Creates missing tables before the first request is served.
     */
    void onStart(@Observes StartupEvent event) {
        try {
            schemaInitializer.createSchemaIfNotExists();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Schema creation failed, refusing to start", e);
            throw new IllegalStateException("Cannot prepare threat registry schema", e);
        }
        logger.info("Threat registry schema in place, tracing " + (tracingService.isEnabled() ? "on" : "off"));
    }

    void onStop(@Observes ShutdownEvent event) {
        tracingService.shutdown();
        logger.info("Threat registry stopped");
    }
}
