/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.health;

import com.threatreg.patternengine.service.repository.JdbcThreatPatternRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Ready once the pattern table answers a count query. An empty registry is still ready.
 */
@Readiness
@ApplicationScoped
public class PatternRegistryHealthCheck implements HealthCheck {

    private static final String CHECK_NAME = "pattern-registry";

    @Inject
    DataSource dataSource;

    @Inject
    JdbcThreatPatternRepository patternRepository;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named(CHECK_NAME);
        try (Connection conn = dataSource.getConnection()) {
            return response.up().withData("patterns", patternRepository.count(conn)).build();
        } catch (SQLException e) {
            return response.down().withData("sqlState", String.valueOf(e.getSQLState()))
                    .withData("error", String.valueOf(e.getMessage())).build();
        }
    }
}
