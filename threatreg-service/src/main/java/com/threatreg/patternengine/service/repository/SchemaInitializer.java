/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the registry tables from {@code sql/schema.sql} when they are missing.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final List<String> SCHEMA = SqlLoader.loadStatements("sql/schema.sql");

    @Inject
    DataSource dataSource;

    public void createSchemaIfNotExists() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : SCHEMA) {
                stmt.execute(sql);
            }
        }
    }
}
