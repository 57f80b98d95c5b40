/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the repositories' SQL from classpath {@code .sql} files.
 *
 * <p>A query file is a sequence of tagged statements; a statement may span several lines:
 * <pre>
 * -- @name: find_pattern
 * SELECT id, name FROM threat_patterns
 * WHERE id = ?;
 * </pre>
 */
public final class SqlLoader {

    private static final Logger logger = Logger.getLogger(SqlLoader.class.getName());
    private static final String QUERY_TAG = "-- @name:";

    private SqlLoader() {
    }

    /**
     * @return each tagged statement by its name, joined onto one line without the closing semicolon
     * @throws IllegalStateException if the resource is missing
     */
    public static Map<String, String> loadQueries(String resourcePath) {
        Map<String, String> queries = new HashMap<>();
        String name = null;
        StringBuilder sql = new StringBuilder();

        for (String raw : readLines(resourcePath)) {
            String line = raw.trim();
            if (line.startsWith(QUERY_TAG)) {
                putQuery(queries, name, sql);
                name = line.substring(QUERY_TAG.length()).trim();
                sql.setLength(0);
            } else if (line.startsWith("--") || line.isEmpty()) {
                continue;
            } else if (name != null) {
                sql.append(sql.length() == 0 ? "" : " ").append(line);
            }
        }
        putQuery(queries, name, sql);

        logger.fine(resourcePath + ": " + queries.size() + " named queries");
        return queries;
    }

    /**
     * Loads a schema file as individual statements, comments dropped.
     */
    public static List<String> loadStatements(String resourcePath) {
        StringBuilder script = new StringBuilder();
        for (String line : readLines(resourcePath)) {
            if (!line.trim().startsWith("--")) {
                script.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String statement : script.toString().split(";")) {
            String trimmed = statement.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        logger.fine(resourcePath + ": " + statements.size() + " schema statements");
        return statements;
    }

    private static void putQuery(Map<String, String> queries, String name, StringBuilder sql) {
        if (name == null || sql.length() == 0) {
            return;
        }
        String text = sql.toString().trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        queries.put(name, text);
    }

    private static List<String> readLines(String resourcePath) {
        InputStream is = SqlLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (is == null) {
            throw new IllegalStateException("SQL resource not found: " + resourcePath);
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to read SQL resource " + resourcePath, e);
            throw new UncheckedIOException("Failed to read SQL resource " + resourcePath, e);
        }
        return lines;
    }
}
