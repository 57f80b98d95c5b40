/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlLoaderTest {

    @Test
    @DisplayName("Should load named queries without trailing semicolons")
    void shouldLoadNamedQueries() {
        Map<String, String> queries = SqlLoader.loadQueries("sql/sample-queries.sql");

        assertThat(queries).containsOnlyKeys("first_query", "second_query");
        assertThat(queries.get("first_query")).isEqualTo("SELECT id FROM widgets WHERE id = ?");
        assertThat(queries.get("second_query")).isEqualTo("DELETE FROM widgets");
    }

    @Test
    @DisplayName("Should split the schema into statements")
    void shouldLoadSchemaStatements() {
        List<String> statements = SqlLoader.loadStatements("sql/schema.sql");

        assertThat(statements).isNotEmpty();
        assertThat(statements).allSatisfy(sql -> assertThat(sql).doesNotContain(";").doesNotStartWith("--"));
        assertThat(statements).anySatisfy(sql -> assertThat(sql).startsWith("CREATE TABLE IF NOT EXISTS threat_patterns"));
    }

    @Test
    @DisplayName("Should fail on a missing resource")
    void shouldFailOnMissingResource() {
        assertThatThrownBy(() -> SqlLoader.loadQueries("sql/missing.sql"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sql/missing.sql");
    }
}
