/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A private in-memory H2 database with the registry schema and wired repositories.
 * Also inserts inventory rows, which the registry itself never writes.
 */
public final class TestDatabase {

    private final JdbcDataSource dataSource;
    private final TransactionRunner transactions;
    private final JdbcPatternConditionRepository conditionRepository;
    private final JdbcThreatPatternRepository patternRepository;
    private final JdbcInventoryRepository inventoryRepository;
    private final AtomicLong clock = new AtomicLong(Instant.parse("2025-01-01T00:00:00Z").toEpochMilli());

    private TestDatabase() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:test-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");

        SchemaInitializer schema = new SchemaInitializer();
        schema.dataSource = dataSource;
        schema.createSchemaIfNotExists();

        transactions = new TransactionRunner();
        transactions.dataSource = dataSource;

        conditionRepository = new JdbcPatternConditionRepository();

        patternRepository = new JdbcThreatPatternRepository();
        patternRepository.transactions = transactions;
        patternRepository.conditionRepository = conditionRepository;

        inventoryRepository = new JdbcInventoryRepository();
        inventoryRepository.dataSource = dataSource;
    }

    public static TestDatabase create() {
        try {
            return new TestDatabase();
        } catch (SQLException e) {
            throw new IllegalStateException("Could not create test database", e);
        }
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public TransactionRunner transactions() {
        return transactions;
    }

    public JdbcThreatPatternRepository patternRepository() {
        return patternRepository;
    }

    /**
     * A pattern repository wired like {@link #patternRepository()} that hands each threat id
     * to {@code beforeCheck} just before checking that the threat exists.
     */
    public JdbcThreatPatternRepository patternRepository(Consumer<UUID> beforeCheck) {
        JdbcThreatPatternRepository repository = new JdbcThreatPatternRepository() {
            @Override
            public boolean threatExists(Connection conn, UUID threatId) throws SQLException {
                beforeCheck.accept(threatId);
                return super.threatExists(conn, threatId);
            }
        };
        repository.transactions = transactions;
        repository.conditionRepository = conditionRepository;
        return repository;
    }

    public JdbcPatternConditionRepository conditionRepository() {
        return conditionRepository;
    }

    public JdbcInventoryRepository inventoryRepository() {
        return inventoryRepository;
    }

    public void drop() {
        execute("DROP ALL OBJECTS");
    }

    // ========================================
    // Inventory fixtures
    // ========================================

    public UUID insertThreat(String title) {
        UUID id = UUID.randomUUID();
        update("INSERT INTO threats (id, title, description) VALUES (?, ?, ?)", id, title, null);
        return id;
    }

    public void deleteThreat(UUID threatId) {
        update("DELETE FROM threats WHERE id = ?", threatId);
    }

    public UUID insertProduct(String name) {
        UUID id = UUID.randomUUID();
        update("INSERT INTO products (id, name, description) VALUES (?, ?, ?)", id, name, null);
        return id;
    }

    public UUID insertEntity(String name, UUID productId) {
        UUID id = UUID.randomUUID();
        update("INSERT INTO entities (id, name, product_id) VALUES (?, ?, ?)", id, name, productId);
        return id;
    }

    public void tagEntity(UUID entityId, String tagName) {
        update("INSERT INTO entity_tags (entity_id, tag_id) VALUES (?, ?)", entityId, tagId(tagName));
    }

    public void tagProduct(UUID productId, String tagName) {
        update("INSERT INTO product_tags (product_id, tag_id) VALUES (?, ?)", productId, tagId(tagName));
    }

    /**
     * Relationships are stamped a second apart so that listing order follows insertion.
     */
    public UUID relate(UUID fromEntityId, String type, UUID toEntityId, UUID toProductId) {
        UUID id = UUID.randomUUID();
        update("INSERT INTO relationships (id, relationship_type, from_entity_id, to_entity_id, to_product_id, created_at)"
                        + " VALUES (?, ?, ?, ?, ?, ?)",
                id, type, fromEntityId, toEntityId, toProductId,
                new Timestamp(clock.getAndAdd(1000)));
        return id;
    }

    public int countRows(String table) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    private UUID tagId(String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT id FROM tags WHERE name = ?")) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getObject(1, UUID.class);
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        UUID id = UUID.randomUUID();
        update("INSERT INTO tags (id, name, description, color) VALUES (?, ?, ?, ?)", id, name, null, null);
        return id;
    }

    private void update(String sql, Object... parameters) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < parameters.length; i++) {
                stmt.setObject(i + 1, parameters[i]);
            }
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Fixture statement failed: " + sql, e);
        }
    }

    private void execute(String sql) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }
}
