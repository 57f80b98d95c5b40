/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import com.threatreg.patternengine.api.ThreatPatternCatalog;
import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.ThreatPattern;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code threat_patterns} table, H2 or PostgreSQL.
 *
 * <p>Write methods take the caller's connection and are meant to run inside
 * {@link TransactionRunner#inTransaction}. The {@link ThreatPatternCatalog} reads borrow
 * their own connection and always return patterns with their conditions attached; pattern
 * rows and condition rows come from one read transaction.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe through database ACID properties.
 */
@ApplicationScoped
public class JdbcThreatPatternRepository implements ThreatPatternCatalog {

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");

    @Inject
    TransactionRunner transactions;

    @Inject
    JdbcPatternConditionRepository conditionRepository;

    // ════════════════════════════════════════════════════════════════════════════════
    // WRITES (caller's transaction)
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Inserts the pattern row only; conditions are inserted separately.
     *
     * @return the pattern with its generated id and no conditions
     */
    public ThreatPattern insert(Connection conn, ThreatPattern pattern) throws SQLException {
        UUID id = UUID.randomUUID();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_pattern"))) {
            int idx = 1;
            stmt.setObject(idx++, id);
            stmt.setString(idx++, pattern.name());
            stmt.setString(idx++, pattern.description());
            stmt.setObject(idx++, pattern.threatId());
            stmt.setBoolean(idx++, pattern.active());
            stmt.setTimestamp(idx++, Timestamp.from(Instant.now()));
            stmt.executeUpdate();
        }
        return new ThreatPattern(id, pattern.name(), pattern.description(), pattern.threatId(),
                pattern.active(), List.of());
    }

    public boolean update(Connection conn, ThreatPattern pattern) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_pattern"))) {
            int idx = 1;
            stmt.setString(idx++, pattern.name());
            stmt.setString(idx++, pattern.description());
            stmt.setObject(idx++, pattern.threatId());
            stmt.setBoolean(idx++, pattern.active());
            stmt.setObject(idx++, pattern.id());
            return stmt.executeUpdate() > 0;
        }
    }

    public boolean setActive(Connection conn, UUID patternId, boolean active) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("set_pattern_active"))) {
            stmt.setBoolean(1, active);
            stmt.setObject(2, patternId);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * @return whether a row was removed; conditions go with it through the cascade
     */
    public boolean delete(Connection conn, UUID patternId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_pattern"))) {
            stmt.setObject(1, patternId);
            return stmt.executeUpdate() > 0;
        }
    }

    public boolean exists(Connection conn, UUID patternId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("count_pattern_by_id"))) {
            stmt.setObject(1, patternId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    /**
     * Checks the referenced threat on the caller's connection, so the check and the write
     * that depends on it commit or roll back together.
     */
    public boolean threatExists(Connection conn, UUID threatId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("count_threat_by_id"))) {
            stmt.setObject(1, threatId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    public long count(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("count_patterns"));
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    public Optional<ThreatPattern> findById(Connection conn, UUID patternId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_pattern_by_id"))) {
            stmt.setObject(1, patternId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ThreatPattern pattern = mapResultSet(rs);
                return Optional.of(pattern.withConditions(conditionRepository.findByPattern(conn, patternId)));
            }
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CATALOG READS
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public Optional<ThreatPattern> findById(UUID patternId) {
        return transactions.inReadTransaction("load threat pattern " + patternId,
                conn -> findById(conn, patternId));
    }

    @Override
    public List<ThreatPattern> listAll() {
        return transactions.inReadTransaction("list threat patterns",
                conn -> query(conn, SQL.get("select_all_patterns"), null));
    }

    @Override
    public List<ThreatPattern> listActive() {
        return transactions.inReadTransaction("list active threat patterns",
                conn -> query(conn, SQL.get("select_active_patterns"), null));
    }

    @Override
    public List<ThreatPattern> listByThreat(UUID threatId) {
        return transactions.inReadTransaction("list threat patterns of threat " + threatId,
                conn -> query(conn, SQL.get("select_patterns_by_threat"), threatId));
    }

    private List<ThreatPattern> query(Connection conn, String sql, UUID parameter) throws SQLException {
        List<ThreatPattern> patterns = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                stmt.setObject(1, parameter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    patterns.add(mapResultSet(rs));
                }
            }
        }
        if (patterns.isEmpty()) {
            return patterns;
        }

        Map<UUID, List<PatternCondition>> conditions = conditionRepository.findAllGroupedByPattern(conn);
        List<ThreatPattern> withConditions = new ArrayList<>(patterns.size());
        for (ThreatPattern pattern : patterns) {
            withConditions.add(pattern.withConditions(conditions.getOrDefault(pattern.id(), List.of())));
        }
        return withConditions;
    }

    private ThreatPattern mapResultSet(ResultSet rs) throws SQLException {
        return new ThreatPattern(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getString("description"),
                rs.getObject("threat_id", UUID.class),
                rs.getBoolean("is_active"),
                List.of());
    }
}
