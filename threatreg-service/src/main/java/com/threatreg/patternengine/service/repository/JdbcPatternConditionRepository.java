/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import com.threatreg.patternengine.api.model.PatternCondition;
import jakarta.enterprise.context.ApplicationScoped;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code pattern_conditions} table.
 *
 * <p>Every method runs on a caller-supplied connection so that condition writes share the
 * transaction of the surrounding pattern operation (see {@link TransactionRunner}).
 * Conditions keep insertion order through a per-pattern {@code sort_order} column.
 */
@ApplicationScoped
public class JdbcPatternConditionRepository {

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");

    /**
     * Inserts a condition at the end of its pattern's list.
     *
     * @return the condition with its generated id
     */
    public PatternCondition insert(Connection conn, UUID patternId, PatternCondition draft) throws SQLException {
        PatternCondition condition = draft.withIds(UUID.randomUUID(), patternId);

        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_condition"))) {
            int idx = 1;
            stmt.setObject(idx++, condition.id());
            stmt.setObject(idx++, patternId);
            stmt.setInt(idx++, nextOrder(conn, patternId));
            stmt.setString(idx++, condition.conditionType());
            stmt.setString(idx++, condition.operator());
            stmt.setString(idx++, condition.value());
            stmt.setString(idx++, condition.relationshipType());
            stmt.executeUpdate();
        }
        return condition;
    }

    private int nextOrder(Connection conn, UUID patternId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("next_condition_order"))) {
            stmt.setObject(1, patternId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * @return whether a row was updated
     */
    public boolean update(Connection conn, PatternCondition condition) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_condition"))) {
            int idx = 1;
            stmt.setString(idx++, condition.conditionType());
            stmt.setString(idx++, condition.operator());
            stmt.setString(idx++, condition.value());
            stmt.setString(idx++, condition.relationshipType());
            stmt.setObject(idx++, condition.id());
            return stmt.executeUpdate() > 0;
        }
    }

    public boolean delete(Connection conn, UUID conditionId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_condition"))) {
            stmt.setObject(1, conditionId);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * @return number of conditions removed
     */
    public int deleteByPattern(Connection conn, UUID patternId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_conditions_by_pattern"))) {
            stmt.setObject(1, patternId);
            return stmt.executeUpdate();
        }
    }

    public Optional<PatternCondition> findById(Connection conn, UUID conditionId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_condition_by_id"))) {
            stmt.setObject(1, conditionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapResultSet(rs)) : Optional.empty();
            }
        }
    }

    public List<PatternCondition> findByPattern(Connection conn, UUID patternId) throws SQLException {
        List<PatternCondition> conditions = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_conditions_by_pattern"))) {
            stmt.setObject(1, patternId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    conditions.add(mapResultSet(rs));
                }
            }
        }
        return conditions;
    }

    public List<PatternCondition> findAll(Connection conn) throws SQLException {
        List<PatternCondition> conditions = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_all_conditions"));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                conditions.add(mapResultSet(rs));
            }
        }
        return conditions;
    }

    /**
     * Loads every condition grouped by owning pattern, each group in insertion order.
     */
    public Map<UUID, List<PatternCondition>> findAllGroupedByPattern(Connection conn) throws SQLException {
        Map<UUID, List<PatternCondition>> grouped = new LinkedHashMap<>();
        for (PatternCondition condition : findAll(conn)) {
            grouped.computeIfAbsent(condition.patternId(), id -> new ArrayList<>()).add(condition);
        }
        return grouped;
    }

    private PatternCondition mapResultSet(ResultSet rs) throws SQLException {
        return new PatternCondition(
                rs.getObject("id", UUID.class),
                rs.getObject("pattern_id", UUID.class),
                rs.getString("condition_type"),
                rs.getString("condition_operator"),
                rs.getString("condition_value"),
                rs.getString("relationship_type"));
    }
}
