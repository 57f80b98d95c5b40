/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.repository;

import com.threatreg.patternengine.api.exceptions.LookupException;
import com.threatreg.patternengine.api.inventory.EntityInventory;
import com.threatreg.patternengine.api.inventory.ProductCatalog;
import com.threatreg.patternengine.api.inventory.RelationshipStore;
import com.threatreg.patternengine.api.inventory.TagAssignments;
import com.threatreg.patternengine.api.inventory.ThreatCatalog;
import com.threatreg.patternengine.api.model.Entity;
import com.threatreg.patternengine.api.model.Product;
import com.threatreg.patternengine.api.model.Relationship;
import com.threatreg.patternengine.api.model.Tag;
import com.threatreg.patternengine.api.model.Threat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JDBC lookups over the inventory tables: entities, products, tags,
 * relationships and threats.
 *
 * <p>Inventory rows are maintained by other parts of the registry; this class never
 * writes. Database errors surface as {@link LookupException}, which condition evaluation
 * treats as a non-match.
 */
@ApplicationScoped
public class JdbcInventoryRepository
        implements EntityInventory, ProductCatalog, TagAssignments, RelationshipStore, ThreatCatalog {

    private static final Logger logger = Logger.getLogger(JdbcInventoryRepository.class.getName());

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");

    @Inject
    DataSource dataSource;

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @Override
    public List<Entity> listEntities() {
        return queryList("select_all_entities", null, this::mapEntity);
    }

    @Override
    public Optional<Entity> getEntity(UUID id) {
        return querySingle("select_entity_by_id", id, this::mapEntity);
    }

    @Override
    public Optional<Product> getProduct(UUID productId) {
        return querySingle("select_product_by_id", productId, rs -> new Product(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getString("description")));
    }

    @Override
    public List<Tag> listTagsByProduct(UUID productId) {
        return queryList("select_tags_by_product", productId, this::mapTag);
    }

    @Override
    public List<Tag> listTagsByEntity(UUID entityId) {
        return queryList("select_tags_by_entity", entityId, this::mapTag);
    }

    @Override
    public List<Relationship> listRelationshipsByEntity(UUID entityId) {
        return queryList("select_relationships_by_entity", entityId, rs -> new Relationship(
                rs.getObject("id", UUID.class),
                rs.getString("relationship_type"),
                rs.getObject("from_entity_id", UUID.class),
                rs.getObject("to_entity_id", UUID.class),
                rs.getObject("to_product_id", UUID.class)));
    }

    @Override
    public Optional<Threat> getThreat(UUID threatId) {
        return querySingle("select_threat_by_id", threatId, rs -> new Threat(
                rs.getObject("id", UUID.class),
                rs.getString("title"),
                rs.getString("description")));
    }

    private <T> List<T> queryList(String queryName, UUID parameter, RowMapper<T> mapper) {
        List<T> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get(queryName))) {
            if (parameter != null) {
                stmt.setObject(1, parameter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Inventory lookup " + queryName + " failed for " + parameter, e);
            throw new LookupException("Inventory lookup " + queryName + " failed", e);
        }
        return rows;
    }

    private <T> Optional<T> querySingle(String queryName, UUID parameter, RowMapper<T> mapper) {
        List<T> rows = queryList(queryName, parameter, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private Entity mapEntity(ResultSet rs) throws SQLException {
        return new Entity(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getObject("product_id", UUID.class));
    }

    private Tag mapTag(ResultSet rs) throws SQLException {
        return new Tag(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("color"));
    }
}
