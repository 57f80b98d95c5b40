/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * A directed, typed edge from an entity to either another entity or a product.
 *
 * <p>Exactly one of {@code toEntityId} and {@code toProductId} is set.
 *
 * @param id           relationship identifier
 * @param type         free-form relationship type, e.g. {@code connects_to}
 * @param fromEntityId source entity
 * @param toEntityId   target entity, or {@code null} for a product target
 * @param toProductId  target product, or {@code null} for an entity target
 */
public record Relationship(
        @JsonProperty("id") UUID id,
        @JsonProperty("type") String type,
        @JsonProperty("from_entity_id") UUID fromEntityId,
        @JsonProperty("to_entity_id") UUID toEntityId,
        @JsonProperty("to_product_id") UUID toProductId) {

    public Relationship {
        Objects.requireNonNull(fromEntityId, "fromEntityId must not be null");
        if ((toEntityId == null) == (toProductId == null)) {
            throw new IllegalArgumentException(
                    "Relationship " + id + " must target exactly one of an entity or a product");
        }
    }

    public static Relationship toEntity(UUID id, String type, UUID fromEntityId, UUID toEntityId) {
        return new Relationship(id, type, fromEntityId, toEntityId, null);
    }

    public static Relationship toProduct(UUID id, String type, UUID fromEntityId, UUID toProductId) {
        return new Relationship(id, type, fromEntityId, null, toProductId);
    }

    /**
     * @return whether the target is an entity (rather than a product)
     */
    @JsonIgnore
    public boolean targetsEntity() {
        return toEntityId != null;
    }

    /**
     * @return the identifier of whichever target kind is set
     */
    @JsonIgnore
    public UUID targetId() {
        return toEntityId != null ? toEntityId : toProductId;
    }

    public boolean isOfType(String relationshipType) {
        return Objects.equals(type, relationshipType);
    }
}
