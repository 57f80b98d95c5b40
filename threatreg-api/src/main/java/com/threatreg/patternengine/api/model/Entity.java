/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * An inventoried instance being assessed for threats.
 *
 * <p>Entities are owned by inventory management and are immutable for the duration
 * of an evaluation run. Tags and outbound relationships are not carried here; they are
 * fetched through the inventory collaborators when a condition needs them.
 *
 * @param id        unique identifier (must not be null)
 * @param name      display name
 * @param productId the product this entity is an instance of, or {@code null} if unassigned
 */
public record Entity(
        @JsonProperty("id") UUID id,
        @JsonProperty("name") String name,
        @JsonProperty("product_id") UUID productId) {

    public Entity {
        Objects.requireNonNull(id, "id must not be null");
    }
}
