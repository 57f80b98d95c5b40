/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * A label assignable to entities and products.
 *
 * @param id          tag identifier
 * @param name        tag name; conditions match on this value
 * @param description display description
 * @param color       display color, e.g. {@code #FF0000}
 */
public record Tag(
        @JsonProperty("id") UUID id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("color") String color) {
}
