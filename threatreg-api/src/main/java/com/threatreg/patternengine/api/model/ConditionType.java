/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import java.util.Optional;

/**
 * The subject a pattern condition inspects.
 *
 * <p>Conditions are persisted with the {@link #persistedName()} string form and parsed
 * back with {@link #parse(String)}. Parsing is exact and case sensitive.
 */
public enum ConditionType {

    /** Name of the entity's product. */
    PRODUCT("PRODUCT", false, true),

    /** Identifier of the entity's product, compared in string form. */
    PRODUCT_ID("PRODUCT_ID", false, true),

    /** Tags assigned to the entity's product. */
    PRODUCT_TAG("PRODUCT_TAG", false, true),

    /** Tags assigned to the entity itself. */
    TAG("TAG", false, true),

    /** Outbound relationships of a given type. */
    RELATIONSHIP("RELATIONSHIP", true, false),

    /** Outbound relationships of a given type, by target identifier. */
    RELATIONSHIP_TARGET_ID("RELATIONSHIP_TARGET_ID", true, true),

    /** Outbound relationships of a given type, by a tag on the target entity. */
    RELATIONSHIP_TARGET_TAG("RELATIONSHIP_TARGET_TAG", true, true);

    private final String persistedName;
    private final boolean requiresRelationshipType;
    private final boolean valueBearing;

    ConditionType(String persistedName, boolean requiresRelationshipType, boolean valueBearing) {
        this.persistedName = persistedName;
        this.requiresRelationshipType = requiresRelationshipType;
        this.valueBearing = valueBearing;
    }

    public String persistedName() {
        return persistedName;
    }

    /**
     * @return whether a condition of this type must name a relationship type
     */
    public boolean requiresRelationshipType() {
        return requiresRelationshipType;
    }

    /**
     * @return whether a condition of this type needs a value unless its operator is
     * {@link PatternOperator#EXISTS} or {@link PatternOperator#NOT_EXISTS}
     */
    public boolean isValueBearing() {
        return valueBearing;
    }

    public static Optional<ConditionType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ConditionType type : values()) {
            if (type.persistedName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return persistedName;
    }
}
