/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.model;

import java.util.Optional;

/**
 * Comparison operator of a pattern condition.
 *
 * <p>Not every operator is meaningful for every {@link ConditionType}; a combination the
 * evaluator does not recognise evaluates to {@code false}.
 */
public enum PatternOperator {
    EQUALS("EQUALS"),
    NOT_EQUALS("NOT_EQUALS"),
    CONTAINS("CONTAINS"),
    NOT_CONTAINS("NOT_CONTAINS"),
    EXISTS("EXISTS"),
    NOT_EXISTS("NOT_EXISTS"),
    HAS_RELATIONSHIP_WITH("HAS_RELATIONSHIP_WITH"),
    NOT_HAS_RELATIONSHIP_WITH("NOT_HAS_RELATIONSHIP_WITH");

    private final String persistedName;

    PatternOperator(String persistedName) {
        this.persistedName = persistedName;
    }

    public String persistedName() {
        return persistedName;
    }

    /**
     * @return true for {@link #EXISTS} and {@link #NOT_EXISTS}, which never need a value
     */
    public boolean isExistenceCheck() {
        return this == EXISTS || this == NOT_EXISTS;
    }

    public static Optional<PatternOperator> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PatternOperator operator : values()) {
            if (operator.persistedName.equals(value)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return persistedName;
    }
}
