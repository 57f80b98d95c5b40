/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.PatternOperator;

/**
 * Tests the entity's outbound relationships of {@code relationshipType}.
 */
public record RelationshipCondition(PatternOperator operator, String relationshipType, String value) implements CompiledCondition {
}
