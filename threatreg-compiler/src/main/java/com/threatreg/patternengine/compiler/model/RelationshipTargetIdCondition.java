/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.PatternOperator;

/**
 * Tests whether a relationship of {@code relationshipType} points at {@code targetId}.
 */
public record RelationshipTargetIdCondition(PatternOperator operator, String relationshipType, String targetId) implements CompiledCondition {
}
