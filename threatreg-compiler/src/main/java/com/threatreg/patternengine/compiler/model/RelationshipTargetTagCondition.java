/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.PatternOperator;

/**
 * Tests whether a relationship of {@code relationshipType} points at an entity carrying {@code tag}.
 */
public record RelationshipTargetTagCondition(PatternOperator operator, String relationshipType, String tag) implements CompiledCondition {
}
