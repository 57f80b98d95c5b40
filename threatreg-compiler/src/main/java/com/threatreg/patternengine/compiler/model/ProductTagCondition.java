/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.PatternOperator;

/**
 * Tests the tags of the entity's product.
 */
public record ProductTagCondition(PatternOperator operator, String tag) implements CompiledCondition {
}
