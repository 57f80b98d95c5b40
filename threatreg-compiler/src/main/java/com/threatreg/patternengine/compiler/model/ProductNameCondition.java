/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.PatternOperator;

/**
 * Compares the name of the entity's product with {@code value}.
 */
public record ProductNameCondition(PatternOperator operator, String value) implements CompiledCondition {
}
