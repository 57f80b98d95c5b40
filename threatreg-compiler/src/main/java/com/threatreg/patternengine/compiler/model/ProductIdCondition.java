/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.PatternOperator;

/**
 * Compares the entity's product identifier, in string form, with {@code value}.
 */
public record ProductIdCondition(PatternOperator operator, String value) implements CompiledCondition {
}
