/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

/**
 * A stored condition whose type or operator could not be parsed. Always evaluates to false.
 */
public record UnrecognizedCondition(String conditionType, String operator) implements CompiledCondition {
}
