/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

import com.threatreg.patternengine.api.model.ThreatPattern;

import java.util.List;

/**
 * A threat pattern together with its conditions in compiled form, in the same order.
 *
 * @param source     the pattern as stored; carried into match results
 * @param conditions compiled conditions
 */
public record CompiledPattern(ThreatPattern source, List<CompiledCondition> conditions) {

    public CompiledPattern {
        conditions = List.copyOf(conditions);
    }

    public boolean isActive() {
        return source.active();
    }
}
