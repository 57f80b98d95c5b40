/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.evaluation;

import com.threatreg.patternengine.api.model.Entity;
import com.threatreg.patternengine.compiler.model.CompiledCondition;
import com.threatreg.patternengine.compiler.model.CompiledPattern;

/**
 * Decides whether an entity satisfies a whole pattern.
 *
 * <p>An inactive pattern never matches. An active pattern matches when every condition
 * holds, so an active pattern without conditions matches every entity. Conditions are
 * evaluated in order and evaluation stops at the first one that does not hold.
 */
public final class PatternEvaluator {

    private final ConditionEvaluator conditionEvaluator;

    public PatternEvaluator(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public boolean matches(Entity entity, CompiledPattern pattern) {
        if (!pattern.isActive()) {
            return false;
        }
        for (CompiledCondition condition : pattern.conditions()) {
            if (!conditionEvaluator.evaluate(entity, condition)) {
                return false;
            }
        }
        return true;
    }
}
