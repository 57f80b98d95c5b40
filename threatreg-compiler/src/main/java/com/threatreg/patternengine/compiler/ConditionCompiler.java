/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler;

import com.threatreg.patternengine.api.model.ConditionType;
import com.threatreg.patternengine.api.model.PatternCondition;
import com.threatreg.patternengine.api.model.PatternOperator;
import com.threatreg.patternengine.api.model.ThreatPattern;
import com.threatreg.patternengine.compiler.model.CompiledCondition;
import com.threatreg.patternengine.compiler.model.CompiledPattern;
import com.threatreg.patternengine.compiler.model.EntityTagCondition;
import com.threatreg.patternengine.compiler.model.ProductIdCondition;
import com.threatreg.patternengine.compiler.model.ProductNameCondition;
import com.threatreg.patternengine.compiler.model.ProductTagCondition;
import com.threatreg.patternengine.compiler.model.RelationshipCondition;
import com.threatreg.patternengine.compiler.model.RelationshipTargetIdCondition;
import com.threatreg.patternengine.compiler.model.RelationshipTargetTagCondition;
import com.threatreg.patternengine.compiler.model.UnrecognizedCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Parses stored, string-form conditions into {@link CompiledCondition} variants.
 *
 * <p>Compilation happens once, when a pattern is loaded for evaluation. It does not
 * validate: rows that were written before validation existed, or edited directly in
 * the store, compile to {@link UnrecognizedCondition} instead of failing the load.
 * Missing values compile to the empty string.
 */
public class ConditionCompiler {

    private static final Logger logger = Logger.getLogger(ConditionCompiler.class.getName());

    public CompiledPattern compile(ThreatPattern pattern) {
        List<CompiledCondition> compiled = new ArrayList<>(pattern.conditions().size());
        for (PatternCondition condition : pattern.conditions()) {
            compiled.add(compile(condition));
        }
        return new CompiledPattern(pattern, compiled);
    }

    public List<CompiledPattern> compileAll(List<ThreatPattern> patterns) {
        List<CompiledPattern> compiled = new ArrayList<>(patterns.size());
        for (ThreatPattern pattern : patterns) {
            compiled.add(compile(pattern));
        }
        return compiled;
    }

    public CompiledCondition compile(PatternCondition condition) {
        Optional<ConditionType> type = ConditionType.parse(condition.conditionType());
        Optional<PatternOperator> operator = PatternOperator.parse(condition.operator());
        if (type.isEmpty() || operator.isEmpty()) {
            logger.warning(String.format("Condition %s has unrecognised type/operator %s/%s and will never match",
                    condition.id(), condition.conditionType(), condition.operator()));
            return new UnrecognizedCondition(condition.conditionType(), condition.operator());
        }

        PatternOperator op = operator.get();
        String value = nullToEmpty(condition.value());
        String relationshipType = nullToEmpty(condition.relationshipType());

        return switch (type.get()) {
            case PRODUCT -> new ProductNameCondition(op, value);
            case PRODUCT_ID -> new ProductIdCondition(op, value);
            case PRODUCT_TAG -> new ProductTagCondition(op, value);
            case TAG -> new EntityTagCondition(op, value);
            case RELATIONSHIP -> new RelationshipCondition(op, relationshipType, value);
            case RELATIONSHIP_TARGET_ID -> new RelationshipTargetIdCondition(op, relationshipType, value);
            case RELATIONSHIP_TARGET_TAG -> new RelationshipTargetTagCondition(op, relationshipType, value);
        };
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
