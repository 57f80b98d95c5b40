/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.compiler.model;

/**
 * A pattern condition parsed into its typed form.
 *
 * <p>Each variant carries exactly the fields its condition type needs; only the
 * relationship variants have a relationship type. Stored rows whose type or operator
 * cannot be parsed compile to {@link UnrecognizedCondition}, which never matches.
 */
public sealed interface CompiledCondition
        permits ProductNameCondition, ProductIdCondition, ProductTagCondition, EntityTagCondition,
        RelationshipCondition, RelationshipTargetIdCondition, RelationshipTargetTagCondition,
        UnrecognizedCondition {
}
