/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.evaluation;

import com.threatreg.patternengine.api.exceptions.LookupException;
import com.threatreg.patternengine.api.inventory.ProductCatalog;
import com.threatreg.patternengine.api.inventory.RelationshipStore;
import com.threatreg.patternengine.api.inventory.TagAssignments;
import com.threatreg.patternengine.api.model.Entity;
import com.threatreg.patternengine.api.model.PatternOperator;
import com.threatreg.patternengine.api.model.Product;
import com.threatreg.patternengine.api.model.Relationship;
import com.threatreg.patternengine.api.model.Tag;
import com.threatreg.patternengine.compiler.model.CompiledCondition;
import com.threatreg.patternengine.compiler.model.EntityTagCondition;
import com.threatreg.patternengine.compiler.model.ProductIdCondition;
import com.threatreg.patternengine.compiler.model.ProductNameCondition;
import com.threatreg.patternengine.compiler.model.ProductTagCondition;
import com.threatreg.patternengine.compiler.model.RelationshipCondition;
import com.threatreg.patternengine.compiler.model.RelationshipTargetIdCondition;
import com.threatreg.patternengine.compiler.model.RelationshipTargetTagCondition;
import com.threatreg.patternengine.compiler.model.UnrecognizedCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Evaluates a single compiled condition against an entity.
 *
 * <h2>Fail-Closed Lookups</h2>
 * <p>
 * <b>Evaluation never throws because of a collaborator.</b> When a product, tag or
 * relationship lookup raises a {@link LookupException}, or the entity's product cannot
 * be found, the affected condition evaluates to {@code false}. The failure is logged at
 * debug level and the run carries on with the next condition or entity. A broken lookup
 * therefore hides a match; it never produces one.
 *
 * <p>
 * One exception to the per-condition rule: for {@link RelationshipTargetTagCondition} a
 * failed tag lookup on one target skips only that relationship, and the scan continues
 * with the next one.
 *
 * <h2>Operator Coverage</h2>
 * <p>
 * Each condition kind understands a fixed subset of operators. Any other operator makes
 * the condition evaluate to {@code false}, as does an {@link UnrecognizedCondition}.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless apart from its collaborators; safe for concurrent use when they are.
 */
public final class ConditionEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ProductCatalog productCatalog;
    private final TagAssignments tagAssignments;
    private final RelationshipStore relationshipStore;

    public ConditionEvaluator(ProductCatalog productCatalog,
                              TagAssignments tagAssignments,
                              RelationshipStore relationshipStore) {
        this.productCatalog = productCatalog;
        this.tagAssignments = tagAssignments;
        this.relationshipStore = relationshipStore;
    }

    /**
     * @return whether {@code entity} satisfies {@code condition}; {@code false} when a
     * lookup needed to decide fails
     */
    public boolean evaluate(Entity entity, CompiledCondition condition) {
        try {
            if (condition instanceof ProductNameCondition c) {
                return product(entity)
                        .map(p -> applyOperator(c.operator(), nullToEmpty(p.name()), c.value()))
                        .orElse(false);
            }
            if (condition instanceof ProductIdCondition c) {
                // Compared on the reference alone, no product lookup.
                return entity.productId() != null
                        && applyOperator(c.operator(), entity.productId().toString(), c.value());
            }
            if (condition instanceof ProductTagCondition c) {
                if (entity.productId() == null) {
                    return false;
                }
                return evaluateTags(productCatalog.listTagsByProduct(entity.productId()), c.operator(), c.tag());
            }
            if (condition instanceof EntityTagCondition c) {
                return evaluateTags(tagAssignments.listTagsByEntity(entity.id()), c.operator(), c.tag());
            }
            if (condition instanceof RelationshipCondition c) {
                return evaluateRelationship(entity, c);
            }
            if (condition instanceof RelationshipTargetIdCondition c) {
                return evaluateRelationshipTargetId(entity, c);
            }
            if (condition instanceof RelationshipTargetTagCondition c) {
                return evaluateRelationshipTargetTag(entity, c);
            }
            return false;
        } catch (LookupException e) {
            logger.debug("Lookup failed while evaluating {} for entity {}, condition treated as not met",
                    condition, entity.id(), e);
            return false;
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // PRODUCT CONDITIONS
    // ════════════════════════════════════════════════════════════════════════════════

    private Optional<Product> product(Entity entity) {
        if (entity.productId() == null) {
            return Optional.empty();
        }
        Optional<Product> product = productCatalog.getProduct(entity.productId());
        if (product.isEmpty()) {
            logger.debug("Product {} of entity {} not found", entity.productId(), entity.id());
        }
        return product;
    }

    static boolean applyOperator(PatternOperator operator, String actual, String expected) {
        switch (operator) {
            case EQUALS:
                return actual.equals(expected);
            case NOT_EQUALS:
                return !actual.equals(expected);
            case CONTAINS:
                return actual.contains(expected);
            case NOT_CONTAINS:
                return !actual.contains(expected);
            default:
                return false;
        }
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // TAG CONDITIONS
    // ════════════════════════════════════════════════════════════════════════════════

    private static boolean evaluateTags(List<Tag> tags, PatternOperator operator, String tag) {
        switch (operator) {
            case CONTAINS:
                return hasTag(tags, tag);
            case NOT_CONTAINS:
                return !hasTag(tags, tag);
            case EXISTS:
                return !tags.isEmpty();
            case NOT_EXISTS:
                return tags.isEmpty();
            default:
                return false;
        }
    }

    private static boolean hasTag(List<Tag> tags, String name) {
        for (Tag tag : tags) {
            if (name.equals(tag.name())) {
                return true;
            }
        }
        return false;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RELATIONSHIP CONDITIONS
    // ════════════════════════════════════════════════════════════════════════════════

    private boolean evaluateRelationship(Entity entity, RelationshipCondition condition) {
        List<Relationship> relationships = relationshipStore.listRelationshipsByEntity(entity.id());
        switch (condition.operator()) {
            case EXISTS:
                return hasRelationshipOfType(relationships, condition.relationshipType());
            case NOT_EXISTS:
                return !hasRelationshipOfType(relationships, condition.relationshipType());
            case EQUALS:
                return hasRelationshipToTarget(relationships, condition.relationshipType(), condition.value());
            default:
                return false;
        }
    }

    private boolean evaluateRelationshipTargetId(Entity entity, RelationshipTargetIdCondition condition) {
        List<Relationship> relationships = relationshipStore.listRelationshipsByEntity(entity.id());
        switch (condition.operator()) {
            case HAS_RELATIONSHIP_WITH:
                return hasRelationshipToTarget(relationships, condition.relationshipType(), condition.targetId());
            case NOT_HAS_RELATIONSHIP_WITH:
                return !hasRelationshipToTarget(relationships, condition.relationshipType(), condition.targetId());
            default:
                return false;
        }
    }

    /**
     * Scans outbound relationships in order. {@code HAS_RELATIONSHIP_WITH} holds at the
     * first target carrying the tag. {@code NOT_HAS_RELATIONSHIP_WITH} fails at the first
     * such target and holds when the scan completes without one. Product targets are
     * skipped, and so is any target whose tags cannot be read.
     */
    private boolean evaluateRelationshipTargetTag(Entity entity, RelationshipTargetTagCondition condition) {
        PatternOperator operator = condition.operator();
        if (operator != PatternOperator.HAS_RELATIONSHIP_WITH
                && operator != PatternOperator.NOT_HAS_RELATIONSHIP_WITH) {
            return false;
        }

        for (Relationship relationship : relationshipStore.listRelationshipsByEntity(entity.id())) {
            if (!relationship.isOfType(condition.relationshipType()) || !relationship.targetsEntity()) {
                continue;
            }

            List<Tag> targetTags;
            try {
                targetTags = tagAssignments.listTagsByEntity(relationship.toEntityId());
            } catch (LookupException e) {
                logger.debug("Skipping relationship {} of entity {}: target tags unavailable",
                        relationship.id(), entity.id(), e);
                continue;
            }

            if (hasTag(targetTags, condition.tag())) {
                return operator == PatternOperator.HAS_RELATIONSHIP_WITH;
            }
        }
        return operator == PatternOperator.NOT_HAS_RELATIONSHIP_WITH;
    }

    private static boolean hasRelationshipOfType(List<Relationship> relationships, String type) {
        for (Relationship relationship : relationships) {
            if (relationship.isOfType(type)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasRelationshipToTarget(List<Relationship> relationships, String type, String targetId) {
        for (Relationship relationship : relationships) {
            if (!relationship.isOfType(type)) {
                continue;
            }
            UUID target = relationship.targetId();
            if (target != null && target.toString().equals(targetId)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
