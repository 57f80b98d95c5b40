/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.lookup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.threatreg.patternengine.api.inventory.ProductCatalog;
import com.threatreg.patternengine.api.inventory.RelationshipStore;
import com.threatreg.patternengine.api.inventory.TagAssignments;
import com.threatreg.patternengine.api.model.Product;
import com.threatreg.patternengine.api.model.Relationship;
import com.threatreg.patternengine.api.model.Tag;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Memoises inventory lookups for the duration of one evaluation run.
 *
 * <p>A batch run touches the same products and relationship targets many times: once per
 * pattern for every entity, and again whenever an entity is the target of another entity's
 * relationship. Each lookup kind gets its own bounded Caffeine cache keyed by identifier.
 *
 * <p>A lookup that throws is not cached. The exception reaches the caller and the next
 * request for the same key goes to the delegate again.
 *
 * <p><b>Lifecycle:</b> create one instance per run and drop it afterwards, so that no
 * inventory state outlives the run.
 *
 * <p><b>Thread Safety:</b> Thread-safe; concurrent requests for one key call the
 * delegate once.
 */
public final class LookupCache implements ProductCatalog, TagAssignments, RelationshipStore {

    private final ProductCatalog productCatalog;
    private final TagAssignments tagAssignments;
    private final RelationshipStore relationshipStore;

    private final Cache<UUID, Optional<Product>> products;
    private final Cache<UUID, List<Tag>> productTags;
    private final Cache<UUID, List<Tag>> entityTags;
    private final Cache<UUID, List<Relationship>> relationships;

    public LookupCache(ProductCatalog productCatalog,
                       TagAssignments tagAssignments,
                       RelationshipStore relationshipStore,
                       long maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.productCatalog = productCatalog;
        this.tagAssignments = tagAssignments;
        this.relationshipStore = relationshipStore;
        this.products = newCache(maxSize);
        this.productTags = newCache(maxSize);
        this.entityTags = newCache(maxSize);
        this.relationships = newCache(maxSize);
    }

    private static <V> Cache<UUID, V> newCache(long maxSize) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    @Override
    public Optional<Product> getProduct(UUID productId) {
        return products.get(productId, productCatalog::getProduct);
    }

    @Override
    public List<Tag> listTagsByProduct(UUID productId) {
        return productTags.get(productId, productCatalog::listTagsByProduct);
    }

    @Override
    public List<Tag> listTagsByEntity(UUID entityId) {
        return entityTags.get(entityId, tagAssignments::listTagsByEntity);
    }

    @Override
    public List<Relationship> listRelationshipsByEntity(UUID entityId) {
        return relationships.get(entityId, relationshipStore::listRelationshipsByEntity);
    }

    /**
     * @return combined statistics of all four caches
     */
    public CacheStats stats() {
        return products.stats()
                .plus(productTags.stats())
                .plus(entityTags.stats())
                .plus(relationships.stats());
    }
}
