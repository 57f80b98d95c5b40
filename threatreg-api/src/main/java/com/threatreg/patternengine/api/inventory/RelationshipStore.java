/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.inventory;

import com.threatreg.patternengine.api.model.Relationship;

import java.util.List;
import java.util.UUID;

/**
 * Read access to entity relationships.
 */
public interface RelationshipStore {

    /**
     * @param entityId source entity
     * @return outbound relationships of the entity, in a stable order
     */
    List<Relationship> listRelationshipsByEntity(UUID entityId);
}
