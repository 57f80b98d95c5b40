/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.inventory;

import com.threatreg.patternengine.api.model.Entity;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the entity inventory.
 *
 * <p><b>Thread Safety:</b> Implementations must support concurrent reads.
 */
public interface EntityInventory {

    /**
     * @return every entity, in a stable order
     * @throws com.threatreg.patternengine.api.exceptions.LookupException if the inventory cannot be read
     */
    List<Entity> listEntities();

    /**
     * @param id entity identifier
     * @return the entity, or empty if none exists
     * @throws com.threatreg.patternengine.api.exceptions.LookupException if the inventory cannot be read
     */
    Optional<Entity> getEntity(UUID id);
}
