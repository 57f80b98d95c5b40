/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.inventory;

import com.threatreg.patternengine.api.model.Tag;

import java.util.List;
import java.util.UUID;

/**
 * Tags assigned directly to entities.
 */
public interface TagAssignments {

    List<Tag> listTagsByEntity(UUID entityId);
}
