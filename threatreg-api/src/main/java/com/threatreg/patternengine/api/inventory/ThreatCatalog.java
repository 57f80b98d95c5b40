/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.inventory;

import com.threatreg.patternengine.api.model.Threat;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the threat catalog. Used for referential checks when patterns are written.
 */
public interface ThreatCatalog {

    Optional<Threat> getThreat(UUID threatId);
}
