/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api;

import com.threatreg.patternengine.api.model.ThreatPattern;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read view of stored threat patterns. Every returned pattern carries its conditions
 * in insertion order.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 */
public interface ThreatPatternCatalog {

    Optional<ThreatPattern> findById(UUID patternId);

    List<ThreatPattern> listAll();

    /**
     * @return patterns whose active flag is set, in listing order
     */
    List<ThreatPattern> listActive();

    List<ThreatPattern> listByThreat(UUID threatId);
}
