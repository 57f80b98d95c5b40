/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PUT /patterns/{id}/active}.
 */
public record ActivationRequest(@JsonProperty("is_active") boolean active) {
}
