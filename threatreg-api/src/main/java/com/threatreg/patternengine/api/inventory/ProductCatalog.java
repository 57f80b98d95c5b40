/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.api.inventory;

import com.threatreg.patternengine.api.model.Product;
import com.threatreg.patternengine.api.model.Tag;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to products and their tags.
 */
public interface ProductCatalog {

    Optional<Product> getProduct(UUID productId);

    List<Tag> listTagsByProduct(UUID productId);
}
