/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.evaluation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationSettingsTest {

    @Test
    @DisplayName("Should default to sequential evaluation with caching")
    void shouldProvideDefaults() {
        EvaluationSettings settings = EvaluationSettings.defaults();

        assertThat(settings.parallelism()).isEqualTo(1);
        assertThat(settings.isParallel()).isFalse();
        assertThat(settings.lookupCacheSize()).isEqualTo(EvaluationSettings.DEFAULT_LOOKUP_CACHE_SIZE);
        assertThat(settings.isLookupCacheEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should disable caching with a zero cache size")
    void shouldDisableCache() {
        EvaluationSettings settings = EvaluationSettings.builder()
                .parallelism(4)
                .lookupCacheSize(0)
                .build();

        assertThat(settings.isParallel()).isTrue();
        assertThat(settings.isLookupCacheEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> EvaluationSettings.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> EvaluationSettings.builder().lookupCacheSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookupCacheSize");
    }
}
