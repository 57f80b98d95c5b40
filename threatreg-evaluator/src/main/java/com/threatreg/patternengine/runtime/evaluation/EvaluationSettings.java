/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.runtime.evaluation;

/**
 * Tuning knobs of {@link PatternMatchingEngine}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * EvaluationSettings settings = EvaluationSettings.builder()
 *     .parallelism(4)
 *     .lookupCacheSize(50_000)
 *     .build();
 * }</pre>
 */
public final class EvaluationSettings {

    public static final int DEFAULT_PARALLELISM = 1;
    public static final long DEFAULT_LOOKUP_CACHE_SIZE = 10_000;

    private final int parallelism;
    private final long lookupCacheSize;

    private EvaluationSettings(Builder builder) {
        this.parallelism = builder.parallelism;
        this.lookupCacheSize = builder.lookupCacheSize;
        validate();
    }

    public static EvaluationSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private void validate() {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        if (lookupCacheSize < 0) {
            throw new IllegalArgumentException("lookupCacheSize must not be negative, got " + lookupCacheSize);
        }
    }

    /**
     * Number of entities evaluated concurrently in a batch run. 1 evaluates on the
     * calling thread.
     */
    public int parallelism() {
        return parallelism;
    }

    /**
     * Maximum entries of each per-run lookup cache. 0 disables caching.
     */
    public long lookupCacheSize() {
        return lookupCacheSize;
    }

    public boolean isParallel() {
        return parallelism > 1;
    }

    public boolean isLookupCacheEnabled() {
        return lookupCacheSize > 0;
    }

    @Override
    public String toString() {
        return "EvaluationSettings{parallelism=" + parallelism + ", lookupCacheSize=" + lookupCacheSize + "}";
    }

    public static final class Builder {
        private int parallelism = DEFAULT_PARALLELISM;
        private long lookupCacheSize = DEFAULT_LOOKUP_CACHE_SIZE;

        private Builder() {
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder lookupCacheSize(long lookupCacheSize) {
            this.lookupCacheSize = lookupCacheSize;
            return this;
        }

        public EvaluationSettings build() {
            return new EvaluationSettings(this);
        }
    }
}
