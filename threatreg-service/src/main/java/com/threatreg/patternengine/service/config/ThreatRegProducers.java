/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.config;

import com.threatreg.patternengine.api.IPatternMatchingEngine;
import com.threatreg.patternengine.compiler.ConditionCompiler;
import com.threatreg.patternengine.compiler.ConditionValidator;
import com.threatreg.patternengine.runtime.evaluation.EvaluationSettings;
import com.threatreg.patternengine.runtime.evaluation.PatternMatchingEngine;
import com.threatreg.patternengine.service.repository.JdbcInventoryRepository;
import com.threatreg.patternengine.service.repository.JdbcThreatPatternRepository;
import com.threatreg.patternengine.service.telemetry.TracingService;
import io.opentelemetry.api.trace.Tracer;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * CDI producers for the pattern engine components.
 * Creates singleton instances of the non-CDI engine classes.
 */
@ApplicationScoped
public class ThreatRegProducers {

    private static final Logger logger = Logger.getLogger(ThreatRegProducers.class.getName());

    @ConfigProperty(name = "threatreg.evaluation.parallelism", defaultValue = "1")
    int parallelism;

    @ConfigProperty(name = "threatreg.evaluation.lookup-cache-size", defaultValue = "10000")
    long lookupCacheSize;

    private ExecutorService evaluationExecutor;

    @Produces
    @Singleton
    public TracingService tracingService() {
        return TracingService.fromEnvironment();
    }

    @Produces
    @ApplicationScoped
    public Tracer tracer(TracingService tracingService) {
        return tracingService.getTracer();
    }

    @Produces
    @ApplicationScoped
    public ConditionValidator conditionValidator() {
        return new ConditionValidator();
    }

    @Produces
    @ApplicationScoped
    public ConditionCompiler conditionCompiler() {
        return new ConditionCompiler();
    }

    @Produces
    @Singleton
    public EvaluationSettings evaluationSettings() {
        return EvaluationSettings.builder()
                .parallelism(parallelism)
                .lookupCacheSize(lookupCacheSize)
                .build();
    }

    /**
     * Produces the matching engine over the JDBC inventory and pattern catalog.
     * Batch runs use a fixed worker pool when parallelism is above 1.
     */
    @Produces
    @ApplicationScoped
    public IPatternMatchingEngine patternMatchingEngine(JdbcInventoryRepository inventory,
                                                        JdbcThreatPatternRepository patterns,
                                                        ConditionCompiler compiler,
                                                        EvaluationSettings settings,
                                                        Tracer tracer) {
        if (settings.isParallel()) {
            evaluationExecutor = Executors.newFixedThreadPool(settings.parallelism(), evaluationThreadFactory());
            logger.info("Pattern evaluation runs on " + settings.parallelism() + " worker threads");
        }
        return new PatternMatchingEngine(inventory, patterns, inventory, inventory, inventory,
                compiler, tracer, settings, evaluationExecutor);
    }

    private static ThreadFactory evaluationThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pattern-evaluation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    void shutdownExecutor() {
        if (evaluationExecutor != null) {
            evaluationExecutor.shutdownNow();
        }
    }
}
