/*
 * Copyright (c) 2025 Threatreg
 * Licensed under the Apache License, Version 2.0
 */
package com.threatreg.patternengine.service.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the OpenTelemetry SDK of the threat registry and hands out its {@link Tracer}.
 *
 * <p>Settings are read by name, first from the environment and then from system properties:
 * <ul>
 *   <li>{@code OTEL_DISABLED}: {@code true} records nothing (default {@code false})</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code logging} or {@code otlp} (default {@code logging})</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: collector address for {@code otlp}
 *       (default {@code http://localhost:4317})</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0 to 1.0 (default 1.0)</li>
 *   <li>{@code SERVICE_NAME} or {@code OTEL_SERVICE_NAME}, {@code SERVICE_VERSION}</li>
 * </ul>
 *
 * <p>A broken configuration never stops the registry: it logs the problem and falls back to
 * a no-op tracer.
 */
public class TracingService {

    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    static final String INSTRUMENTATION_NAME = "com.threatreg.pattern-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private final OpenTelemetry openTelemetry;
    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracerProvider = tracerProvider;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    /**
     * Configures tracing from environment variables and system properties.
     */
    public static TracingService fromEnvironment() {
        return create(TracingService::lookup);
    }

    /**
     * Records nothing.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    /**
     * @param settings returns the value of a setting by name, or {@code null} when unset
     */
    static TracingService create(UnaryOperator<String> settings) {
        if (Boolean.parseBoolean(setting(settings, "OTEL_DISABLED", "false"))) {
            logger.info("Tracing disabled by OTEL_DISABLED");
            return noop();
        }

        String serviceName = setting(settings, "SERVICE_NAME",
                setting(settings, "OTEL_SERVICE_NAME", "threat-registry"));
        try {
            Sampler sampler = sampler(setting(settings, "OTEL_TRACE_SAMPLING_RATIO", "1.0"));
            SpanExporter exporter = exporter(
                    setting(settings, "OTEL_EXPORTER_TYPE", "logging"),
                    setting(settings, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317"));

            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
                    SERVICE_NAME, serviceName,
                    SERVICE_VERSION, setting(settings, "SERVICE_VERSION", "unknown"))));

            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(exporter)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(provider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info("Tracing enabled for " + serviceName + " with sampler " + sampler.getDescription());
            return new TracingService(sdk, provider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Tracing setup failed, spans will not be recorded", e);
            return noop();
        }
    }

    private static Sampler sampler(String configuredRatio) {
        double ratio;
        try {
            ratio = Double.parseDouble(configuredRatio);
        } catch (NumberFormatException e) {
            logger.warning("Ignoring OTEL_TRACE_SAMPLING_RATIO=" + configuredRatio + ", sampling all traces");
            ratio = 1.0;
        }
        ratio = Math.max(0.0, Math.min(1.0, ratio));
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter exporter(String type, String otlpEndpoint) {
        if ("otlp".equalsIgnoreCase(type)) {
            logger.info("Exporting spans over OTLP to " + otlpEndpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(otlpEndpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equalsIgnoreCase(type)) {
            logger.warning("Unknown OTEL_EXPORTER_TYPE " + type + ", exporting spans to the log");
        }
        return LoggingSpanExporter.create();
    }

    private static String setting(UnaryOperator<String> settings, String name, String defaultValue) {
        String value = settings.apply(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static String lookup(String name) {
        String value = System.getenv(name);
        return value != null && !value.isEmpty() ? value : System.getProperty(name);
    }

    /**
     * Flushes buffered spans and stops the exporter. Safe to call more than once.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        logger.info("Tracing shut down");
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }
}
