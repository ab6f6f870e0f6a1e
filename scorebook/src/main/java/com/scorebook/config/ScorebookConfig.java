package com.scorebook.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ScorebookConfig {
    public static final String DEFAULT_RESOURCE = "scorebook.yml";

    /** Entradas reglamentarias; las siguientes arrancan con corredor en segunda. */
    public int regulationInnings = 9;
    /** Variación mínima de probabilidad de victoria (0..1) para una jugada clave. */
    public double keyPlayThreshold = 0.10;
    /** Reglas con confianza menor no cuentan como reconocimiento. */
    public double minRuleConfidence = 0.5;
    /** Recursos del classpath con reglas de jugadas, en orden. */
    public List<String> rules = new ArrayList<>(List.of("play-rules.yml"));

    public BatchConfig batch = new BatchConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchConfig {
        /** Cantidad de workers; 0 = uno por core disponible. */
        public int workerThreads = 0;
        /** Capacidad de cola de partidos antes de bloquear el envío (backpressure). */
        public int queueCapacity = 64;

        public int effectiveWorkers() {
            return workerThreads > 0 ? workerThreads : Math.max(1, Runtime.getRuntime().availableProcessors());
        }
    }

    public static ScorebookConfig defaults() {
        return new ScorebookConfig().validate();
    }

    /** Carga {@value #DEFAULT_RESOURCE} del classpath, o los defaults si no está. */
    public static ScorebookConfig load() {
        try (InputStream in = ScorebookConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            return in == null ? defaults() : load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + DEFAULT_RESOURCE, e);
        }
    }

    public static ScorebookConfig load(InputStream yaml) {
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            ScorebookConfig cfg = om.readValue(yaml, ScorebookConfig.class);
            return (cfg == null ? new ScorebookConfig() : cfg).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading scorebook configuration", e);
        }
    }

    public ScorebookConfig validate() {
        if (regulationInnings < 1) {
            throw new IllegalArgumentException("regulationInnings must be >= 1, was " + regulationInnings);
        }
        if (keyPlayThreshold < 0.0 || keyPlayThreshold > 1.0) {
            throw new IllegalArgumentException("keyPlayThreshold must be within [0,1], was " + keyPlayThreshold);
        }
        if (minRuleConfidence < 0.0 || minRuleConfidence > 1.0) {
            throw new IllegalArgumentException("minRuleConfidence must be within [0,1], was " + minRuleConfidence);
        }
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("at least one rules resource is required");
        }
        if (batch == null) batch = new BatchConfig();
        if (batch.queueCapacity < 1) {
            throw new IllegalArgumentException("batch.queueCapacity must be >= 1, was " + batch.queueCapacity);
        }
        return this;
    }
}
