package com.lob.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from engine.yml (or classpath default).
 * All fields have sensible defaults for a single book on a developer machine.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private static final String DEFAULTS_SOURCE = "defaults";
    private static final String CLASSPATH_SOURCE = "classpath:/engine.yml";

    // Book
    public int orderPoolSize = 100_000;
    public int levelPoolSize = 50_000;
    public boolean allowNonPositivePrices = false;

    // Sequencer
    public int commandQueueCapacity = 65_536;   // rounded up to a power of two by Agrona
    public String idleStrategy = "backoff";     // busy-spin | yielding | backoff

    // Metrics
    public int metricsIntervalSecs = 5;

    // Where the values came from: a file path, the classpath resource, or "defaults"
    public String source = DEFAULTS_SOURCE;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig load(String path) {
        EngineConfig cfg = new EngineConfig();
        boolean fromFile = path != null && Files.exists(Paths.get(path));
        if (path != null && !fromFile) {
            log.warn("Engine config {} not found, trying {}", path, CLASSPATH_SOURCE);
        }
        try (InputStream is = fromFile
                ? Files.newInputStream(Paths.get(path))
                : EngineConfig.class.getResourceAsStream("/engine.yml")) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
            cfg.source = fromFile ? path : CLASSPATH_SOURCE;
            log.info("Loaded engine config from {}", cfg.source);
        } catch (Exception e) {
            log.warn("Failed to load engine config, using defaults: {}", e.getMessage());
            return new EngineConfig();
        }
        return cfg;
    }

    private static void applyMap(EngineConfig cfg, Map<String, Object> map) {
        if (map.containsKey("orderPoolSize")) cfg.orderPoolSize = (int) map.get("orderPoolSize");
        if (map.containsKey("levelPoolSize")) cfg.levelPoolSize = (int) map.get("levelPoolSize");
        if (map.containsKey("allowNonPositivePrices")) cfg.allowNonPositivePrices = (boolean) map.get("allowNonPositivePrices");
        if (map.containsKey("commandQueueCapacity")) cfg.commandQueueCapacity = (int) map.get("commandQueueCapacity");
        if (map.containsKey("idleStrategy")) cfg.idleStrategy = (String) map.get("idleStrategy");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
    }

    @Override
    public String toString() {
        return "EngineConfig{orderPoolSize=" + orderPoolSize +
                ", levelPoolSize=" + levelPoolSize +
                ", allowNonPositivePrices=" + allowNonPositivePrices +
                ", commandQueueCapacity=" + commandQueueCapacity +
                ", idleStrategy=" + idleStrategy +
                ", metricsIntervalSecs=" + metricsIntervalSecs +
                ", source=" + source + '}';
    }
}
