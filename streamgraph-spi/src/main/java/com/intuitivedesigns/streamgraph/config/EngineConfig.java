/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Properties-backed engine configuration.
 * Loads from -Dsg.config.path, ENV 'SG_CONFIG_PATH', or classpath 'streamgraph.properties'.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String PROP_CONFIG_PATH = "sg.config.path";
    public static final String ENV_CONFIG_PATH = "SG_CONFIG_PATH";
    public static final String CLASSPATH_RESOURCE = "streamgraph.properties";

    private static final EngineConfig EMPTY = new EngineConfig(new Properties());

    private final Properties props;

    private EngineConfig(Properties props) {
        this.props = props;
    }

    public static EngineConfig load() {
        // 1. System property, then environment
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        final Properties props = new Properties();
        if (path != null && !path.isBlank()) {
            log.info("Loading configuration from: {}", path);
            try (InputStream is = new FileInputStream(path)) {
                props.load(is);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config file: " + path, e);
            }
            log.info("Loaded {} properties.", props.size());
            return new EngineConfig(props);
        }

        // 2. Classpath fallback
        final ClassLoader cl = resolveClassLoader();
        try (InputStream is = cl.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (is == null) {
                log.warn("No configuration file specified; using defaults. Usage: -D{}=/path/to/streamgraph.properties", PROP_CONFIG_PATH);
                return new EngineConfig(props);
            }
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load classpath config: " + CLASSPATH_RESOURCE, e);
        }
        log.info("Loaded {} properties from classpath:{}", props.size(), CLASSPATH_RESOURCE);
        return new EngineConfig(props);
    }

    public static EngineConfig empty() {
        return EMPTY;
    }

    public static EngineConfig fromProperties(Properties source) {
        Objects.requireNonNull(source, "source");
        final Properties copy = new Properties();
        copy.putAll(source);
        return new EngineConfig(copy);
    }

    public static EngineConfig fromMap(Map<String, ?> source) {
        Objects.requireNonNull(source, "source");
        final Properties copy = new Properties();
        source.forEach((k, v) -> {
            if (k != null && v != null) copy.setProperty(k, String.valueOf(v));
        });
        return new EngineConfig(copy);
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid int for '{}': '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}' (using {})", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : EngineConfig.class.getClassLoader();
    }
}
