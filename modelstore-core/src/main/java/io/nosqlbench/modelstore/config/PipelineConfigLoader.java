package io.nosqlbench.modelstore.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.modelstore.cache.EvictionStrategy;
import io.nosqlbench.modelstore.errors.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Reads [PipelineConfig] from YAML.
///
/// The document is a flat map whose keys are the kebab-case names of the settings:
/// ```yaml
/// cache-dir: ~/.cache/nbmodelstore/models
/// max-cache-size: 5GB
/// max-age: 30d
/// eviction-strategy: lru
/// max-concurrent-downloads: 3
/// max-speed: 10MB
/// connectivity-endpoints:
///   - https://huggingface.co
/// ```
/// Sizes accept a plain byte count or a `KB`, `MB`, `GB` suffix (powers of 1024). Durations
/// accept a plain number of seconds or a `ms`, `s`, `m`, `h`, `d` suffix. Settings which are
/// absent keep their defaults; unknown keys are logged and ignored.
public class PipelineConfigLoader {
    private static final Logger logger = LogManager.getLogger(PipelineConfigLoader.class);

    /// Default settings file location
    public static final Path DEFAULT_SETTINGS = Path.of("~/.config/nbmodelstore/settings.yaml");

    private static final Pattern SIZE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([kmgt]i?b?|b)?");
    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)?");

    private PipelineConfigLoader() {
    }

    /// Loads `~/.config/nbmodelstore/settings.yaml`, or the defaults when that file is absent.
    /// @return the configuration
    public static PipelineConfig loadDefault() {
        Path settings = expandTilde(DEFAULT_SETTINGS);
        if (!Files.exists(settings)) {
            logger.debug("no settings at {}, using defaults", settings);
            return PipelineConfig.defaults();
        }
        return load(settings);
    }

    /// @param settings a YAML settings file
    /// @return the configuration
    /// @throws ConfigurationException if the file cannot be read or holds invalid values
    public static PipelineConfig load(Path settings) {
        try {
            return loadFromString(Files.readString(settings));
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read settings file " + settings, e);
        }
    }

    /// @param yaml YAML settings text
    /// @return the configuration
    /// @throws ConfigurationException if the text is not a map or holds invalid values
    public static PipelineConfig loadFromString(String yaml) {
        LoadSettings loadSettings = LoadSettings.builder().setLabel("nbmodelstore settings").build();
        Load load = new Load(loadSettings);
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ConfigurationException("Settings are not valid YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return PipelineConfig.defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Settings must be a map of keys to values");
        }
        return apply(map, PipelineConfig.builder()).build();
    }

    private static PipelineConfig.Builder apply(Map<?, ?> map, PipelineConfig.Builder builder) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "cache-dir" -> builder.cacheDirectory(expandTilde(Path.of(value.toString())));
                case "quarantine-dir" -> builder.quarantineDirectory(expandTilde(Path.of(value.toString())));
                case "max-cache-size" -> builder.maxCacheSize(parseBytes(key, value));
                case "max-age" -> builder.maxAge(parseDuration(key, value));
                case "eviction-strategy" -> builder.evictionStrategy(parseStrategy(value));
                case "max-concurrent-downloads" -> builder.maxConcurrentDownloads(parseInt(key, value));
                case "max-speed" -> builder.maxBytesPerSecond(parseBytes(key, value));
                case "buffer-size" -> builder.bufferSize(parseIntBytes(key, value));
                case "high-water-mark" -> builder.highWaterMark(parseIntBytes(key, value));
                case "memory-threshold" -> builder.memoryThreshold(parseBytes(key, value));
                case "quarantine-retention-days" -> builder.quarantineRetentionDays(parseInt(key, value));
                case "connectivity-endpoints" -> builder.connectivityEndpoints(parseEndpoints(value));
                case "probe-timeout" -> builder.probeTimeout(parseDuration(key, value));
                case "connectivity-cache-ttl" -> builder.connectivityCacheTtl(parseDuration(key, value));
                case "disk-space-cache-ttl" -> builder.diskSpaceCacheTtl(parseDuration(key, value));
                case "minimum-free-space" -> builder.minimumFreeSpace(parseBytes(key, value));
                case "retry-base-delay" -> builder.retryBaseDelay(parseDuration(key, value));
                case "max-retry-attempts" -> builder.maxRetryAttempts(parseInt(key, value));
                case "allow-insecure-loopback" -> builder.allowInsecureLoopback(Boolean.parseBoolean(value.toString()));
                default -> logger.warn("ignoring unknown setting '{}'", key);
            }
        }
        return builder;
    }

    /// Parses a byte count such as `1048576`, `64KB` or `1.5 GB`.
    /// @param key the setting name, for error messages
    /// @param value the raw value
    /// @return the size in bytes
    public static long parseBytes(String key, Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        Matcher matcher = SIZE.matcher(value.toString().trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ConfigurationException("Invalid size for " + key + ": " + value);
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "b" : matcher.group(2);
        long multiplier = switch (unit.charAt(0)) {
            case 'k' -> PipelineConfig.KB;
            case 'm' -> PipelineConfig.MB;
            case 'g' -> PipelineConfig.GB;
            case 't' -> PipelineConfig.GB * 1024L;
            default -> 1L;
        };
        return (long) (amount * multiplier);
    }

    /// Parses a duration such as `30d`, `60s`, `500ms` or a plain number of seconds.
    /// @param key the setting name, for error messages
    /// @param value the raw value
    /// @return the duration
    public static Duration parseDuration(String key, Object value) {
        if (value instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        Matcher matcher = DURATION.matcher(value.toString().trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ConfigurationException("Invalid duration for " + key + ": " + value);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "s" : matcher.group(2);
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> Duration.ofSeconds(amount);
        };
    }

    private static int parseIntBytes(String key, Object value) {
        long bytes = parseBytes(key, value);
        if (bytes > Integer.MAX_VALUE) {
            throw new ConfigurationException(key + " must be below 2GB, was " + value);
        }
        return (int) bytes;
    }

    private static int parseInt(String key, Object value) {
        if (value instanceof Number number) {
            long whole = number.longValue();
            if (whole != number.intValue()) {
                throw new ConfigurationException("Integer out of range for " + key + ": " + value);
            }
            return (int) whole;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static EvictionStrategy parseStrategy(Object value) {
        try {
            return EvictionStrategy.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid eviction-strategy: " + value + ", expected lru or age", e);
        }
    }

    private static List<URI> parseEndpoints(Object value) {
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("connectivity-endpoints must be a list of URLs");
        }
        List<URI> endpoints = new ArrayList<>();
        for (Object element : list) {
            try {
                endpoints.add(URI.create(String.valueOf(element).trim()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid connectivity endpoint: " + element, e);
            }
        }
        return endpoints;
    }

    /// Replaces a leading `~` with the user's home directory.
    /// @param path a path which may start with `~`
    /// @return the expanded path
    public static Path expandTilde(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + text.substring(1));
        }
        return path;
    }
}
