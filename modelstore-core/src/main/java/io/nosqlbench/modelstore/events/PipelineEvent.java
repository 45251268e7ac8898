package io.nosqlbench.modelstore.events;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Structured events emitted by the acquisition pipeline.
///
/// Names are kept within 15 characters so that formatted event lines stay aligned.
public enum PipelineEvent implements EventType {
    // Transfers
    TRANSFER_START(EventType.Level.INFO,
        param("id", String.class, "The artifact id being transferred"),
        param("url", String.class, "The source location"),
        param("offset", Long.class, "The byte offset the transfer starts at")),
    TRANSFER_PROG(EventType.Level.DEBUG,
        param("id", String.class, "The artifact id being transferred"),
        param("bytes", Long.class, "Bytes held so far, including resumed bytes"),
        param("total", Long.class, "Total expected bytes, -1 if unknown"),
        param("speed", Double.class, "Moving-average speed in bytes per second")),
    TRANSFER_DONE(EventType.Level.INFO,
        param("id", String.class, "The artifact id transferred"),
        param("bytes", Long.class, "Final size of the file"),
        param("millis", Long.class, "Elapsed wall-clock time of this attempt")),
    TRANSFER_FAIL(EventType.Level.ERROR,
        param("id", String.class, "The artifact id that failed"),
        param("offset", Long.class, "Bytes kept in the partial file"),
        param("text", String.class, "The failure message")),
    TRANSFER_PAUSE(EventType.Level.INFO, param("id", String.class, "The paused artifact id")),
    TRANSFER_RESUME(EventType.Level.INFO, param("id", String.class, "The resumed artifact id")),
    TRANSFER_CANCEL(EventType.Level.WARN,
        param("id", String.class, "The cancelled artifact id"),
        param("bytes", Long.class, "Bytes kept in the partial file")),
    THROTTLE(EventType.Level.DEBUG,
        param("id", String.class, "The throttled artifact id"),
        param("delay", Long.class, "Delay inserted before the next read, in milliseconds"),
        param("speed", Double.class, "Moving-average speed that triggered the delay")),
    BACKPRESSURE(EventType.Level.TRACE,
        param("id", String.class, "The artifact id whose sink is draining"),
        param("buffered", Long.class, "Bytes waiting in the sink")),
    MEMORY_HIGH(EventType.Level.WARN,
        param("used", Long.class, "Heap bytes in use"),
        param("threshold", Long.class, "Configured threshold")),
    SETTINGS_TUNED(EventType.Level.INFO,
        param("concurrency", Integer.class, "Maximum concurrent transfers"),
        param("buffer", Integer.class, "Read buffer size in bytes"),
        param("maxSpeed", Long.class, "Bandwidth cap in bytes per second")),

    // Verification
    VERIFY_OK(EventType.Level.INFO,
        param("path", String.class, "The verified file"),
        param("checksum", String.class, "The computed SHA-256")),
    VERIFY_FAIL(EventType.Level.ERROR,
        param("path", String.class, "The rejected file"),
        param("reason", String.class, "The quarantine reason"),
        param("text", String.class, "The failing checks")),
    QUARANTINE(EventType.Level.WARN,
        param("path", String.class, "The original location"),
        param("quarantined", String.class, "The location inside quarantine"),
        param("reason", String.class, "The quarantine reason")),
    RESTORE(EventType.Level.INFO,
        param("quarantined", String.class, "The location inside quarantine"),
        param("target", String.class, "The restored location")),
    QUARANTINE_PURGE(EventType.Level.INFO, param("count", Long.class, "Entries removed")),

    // Cache
    CACHE_HIT(EventType.Level.DEBUG, param("id", String.class, "The artifact id")),
    CACHE_MISS(EventType.Level.DEBUG,
        param("id", String.class, "The artifact id"),
        param("status", String.class, "Why the entry could not be used")),
    CACHE_JOIN(EventType.Level.DEBUG, param("id", String.class, "The artifact id already in flight")),
    CACHE_STORE(EventType.Level.INFO,
        param("id", String.class, "The artifact id"),
        param("size", Long.class, "Stored size in bytes")),
    CACHE_EVICT(EventType.Level.INFO,
        param("id", String.class, "The evicted artifact id"),
        param("reason", String.class, "The eviction strategy")),

    // Errors and recovery
    ERROR_RECORDED(EventType.Level.WARN,
        param("code", String.class, "The generated error code"),
        param("category", String.class, "The error category"),
        param("severity", String.class, "The error severity"),
        param("text", String.class, "The human-readable message")),
    RECOVERY(EventType.Level.INFO,
        param("code", String.class, "The error code being recovered"),
        param("strategy", String.class, "The strategy applied"),
        param("success", Boolean.class, "Whether recovery succeeded")),
    FALLBACK(EventType.Level.INFO,
        param("primary", String.class, "The artifact that could not be used"),
        param("alternative", String.class, "The selected alternative")),
    CONNECTIVITY(EventType.Level.INFO,
        param("status", String.class, "The overall connectivity status"),
        param("reachable", Integer.class, "Reachable endpoints"),
        param("total", Integer.class, "Probed endpoints"));

    private record ParamInfo(String name, Class<?> type, String description) {
        private ParamInfo {
            Objects.requireNonNull(name, "Parameter name cannot be null");
            Objects.requireNonNull(type, "Parameter type cannot be null");
            Objects.requireNonNull(description, "Parameter description cannot be null");
        }
    }

    private final EventType.Level level;
    private final Map<String, Class<?>> requiredParams;
    private final Map<String, String> paramDescriptions;

    PipelineEvent(EventType.Level level, ParamInfo... requiredParams) {
        this.level = level;
        Map<String, Class<?>> params = new LinkedHashMap<>();
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (ParamInfo info : requiredParams) {
            params.put(info.name(), info.type());
            descriptions.put(info.name(), info.description());
        }
        this.requiredParams = Collections.unmodifiableMap(params);
        this.paramDescriptions = Collections.unmodifiableMap(descriptions);
    }

    private static ParamInfo param(String name, Class<?> type, String description) {
        return new ParamInfo(name, type, description);
    }

    @Override
    public EventType.Level getLevel() {
        return level;
    }

    @Override
    public Map<String, Class<?>> getRequiredParams() {
        return requiredParams;
    }

    /// @return parameter names mapped to their descriptions
    public Map<String, String> getParamDescriptions() {
        return paramDescriptions;
    }
}
