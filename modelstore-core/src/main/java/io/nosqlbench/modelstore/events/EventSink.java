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

import java.util.Map;

/// Channel through which pipeline components report what they are doing.
///
/// Components receive a sink at construction and never call back into caller code directly;
/// a caller who wants to observe progress supplies a sink, or polls the components.
public interface EventSink {
    void debug(String format, Object... args);

    void info(String format, Object... args);

    void warn(String format, Object... args);

    void warn(String message, Throwable t);

    void error(String format, Object... args);

    void error(String message, Throwable t);

    void trace(String format, Object... args);

    /// Log a structured event. The level is taken from the event type.
    ///
    /// @param event the event type
    /// @param params named parameters, which must include every required parameter
    default void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        String message = formatEventMessage(event, params);
        switch (event.getLevel()) {
            case TRACE:
                trace(message);
                break;
            case DEBUG:
                debug(message);
                break;
            case INFO:
                info(message);
                break;
            case WARN:
                warn(message);
                break;
            case ERROR:
                error(message);
                break;
        }
    }

    /// Validate that all required parameters are present and of the correct type.
    /// Null values are allowed, and any number may stand in for another number type.
    ///
    /// @param event the event type
    /// @param params named parameters
    default void validateRequiredParams(EventType event, Map<String, Object> params) {
        for (Map.Entry<String, Class<?>> required : event.getRequiredParams().entrySet()) {
            String paramName = required.getKey();
            Class<?> paramType = required.getValue();
            if (params == null || !params.containsKey(paramName)) {
                throw new IllegalArgumentException("Missing required parameter: " + paramName + " for event: " + event.name());
            }
            Object value = params.get(paramName);
            if (value == null || paramType.isInstance(value)) {
                continue;
            }
            if (Number.class.isAssignableFrom(paramType) && value instanceof Number) {
                continue;
            }
            throw new IllegalArgumentException("Parameter " + paramName + " for event " + event.name()
                + " must be of type " + paramType.getSimpleName() + ", but was " + value.getClass().getSimpleName());
        }
    }

    /// Formats an event as its left-justified name followed by `key=value` pairs.
    ///
    /// @param event the event type
    /// @param params named parameters
    /// @return the formatted message
    default String formatEventMessage(EventType event, Map<String, Object> params) {
        StringBuilder sb = new StringBuilder(String.format("%-15s", event.name()));
        if (params != null) {
            params.forEach((key, value) -> {
                sb.append(' ').append(key).append('=');
                if (value instanceof Double || value instanceof Float) {
                    sb.append(String.format("%.2f", ((Number) value).doubleValue()));
                } else {
                    sb.append(value);
                }
            });
        }
        return sb.toString();
    }
}
