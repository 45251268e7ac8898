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

/// A kind of event which can be sent through an [EventSink].
///
/// Implement this as an enum where each constant declares its level and the parameters it
/// requires:
/// ```java
/// MY_EVENT(EventType.Level.INFO, param("id", String.class, "The artifact id"))
/// ```
/// Sinks reject events whose required parameters are missing or of the wrong type.
public interface EventType {
    /// Logging levels for events
    enum Level {
        TRACE,
        DEBUG,
        INFO,
        WARN,
        ERROR;

        /// @return a single character representing the level
        public char getSymbol() {
            return name().charAt(0);
        }
    }

    /// @return the logging level
    Level getLevel();

    /// @return map of parameter names to their required types
    Map<String, Class<?>> getRequiredParams();

    /// @return the event name
    String name();
}
