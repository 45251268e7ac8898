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

/// An [EventSink] which discards everything, after checking structured events are well-formed.
public class NoOpEventSink implements EventSink {

    @Override
    public void debug(String format, Object... args) {}

    @Override
    public void info(String format, Object... args) {}

    @Override
    public void warn(String format, Object... args) {}

    @Override
    public void warn(String message, Throwable t) {}

    @Override
    public void error(String format, Object... args) {}

    @Override
    public void error(String message, Throwable t) {}

    @Override
    public void trace(String format, Object... args) {}

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
    }
}
