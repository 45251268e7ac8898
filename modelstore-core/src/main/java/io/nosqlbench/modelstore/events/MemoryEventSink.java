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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// A bounded, pollable [EventSink].
///
/// Structured events are kept in arrival order until [#drain()] takes them. When the limit is
/// reached the oldest event is dropped. Plain log lines are kept as events without a type.
/// Every event is also passed on to a delegate sink.
public class MemoryEventSink implements EventSink {
    private static final int DEFAULT_EVENT_LIMIT = 10000;

    /// One recorded event.
    ///
    /// @param timestamp when the event was recorded
    /// @param level the event level
    /// @param type the structured type, or null for a plain log line
    /// @param params the structured parameters, empty for a plain log line
    /// @param message the formatted message
    public record Event(Instant timestamp, EventType.Level level, EventType type,
                        Map<String, Object> params, String message) {
    }

    private final int eventLimit;
    private final EventSink delegate;
    private final Deque<Event> events = new ArrayDeque<>();
    private long dropped;

    public MemoryEventSink() {
        this(DEFAULT_EVENT_LIMIT, new NoOpEventSink());
    }

    /// @param eventLimit the number of events to keep
    /// @param delegate receives every event as well
    public MemoryEventSink(int eventLimit, EventSink delegate) {
        if (eventLimit <= 0) {
            throw new IllegalArgumentException("eventLimit must be positive: " + eventLimit);
        }
        this.eventLimit = eventLimit;
        this.delegate = delegate;
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        Map<String, Object> copy = params == null ? Map.of() : new LinkedHashMap<>(params);
        add(new Event(Instant.now(), event.getLevel(), event, copy, formatEventMessage(event, params)));
        delegate.log(event, params);
    }

    @Override
    public void debug(String format, Object... args) {
        plain(EventType.Level.DEBUG, format, args);
        delegate.debug(format, args);
    }

    @Override
    public void info(String format, Object... args) {
        plain(EventType.Level.INFO, format, args);
        delegate.info(format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        plain(EventType.Level.WARN, format, args);
        delegate.warn(format, args);
    }

    @Override
    public void warn(String message, Throwable t) {
        plain(EventType.Level.WARN, message + ": " + t);
        delegate.warn(message, t);
    }

    @Override
    public void error(String format, Object... args) {
        plain(EventType.Level.ERROR, format, args);
        delegate.error(format, args);
    }

    @Override
    public void error(String message, Throwable t) {
        plain(EventType.Level.ERROR, message + ": " + t);
        delegate.error(message, t);
    }

    @Override
    public void trace(String format, Object... args) {
        plain(EventType.Level.TRACE, format, args);
        delegate.trace(format, args);
    }

    /// Removes and returns all buffered events, oldest first.
    public synchronized List<Event> drain() {
        List<Event> drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }

    /// @return a copy of the buffered events, oldest first
    public synchronized List<Event> snapshot() {
        return new ArrayList<>(events);
    }

    /// @param type the structured event type
    /// @return buffered events of that type, oldest first
    public synchronized List<Event> eventsOf(EventType type) {
        return events.stream().filter(e -> e.type() == type).collect(Collectors.toList());
    }

    /// @return the number of events dropped because the limit was reached
    public synchronized long getDroppedCount() {
        return dropped;
    }

    private void plain(EventType.Level level, String format, Object... args) {
        add(new Event(Instant.now(), level, null, Map.of(), substitute(format, args)));
    }

    private synchronized void add(Event event) {
        if (events.size() >= eventLimit) {
            events.removeFirst();
            dropped++;
        }
        events.addLast(event);
    }

    // Log4j-style {} placeholders
    private static String substitute(String format, Object... args) {
        if (format == null || args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            if (argIndex < args.length && format.startsWith("{}", i)) {
                sb.append(args[argIndex++]);
                i += 2;
            } else {
                sb.append(format.charAt(i++));
            }
        }
        return sb.toString();
    }
}
