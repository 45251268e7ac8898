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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MemoryEventSinkTest {

    @Test
    public void testEventsAreKeptInOrder() {
        MemoryEventSink sink = new MemoryEventSink();
        sink.log(PipelineEvent.CACHE_HIT, Map.of("id", "a@1"));
        sink.info("plain {} line", "log");
        sink.log(PipelineEvent.TRANSFER_PAUSE, Map.of("id", "b@1"));

        List<MemoryEventSink.Event> events = sink.snapshot();
        assertEquals(3, events.size());
        assertEquals(PipelineEvent.CACHE_HIT, events.get(0).type());
        assertNull(events.get(1).type());
        assertEquals("plain log line", events.get(1).message());
        assertEquals("b@1", events.get(2).params().get("id"));
        assertEquals(1, sink.eventsOf(PipelineEvent.TRANSFER_PAUSE).size());
    }

    @Test
    public void testDrainEmpties() {
        MemoryEventSink sink = new MemoryEventSink();
        sink.log(PipelineEvent.CACHE_HIT, Map.of("id", "a@1"));
        assertEquals(1, sink.drain().size());
        assertTrue(sink.drain().isEmpty());
    }

    @Test
    public void testOldestEventsAreDropped() {
        MemoryEventSink delegate = new MemoryEventSink();
        MemoryEventSink sink = new MemoryEventSink(2, delegate);
        for (int i = 0; i < 5; i++) {
            sink.log(PipelineEvent.CACHE_HIT, Map.of("id", "m@" + i));
        }
        List<MemoryEventSink.Event> kept = sink.snapshot();
        assertEquals(2, kept.size());
        assertEquals("m@3", kept.get(0).params().get("id"));
        assertEquals(3, sink.getDroppedCount());
        assertEquals(5, delegate.snapshot().size());
    }

    @Test
    public void testMissingParameterIsRejected() {
        MemoryEventSink sink = new MemoryEventSink();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> sink.log(PipelineEvent.TRANSFER_START, Map.of("id", "a@1", "offset", 0L)));
        assertThat(e.getMessage()).contains("url").contains("TRANSFER_START");
        assertTrue(sink.snapshot().isEmpty());
    }

    @Test
    public void testWrongParameterTypeIsRejected() {
        MemoryEventSink sink = new MemoryEventSink();
        assertThrows(IllegalArgumentException.class,
            () -> sink.log(PipelineEvent.CACHE_HIT, Map.of("id", 42)));
    }

    @Test
    public void testNumbersAreInterchangeable() {
        MemoryEventSink sink = new MemoryEventSink();
        sink.log(PipelineEvent.TRANSFER_CANCEL, Map.of("id", "a@1", "bytes", 12));
        assertEquals(1, sink.snapshot().size());
    }

    @Test
    public void testMessageFormat() {
        MemoryEventSink sink = new MemoryEventSink();
        sink.log(PipelineEvent.THROTTLE, Map.of("id", "a@1", "delay", 250L, "speed", 1234.5678));
        String message = sink.snapshot().get(0).message();
        assertThat(message).startsWith("THROTTLE ");
        assertThat(message).contains("delay=250").contains("speed=1234").contains("id=a@1");
        assertEquals(EventType.Level.DEBUG, sink.snapshot().get(0).level());
    }
}
