package io.nosqlbench.modelstore.download;

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

import io.nosqlbench.modelstore.MutableClock;
import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TransferStateTest {
    private static final long MILLI = TimeUnit.MILLISECONDS.toNanos(1);

    private static TransferState state() {
        ArtifactDescriptor descriptor = new ArtifactDescriptor("encoder", "2.1.0",
            URI.create("https://models.example.com/encoder.onnx"), "abc123", 10_000, "onnx", 768);
        return new TransferState(descriptor, MutableClock.startingAt("2026-05-01T00:00:00Z"));
    }

    @Test
    public void testLifecycle() {
        TransferState state = state();
        assertEquals(TransferStatus.PENDING, state.status());
        assertTrue(state.pause());
        assertFalse(state.pause());
        assertTrue(state.resume());
        assertEquals(TransferStatus.DOWNLOADING, state.status());
        assertTrue(state.cancel());
        assertFalse(state.cancel());
        assertFalse(state.resume());
        state.finish(TransferStatus.FAILED);
        assertEquals(TransferStatus.CANCELLED, state.status());
    }

    @Test
    public void testSpeedIsMovingAverage() {
        TransferState state = state();
        state.begin(0, 10_000, null);
        assertFalse(state.record(1000, 0));
        // the first record opens the sample, so 2000 bytes over 100 ms
        assertTrue(state.record(1000, 100 * MILLI));
        assertEquals(20_000.0, state.speed(), 0.001);
        // 4000 bytes over the next 100 ms: 0.8 * 20000 + 0.2 * 40000
        assertTrue(state.record(4000, 200 * MILLI));
        assertEquals(24_000.0, state.speed(), 0.001);

        TransferSnapshot snapshot = state.snapshot();
        assertEquals(6000, snapshot.bytesTransferred());
        assertEquals(60.0, snapshot.percentage(), 0.001);
        assertEquals(166, snapshot.eta().toMillis());
    }

    @Test
    public void testResumeOffsetCounts() {
        TransferState state = state();
        state.begin(4000, 10_000, null);
        state.record(1000, 0);
        assertEquals(5000, state.snapshot().bytesTransferred());
        assertNull(state.snapshot().eta());
    }

    @Test
    public void testPausedWaitReturnsOnCancel() throws Exception {
        TransferState state = state();
        state.pause();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            state.cancel();
        });
        canceller.start();
        assertTrue(state.awaitUnpaused());
        assertTrue(state.isCancelled());
        canceller.join();
    }
}
