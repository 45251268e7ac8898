package io.nosqlbench.modelstore.transport;

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

import io.nosqlbench.modelstore.testserver.JettyFileServerExtension;
import io.nosqlbench.modelstore.testserver.JettyFileServerFixture;
import io.nosqlbench.modelstore.testserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
@ExtendWith(JettyFileServerExtension.class)
public class HttpRangeTransportTest {

    private static HttpRangeTransport transport;

    @BeforeAll
    public static void setUp() {
        transport = HttpRangeTransport.create();
    }

    @AfterAll
    public static void tearDown() {
        transport.close();
    }

    private static byte[] content(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) (i * 31);
        }
        return data;
    }

    private static byte[] readAll(TransferResponse response) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ReadableByteChannel channel = response.channel();
        ByteBuffer buffer = ByteBuffer.allocate(8192);
        while (channel.read(buffer) >= 0) {
            buffer.flip();
            out.write(buffer.array(), 0, buffer.limit());
            buffer.clear();
        }
        return out.toByteArray();
    }

    @Test
    public void testFullFetch() throws IOException {
        byte[] data = content(64 * 1024);
        URI uri = JettyFileServerExtension.getServer().publish("transport/full.bin", data);

        try (TransferResponse response = transport.open(RangeRequest.get(uri))) {
            assertEquals(200, response.statusCode());
            assertFalse(response.isPartial());
            assertEquals(0L, response.startOffset());
            assertEquals(data.length, response.totalSize());
            assertArrayEquals(data, readAll(response));
        }
    }

    @Test
    public void testResumedFetchStartsAtOffset() throws IOException {
        JettyFileServerFixture server = JettyFileServerExtension.getServer();
        byte[] data = content(100_000);
        URI uri = server.publish("transport/resume.bin", data);

        try (TransferResponse response = transport.open(RangeRequest.resumeFrom(uri, 40_000))) {
            assertEquals(206, response.statusCode());
            assertTrue(response.isPartial());
            assertEquals(40_000L, response.startOffset());
            assertEquals(100_000L, response.totalSize());
            assertEquals(60_000L, response.contentLength());
            assertArrayEquals(Arrays.copyOfRange(data, 40_000, 100_000), readAll(response));
        }

        List<RecordedRequest> requests = server.requestsFor("transport/resume.bin");
        assertThat(requests).extracting(RecordedRequest::range).containsExactly("bytes=40000-");
    }

    @Test
    public void testMissingResourceIsTransportError() throws IOException {
        URI uri = JettyFileServerExtension.getServer().uriFor("transport/not-there.bin");
        TransportException e = assertThrows(TransportException.class, () -> transport.open(RangeRequest.get(uri)));
        assertEquals(404, e.getStatusCode());
        assertFalse(e.isServerError());
    }

    @Test
    public void testServerErrorIsTransportError() throws IOException {
        JettyFileServerFixture server = JettyFileServerExtension.getServer();
        URI uri = server.publish("transport/busy.bin", content(100));
        server.forceStatus("transport/busy.bin", 503);
        try {
            TransportException e = assertThrows(TransportException.class, () -> transport.open(RangeRequest.get(uri)));
            assertEquals(503, e.getStatusCode());
            assertTrue(e.isServerError());
        } finally {
            server.clearFaults();
        }
    }

    @Test
    public void testRangePastEndIsNotSatisfiable() throws IOException {
        URI uri = JettyFileServerExtension.getServer().publish("transport/short.bin", content(1000));
        TransportException e = assertThrows(TransportException.class,
            () -> transport.open(RangeRequest.resumeFrom(uri, 1000)));
        assertTrue(e.isRangeNotSatisfiable());
        assertEquals(1000L, e.getResourceSize());
    }

    @Test
    public void testHeadReportsStatusWithoutValidation() throws IOException {
        JettyFileServerFixture server = JettyFileServerExtension.getServer();
        URI present = server.publish("transport/head.bin", content(2048));
        try (TransferResponse response = transport.open(RangeRequest.head(present))) {
            assertEquals(200, response.statusCode());
            assertEquals(2048L, response.totalSize());
        }
        try (TransferResponse response = transport.open(RangeRequest.head(server.uriFor("transport/nope.bin")))) {
            assertEquals(404, response.statusCode());
        }
    }

    @Test
    public void testClosedTransportRejectsRequests() {
        HttpRangeTransport local = HttpRangeTransport.create();
        local.close();
        URI uri = JettyFileServerExtension.getServer().uriFor("transport/full.bin");
        assertThrows(IOException.class, () -> local.open(RangeRequest.get(uri)));
    }
}
