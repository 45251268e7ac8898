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

import io.nosqlbench.modelstore.errors.ErrorCategory;
import io.nosqlbench.modelstore.errors.SecurityViolationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class UrlPolicyTest {

    @Test
    public void testHttpsIsAlwaysAccepted() {
        assertDoesNotThrow(() -> new UrlPolicy(false).check("m@1", URI.create("https://models.example.com/m.onnx")));
    }

    @Test
    public void testPlainHttpIsRejected() {
        SecurityViolationException e = assertThrows(SecurityViolationException.class,
            () -> new UrlPolicy(true).check("m@1", URI.create("http://models.example.com/m.onnx")));
        assertEquals(ErrorCategory.SECURITY, e.getCategory());
        assertEquals("m@1", e.getArtifactId());
    }

    @Test
    public void testLoopbackNeedsExplicitPermission() {
        URI local = URI.create("http://127.0.0.1:8080/m.onnx");
        assertThrows(SecurityViolationException.class, () -> new UrlPolicy(false).check("m@1", local));
        assertDoesNotThrow(() -> new UrlPolicy(true).check("m@1", local));
        assertDoesNotThrow(() -> new UrlPolicy(true).check("m@1", URI.create("http://localhost:8080/m.onnx")));
    }

    @Test
    public void testLookalikeHostsAreNotLoopback() {
        assertFalse(UrlPolicy.isLoopback("127.0.0.1.example.com"));
        assertFalse(UrlPolicy.isLoopback("10.0.0.1"));
        assertFalse(UrlPolicy.isLoopback(null));
        assertTrue(UrlPolicy.isLoopback("127.0.0.2"));
        assertTrue(UrlPolicy.isLoopback("[::1]"));
    }

    @Test
    public void testOtherSchemesAreRejected() {
        assertThrows(SecurityViolationException.class,
            () -> new UrlPolicy(true).check("m@1", URI.create("ftp://127.0.0.1/m.onnx")));
        assertThrows(SecurityViolationException.class,
            () -> new UrlPolicy(true).check("m@1", URI.create("file:///tmp/m.onnx")));
    }
}
