package io.nosqlbench.modelstore.testserver;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// A JUnit Jupiter extension which shares one [JettyFileServerFixture] across a test run.
///
/// The server is started lazily on first use, serves a fresh temporary directory, and is
/// stopped by a shutdown hook when the JVM exits.
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// public class MyTransferTest {
///     URI uri = JettyFileServerExtension.getServer().publish("a.bin", bytes);
/// }
/// ```
public class JettyFileServerExtension implements BeforeAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);
    private static final Object lock = new Object();
    private static JettyFileServerFixture server;

    /// Starts the shared server if needed. Thread-safe and idempotent.
    public static void initialize() {
        synchronized (lock) {
            if (server != null) {
                return;
            }
            try {
                Path root = Files.createTempDirectory("modelstore-testserver");
                server = new JettyFileServerFixture(root);
                server.start();
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    synchronized (lock) {
                        if (server != null) {
                            server.close();
                            server = null;
                        }
                    }
                }));
            } catch (IOException e) {
                logger.error("Failed to start Jetty test file server", e);
                throw new UncheckedIOException("Failed to start Jetty test file server", e);
            }
        }
    }

    /// @return the shared fixture, started
    public static JettyFileServerFixture getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        server.clearFaults();
        logger.debug("file server ready at {} for {}", server.getBaseUri(), context.getDisplayName());
    }
}
