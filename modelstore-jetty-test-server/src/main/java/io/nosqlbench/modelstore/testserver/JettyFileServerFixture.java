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

import jakarta.servlet.DispatcherType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/// A loopback Jetty server which serves artifact files from a directory.
///
/// Jetty's `DefaultServlet` answers `Range: bytes=N-` with `206 Partial Content`, which is what
/// resumable transfers are tested against. In front of it sits a filter which records each
/// request and can inject faults:
/// - [#forceStatus(String, int)] answers every request for a path with the given status
/// - [#interruptOnce(String, long)] sends only a prefix of the next GET body, then drops
///   the connection
///
/// ```java
/// try (JettyFileServerFixture server = new JettyFileServerFixture(dir)) {
///     server.start();
///     URI uri = server.uriFor("model-1.0.0.onnx");
/// }
/// ```
public class JettyFileServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    private final Path rootDirectory;
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> forcedStatus = new ConcurrentHashMap<>();
    private final Map<String, Long> interruptions = new ConcurrentHashMap<>();
    private Server server;
    private int port;

    /// @param rootDirectory the directory whose files are served at `/`
    public JettyFileServerFixture(Path rootDirectory) {
        if (!Files.isDirectory(rootDirectory)) {
            throw new UncheckedIOException(new IOException("Root directory does not exist: " + rootDirectory));
        }
        this.rootDirectory = rootDirectory.toAbsolutePath();
    }

    /// Starts the server on a free loopback port.
    /// @throws IOException if Jetty cannot be started
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(rootDirectory.toString());
        server.setHandler(context);

        context.addFilter(new FilterHolder(new RequestRecordingFilter(this)), "/*",
            EnumSet.of(DispatcherType.REQUEST));

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("acceptRanges", "true");
        defaultServlet.setInitParameter("etags", "true");
        defaultServlet.setInitParameter("precompressed", "false");
        // files are rewritten between tests, so nothing may be served from memory
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        defaultServlet.setInitParameter("maxCacheSize", "0");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            logger.info("Jetty file server started on port {} serving {}", port, rootDirectory);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /// @return the base URI, ending in `/`
    public URI getBaseUri() {
        return URI.create("http://127.0.0.1:" + port + "/");
    }

    /// @param relativePath a path below the root directory
    /// @return the URI which serves that file
    public URI uriFor(String relativePath) {
        return getBaseUri().resolve(relativePath);
    }

    /// @return the directory being served
    public Path getRootDirectory() {
        return rootDirectory;
    }

    /// Writes content to a file below the root directory, replacing any prior content.
    /// @param relativePath the target path below the root directory
    /// @param content the bytes to serve
    /// @return the URI of the published file
    /// @throws IOException if the file cannot be written
    public URI publish(String relativePath, byte[] content) throws IOException {
        Path target = rootDirectory.resolve(relativePath);
        Files.createDirectories(target.getParent());
        Files.write(target, content);
        return uriFor(relativePath);
    }

    /// Answers all requests for the path with the status until [#clearFaults()] is called.
    public void forceStatus(String relativePath, int status) {
        forcedStatus.put(normalize(relativePath), status);
    }

    /// The next GET for the path writes at most `bytes` body bytes, then drops the connection.
    public void interruptOnce(String relativePath, long bytes) {
        interruptions.put(normalize(relativePath), bytes);
    }

    /// Removes all registered faults.
    public void clearFaults() {
        forcedStatus.clear();
        interruptions.clear();
    }

    /// @return every request seen since start or the last [#clearRequests()]
    public List<RecordedRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    /// @param relativePath a path below the root directory
    /// @return the requests seen for that path, in arrival order
    public List<RecordedRequest> requestsFor(String relativePath) {
        String path = normalize(relativePath);
        return requests.stream().filter(r -> r.path().equals(path)).collect(Collectors.toList());
    }

    public void clearRequests() {
        requests.clear();
    }

    void record(RecordedRequest request) {
        logger.trace("{} {} range={}", request.method(), request.path(), request.range());
        requests.add(request);
    }

    Integer forcedStatusFor(String path) {
        return forcedStatus.get(path);
    }

    Long takeInterruption(String path) {
        return interruptions.remove(path);
    }

    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty file server on port {} stopped", port);
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
            server = null;
        }
    }

    private static String normalize(String relativePath) {
        return relativePath.startsWith("/") ? relativePath : "/" + relativePath;
    }

    private static int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to find available port", e);
        }
    }
}
