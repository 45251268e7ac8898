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

import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// OkHttp implementation of [ArtifactTransport].
///
/// Resumed requests carry an open-ended `Range` header. A `206` answer must start at the
/// requested offset; a `200` answer means the server ignored the range and the body starts at
/// byte zero. Everything else is surfaced as a [TransportException].
public class HttpRangeTransport implements ArtifactTransport {
    private static final Logger logger = LogManager.getLogger(HttpRangeTransport.class);

    private final OkHttpClient httpClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private HttpRangeTransport(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /// @return a transport with default timeouts
    public static HttpRangeTransport create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TransferResponse open(RangeRequest request) throws IOException {
        if (closed.get()) {
            throw new IOException("HttpRangeTransport has been closed");
        }
        Request.Builder builder = new Request.Builder().url(request.uri().toString());
        if (request.method() == RangeRequest.Method.HEAD) {
            builder.head();
        } else {
            builder.get();
            // transparent gzip would make byte offsets meaningless
            builder.header("Accept-Encoding", "identity");
        }
        request.rangeHeader().ifPresent(range -> builder.header("Range", range));

        logger.debug("opening {}", request);
        Response response = httpClient.newCall(builder.build()).execute();
        try {
            if (request.method() == RangeRequest.Method.HEAD) {
                return new HttpTransferResponse(request, response, 0L, headerLength(response));
            }
            return validateResponse(request, response);
        } catch (IOException | RuntimeException e) {
            response.close();
            throw e;
        }
    }

    private TransferResponse validateResponse(RangeRequest request, Response response) throws IOException {
        URI uri = request.uri();
        int code = response.code();
        if (code == 206) {
            ContentRange range = ContentRange.parse(response.header("Content-Range"));
            if (range == null) {
                throw new TransportException("Server returned 206 without a usable Content-Range header", uri, code);
            }
            if (range.start() != request.startOffset()) {
                throw new TransportException("Server returned different start offset. Expected: "
                    + request.startOffset() + ", Got: " + range.start(), uri, code, range.total());
            }
            return new HttpTransferResponse(request, response, range.start(), range.total());
        } else if (code == 200) {
            if (request.isResume()) {
                logger.info("server ignored range {} for {}, restarting from byte 0",
                    request.rangeHeader().orElse(""), uri);
            }
            return new HttpTransferResponse(request, response, 0L, headerLength(response));
        } else if (code == 416) {
            ContentRange range = ContentRange.parse(response.header("Content-Range"));
            long total = range != null ? range.total() : -1L;
            throw new TransportException("Requested range not satisfiable: " + request.rangeHeader().orElse(""),
                uri, code, total);
        } else {
            throw new TransportException("HTTP request failed with status: " + code + " " + response.message(),
                uri, code);
        }
    }

    private static long headerLength(Response response) {
        String contentLength = response.header("Content-Length");
        if (contentLength == null) {
            return -1L;
        }
        try {
            return Long.parseLong(contentLength.trim());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    /// Parsed `Content-Range: bytes start-end/total` header. Total is -1 when sent as `*`.
    record ContentRange(long start, long end, long total) {

        static ContentRange parse(String header) {
            if (header == null || !header.startsWith("bytes ")) {
                return null;
            }
            String[] parts = header.substring("bytes ".length()).trim().split("/");
            if (parts.length != 2) {
                return null;
            }
            try {
                long total = "*".equals(parts[1].trim()) ? -1L : Long.parseLong(parts[1].trim());
                if ("*".equals(parts[0].trim())) {
                    return new ContentRange(-1L, -1L, total);
                }
                String[] range = parts[0].split("-");
                if (range.length != 2) {
                    return null;
                }
                return new ContentRange(Long.parseLong(range[0].trim()), Long.parseLong(range[1].trim()), total);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }

    /// Builder for [HttpRangeTransport].
    public static class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ZERO;
        private int maxRequestsPerHost = 8;
        private boolean followRedirects = true;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        /// Bounds a whole call, including reading the body. Zero means unbounded.
        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder maxRequestsPerHost(int maxRequestsPerHost) {
            this.maxRequestsPerHost = maxRequestsPerHost;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public HttpRangeTransport build() {
            Dispatcher dispatcher = new Dispatcher();
            dispatcher.setMaxRequestsPerHost(maxRequestsPerHost);

            OkHttpClient client = new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .followRedirects(followRedirects)
                // never follow a redirect which drops TLS
                .followSslRedirects(false)
                .retryOnConnectionFailure(true)
                .build();
            return new HttpRangeTransport(client);
        }
    }
}
