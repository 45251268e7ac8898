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

import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.util.concurrent.atomic.AtomicBoolean;

/// [TransferResponse] backed by an OkHttp [Response].
final class HttpTransferResponse implements TransferResponse {
    private final RangeRequest request;
    private final Response response;
    private final long startOffset;
    private final long totalSize;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ReadableByteChannel channel;

    HttpTransferResponse(RangeRequest request, Response response, long startOffset, long totalSize) {
        this.request = request;
        this.response = response;
        this.startOffset = startOffset;
        this.totalSize = totalSize;
    }

    @Override
    public RangeRequest request() {
        return request;
    }

    @Override
    public int statusCode() {
        return response.code();
    }

    @Override
    public long startOffset() {
        return startOffset;
    }

    @Override
    public long contentLength() {
        ResponseBody body = response.body();
        return body != null ? body.contentLength() : -1L;
    }

    @Override
    public long totalSize() {
        return totalSize;
    }

    @Override
    public String validator() {
        String lastModified = response.header("Last-Modified");
        return lastModified != null ? lastModified : response.header("ETag");
    }

    @Override
    public synchronized ReadableByteChannel channel() throws IOException {
        if (closed.get()) {
            throw new IOException("Response for " + request.uri() + " has been closed");
        }
        if (channel == null) {
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Response body is null for " + request);
            }
            channel = Channels.newChannel(body.byteStream());
        }
        return channel;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            response.close();
        }
    }
}
