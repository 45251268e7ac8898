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

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/// An immutable description of one transfer request.
///
/// A request either fetches the whole resource, or resumes it from a byte offset with an
/// open-ended `Range: bytes=<offset>-` header. An offset of zero is the same as no offset.
///
/// @param method the request method
/// @param uri the resource location
/// @param offset the first byte wanted, when resuming
public record RangeRequest(Method method, URI uri, OptionalLong offset) {

    /// Request methods used by transfers and reachability probes.
    public enum Method {
        GET,
        HEAD
    }

    public RangeRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(offset, "offset");
        if (offset.isPresent()) {
            if (offset.getAsLong() < 0) {
                throw new IllegalArgumentException("Offset cannot be negative: " + offset.getAsLong());
            }
            if (method == Method.HEAD) {
                throw new IllegalArgumentException("HEAD requests do not carry a range");
            }
            if (offset.getAsLong() == 0) {
                offset = OptionalLong.empty();
            }
        }
    }

    /// @param uri the resource
    /// @return a request for the whole resource
    public static RangeRequest get(URI uri) {
        return new RangeRequest(Method.GET, uri, OptionalLong.empty());
    }

    /// @param uri the resource
    /// @param offset bytes already held locally
    /// @return a request for everything from `offset` to the end
    public static RangeRequest resumeFrom(URI uri, long offset) {
        return new RangeRequest(Method.GET, uri, OptionalLong.of(offset));
    }

    /// @param uri the resource
    /// @return a metadata-only request
    public static RangeRequest head(URI uri) {
        return new RangeRequest(Method.HEAD, uri, OptionalLong.empty());
    }

    /// @return the offset the response body should start at
    public long startOffset() {
        return offset.orElse(0L);
    }

    /// @return true when the request resumes from a non-zero offset
    public boolean isResume() {
        return offset.isPresent();
    }

    /// @return the value of the `Range` header, if one is sent
    public Optional<String> rangeHeader() {
        if (offset.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("bytes=" + offset.getAsLong() + "-");
    }

    @Override
    public String toString() {
        return method + " " + uri + rangeHeader().map(r -> " [" + r + "]").orElse("");
    }
}
