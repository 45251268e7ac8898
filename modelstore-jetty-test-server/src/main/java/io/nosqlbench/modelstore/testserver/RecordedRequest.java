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

/// One request observed by the test file server, in arrival order.
///
/// @param method the HTTP method
/// @param path the request path, including the leading slash
/// @param range the raw `Range` header, or null when absent
public record RecordedRequest(String method, String path, String range) {

    /// @return true when a `Range` header accompanied the request
    public boolean hasRange() {
        return range != null;
    }
}
