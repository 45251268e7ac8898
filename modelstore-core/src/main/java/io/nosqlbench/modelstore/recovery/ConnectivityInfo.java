package io.nosqlbench.modelstore.recovery;

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

import java.time.Instant;
import java.util.List;

/// Result of probing the connectivity endpoints.
///
/// @param status overall status
/// @param reachable endpoints which answered with a status below 500
/// @param total endpoints probed
/// @param errors one `endpoint: reason` line per unreachable endpoint
/// @param checkedAt when the probe ran
public record ConnectivityInfo(
    ConnectivityStatus status,
    int reachable,
    int total,
    List<String> errors,
    Instant checkedAt
) {
    public ConnectivityInfo {
        errors = List.copyOf(errors);
    }

    public boolean isOnline() {
        return status == ConnectivityStatus.ONLINE;
    }
}
