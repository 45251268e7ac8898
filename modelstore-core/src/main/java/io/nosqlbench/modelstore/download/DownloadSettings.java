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

/// Tunable transfer settings, replaced as a whole by
/// [DownloadOrchestrator#optimizeConfiguration()].
///
/// @param maxConcurrentDownloads transfers allowed in flight at once
/// @param bufferSize read buffer size per transfer
/// @param maxBytesPerSecond bandwidth cap per transfer
public record DownloadSettings(int maxConcurrentDownloads, int bufferSize, long maxBytesPerSecond) {
}
