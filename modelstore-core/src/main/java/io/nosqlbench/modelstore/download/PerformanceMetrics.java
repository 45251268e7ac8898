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

import java.util.List;

/// Orchestrator-wide transfer metrics.
///
/// @param activeDownloads transfers not yet in a terminal state
/// @param completedDownloads transfers completed since construction
/// @param failedDownloads transfers failed since construction
/// @param totalBytes bytes written by all transfers
/// @param averageSpeed mean of the recorded speed samples, bytes per second
/// @param peakSpeed highest recorded speed sample, bytes per second
/// @param heapUsed heap bytes in use when the metrics were taken
/// @param speedHistory recent speed samples, oldest first
public record PerformanceMetrics(
    int activeDownloads,
    long completedDownloads,
    long failedDownloads,
    long totalBytes,
    double averageSpeed,
    double peakSpeed,
    long heapUsed,
    List<Double> speedHistory
) {
}
