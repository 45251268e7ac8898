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

import io.nosqlbench.modelstore.errors.ErrorCategory;
import io.nosqlbench.modelstore.errors.ErrorSeverity;

import java.util.List;
import java.util.Map;

/// Summary of the classified-error history.
///
/// @param total records in the history
/// @param byCategory record counts per category
/// @param bySeverity record counts per severity
/// @param recent the latest records, newest last
/// @param lastHour records classified within the last hour
/// @param ratePerMinute `lastHour / 60`
public record ErrorStatistics(
    long total,
    Map<ErrorCategory, Long> byCategory,
    Map<ErrorSeverity, Long> bySeverity,
    List<ErrorRecord> recent,
    long lastHour,
    double ratePerMinute
) {
}
