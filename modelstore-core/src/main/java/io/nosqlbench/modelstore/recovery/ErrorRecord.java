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
import io.nosqlbench.modelstore.errors.RecoveryStrategy;

import java.time.Instant;

/// A classified failure.
///
/// @param code generated code, `<CATEGORY>_<message hash>_<timestamp>`
/// @param category what kind of failure this is
/// @param severity how serious it is
/// @param message human-readable message
/// @param technicalDetail exception type and raw message
/// @param strategy the recovery strategy for the category
/// @param recommendedAction what the operator or caller should do next
/// @param timestamp when the failure was classified
/// @param artifactId `name@version` of the affected artifact, or null
public record ErrorRecord(
    String code,
    ErrorCategory category,
    ErrorSeverity severity,
    String message,
    String technicalDetail,
    RecoveryStrategy strategy,
    String recommendedAction,
    Instant timestamp,
    String artifactId
) {
}
