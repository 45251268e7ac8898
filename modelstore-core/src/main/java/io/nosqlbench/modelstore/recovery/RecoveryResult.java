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

import io.nosqlbench.modelstore.artifact.ArtifactDescriptor;
import io.nosqlbench.modelstore.errors.RecoveryStrategy;

/// Outcome of [ErrorRecoveryCoordinator#attemptRecovery].
///
/// @param success whether recovery produced something usable
/// @param strategy the strategy that was applied
/// @param message what happened, suitable for an operator
/// @param fallback the alternative to acquire instead, for the fallback strategy
/// @param value the re-invoked action's result, when a retry succeeded
/// @param retryRecommended whether the caller should try the operation again
/// @param failure the failure of a re-invoked action, when it failed again
/// @param <T> result type of the re-invoked action
public record RecoveryResult<T>(
    boolean success,
    RecoveryStrategy strategy,
    String message,
    ArtifactDescriptor fallback,
    T value,
    boolean retryRecommended,
    Throwable failure
) {
    static <T> RecoveryResult<T> failed(RecoveryStrategy strategy, String message) {
        return new RecoveryResult<>(false, strategy, message, null, null, false, null);
    }
}
