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

import java.util.concurrent.Callable;

/// What was being attempted when a failure happened.
///
/// @param operation short name of the operation, for example `download`
/// @param descriptor the artifact involved, or null
/// @param action the operation to re-invoke on retry, or null when the caller retries itself
/// @param attempt 1 for the first attempt
/// @param <T> result type of the action
public record RecoveryContext<T>(String operation, ArtifactDescriptor descriptor, Callable<T> action, int attempt) {

    public RecoveryContext {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1: " + attempt);
        }
    }

    public static <T> RecoveryContext<T> of(String operation, ArtifactDescriptor descriptor) {
        return new RecoveryContext<>(operation, descriptor, null, 1);
    }

    public RecoveryContext<T> withAction(Callable<T> retryAction) {
        return new RecoveryContext<>(operation, descriptor, retryAction, attempt);
    }

    public RecoveryContext<T> withAttempt(int number) {
        return new RecoveryContext<>(operation, descriptor, action, number);
    }

    public String artifactId() {
        return descriptor == null ? null : descriptor.id();
    }
}
