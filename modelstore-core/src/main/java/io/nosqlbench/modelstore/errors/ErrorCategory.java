package io.nosqlbench.modelstore.errors;

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

/// Failure taxonomy for the acquisition pipeline.
///
/// Each category maps to exactly one [RecoveryStrategy] and to the severity assumed for
/// failures raised by pipeline stages themselves.
public enum ErrorCategory {
    NETWORK(RecoveryStrategy.RETRY, ErrorSeverity.HIGH),
    DISK_SPACE(RecoveryStrategy.MANUAL, ErrorSeverity.HIGH),
    FILE_SYSTEM(RecoveryStrategy.RETRY, ErrorSeverity.MEDIUM),
    VALIDATION(RecoveryStrategy.FALLBACK, ErrorSeverity.HIGH),
    CONFIGURATION(RecoveryStrategy.MANUAL, ErrorSeverity.HIGH),
    SECURITY(RecoveryStrategy.ABORT, ErrorSeverity.CRITICAL),
    UNKNOWN(RecoveryStrategy.RETRY, ErrorSeverity.LOW);

    private final RecoveryStrategy strategy;
    private final ErrorSeverity baseSeverity;

    ErrorCategory(RecoveryStrategy strategy, ErrorSeverity baseSeverity) {
        this.strategy = strategy;
        this.baseSeverity = baseSeverity;
    }

    /// @return the fixed recovery strategy for this category
    public RecoveryStrategy strategy() {
        return strategy;
    }

    /// @return the severity of a failure of this category raised by a pipeline stage
    public ErrorSeverity baseSeverity() {
        return baseSeverity;
    }
}
