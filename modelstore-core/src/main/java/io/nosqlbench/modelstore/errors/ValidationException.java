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

import java.nio.file.Path;
import java.util.List;

/// A downloaded file failed integrity verification and was moved to quarantine.
public class ValidationException extends AcquisitionException {
    private final List<String> problems;
    private final Path quarantinePath;

    /// @param problems the failing checks, in the order they were detected
    /// @param quarantinePath where the rejected file now lives, or null if it could not be moved
    public ValidationException(String artifactId, List<String> problems, Path quarantinePath) {
        super(ErrorCategory.VALIDATION, artifactId,
            "Verification failed for " + artifactId + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
        this.quarantinePath = quarantinePath;
    }

    public List<String> getProblems() {
        return problems;
    }

    public Path getQuarantinePath() {
        return quarantinePath;
    }
}
