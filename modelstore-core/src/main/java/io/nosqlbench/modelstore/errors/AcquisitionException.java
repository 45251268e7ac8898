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

/// Base type of every failure raised by a pipeline stage.
///
/// The stage that detects a failure knows what kind it is, so it raises the matching subclass
/// and the recovery layer never has to guess from message text.
public class AcquisitionException extends RuntimeException {
    private final ErrorCategory category;
    private final String artifactId;

    public AcquisitionException(ErrorCategory category, String artifactId, String message) {
        super(message);
        this.category = category;
        this.artifactId = artifactId;
    }

    public AcquisitionException(ErrorCategory category, String artifactId, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.artifactId = artifactId;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /// @return the `name@version` of the artifact involved, or null when not tied to one
    public String getArtifactId() {
        return artifactId;
    }

    /// @return the severity implied by the category
    public ErrorSeverity getSeverity() {
        return category.baseSeverity();
    }
}
