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

import java.io.IOException;
import java.nio.file.Path;

/// A local file operation failed.
public class ArtifactIOException extends AcquisitionException {
    private final Path path;

    public ArtifactIOException(String artifactId, Path path, String message, IOException cause) {
        super(ErrorCategory.FILE_SYSTEM, artifactId, message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
