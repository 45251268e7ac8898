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

import java.nio.file.Path;

/// Where an interrupted transfer can pick up again.
///
/// @param offset bytes already in the partial file
/// @param partialFile the partial file
/// @param validator `Last-Modified` or `ETag` seen by the attempt that wrote the partial file,
/// or null when unknown
public record ResumeInfo(long offset, Path partialFile, String validator) {
}
