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

import java.util.List;
import java.util.Objects;

/// Alternatives for a primary artifact, in priority order.
public record FallbackRegistration(List<ArtifactDescriptor> alternatives, FallbackCriteria criteria) {

    public FallbackRegistration {
        alternatives = List.copyOf(alternatives);
        Objects.requireNonNull(criteria, "criteria");
    }

    public static FallbackRegistration of(FallbackCriteria criteria, ArtifactDescriptor... alternatives) {
        return new FallbackRegistration(List.of(alternatives), criteria);
    }
}
