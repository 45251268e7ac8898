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

import java.util.Locale;

/// Constraints an alternative artifact must meet.
///
/// @param maxSize largest acceptable size in bytes, 0 for no limit
/// @param minDimensions smallest acceptable embedding dimension, 0 for no limit
/// @param preferredFormat container format tried first, or null for no preference
/// @param requireLocal the alternative must be usable without the network
public record FallbackCriteria(long maxSize, int minDimensions, String preferredFormat, boolean requireLocal) {

    public FallbackCriteria {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        if (minDimensions < 0) {
            throw new IllegalArgumentException("minDimensions must not be negative: " + minDimensions);
        }
        preferredFormat = preferredFormat == null ? null : preferredFormat.toLowerCase(Locale.ROOT);
    }

    public static FallbackCriteria none() {
        return new FallbackCriteria(0, 0, null, false);
    }

    public static FallbackCriteria maxSize(long maxSize) {
        return new FallbackCriteria(maxSize, 0, null, false);
    }

    public FallbackCriteria withMinDimensions(int dimensions) {
        return new FallbackCriteria(maxSize, dimensions, preferredFormat, requireLocal);
    }

    public FallbackCriteria withPreferredFormat(String format) {
        return new FallbackCriteria(maxSize, minDimensions, format, requireLocal);
    }

    public FallbackCriteria withRequireLocal(boolean local) {
        return new FallbackCriteria(maxSize, minDimensions, preferredFormat, local);
    }
}
