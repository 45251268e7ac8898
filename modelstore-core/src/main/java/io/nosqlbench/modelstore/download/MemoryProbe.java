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

/// Reads heap usage for memory monitoring and tuning.
public interface MemoryProbe {

    /// @return heap bytes currently in use
    long heapUsed();

    /// @return heap bytes which could still be allocated
    long available();

    /// @return a probe reading [Runtime]
    static MemoryProbe runtime() {
        return new MemoryProbe() {
            @Override
            public long heapUsed() {
                Runtime runtime = Runtime.getRuntime();
                return runtime.totalMemory() - runtime.freeMemory();
            }

            @Override
            public long available() {
                return Runtime.getRuntime().maxMemory() - heapUsed();
            }
        };
    }
}
