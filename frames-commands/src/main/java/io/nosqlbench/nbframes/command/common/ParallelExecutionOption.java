/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.nbframes.command.common;

import picocli.CommandLine;

/**
 * Shared parallel execution options.
 * Readout planes are rebinned as independent work units; these options choose
 * how many run at once.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Rebin planes in parallel, one thread per available core but one"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of planes rebinned at once (implies --parallel)"
    )
    private Integer explicitThreads;

    /**
     * Checks if parallel execution was requested in either form.
     */
    public boolean isParallel() {
        return parallel || explicitThreads != null;
    }

    /**
     * Gets the number of worker threads to use.
     *
     * @return 1 for sequential runs, otherwise the explicit or detected thread count
     */
    public int getThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        }
        if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return 1;
    }

    /**
     * Validates the thread count.
     *
     * @throws IllegalStateException if an explicit thread count is not positive
     */
    public void validate() {
        if (explicitThreads != null && explicitThreads < 1) {
            throw new IllegalStateException("--threads must be positive, got " + explicitThreads);
        }
    }
}
