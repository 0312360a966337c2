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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.LoggerConfig;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * {@code -v} raises the log level of this tool to debug, {@code -q} lowers the
 * root level to errors only.
 */
public class VerbosityOption {

    private static final String TOOL_LOGGER = "io.nosqlbench.nbframes";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output, including per-plane detail"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Checks if normal (non-quiet) output should be shown.
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /**
     * Adjusts the running log4j configuration to the chosen verbosity.
     * Does nothing when neither flag is given, or when log4j-core is not the backend.
     */
    public void applyLogLevel() {
        if (!verbose && !quiet) {
            return;
        }
        if (!(LogManager.getContext(false) instanceof LoggerContext context)) {
            return;
        }
        LoggerConfig rootConfig = context.getConfiguration().getRootLogger();
        if (quiet) {
            rootConfig.setLevel(Level.ERROR);
        } else {
            LoggerConfig toolConfig = context.getConfiguration().getLoggerConfig(TOOL_LOGGER);
            if (toolConfig == rootConfig) {
                toolConfig = new LoggerConfig(TOOL_LOGGER, Level.DEBUG, true);
                context.getConfiguration().addLogger(TOOL_LOGGER, toolConfig);
            }
            toolConfig.setLevel(Level.DEBUG);
        }
        context.updateLoggers();
    }
}
