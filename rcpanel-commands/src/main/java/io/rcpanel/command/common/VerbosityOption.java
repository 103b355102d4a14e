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

package io.rcpanel.command.common;

import org.apache.logging.log4j.Level;
import picocli.CommandLine;

/**
 * Verbosity flags for the log section of the panel.
 * {@code -v/--verbose} shows debug messages, {@code -q/--quiet} shows errors only.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Show debug messages in the log section"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Show only errors in the log section"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * The lowest level shown in the log section.
     *
     * @return {@link Level#DEBUG} when verbose, {@link Level#ERROR} when quiet, else {@link Level#INFO}
     */
    public Level displayLevel() {
        if (verbose) {
            return Level.DEBUG;
        }
        if (quiet) {
            return Level.ERROR;
        }
        return Level.INFO;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }
}
