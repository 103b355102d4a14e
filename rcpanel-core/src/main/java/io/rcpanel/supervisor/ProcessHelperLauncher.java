/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.rcpanel.supervisor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches helpers with {@link ProcessBuilder}. Standard input is closed right after the
 * spawn, standard output is discarded so it cannot disturb the terminal, and standard error
 * is read as UTF-8 lines.
 */
public class ProcessHelperLauncher implements HelperLauncher {

    private static final Logger logger = LogManager.getLogger(ProcessHelperLauncher.class);

    @Override
    public HelperProcess launch(Path binary, List<String> arguments) throws IOException {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(binary.toString());
        command.addAll(arguments);

        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.PIPE);
        Process process = builder.start();
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            logger.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
        logger.info("Spawned {} (pid {})", String.join(" ", command), process.pid());
        return new SpawnedHelper(process);
    }

    private static final class SpawnedHelper implements HelperProcess {

        private final Process process;
        private final BufferedReader diagnostics;

        private SpawnedHelper(Process process) {
            this.process = process;
            this.diagnostics = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8));
        }

        @Override
        public String readDiagnosticLine() throws IOException {
            return diagnostics.readLine();
        }

        @Override
        public void kill() {
            if (process.isAlive()) {
                logger.info("Killing helper pid {}", process.pid());
            }
            process.destroyForcibly();
        }

        @Override
        public void awaitExit() throws InterruptedException {
            int exitCode = process.waitFor();
            logger.debug("Helper pid {} exited with {}", process.pid(), exitCode);
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void close() {
            try {
                diagnostics.close();
            } catch (IOException e) {
                logger.debug("Error closing diagnostic stream of pid {}: {}", process.pid(), e.getMessage());
            }
        }

        @Override
        public String toString() {
            return "pid " + process.pid();
        }
    }
}
