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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Spawns helper processes.
 *
 * @see ProcessHelperLauncher
 */
@FunctionalInterface
public interface HelperLauncher {

    /**
     * Starts {@code binary} with {@code arguments}, with no standard input and with the
     * diagnostic stream captured.
     *
     * @param binary    the executable
     * @param arguments the arguments after the executable
     * @return a handle to the running process
     * @throws IOException if the process cannot be spawned
     */
    HelperProcess launch(Path binary, List<String> arguments) throws IOException;
}
