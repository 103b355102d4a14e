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

/**
 * Thrown by {@link ProcessSupervisor#activate()} when the helper could not be spawned or its
 * first diagnostic line could not be read. The supervisor is back in
 * {@link SupervisorState#IDLE} when this is thrown, with no process left behind.
 */
public class HelperStartException extends IOException {

    private final Path binary;

    public HelperStartException(Path binary, Throwable cause) {
        super("Unable to start helper " + binary + ": " + cause.getMessage(), cause);
        this.binary = binary;
    }

    public Path getBinary() {
        return binary;
    }
}
