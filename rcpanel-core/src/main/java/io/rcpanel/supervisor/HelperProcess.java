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

/**
 * Handle to a spawned helper process. The {@link ProcessSupervisor} owns a handle from spawn
 * until it has killed the process, waited for it and closed the handle.
 */
public interface HelperProcess extends AutoCloseable {

    /**
     * Blocks until the next line of the process's diagnostic (error) stream is available.
     * There is no timeout.
     *
     * @return the line without its terminator, or null if the stream closed first
     * @throws IOException if the stream cannot be read
     */
    String readDiagnosticLine() throws IOException;

    /**
     * Forcibly terminates the process. Safe to call on a process that already exited.
     */
    void kill();

    /**
     * Waits for the process to terminate.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void awaitExit() throws InterruptedException;

    /**
     * @return whether the process is still running
     */
    boolean isAlive();

    /**
     * Releases the streams held by this handle.
     */
    @Override
    void close();
}
