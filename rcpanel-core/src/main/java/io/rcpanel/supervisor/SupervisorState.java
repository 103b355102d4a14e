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

/**
 * States of the {@link ProcessSupervisor}. There is no terminal state; the machine cycles
 * for as long as the session lasts.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>IDLE → LOCATING:</strong> activation</li>
 *   <li><strong>LOCATE_FAILED → LOCATING:</strong> activation, discovery is retried</li>
 *   <li><strong>LOCATING → LOCATE_FAILED:</strong> the binary is not on the search path</li>
 *   <li><strong>LOCATING → STARTING:</strong> the binary was found or was already cached</li>
 *   <li><strong>STARTING → RUNNING:</strong> the first diagnostic line was read (or the stream ended)</li>
 *   <li><strong>STARTING → IDLE:</strong> the helper could not be spawned</li>
 *   <li><strong>RUNNING → STOPPING → IDLE:</strong> activation, the helper is killed</li>
 * </ul>
 *
 * <p>Resting states, where an activation returns, are {@link #IDLE}, {@link #LOCATE_FAILED}
 * and {@link #RUNNING}. The others are only observed by {@link SupervisorListener}s.</p>
 */
public enum SupervisorState {
    IDLE(true),
    LOCATING(false),
    LOCATE_FAILED(true),
    STARTING(false),
    RUNNING(true),
    STOPPING(false);

    private final boolean resting;

    SupervisorState(boolean resting) {
        this.resting = resting;
    }

    /**
     * @return true when an activation may end in this state
     */
    public boolean isResting() {
        return resting;
    }

    /**
     * @return true while the supervisor owns a process handle
     */
    public boolean holdsProcess() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }
}
