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

import io.rcpanel.tree.NodeId;
import io.rcpanel.tree.NodeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Supervises one external helper process, advancing one visible step per
 * {@link #activate() activation} and reporting its status through node labels.
 *
 * <h2>Activation Cycle</h2>
 * <pre>
 *  activate()                          activate()
 * IDLE ──► LOCATING ──► STARTING ──► RUNNING ──► STOPPING ──► IDLE
 *              │                          "Started."               "Stopped."
 *              ▼                          "Started but may be incompatible."
 *        LOCATE_FAILED  "Cannot find rclone binary."
 * </pre>
 *
 * <ul>
 *   <li>Discovery runs on every activation until it succeeds once; the path is then cached
 *       for the life of the supervisor and shown on the path node.</li>
 *   <li>Starting spawns the helper and blocks on its first diagnostic line, without a timeout.
 *       A line holding the readiness marker reports "Started."; any other line, or an
 *       immediately closed stream, reports the degraded "Started but may be incompatible."</li>
 *   <li>If the spawn fails, the status shows "Failed to start.", the machine returns to
 *       {@link SupervisorState#IDLE} and a {@link HelperStartException} reaches the caller.</li>
 *   <li>Once a process handle exists it is killed, waited for and closed whenever the
 *       starting/running span ends: a normal stop, a failure while starting, or {@link #close()}.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Activations are serialized on the supervisor's monitor. An activation issued from inside
 * another one (for example by a listener reacting to a label change) is ignored, so a second
 * process is never spawned for the same instance. {@link #close()} may run on another thread,
 * such as a shutdown hook, while an activation is blocked on a silent helper: it kills that
 * helper before taking the monitor.</p>
 */
public class ProcessSupervisor implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ProcessSupervisor.class);

    public static final String STATUS_STARTING = "Server: Starting.";
    public static final String STATUS_STARTED = "Server: Started.";
    public static final String STATUS_DEGRADED = "Server: Started but may be incompatible.";
    public static final String STATUS_START_FAILED = "Server: Failed to start.";
    public static final String STATUS_STOPPING = "Server: Stopping.";
    public static final String STATUS_STOPPED = "Server: Stopped.";

    private final NodeStore<String> store;
    private final NodeId statusNode;
    private final NodeId pathNode;
    private final SupervisorConfig config;
    private final BinaryLocator locator;
    private final HelperLauncher launcher;
    private final List<SupervisorListener> listeners = new CopyOnWriteArrayList<>();

    private volatile SupervisorState state = SupervisorState.IDLE;
    private Path resolvedBinary;
    private HelperProcess helper;
    // set while activate() is blocked reading the first diagnostic line
    private volatile HelperProcess startingHelper;
    private volatile boolean closing;
    private boolean activating;
    private boolean closed;

    /**
     * Creates a supervisor using the host search path and {@link ProcessBuilder}.
     */
    public ProcessSupervisor(NodeStore<String> store, NodeId statusNode, NodeId pathNode, SupervisorConfig config) {
        this(store, statusNode, pathNode, config, new PathBinaryLocator(), new ProcessHelperLauncher());
    }

    /**
     * @param store      the tree holding the status nodes
     * @param statusNode the node whose label reports the helper status
     * @param pathNode   the node whose label and data report the resolved binary
     * @param config     helper settings
     * @param locator    resolves the binary name
     * @param launcher   spawns the helper
     */
    public ProcessSupervisor(NodeStore<String> store, NodeId statusNode, NodeId pathNode, SupervisorConfig config,
                             BinaryLocator locator, HelperLauncher launcher) {
        this.store = Objects.requireNonNull(store, "store");
        this.statusNode = Objects.requireNonNull(statusNode, "statusNode");
        this.pathNode = Objects.requireNonNull(pathNode, "pathNode");
        this.config = Objects.requireNonNull(config, "config");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        config.getBinaryPath().ifPresent(this::cacheBinary);
    }

    public void addListener(SupervisorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SupervisorListener listener) {
        listeners.remove(listener);
    }

    /**
     * Advances the state machine by one visible step: from a resting state that holds no
     * process, locate and start the helper; from {@link SupervisorState#RUNNING}, stop it.
     *
     * @return the resting state reached
     * @throws HelperStartException  if the helper could not be started; the state is IDLE
     * @throws IllegalStateException if the supervisor was closed
     */
    public synchronized SupervisorState activate() throws HelperStartException {
        if (closed) {
            throw new IllegalStateException("Supervisor for " + config.getBinaryName() + " has been closed");
        }
        if (activating) {
            logger.warn("Ignoring nested activation while {}", state);
            return state;
        }
        activating = true;
        try {
            switch (state) {
                case IDLE:
                case LOCATE_FAILED:
                    start();
                    break;
                case RUNNING:
                    stop();
                    break;
                default:
                    throw new IllegalStateException("Activation found supervisor mid-step in " + state);
            }
            return state;
        } finally {
            activating = false;
        }
    }

    /**
     * Stops a live helper through the normal stopping path and refuses further activations.
     * A helper still waiting to report readiness is killed first, which releases the blocked
     * activation; the activation then finishes the cleanup and this call waits for it.
     */
    @Override
    public void close() {
        closing = true;
        HelperProcess starting = startingHelper;
        if (starting != null) {
            logger.info("Closing supervisor while {} is starting, killing {}", config.getBinaryName(), starting);
            starting.kill();
        }
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (helper != null) {
                logger.info("Closing supervisor with live helper {}", helper);
                stop();
            }
        }
    }

    public SupervisorState getState() {
        return state;
    }

    /**
     * @return the binary found by discovery or configured up front, if any
     */
    public synchronized Optional<Path> getResolvedBinary() {
        return Optional.ofNullable(resolvedBinary);
    }

    /**
     * @return whether a process handle is currently held
     */
    public synchronized boolean hasProcess() {
        return helper != null;
    }

    public NodeId getStatusNode() {
        return statusNode;
    }

    public NodeId getPathNode() {
        return pathNode;
    }

    public SupervisorConfig getConfig() {
        return config;
    }

    private void start() throws HelperStartException {
        transition(SupervisorState.LOCATING);
        Path binary = resolvedBinary;
        if (binary == null) {
            Optional<Path> located = locator.locate(config.getBinaryName());
            if (located.isEmpty()) {
                logger.warn("Cannot find {} on the executable search path", config.getBinaryName());
                setStatus("Server: Cannot find " + config.getBinaryName() + " binary.");
                transition(SupervisorState.LOCATE_FAILED);
                return;
            }
            binary = located.get();
            cacheBinary(binary);
        }

        transition(SupervisorState.STARTING);
        setStatus(STATUS_STARTING);
        try {
            helper = launcher.launch(binary, config.getArguments());
        } catch (IOException | RuntimeException e) {
            throw failStart(binary, e);
        }

        startingHelper = helper;
        String firstLine;
        try {
            if (closing) {
                helper.kill();
                abandonStart();
                return;
            }
            firstLine = helper.readDiagnosticLine();
        } catch (IOException | RuntimeException e) {
            if (closing) {
                abandonStart();
                return;
            }
            terminateHelper();
            throw failStart(binary, e);
        } finally {
            startingHelper = null;
        }

        if (closing) {
            abandonStart();
            return;
        }
        if (firstLine != null && firstLine.contains(config.getReadinessMarker())) {
            logger.info("{} is serving: {}", config.getBinaryName(), firstLine.trim());
            setStatus(STATUS_STARTED);
        } else if (firstLine == null) {
            logger.warn("{} closed its diagnostic stream before reporting readiness", config.getBinaryName());
            setStatus(STATUS_DEGRADED);
        } else {
            logger.warn("{} started without the expected notice: {}", config.getBinaryName(), firstLine.trim());
            setStatus(STATUS_DEGRADED);
        }
        transition(SupervisorState.RUNNING);
    }

    /**
     * Ends a start interrupted by {@link #close()}. The helper has already been killed.
     */
    private void abandonStart() {
        logger.info("Start of {} abandoned, supervisor is closing", config.getBinaryName());
        HelperProcess process = helper;
        helper = null;
        if (process != null) {
            release(process);
        }
        transition(SupervisorState.IDLE);
        setStatus(STATUS_STOPPED);
    }

    private void stop() {
        transition(SupervisorState.STOPPING);
        setStatus(STATUS_STOPPING);
        terminateHelper();
        transition(SupervisorState.IDLE);
        setStatus(STATUS_STOPPED);
    }

    private HelperStartException failStart(Path binary, Exception cause) {
        logger.error("Failed to start {}: {}", binary, cause.getMessage());
        transition(SupervisorState.IDLE);
        setStatus(STATUS_START_FAILED);
        return new HelperStartException(binary, cause);
    }

    private void terminateHelper() {
        HelperProcess process = helper;
        helper = null;
        if (process == null) {
            return;
        }
        process.kill();
        release(process);
    }

    private void release(HelperProcess process) {
        try {
            process.awaitExit();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for helper {} to exit", process);
        } finally {
            process.close();
        }
    }

    private void cacheBinary(Path binary) {
        resolvedBinary = binary;
        store.setData(pathNode, binary.toString());
        store.setLabel(pathNode, config.getBinaryName() + " path: " + binary);
    }

    private void setStatus(String label) {
        store.setLabel(statusNode, label);
    }

    private void transition(SupervisorState to) {
        SupervisorState from = state;
        state = to;
        logger.debug("Supervisor {} -> {}", from, to);
        for (SupervisorListener listener : listeners) {
            try {
                listener.stateChanged(from, to);
            } catch (RuntimeException e) {
                logger.warn("Supervisor listener {} failed on {} -> {}", listener, from, to, e);
            }
        }
    }
}
