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

package io.rcpanel.control;

import io.rcpanel.supervisor.BinaryLocator;
import io.rcpanel.supervisor.HelperLauncher;
import io.rcpanel.supervisor.PathBinaryLocator;
import io.rcpanel.supervisor.ProcessHelperLauncher;
import io.rcpanel.supervisor.ProcessSupervisor;
import io.rcpanel.supervisor.SupervisorConfig;
import io.rcpanel.tree.NodeId;
import io.rcpanel.tree.NodeStore;

/**
 * The control-panel tree and the supervisor reporting through it:
 * <pre>
 * rclone rc
 *   ├─ Server: ...        (click to start / stop the helper)
 *   ├─ Client: ...
 *   └─ rclone path: ...
 * </pre>
 * The root is expanded when the panel is created.
 */
public class ControlPanel implements AutoCloseable {

    public static final String PLACEHOLDER = "...";

    private final NodeStore<String> store;
    private final NodeId serverNode;
    private final NodeId clientNode;
    private final NodeId pathNode;
    private final ProcessSupervisor supervisor;

    public ControlPanel(SupervisorConfig config) {
        this(config, new PathBinaryLocator(), new ProcessHelperLauncher());
    }

    public ControlPanel(SupervisorConfig config, BinaryLocator locator, HelperLauncher launcher) {
        String binaryName = config.getBinaryName();
        this.store = new NodeStore<>(binaryName + " rc", "");
        NodeId root = store.root();
        this.serverNode = store.add(root, "Server: " + PLACEHOLDER, "");
        this.clientNode = store.add(root, "Client: " + PLACEHOLDER, "");
        this.pathNode = store.add(root, binaryName + " path: " + PLACEHOLDER, "");
        store.expand(root);
        this.supervisor = new ProcessSupervisor(store, serverNode, pathNode, config, locator, launcher);
    }

    public NodeStore<String> getStore() {
        return store;
    }

    public NodeId getServerNode() {
        return serverNode;
    }

    public NodeId getClientNode() {
        return clientNode;
    }

    public NodeId getPathNode() {
        return pathNode;
    }

    public ProcessSupervisor getSupervisor() {
        return supervisor;
    }

    /**
     * Closes the supervisor, killing a running helper.
     */
    @Override
    public void close() {
        supervisor.close();
    }
}
