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

package io.rcpanel.tree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A tree of identified, labeled nodes with lazy child population.
 *
 * <p><strong>Structure:</strong></p>
 * <ul>
 *   <li>The store always holds a root node, created with the store and never removable.</li>
 *   <li>Every other node has exactly one parent and appears exactly once in that parent's
 *       ordered child list. Links are held as {@link NodeId}s, never as object references.</li>
 *   <li>Ids are assigned monotonically and never reused, so a stale id stays invalid.</li>
 * </ul>
 *
 * <p><strong>Hierarchy Example:</strong></p>
 * <pre>
 * rclone rc              (root, expanded)
 *   ├─ Server: Started.
 *   ├─ Client: ...
 *   └─ rclone path: /usr/bin/rclone
 * </pre>
 *
 * <p><strong>Lazy population:</strong> a node created with a {@link LazyPopulator} gets its
 * children the first time it is expanded while still childless. The populator runs once;
 * collapsing and expanding again never repopulates.</p>
 *
 * <p><strong>Removal:</strong> {@link #remove(NodeId)} cascades: the node's whole subtree
 * leaves the store, so no unreachable nodes are retained.</p>
 *
 * <p><strong>Failure atomicity:</strong> a failing {@code add}, {@code remove} or
 * {@code toggle} leaves the store exactly as it was.</p>
 *
 * <p><strong>Thread Safety:</strong> all mutators and queries synchronize on the store, so a
 * render thread may read {@link #visibleRows()} while the control loop mutates. Change
 * listeners run on the mutating thread after the monitor is released; notifications raised
 * by a populator are coalesced into one notification for the expanded node.</p>
 *
 * @param <T> the node data type
 * @see LazyPopulator
 * @see NodeChangeListener
 */
public class NodeStore<T> {

    private static final Logger logger = LogManager.getLogger(NodeStore.class);

    private final Map<NodeId, Node<T>> nodes = new HashMap<>();
    private final List<NodeChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final NodeId rootId;
    private long nextId;
    private int populating;

    /**
     * Creates a store whose root is a plain node.
     *
     * @param rootLabel the root label
     * @param rootData  the root data
     */
    public NodeStore(String rootLabel, T rootData) {
        this(rootLabel, rootData, null);
    }

    /**
     * Creates a store whose root carries a populator, such as a directory tree.
     *
     * @param rootLabel     the root label
     * @param rootData      the root data
     * @param rootPopulator the root populator, or null for a plain root
     */
    public NodeStore(String rootLabel, T rootData, LazyPopulator<T> rootPopulator) {
        this.rootId = new NodeId(nextId++);
        nodes.put(rootId, new Node<>(rootId, null, Objects.requireNonNull(rootLabel, "rootLabel"), rootData, rootPopulator));
    }

    public void addChangeListener(NodeChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeChangeListener(NodeChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Adds a plain node as the last child of {@code parent}.
     *
     * @return the id of the new node
     * @throws NodeNotFoundException if {@code parent} is not in the store
     */
    public NodeId add(NodeId parent, String label, T data) {
        return add(parent, label, data, null);
    }

    /**
     * Adds a node as the last child of {@code parent}.
     *
     * @param parent    the parent node
     * @param label     the single-line display label
     * @param data      the node data
     * @param populator populates the node's children on first expansion, or null
     * @return the id of the new node
     * @throws NodeNotFoundException if {@code parent} is not in the store
     */
    public NodeId add(NodeId parent, String label, T data, LazyPopulator<T> populator) {
        Objects.requireNonNull(label, "label");
        NodeId id;
        boolean notify;
        synchronized (this) {
            Node<T> parentNode = require(parent);
            id = new NodeId(nextId++);
            nodes.put(id, new Node<>(id, parent, label, data, populator));
            parentNode.addChild(id);
            notify = populating == 0;
        }
        if (notify) {
            fireChanged(parent);
        }
        return id;
    }

    /**
     * Removes a node and its whole subtree. The remaining siblings keep their order.
     *
     * @throws IllegalArgumentException if {@code id} is the root
     * @throws NodeNotFoundException    if {@code id} is not in the store
     */
    public void remove(NodeId id) {
        NodeId parent;
        synchronized (this) {
            if (rootId.equals(id)) {
                throw new IllegalArgumentException("Cannot remove root node " + id);
            }
            Node<T> node = require(id);
            parent = node.getParent().orElseThrow();
            nodes.get(parent).removeChild(id);
            int dropped = dropSubtree(id);
            logger.trace("Removed {} with {} descendant(s)", node, dropped - 1);
        }
        fireChanged(parent);
    }

    /**
     * Flips a node's expansion state. When the node is expanded while still childless and
     * holds an unspent populator, the populator runs first.
     *
     * @return the new expansion state
     * @throws NodeNotFoundException if {@code id} is not in the store
     * @throws UncheckedIOException  if the populator fails; the node stays collapsed
     */
    public boolean toggle(NodeId id) {
        boolean expanded;
        synchronized (this) {
            Node<T> node = require(id);
            expanded = !node.isExpanded();
            if (expanded) {
                populateIfNeeded(node);
            }
            node.setExpanded(expanded);
        }
        fireChanged(id);
        return expanded;
    }

    /**
     * Expands a node if it is collapsed.
     *
     * @see #toggle(NodeId)
     */
    public void expand(NodeId id) {
        synchronized (this) {
            if (require(id).isExpanded()) {
                return;
            }
        }
        toggle(id);
    }

    /**
     * Collapses a node if it is expanded.
     */
    public void collapse(NodeId id) {
        synchronized (this) {
            if (!require(id).isExpanded()) {
                return;
            }
        }
        toggle(id);
    }

    /**
     * Replaces a node's label and notifies listeners.
     *
     * @throws NodeNotFoundException if {@code id} is not in the store
     */
    public void setLabel(NodeId id, String label) {
        Objects.requireNonNull(label, "label");
        synchronized (this) {
            require(id).setLabel(label);
        }
        fireChanged(id);
    }

    /**
     * Replaces a node's data. Data is not displayed, so no notification is sent.
     *
     * @throws NodeNotFoundException if {@code id} is not in the store
     */
    public synchronized void setData(NodeId id, T data) {
        require(id).setData(data);
    }

    public NodeId root() {
        return rootId;
    }

    /**
     * @throws NodeNotFoundException if {@code id} is not in the store
     */
    public synchronized Node<T> get(NodeId id) {
        return require(id);
    }

    public synchronized Optional<Node<T>> find(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public synchronized boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    /**
     * @throws NodeNotFoundException if {@code id} is not in the store
     */
    public synchronized List<NodeId> children(NodeId id) {
        return require(id).getChildren();
    }

    /**
     * @return the parent id, or empty for the root
     * @throws NodeNotFoundException if {@code id} is not in the store
     */
    public synchronized Optional<NodeId> parent(NodeId id) {
        return require(id).getParent();
    }

    /**
     * A node is expandable when it has children or an unspent populator.
     *
     * @throws NodeNotFoundException if {@code id} is not in the store
     */
    public synchronized boolean isExpandable(NodeId id) {
        Node<T> node = require(id);
        return node.hasChildren() || node.isLazy();
    }

    public synchronized int size() {
        return nodes.size();
    }

    /**
     * Collects the rows a renderer shows: the root, then depth-first every node whose
     * ancestors are all expanded.
     *
     * @return the visible rows in display order
     */
    public synchronized List<TreeRow> visibleRows() {
        List<TreeRow> rows = new ArrayList<>();
        collectRows(nodes.get(rootId), 0, true, rows);
        return rows;
    }

    private void collectRows(Node<T> node, int depth, boolean lastChild, List<TreeRow> rows) {
        boolean expandable = node.hasChildren() || node.isLazy();
        rows.add(new TreeRow(node.getId(), node.getLabel(), depth, expandable, node.isExpanded(), lastChild));
        if (!node.isExpanded()) {
            return;
        }
        List<NodeId> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            collectRows(nodes.get(children.get(i)), depth + 1, i == children.size() - 1, rows);
        }
    }

    private void populateIfNeeded(Node<T> node) {
        if (!node.isLazy() || node.hasChildren()) {
            return;
        }
        populating++;
        try {
            node.populator().populate(this, node.getId());
            node.markPopulated();
            logger.debug("Populated {} with {} child(ren)", node, node.getChildren().size());
        } catch (IOException e) {
            rollbackChildren(node);
            throw new UncheckedIOException("Unable to populate " + node, e);
        } catch (RuntimeException e) {
            rollbackChildren(node);
            throw e;
        } finally {
            populating--;
        }
    }

    private void rollbackChildren(Node<T> node) {
        for (NodeId child : node.getChildren()) {
            node.removeChild(child);
            dropSubtree(child);
        }
    }

    private int dropSubtree(NodeId id) {
        int dropped = 0;
        Deque<NodeId> pending = new ArrayDeque<>();
        pending.push(id);
        while (!pending.isEmpty()) {
            Node<T> node = nodes.remove(pending.pop());
            if (node != null) {
                dropped++;
                node.getChildren().forEach(pending::push);
            }
        }
        return dropped;
    }

    private Node<T> require(NodeId id) {
        Node<T> node = id == null ? null : nodes.get(id);
        if (node == null) {
            throw new NodeNotFoundException(id);
        }
        return node;
    }

    private void fireChanged(NodeId id) {
        for (NodeChangeListener listener : listeners) {
            try {
                listener.nodeChanged(this, id);
            } catch (RuntimeException e) {
                logger.warn("Change listener {} failed for node {}", listener, id, e);
            }
        }
    }
}
