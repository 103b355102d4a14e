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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A labeled node of a {@link NodeStore}. Nodes refer to their parent and children by
 * {@link NodeId} only; links are resolved through the store.
 *
 * <p>Instances are owned by their store. All mutation goes through {@link NodeStore} so
 * that the tree stays consistent and change notifications fire; the accessors here are read-only.</p>
 *
 * @param <T> the node data type
 */
public final class Node<T> {

    private final NodeId id;
    private final NodeId parent;
    private final List<NodeId> children = new ArrayList<>();
    private final LazyPopulator<T> populator;
    private volatile String label;
    private volatile T data;
    private volatile boolean expanded;
    private volatile boolean populated;

    Node(NodeId id, NodeId parent, String label, T data, LazyPopulator<T> populator) {
        this.id = id;
        this.parent = parent;
        this.label = label;
        this.data = data;
        this.populator = populator;
    }

    public NodeId getId() {
        return id;
    }

    /**
     * @return the parent id, or empty for the root
     */
    public Optional<NodeId> getParent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public String getLabel() {
        return label;
    }

    public T getData() {
        return data;
    }

    public boolean isExpanded() {
        return expanded;
    }

    /**
     * @return a snapshot of the child ids in display order
     */
    public List<NodeId> getChildren() {
        synchronized (children) {
            return List.copyOf(children);
        }
    }

    public boolean hasChildren() {
        synchronized (children) {
            return !children.isEmpty();
        }
    }

    /**
     * @return true when this node carries a populator that has not run yet
     */
    public boolean isLazy() {
        return populator != null && !populated;
    }

    LazyPopulator<T> populator() {
        return populator;
    }

    void addChild(NodeId child) {
        synchronized (children) {
            children.add(child);
        }
    }

    boolean removeChild(NodeId child) {
        synchronized (children) {
            return children.remove(child);
        }
    }

    void setLabel(String label) {
        this.label = label;
    }

    void setData(T data) {
        this.data = data;
    }

    void setExpanded(boolean expanded) {
        this.expanded = expanded;
    }

    void markPopulated() {
        this.populated = true;
    }

    @Override
    public String toString() {
        return id + " '" + label + "'";
    }
}
