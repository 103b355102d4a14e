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

import java.io.IOException;

/**
 * Optional per-node capability that produces a node's children the first time it is expanded.
 * Nodes without a populator are plain label/value nodes.
 *
 * <p>The store calls {@link #populate(NodeStore, NodeId)} at most once per node, synchronously
 * from {@link NodeStore#toggle(NodeId)} or {@link NodeStore#expand(NodeId)}. Implementations add
 * children through {@link NodeStore#add(NodeId, String, Object)} or
 * {@link NodeStore#add(NodeId, String, Object, LazyPopulator)}.</p>
 *
 * @param <T> the node data type
 * @see DirectoryPopulator
 */
@FunctionalInterface
public interface LazyPopulator<T> {

    /**
     * Adds the children of {@code node}.
     *
     * @param store the owning store
     * @param node  the node being expanded; it has no children yet
     * @throws IOException if the backing data cannot be read
     */
    void populate(NodeStore<T> store, NodeId node) throws IOException;
}
