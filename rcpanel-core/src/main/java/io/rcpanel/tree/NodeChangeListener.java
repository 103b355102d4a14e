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

/**
 * Receives a notification after a node's label, expansion state or child list changed.
 * Renderers register one of these to know when a redraw is due.
 *
 * <p>Listeners are invoked synchronously on the thread that mutated the store, while the
 * store's monitor is released. They should return quickly.</p>
 */
@FunctionalInterface
public interface NodeChangeListener {

    /**
     * @param store the store that changed
     * @param node  the node whose display changed; for structural changes this is the parent
     */
    void nodeChanged(NodeStore<?> store, NodeId node);
}
