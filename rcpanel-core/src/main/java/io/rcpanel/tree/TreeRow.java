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
 * One visible line of a tree, as produced by {@link NodeStore#visibleRows()}.
 *
 * @param id         the node shown on this row
 * @param label      the node label at the time the rows were collected
 * @param depth      distance from the root; the root has depth 0
 * @param expandable whether clicking the row would expand or collapse it
 * @param expanded   whether the node is currently expanded
 * @param lastChild  whether the node is the last child of its parent (true for the root)
 */
public record TreeRow(NodeId id, String label, int depth, boolean expandable, boolean expanded, boolean lastChild) {
}
