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

package io.rcpanel.console;

import io.rcpanel.tree.NodeId;
import io.rcpanel.tree.NodeStore;
import io.rcpanel.tree.TreeRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out the visible rows of one or more trees as text with box-drawing guides:
 * <pre>
 * ▾ rclone rc
 *   ├─ Server: Started.
 *   ├─ Client: ...
 *   └─ rclone path: /usr/bin/rclone
 * ▸ alice
 * </pre>
 */
public final class TreeRenderer {

    static final String EXPANDED = "▾ ";
    static final String COLLAPSED = "▸ ";

    private TreeRenderer() {
    }

    /**
     * One rendered line, still linked to the node it shows so that a click can be routed.
     *
     * @param store the tree holding the node
     * @param id    the node
     * @param text  the line text, guides included
     */
    public record RenderedRow(NodeStore<?> store, NodeId id, String text) {
    }

    /**
     * Renders each tree in turn, in the order given.
     */
    public static List<RenderedRow> render(List<? extends NodeStore<?>> stores) {
        List<RenderedRow> rendered = new ArrayList<>();
        for (NodeStore<?> store : stores) {
            render(store, rendered);
        }
        return rendered;
    }

    static void render(NodeStore<?> store, List<RenderedRow> into) {
        // open[d] is true while an ancestor at depth d still has siblings below it
        List<Boolean> open = new ArrayList<>();
        for (TreeRow row : store.visibleRows()) {
            StringBuilder line = new StringBuilder();
            if (row.depth() > 0) {
                line.append("  ");
                for (int d = 1; d < row.depth(); d++) {
                    line.append(open.get(d) ? "│  " : "   ");
                }
                line.append(row.lastChild() ? "└─ " : "├─ ");
            }
            if (row.expandable()) {
                line.append(row.expanded() ? EXPANDED : COLLAPSED);
            }
            line.append(row.label());

            while (open.size() <= row.depth()) {
                open.add(Boolean.FALSE);
            }
            open.set(row.depth(), !row.lastChild());
            into.add(new RenderedRow(store, row.id(), line.toString()));
        }
    }
}
