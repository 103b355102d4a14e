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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NodeStore")
class NodeStoreTest {

    private NodeStore<String> store;
    private NodeId root;

    @BeforeEach
    void setUp() {
        store = new NodeStore<>("rclone rc", "");
        root = store.root();
    }

    @Nested
    @DisplayName("Structure")
    class StructureTest {

        @Test
        @DisplayName("should start with a childless root")
        void shouldStartWithRoot() {
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.get(root).isRoot()).isTrue();
            assertThat(store.get(root).getLabel()).isEqualTo("rclone rc");
            assertThat(store.children(root)).isEmpty();
            assertThat(store.parent(root)).isEmpty();
        }

        @Test
        @DisplayName("should append children in order")
        void shouldAppendChildrenInOrder() {
            NodeId a = store.add(root, "a", "");
            NodeId b = store.add(root, "b", "");
            NodeId c = store.add(root, "c", "");

            assertThat(store.children(root)).containsExactly(a, b, c);
            assertThat(store.parent(b)).contains(root);
            assertThat(store.size()).isEqualTo(4);
        }

        @Test
        @DisplayName("should never reuse ids")
        void shouldNeverReuseIds() {
            NodeId a = store.add(root, "a", "");
            store.remove(a);
            NodeId b = store.add(root, "b", "");

            assertThat(b).isNotEqualTo(a);
            assertThat(store.contains(a)).isFalse();
            assertThatThrownBy(() -> store.get(a)).isInstanceOf(NodeNotFoundException.class);
        }

        @Test
        @DisplayName("should reject adding under an unknown parent")
        void shouldRejectUnknownParent() {
            NodeId ghost = store.add(root, "ghost", "");
            store.remove(ghost);

            assertThatThrownBy(() -> store.add(ghost, "child", ""))
                .isInstanceOf(NodeNotFoundException.class)
                .satisfies(e -> assertThat(((NodeNotFoundException) e).getNodeId()).isEqualTo(ghost));
            assertThat(store.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Removal")
    class RemovalTest {

        @Test
        @DisplayName("should refuse to remove the root")
        void shouldRefuseRootRemoval() {
            store.add(root, "a", "");

            assertThatThrownBy(() -> store.remove(root)).isInstanceOf(IllegalArgumentException.class);
            assertThat(store.size()).isEqualTo(2);
            assertThat(store.contains(root)).isTrue();
        }

        @Test
        @DisplayName("should fail on an unknown node and leave the store unchanged")
        void shouldFailOnUnknownNode() {
            NodeId a = store.add(root, "a", "");
            store.remove(a);

            assertThatThrownBy(() -> store.remove(a)).isInstanceOf(NodeNotFoundException.class);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("adding then removing a leaf restores the previous child order")
        void shouldRestoreOrder() {
            NodeId a = store.add(root, "a", "");
            NodeId b = store.add(root, "b", "");
            List<NodeId> before = store.children(root);

            NodeId extra = store.add(root, "extra", "");
            store.remove(extra);

            assertThat(store.children(root)).isEqualTo(before).containsExactly(a, b);
        }

        @Test
        @DisplayName("should keep sibling order when removing from the middle")
        void shouldKeepSiblingOrder() {
            NodeId a = store.add(root, "a", "");
            NodeId b = store.add(root, "b", "");
            NodeId c = store.add(root, "c", "");

            store.remove(b);

            assertThat(store.children(root)).containsExactly(a, c);
        }

        @Test
        @DisplayName("should remove the whole subtree")
        void shouldCascade() {
            NodeId dir = store.add(root, "dir", "");
            NodeId sub = store.add(dir, "sub", "");
            NodeId leaf = store.add(sub, "leaf", "");
            NodeId sibling = store.add(root, "sibling", "");

            store.remove(dir);

            assertThat(store.contains(dir)).isFalse();
            assertThat(store.contains(sub)).isFalse();
            assertThat(store.contains(leaf)).isFalse();
            assertThat(store.children(root)).containsExactly(sibling);
            assertThat(store.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Expansion")
    class ExpansionTest {

        @Test
        @DisplayName("should flip the expansion state")
        void shouldToggle() {
            store.add(root, "a", "");

            assertThat(store.toggle(root)).isTrue();
            assertThat(store.get(root).isExpanded()).isTrue();
            assertThat(store.toggle(root)).isFalse();
            assertThat(store.get(root).isExpanded()).isFalse();
        }

        @Test
        @DisplayName("should populate a lazy node exactly once")
        void shouldPopulateOnce() {
            AtomicInteger calls = new AtomicInteger();
            NodeId lazy = store.add(root, "lazy", "", (s, node) -> {
                calls.incrementAndGet();
                s.add(node, "x", "");
                s.add(node, "y", "");
            });
            assertThat(store.isExpandable(lazy)).isTrue();
            assertThat(store.children(lazy)).isEmpty();

            store.toggle(lazy);
            store.toggle(lazy);
            store.toggle(lazy);

            assertThat(calls).hasValue(1);
            assertThat(store.children(lazy)).hasSize(2);
            assertThat(store.get(lazy).isExpanded()).isTrue();
        }

        @Test
        @DisplayName("should not run the populator on collapse")
        void shouldNotPopulateOnCollapse() {
            AtomicInteger calls = new AtomicInteger();
            NodeId lazy = store.add(root, "lazy", "", (s, node) -> calls.incrementAndGet());

            store.collapse(lazy);

            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("should roll back and stay collapsed when the populator fails")
        void shouldRollBackFailedPopulation() {
            NodeId lazy = store.add(root, "lazy", "", (s, node) -> {
                s.add(node, "partial", "");
                throw new IOException("permission denied");
            });
            int sizeBefore = store.size();

            assertThatThrownBy(() -> store.toggle(lazy))
                .isInstanceOf(UncheckedIOException.class)
                .hasCauseInstanceOf(IOException.class);

            assertThat(store.size()).isEqualTo(sizeBefore);
            assertThat(store.children(lazy)).isEmpty();
            assertThat(store.get(lazy).isExpanded()).isFalse();
            assertThat(store.isExpandable(lazy)).isTrue();
        }

        @Test
        @DisplayName("should fail on an unknown node")
        void shouldFailOnUnknownNode() {
            assertThatThrownBy(() -> store.toggle(new NodeId(99))).isInstanceOf(NodeNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Labels and rows")
    class LabelsTest {

        @Test
        @DisplayName("should notify listeners of label changes")
        void shouldNotifyOnLabel() {
            NodeId server = store.add(root, "Server: ...", "");
            List<NodeId> changed = new ArrayList<>();
            store.addChangeListener((s, node) -> changed.add(node));

            store.setLabel(server, "Server: Starting.");

            assertThat(store.get(server).getLabel()).isEqualTo("Server: Starting.");
            assertThat(changed).containsExactly(server);
        }

        @Test
        @DisplayName("should coalesce notifications raised while populating")
        void shouldCoalescePopulation() {
            NodeId lazy = store.add(root, "lazy", "", (s, node) -> {
                s.add(node, "x", "");
                s.add(node, "y", "");
            });
            List<NodeId> changed = new ArrayList<>();
            store.addChangeListener((s, node) -> changed.add(node));

            store.expand(lazy);

            assertThat(changed).containsExactly(lazy);
        }

        @Test
        @DisplayName("should keep going when a listener throws")
        void shouldSurviveFailingListener() {
            NodeId a = store.add(root, "a", "");
            store.addChangeListener((s, node) -> {
                throw new IllegalStateException("boom");
            });

            store.setLabel(a, "b");

            assertThat(store.get(a).getLabel()).isEqualTo("b");
        }

        @Test
        @DisplayName("should list only rows under expanded nodes")
        void shouldListVisibleRows() {
            NodeId a = store.add(root, "a", "");
            store.add(a, "a1", "");
            NodeId b = store.add(root, "b", "");
            store.expand(root);

            List<TreeRow> rows = store.visibleRows();

            assertThat(rows).extracting(TreeRow::label).containsExactly("rclone rc", "a", "b");
            assertThat(rows.get(1).expandable()).isTrue();
            assertThat(rows.get(1).lastChild()).isFalse();
            assertThat(rows.get(2).id()).isEqualTo(b);
            assertThat(rows.get(2).lastChild()).isTrue();
            assertThat(rows.get(2).depth()).isEqualTo(1);

            store.expand(a);
            assertThat(store.visibleRows()).extracting(TreeRow::label).containsExactly("rclone rc", "a", "a1", "b");
        }
    }
}
