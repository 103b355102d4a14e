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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TreeRenderer")
class TreeRendererTest {

    @Test
    @DisplayName("should draw guides for nested rows")
    void shouldDrawGuides() {
        NodeStore<String> store = new NodeStore<>("root", "");
        NodeId a = store.add(store.root(), "a", "");
        store.add(a, "a1", "");
        store.add(a, "a2", "");
        NodeId b = store.add(store.root(), "b", "");
        store.add(b, "b1", "");
        store.expand(store.root());
        store.expand(a);
        store.expand(b);

        List<String> lines = TreeRenderer.render(List.of(store)).stream()
            .map(TreeRenderer.RenderedRow::text)
            .toList();

        assertThat(lines).containsExactly(
            "▾ root",
            "  ├─ ▾ a",
            "  │  ├─ a1",
            "  │  └─ a2",
            "  └─ ▾ b",
            "     └─ b1");
    }

    @Test
    @DisplayName("should mark collapsed nodes and hide their children")
    void shouldMarkCollapsed() {
        NodeStore<String> store = new NodeStore<>("root", "");
        NodeId a = store.add(store.root(), "a", "");
        store.add(a, "hidden", "");

        List<TreeRenderer.RenderedRow> rows = TreeRenderer.render(List.of(store));

        assertThat(rows).extracting(TreeRenderer.RenderedRow::text).containsExactly("▸ root");
        assertThat(rows.get(0).id()).isEqualTo(store.root());
    }

    @Test
    @DisplayName("should render several trees in order")
    void shouldRenderSeveralTrees() {
        NodeStore<String> first = new NodeStore<>("first", "");
        NodeStore<String> second = new NodeStore<>("second", "");

        List<TreeRenderer.RenderedRow> rows = TreeRenderer.render(List.of(first, second));

        assertThat(rows).extracting(TreeRenderer.RenderedRow::text).containsExactly("first", "second");
        assertThat(rows.get(1).store()).isSameAs(second);
    }
}
