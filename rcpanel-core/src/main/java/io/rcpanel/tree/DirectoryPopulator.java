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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Populates filesystem-backed nodes: the node data is a {@link Path}, and expanding a
 * directory node adds one child per directory entry, ordered by file name. Child directories
 * get this populator too, so the tree unfolds level by level. Expanding a non-directory is a
 * no-op.
 */
public class DirectoryPopulator implements LazyPopulator<Path> {

    private static final Comparator<Path> BY_NAME = Comparator.comparing(DirectoryPopulator::labelFor);

    /**
     * Creates a tree rooted at {@code directory}. The root is not expanded yet.
     *
     * @param directory the root directory
     * @return a new store whose root lists {@code directory} on first expansion
     */
    public static NodeStore<Path> newTree(Path directory) {
        return new NodeStore<>(labelFor(directory), directory, new DirectoryPopulator());
    }

    @Override
    public void populate(NodeStore<Path> store, NodeId node) throws IOException {
        Path directory = store.get(node).getData();
        if (directory == null || !Files.isDirectory(directory)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> listing = Files.list(directory)) {
            entries = listing.sorted(BY_NAME).collect(Collectors.toList());
        }
        for (Path entry : entries) {
            store.add(node, labelFor(entry), entry, Files.isDirectory(entry) ? this : null);
        }
    }

    static String labelFor(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
