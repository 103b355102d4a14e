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

package io.rcpanel.supervisor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds executables on the host's executable search path, the {@code PATH} environment
 * variable. Directories are searched in order and the first regular, executable file with
 * the requested name wins. On Windows the {@code PATHEXT} extensions are tried as well.
 */
public class PathBinaryLocator implements BinaryLocator {

    private static final Logger logger = LogManager.getLogger(PathBinaryLocator.class);

    private final String searchPath;
    private final List<String> extensions;

    /**
     * Creates a locator over the current process environment.
     */
    public PathBinaryLocator() {
        this(System.getenv("PATH"), defaultExtensions());
    }

    /**
     * Creates a locator over an explicit search path.
     *
     * @param searchPath directories separated by {@link File#pathSeparator}; null means empty
     * @param extensions file name suffixes to try after the bare name, such as {@code ".exe"}
     */
    public PathBinaryLocator(String searchPath, List<String> extensions) {
        this.searchPath = searchPath == null ? "" : searchPath;
        this.extensions = List.copyOf(extensions);
    }

    @Override
    public Optional<Path> locate(String name) {
        if (name == null || name.isEmpty() || name.contains("/") || name.contains(File.separator)) {
            throw new IllegalArgumentException("Executable name must be a bare file name: " + name);
        }
        for (String entry : searchPath.split(File.pathSeparator)) {
            if (entry.isEmpty()) {
                continue;
            }
            for (String candidateName : candidateNames(name)) {
                Path candidate;
                try {
                    candidate = Paths.get(entry, candidateName);
                } catch (InvalidPathException e) {
                    logger.debug("Skipping invalid search path entry '{}': {}", entry, e.getMessage());
                    break;
                }
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    logger.debug("Located {} at {}", name, candidate);
                    return Optional.of(candidate.toAbsolutePath());
                }
            }
        }
        logger.debug("{} not found on search path", name);
        return Optional.empty();
    }

    private List<String> candidateNames(String name) {
        List<String> names = new ArrayList<>(extensions.size() + 1);
        names.add(name);
        for (String extension : extensions) {
            names.add(name + extension);
        }
        return names;
    }

    private static List<String> defaultExtensions() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (!os.startsWith("windows")) {
            return List.of();
        }
        String pathext = System.getenv("PATHEXT");
        if (pathext == null || pathext.isBlank()) {
            return List.of(".exe", ".bat", ".cmd");
        }
        List<String> extensions = new ArrayList<>();
        for (String extension : pathext.split(";")) {
            if (!extension.isBlank()) {
                extensions.add(extension.toLowerCase(Locale.ROOT));
            }
        }
        return extensions;
    }
}
