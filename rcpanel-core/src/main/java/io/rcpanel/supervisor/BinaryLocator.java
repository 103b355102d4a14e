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

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves an executable name to a path.
 *
 * @see PathBinaryLocator
 */
@FunctionalInterface
public interface BinaryLocator {

    /**
     * @param name the executable name, without directory
     * @return the first matching executable, or empty if there is none
     */
    Optional<Path> locate(String name);
}
