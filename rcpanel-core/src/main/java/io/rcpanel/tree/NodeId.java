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
 * Opaque identifier of a node within one {@link NodeStore}. Identifiers are assigned
 * monotonically by the store, starting with {@code 0} for the root, and are never reused.
 *
 * @param value the numeric identifier
 */
public record NodeId(long value) {

    @Override
    public String toString() {
        return "#" + value;
    }
}
