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

package io.rcpanel.keys;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable, ordered sequence of key names such as {@code ("Z", "Z")} or {@code ("enter")}.
 * Key names are the strings produced by the terminal key decoder: printable characters stand
 * for themselves, special keys use lowercase names.
 *
 * @param keys the keys in press order
 */
public record KeySequence(List<String> keys) {

    public static final KeySequence EMPTY = new KeySequence(List.of());

    public KeySequence {
        keys = List.copyOf(keys);
        for (String key : keys) {
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Key names must not be empty: " + keys);
            }
        }
    }

    public static KeySequence of(String... keys) {
        return new KeySequence(Arrays.asList(keys));
    }

    /**
     * Parses a space separated key list, e.g. {@code "g g"} or {@code "enter"}.
     *
     * @param spec the key list
     * @return the parsed sequence
     * @throws IllegalArgumentException if {@code spec} holds no keys
     */
    public static KeySequence parse(String spec) {
        String trimmed = spec == null ? "" : spec.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Key sequence must contain at least one key");
        }
        return new KeySequence(Arrays.asList(trimmed.split("\\s+")));
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public String get(int index) {
        return keys.get(index);
    }

    /**
     * @return a new sequence with {@code key} appended
     */
    public KeySequence append(String key) {
        List<String> extended = new ArrayList<>(keys.size() + 1);
        extended.addAll(keys);
        extended.add(key);
        return new KeySequence(extended);
    }

    /**
     * @return true when this sequence is shorter than {@code other} and matches its first keys
     */
    public boolean isStrictPrefixOf(KeySequence other) {
        return keys.size() < other.keys.size() && other.keys.subList(0, keys.size()).equals(keys);
    }

    @Override
    public String toString() {
        return String.join(" ", keys);
    }
}
