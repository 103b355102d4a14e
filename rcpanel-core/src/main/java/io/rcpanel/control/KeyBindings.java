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

package io.rcpanel.control;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default single-key bindings, the last stage of the key pipeline. Each key maps to an action
 * and a short description for help output.
 */
public class KeyBindings implements KeyStage {

    private static final Logger logger = LogManager.getLogger(KeyBindings.class);

    /**
     * A bound action.
     *
     * @param key         the key name
     * @param description what the action does
     * @param action      the action
     */
    public record Binding(String key, String description, Runnable action) {
    }

    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    /**
     * Binds {@code key}, replacing an earlier binding of the same key.
     */
    public void bind(String key, String description, Runnable action) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        bindings.put(key, new Binding(key, description == null ? "" : description, action));
    }

    public void unbind(String key) {
        bindings.remove(key);
    }

    public boolean isBound(String key) {
        return bindings.containsKey(key);
    }

    /**
     * @return the bindings in registration order
     */
    public List<Binding> getBindings() {
        return new ArrayList<>(bindings.values());
    }

    @Override
    public boolean onKey(String key) {
        Binding binding = bindings.get(key);
        if (binding == null) {
            return false;
        }
        logger.trace("Key '{}' -> {}", key, binding.description());
        binding.action().run();
        return true;
    }
}
