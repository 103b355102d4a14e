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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The one-line command area at the bottom of the panel. While focused it consumes printable
 * keys, appending them to its text; {@code enter} releases focus and runs the typed command.
 * Other keys are not consumed and continue down the pipeline.
 *
 * <p>Commands are whole-line matches, such as {@code ":q"}. Unknown commands are logged.</p>
 */
public class CommandArea implements KeyStage {

    private static final Logger logger = LogManager.getLogger(CommandArea.class);

    private final StringBuilder text = new StringBuilder();
    private final Map<String, Runnable> commands = new LinkedHashMap<>();
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();
    private Runnable releaseHandler = () -> { };
    private boolean focused;

    public void registerCommand(String command, Runnable action) {
        commands.put(Objects.requireNonNull(command, "command"), Objects.requireNonNull(action, "action"));
    }

    /**
     * @param handler called when {@code enter} gives up focus, before the command runs
     */
    public void setReleaseHandler(Runnable handler) {
        this.releaseHandler = Objects.requireNonNull(handler, "handler");
    }

    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    /**
     * Takes focus and clears the text.
     */
    public void focus() {
        focused = true;
        text.setLength(0);
        fireChanged();
    }

    public boolean isFocused() {
        return focused;
    }

    public String getText() {
        return text.toString();
    }

    @Override
    public boolean onKey(String key) {
        if (!focused) {
            return false;
        }
        if ("enter".equals(key)) {
            focused = false;
            releaseHandler.run();
            execute(text.toString());
            fireChanged();
            return true;
        }
        if ("space".equals(key) || isPrintable(key)) {
            text.append("space".equals(key) ? " " : key);
            fireChanged();
            return true;
        }
        return false;
    }

    private void execute(String command) {
        if (command.isEmpty()) {
            return;
        }
        Runnable action = commands.get(command);
        if (action == null) {
            logger.warn("Unknown command: {}", command);
            return;
        }
        logger.debug("Running command {}", command);
        action.run();
    }

    static boolean isPrintable(String key) {
        return key.length() == 1 && !Character.isISOControl(key.charAt(0));
    }

    private void fireChanged() {
        for (Runnable listener : changeListeners) {
            listener.run();
        }
    }
}
