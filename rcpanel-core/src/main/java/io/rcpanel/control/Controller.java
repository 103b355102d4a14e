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

import io.rcpanel.keys.ChordRemapper;
import io.rcpanel.keys.KeySequence;
import io.rcpanel.keys.PressResult;
import io.rcpanel.supervisor.HelperStartException;
import io.rcpanel.supervisor.ProcessSupervisor;
import io.rcpanel.tree.NodeId;
import io.rcpanel.tree.NodeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Routes key and click events to the chord remapper, the trees and the helper supervisor.
 *
 * <h2>Key Pipeline</h2>
 * <ol>
 *   <li>The focused stage, when there is one (the command area while command mode is on).</li>
 *   <li>The {@link ChordRemapper}. A completed chord redispatches its target keys one at a
 *       time through the focused stage and the default bindings, skipping the remapper.
 *       Redispatch stops at the first target key nobody consumes.</li>
 *   <li>The default {@link KeyBindings}, for keys that are not part of a chord.</li>
 * </ol>
 *
 * <p>The controller is driven by a single control loop and is not thread safe.</p>
 */
public class Controller {

    private static final Logger logger = LogManager.getLogger(Controller.class);

    public static final String COMMAND_MODE_KEY = ":";
    public static final String QUIT_KEY = "q";
    public static final String QUIT_COMMAND = ":q";
    public static final KeySequence DEFAULT_CHORD = KeySequence.of("Z", "Z");
    public static final KeySequence DEFAULT_CHORD_TARGET = KeySequence.of(QUIT_KEY);

    private final ChordRemapper remapper;
    private final KeyBindings bindings;
    private final CommandArea commandArea;
    private ControlPanel controlPanel;
    private KeyStage focusedStage;
    private volatile boolean quitRequested;

    public Controller() {
        this(new ChordRemapper(), new KeyBindings(), new CommandArea());
    }

    /**
     * Wires the default bindings: {@code ":"} opens the command area, {@code "q"} quits,
     * and the {@code ":q"} command quits.
     */
    public Controller(ChordRemapper remapper, KeyBindings bindings, CommandArea commandArea) {
        this.remapper = Objects.requireNonNull(remapper, "remapper");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.commandArea = Objects.requireNonNull(commandArea, "commandArea");

        bindings.bind(COMMAND_MODE_KEY, "Enable command mode", () -> {
            setFocusedStage(commandArea);
            commandArea.focus();
            commandArea.onKey(COMMAND_MODE_KEY);
        });
        bindings.bind(QUIT_KEY, "Quit", this::requestQuit);
        commandArea.registerCommand(QUIT_COMMAND, this::requestQuit);
        commandArea.setReleaseHandler(() -> setFocusedStage(null));
    }

    /**
     * Binds {@code Z Z} to {@code q}.
     */
    public void bindDefaultChords() {
        remapper.bind(DEFAULT_CHORD, DEFAULT_CHORD_TARGET);
    }

    /**
     * Attaches the control panel whose status node starts and stops the helper on click.
     */
    public void attach(ControlPanel panel) {
        this.controlPanel = Objects.requireNonNull(panel, "panel");
    }

    /**
     * @param key the decoded key name, such as {@code "a"}, {@code "Z"} or {@code "enter"}
     * @return whether any stage consumed the key
     */
    public boolean keyPressed(String key) {
        Objects.requireNonNull(key, "key");
        KeyStage focused = focusedStage;
        if (focused != null && focused.onKey(key)) {
            return true;
        }

        PressResult result = remapper.press(key);
        if (result.isMatched()) {
            redispatch(result.getTarget());
            return true;
        }
        if (result.isContinuing()) {
            logger.trace("Chord pending: {}", remapper.getPending());
            return true;
        }
        return bindings.onKey(key);
    }

    /**
     * Activates the supervisor when {@code node} is the control panel's status node,
     * otherwise toggles the node if it can be expanded.
     */
    public void clicked(NodeStore<?> store, NodeId node) {
        ControlPanel panel = controlPanel;
        if (panel != null && panel.getStore() == store && panel.getServerNode().equals(node)) {
            ProcessSupervisor supervisor = panel.getSupervisor();
            try {
                supervisor.activate();
            } catch (HelperStartException e) {
                logger.error("Could not start {}: {}", e.getBinary(), e.getCause() != null
                    ? e.getCause().getMessage() : e.getMessage());
            }
            return;
        }
        if (!store.isExpandable(node)) {
            return;
        }
        try {
            store.toggle(node);
        } catch (UncheckedIOException e) {
            logger.warn("Could not expand {}: {}", store.get(node).getLabel(), e.getCause().getMessage());
        }
    }

    public void setFocusedStage(KeyStage stage) {
        if (stage != focusedStage) {
            remapper.reset();
        }
        this.focusedStage = stage;
    }

    public KeyStage getFocusedStage() {
        return focusedStage;
    }

    public void requestQuit() {
        if (!quitRequested) {
            logger.debug("Quit requested");
        }
        quitRequested = true;
    }

    public boolean isQuitRequested() {
        return quitRequested;
    }

    public ChordRemapper getRemapper() {
        return remapper;
    }

    public KeyBindings getBindings() {
        return bindings;
    }

    public CommandArea getCommandArea() {
        return commandArea;
    }

    /**
     * Delivers the target keys in order, continuing only while each key is consumed: the first
     * unconsumed key ends the redispatch and the keys after it are dropped.
     */
    private void redispatch(KeySequence target) {
        for (String key : target.keys()) {
            if (!dispatchSynthetic(key)) {
                logger.debug("Synthetic key '{}' of {} was not handled, dropping the rest", key, target);
                return;
            }
        }
    }

    private boolean dispatchSynthetic(String key) {
        KeyStage focused = focusedStage;
        if (focused != null && focused.onKey(key)) {
            return true;
        }
        return bindings.onKey(key);
    }
}
