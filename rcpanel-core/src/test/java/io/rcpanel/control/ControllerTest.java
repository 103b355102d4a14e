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

import io.rcpanel.keys.KeySequence;
import io.rcpanel.supervisor.HelperLauncher;
import io.rcpanel.supervisor.HelperProcess;
import io.rcpanel.supervisor.SupervisorConfig;
import io.rcpanel.supervisor.SupervisorState;
import io.rcpanel.tree.NodeId;
import io.rcpanel.tree.NodeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Controller")
class ControllerTest {

    private Controller controller;
    private List<String> handled;

    @BeforeEach
    void setUp() {
        controller = new Controller();
        handled = new ArrayList<>();
        for (String key : List.of("enter", "a", "up")) {
            controller.getBindings().bind(key, "record " + key, () -> handled.add(key));
        }
    }

    @Nested
    @DisplayName("Chords")
    class ChordTest {

        @Test
        @DisplayName("a a should reach the bindings as exactly one enter")
        void shouldRemapToSingleEnter() {
            controller.getRemapper().bind(KeySequence.of("a", "a"), KeySequence.of("enter"));

            assertThat(controller.keyPressed("a")).isTrue();
            assertThat(handled).isEmpty();
            assertThat(controller.keyPressed("a")).isTrue();

            assertThat(handled).containsExactly("enter");
        }

        @Test
        @DisplayName("Z Z should quit")
        void shouldQuitOnDoubleZ() {
            controller.bindDefaultChords();

            controller.keyPressed("Z");
            assertThat(controller.isQuitRequested()).isFalse();
            controller.keyPressed("Z");

            assertThat(controller.isQuitRequested()).isTrue();
        }

        @Test
        @DisplayName("a key breaking a chord should fall through to the bindings")
        void shouldFallThroughOnBrokenChord() {
            controller.getRemapper().bind(KeySequence.of("Z", "Z"), KeySequence.of("q"));

            controller.keyPressed("Z");
            assertThat(controller.keyPressed("up")).isTrue();

            assertThat(handled).containsExactly("up");
            assertThat(controller.isQuitRequested()).isFalse();
        }

        @Test
        @DisplayName("should stop redispatching at the first unhandled target key")
        void shouldStopAtUnhandledKey() {
            controller.getRemapper().bind(KeySequence.of("g"), KeySequence.of("enter", "nope", "up"));

            controller.keyPressed("g");

            assertThat(handled).containsExactly("enter");
        }

        @Test
        @DisplayName("targets should not be remapped again")
        void shouldNotRecurse() {
            controller.getRemapper().bind(KeySequence.of("a"), KeySequence.of("a"));

            controller.keyPressed("a");

            assertThat(handled).containsExactly("a");
        }

        @Test
        @DisplayName("unbound keys should report as unconsumed")
        void shouldReportUnconsumed() {
            assertThat(controller.keyPressed("x")).isFalse();
        }
    }

    @Nested
    @DisplayName("Command mode")
    class CommandModeTest {

        @Test
        @DisplayName("colon should focus the command area and q should quit")
        void shouldQuitFromCommandLine() {
            controller.keyPressed(":");
            assertThat(controller.getFocusedStage()).isSameAs(controller.getCommandArea());
            controller.keyPressed("q");
            assertThat(controller.isQuitRequested()).isFalse();
            assertThat(controller.getCommandArea().getText()).isEqualTo(":q");

            controller.keyPressed("enter");

            assertThat(controller.isQuitRequested()).isTrue();
            assertThat(controller.getFocusedStage()).isNull();
            assertThat(handled).isEmpty();
        }

        @Test
        @DisplayName("chord keys should be typed while the command area has focus")
        void shouldTypeChordKeys() {
            controller.getRemapper().bind(KeySequence.of("a", "a"), KeySequence.of("enter"));

            controller.keyPressed(":");
            controller.keyPressed("a");
            controller.keyPressed("a");

            assertThat(controller.getCommandArea().getText()).isEqualTo(":aa");
            assertThat(handled).isEmpty();
        }

        @Test
        @DisplayName("non-printable keys should pass through the focused command area")
        void shouldPassNavigationThrough() {
            controller.keyPressed(":");
            controller.keyPressed("up");

            assertThat(handled).containsExactly("up");
            assertThat(controller.getFocusedStage()).isSameAs(controller.getCommandArea());
        }

        @Test
        @DisplayName("an unknown command should release focus without quitting")
        void shouldIgnoreUnknownCommand() {
            controller.keyPressed(":");
            controller.keyPressed("w");
            controller.keyPressed("enter");

            assertThat(controller.isQuitRequested()).isFalse();
            assertThat(controller.getFocusedStage()).isNull();
        }

        @Test
        @DisplayName("q should quit directly")
        void shouldQuitOnQ() {
            controller.keyPressed("q");

            assertThat(controller.isQuitRequested()).isTrue();
        }
    }

    @Nested
    @DisplayName("Clicks")
    class ClickTest {

        private int launches;
        private int kills;

        private ControlPanel panel(Optional<Path> binary) {
            HelperLauncher launcher = (path, arguments) -> {
                launches++;
                return new HelperProcess() {
                    @Override
                    public String readDiagnosticLine() {
                        return "x NOTICE: Serving remote control on http://127.0.0.1:5572/";
                    }

                    @Override
                    public void kill() {
                        kills++;
                    }

                    @Override
                    public void awaitExit() {
                    }

                    @Override
                    public boolean isAlive() {
                        return kills == 0;
                    }

                    @Override
                    public void close() {
                    }
                };
            };
            ControlPanel panel = new ControlPanel(SupervisorConfig.defaults(), name -> binary, launcher);
            controller.attach(panel);
            return panel;
        }

        @Test
        @DisplayName("should lay out the control tree with the root expanded")
        void shouldBuildControlTree() {
            ControlPanel panel = panel(Optional.empty());
            NodeStore<String> store = panel.getStore();

            assertThat(store.get(store.root()).getLabel()).isEqualTo("rclone rc");
            assertThat(store.get(store.root()).isExpanded()).isTrue();
            assertThat(store.children(store.root())).extracting(id -> store.get(id).getLabel())
                .containsExactly("Server: ...", "Client: ...", "rclone path: ...");
        }

        @Test
        @DisplayName("clicking the server node should start then stop the helper")
        void shouldStartAndStop() {
            ControlPanel panel = panel(Optional.of(Path.of("/usr/bin/rclone")));
            NodeStore<String> store = panel.getStore();

            controller.clicked(store, panel.getServerNode());
            assertThat(store.get(panel.getServerNode()).getLabel()).isEqualTo("Server: Started.");
            assertThat(store.get(panel.getPathNode()).getLabel()).isEqualTo("rclone path: /usr/bin/rclone");

            controller.clicked(store, panel.getServerNode());
            assertThat(store.get(panel.getServerNode()).getLabel()).isEqualTo("Server: Stopped.");
            assertThat(launches).isEqualTo(1);
            assertThat(kills).isEqualTo(1);
        }

        @Test
        @DisplayName("clicking the server node without a binary should only update its label")
        void shouldReportMissingBinary() {
            ControlPanel panel = panel(Optional.empty());

            controller.clicked(panel.getStore(), panel.getServerNode());

            assertThat(panel.getStore().get(panel.getServerNode()).getLabel())
                .isEqualTo("Server: Cannot find rclone binary.");
            assertThat(panel.getSupervisor().getState()).isEqualTo(SupervisorState.LOCATE_FAILED);
        }

        @Test
        @DisplayName("a spawn failure should be logged, not thrown")
        void shouldContainSpawnFailure() {
            HelperLauncher failing = (path, arguments) -> {
                throw new IOException("Exec format error");
            };
            ControlPanel panel = new ControlPanel(SupervisorConfig.defaults(),
                name -> Optional.of(Path.of("/usr/bin/rclone")), failing);
            controller.attach(panel);

            assertThatCode(() -> controller.clicked(panel.getStore(), panel.getServerNode())).doesNotThrowAnyException();
            assertThat(panel.getSupervisor().getState()).isEqualTo(SupervisorState.IDLE);
        }

        @Test
        @DisplayName("clicking other nodes should toggle expandable ones only")
        void shouldToggleExpandable() {
            NodeStore<String> files = new NodeStore<>("home", "");
            NodeId dir = files.add(files.root(), "dir", "");
            files.add(dir, "file", "");
            NodeId leaf = files.add(files.root(), "leaf", "");

            controller.clicked(files, dir);
            controller.clicked(files, leaf);

            assertThat(files.get(dir).isExpanded()).isTrue();
            assertThat(files.get(leaf).isExpanded()).isFalse();
        }
    }
}
