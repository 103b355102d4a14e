package io.rcpanel.command;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.rcpanel.command.common.ChordOption;
import io.rcpanel.command.common.VerbosityOption;
import io.rcpanel.console.ConsolePanel;
import io.rcpanel.console.ConsolePanelLogIntercept;
import io.rcpanel.console.LogBuffer;
import io.rcpanel.control.ControlPanel;
import io.rcpanel.control.Controller;
import io.rcpanel.supervisor.SupervisorConfig;
import io.rcpanel.tree.DirectoryPopulator;
import io.rcpanel.tree.NodeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// # rcpanel
///
/// A terminal control panel for an `rclone rcd` helper process.
///
/// The screen shows two trees and a log section:
/// - the control tree: `rclone rc` with `Server`, `Client` and `rclone path` rows.
///   Clicking `Server` (enter or space on its row) starts the helper, clicking it again stops it.
/// - a lazily populated directory tree rooted at `--directory`.
///
/// ## Keys
/// - `↑`/`↓` move the cursor, `enter`/`space` click the cursor row
/// - `:` opens the command area, `:q` quits
/// - `q` quits, as does the default chord `Z Z`
///
/// # Basic Usage
/// ```
/// rcpanel
/// rcpanel --directory /data --binary-path /opt/rclone/rclone
/// rcpanel --chord "g g=q" -v
/// ```
@CommandLine.Command(name = "rcpanel",
    header = "Terminal control panel for an rclone rcd helper",
    description = "Shows the helper status and a directory tree, and routes key and click events.",
    mixinStandardHelpOptions = true,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "2: error"})
public class CMD_rcpanel implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_rcpanel.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--directory"},
        description = "Root of the directory tree (default: the user's home directory)"
    )
    private Path directory;

    @CommandLine.Option(
        names = {"--binary"},
        description = "Helper binary to look up on the PATH (default: ${DEFAULT-VALUE})",
        defaultValue = SupervisorConfig.DEFAULT_BINARY_NAME
    )
    private String binaryName = SupervisorConfig.DEFAULT_BINARY_NAME;

    @CommandLine.Option(
        names = {"--binary-path"},
        description = "Use this helper binary instead of searching the PATH"
    )
    private Path binaryPath;

    @CommandLine.Option(
        names = {"--no-color"},
        description = "Disable colored output"
    )
    private boolean noColor = false;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Mixin
    private ChordOption chordOption = new ChordOption();

    /**
     * Run the control panel
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        CMD_rcpanel cmd = new CMD_rcpanel();
        int exitCode = new CommandLine(cmd).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        Path root = rootDirectory();
        if (!Files.isDirectory(root)) {
            logger.error("Not a directory: {}", root);
            return EXIT_ERROR;
        }

        ConsolePanelLogIntercept.install();
        LogBuffer.setDisplayLevel(verbosityOption.displayLevel());

        SupervisorConfig config = supervisorConfig();
        Controller controller = createController();

        NodeStore<Path> files = DirectoryPopulator.newTree(root);
        try {
            files.expand(files.root());
        } catch (UncheckedIOException e) {
            logger.warn("Could not list {}: {}", root, e.getCause().getMessage());
        }

        ControlPanel controlPanel = new ControlPanel(config);
        try (ConsolePanel panel = ConsolePanel.builder()
            .withColorOutput(!noColor)
            .withController(controller)
            .withControlPanel(controlPanel)
            .withTree(files)
            .build()) {
            logger.info("Click \"Server\" to start {} {}", config.getBinaryName(),
                String.join(" ", config.getArguments()));
            panel.run();
        } finally {
            controlPanel.close();
        }
        return EXIT_SUCCESS;
    }

    Path rootDirectory() {
        return directory != null ? directory : Path.of(System.getProperty("user.home"));
    }

    SupervisorConfig supervisorConfig() {
        SupervisorConfig.Builder builder = SupervisorConfig.builder().withBinaryName(binaryName);
        if (binaryPath != null) {
            builder.withBinaryPath(binaryPath);
        }
        return builder.build();
    }

    Controller createController() {
        Controller controller = new Controller();
        controller.bindDefaultChords();
        for (ChordOption.Chord chord : chordOption.getChords()) {
            controller.getRemapper().bind(chord.source(), chord.target());
        }
        return controller;
    }

    boolean isColorOutput() {
        return !noColor;
    }

    VerbosityOption getVerbosityOption() {
        return verbosityOption;
    }
}
