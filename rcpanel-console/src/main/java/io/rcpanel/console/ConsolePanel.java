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

package io.rcpanel.console;

import io.rcpanel.control.ControlPanel;
import io.rcpanel.control.Controller;
import io.rcpanel.tree.NodeStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Attributes;
import org.jline.terminal.Size;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.jline.utils.Display;
import org.jline.utils.InfoCmp;
import org.jline.utils.NonBlockingReader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Full-screen terminal view over the control tree, the file trees, the log and the command
 * line. The panel owns the terminal in raw mode and runs the single control loop: it reads
 * one key, hands it to the {@link Controller}, and redraws when anything changed.
 *
 * <h2>Display Layout:</h2>
 * <pre>
 * ╔═══════════════ Trees ═══════════════╗
 * ║ ▾ rclone rc                          ║
 * ║ > ├─ Server: Started.                ║
 * ║   ├─ Client: ...                     ║
 * ║   └─ rclone path: /usr/bin/rclone    ║
 * ║ ▸ alice                              ║
 * ╚══════════════════════════════════════╝
 * ╔════════════════ Log ════════════════╗
 * ║ [+00:01.204] [INFO ] ProcessSuper... ║
 * ╚══════════════════════════════════════╝
 * q quit  : command  ↑/↓ move  enter select
 * </pre>
 *
 * <h2>Keys</h2>
 * <p>{@code up}/{@code down} move the cursor across all trees; {@code enter} and
 * {@code space} click the node under the cursor. Every other key goes through the
 * controller's pipeline.</p>
 *
 * <p>Log messages may arrive from any thread through {@link #addLogMessage(String)};
 * rendering happens only on the thread running {@link #run()}.</p>
 */
public class ConsolePanel implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ConsolePanel.class);

    static final String CURSOR_MARK = "> ";
    static final String HINT = "q quit  : command  ↑/↓ move  enter select";
    private static final long POLL_MS = 100;
    private static final Size DEFAULT_SIZE = new Size(100, 40);

    private static final AttributedStyle STYLE_BORDER = AttributedStyle.DEFAULT.bold().foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);
    private static final AttributedStyle STYLE_BORDER_TITLE = AttributedStyle.DEFAULT.bold().foreground(AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_CURSOR = AttributedStyle.DEFAULT.inverse();
    private static final AttributedStyle STYLE_LOG_WARN = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_LOG_ERROR = AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
    private static final AttributedStyle STYLE_LOG_DEBUG = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLACK);
    private static final AttributedStyle STYLE_SECONDARY = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);

    private final Terminal terminal;
    private final boolean usingCustomTerminal;
    private final Attributes savedAttributes;
    private final Display display;
    private final Controller controller;
    private final ControlPanel controlPanel;
    private final List<NodeStore<?>> trees;
    private final boolean useColors;
    private final int maxLogLines;
    private final LinkedList<String> logBuffer = new LinkedList<>();
    private final ReentrantReadWriteLock logLock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean dirty = new AtomicBoolean(true);
    private final Thread shutdownHook;

    private int cursor;
    private int treeScrollOffset;
    private volatile List<String> lastRenderSnapshot = Collections.emptyList();

    private ConsolePanel(Builder builder) {
        this.controller = Objects.requireNonNull(builder.controller, "controller");
        this.controlPanel = builder.controlPanel;
        this.useColors = builder.useColors;
        this.maxLogLines = builder.maxLogLines;
        this.usingCustomTerminal = builder.terminalOverride != null;

        try {
            if (usingCustomTerminal) {
                this.terminal = builder.terminalOverride;
            } else {
                this.terminal = TerminalBuilder.builder()
                        .system(true)
                        .color(builder.useColors)
                        .build();
            }
            this.savedAttributes = terminal.enterRawMode();
            this.display = new Display(terminal, true);
            Size initialSize = usableSize(terminal.getSize());
            display.resize(initialSize.getRows(), initialSize.getColumns());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize JLine terminal: " + e.getMessage(), e);
        }

        try {
            terminal.puts(InfoCmp.Capability.clear_screen);
            terminal.flush();
        } catch (RuntimeException e) {
            logger.warn("Could not clear screen: {}", e.getMessage());
        }
        terminal.handle(Terminal.Signal.WINCH, signal -> dirty.set(true));

        List<NodeStore<?>> allTrees = new ArrayList<>();
        if (controlPanel != null) {
            controller.attach(controlPanel);
            allTrees.add(controlPanel.getStore());
        }
        allTrees.addAll(builder.trees);
        this.trees = List.copyOf(allTrees);
        for (NodeStore<?> tree : trees) {
            tree.addChangeListener((store, node) -> dirty.set(true));
        }
        controller.getCommandArea().addChangeListener(() -> dirty.set(true));

        controller.getBindings().bind("up", "Move the cursor up", () -> moveCursor(-1));
        controller.getBindings().bind("down", "Move the cursor down", () -> moveCursor(1));
        controller.getBindings().bind("enter", "Select the node under the cursor", this::clickCursor);
        controller.getBindings().bind("space", "Select the node under the cursor", this::clickCursor);
        for (Map.Entry<String, Runnable> handler : builder.customKeyHandlers.entrySet()) {
            controller.getBindings().bind(handler.getKey(), "Custom handler", handler.getValue());
        }

        if (builder.shutdownHook) {
            this.shutdownHook = new Thread(this::close, "ConsolePanel-Shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            this.shutdownHook = null;
        }

        LogBuffer.setActivePanel(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the control loop until the controller requests quit, the input ends, or the panel
     * is closed.
     */
    public void run() {
        NonBlockingReader reader = terminal.reader();
        logger.debug("Control loop started");
        refresh();
        while (!closed.get() && !controller.isQuitRequested()) {
            int c;
            try {
                c = reader.read(POLL_MS);
            } catch (IOException e) {
                logger.error("Terminal read failed: {}", e.getMessage());
                break;
            }
            if (c == NonBlockingReader.EOF) {
                logger.debug("Terminal input closed");
                break;
            }
            if (c != NonBlockingReader.READ_EXPIRED) {
                handleInput(reader, c);
            }
            if (dirty.getAndSet(false) && !closed.get()) {
                refresh();
            }
        }
        logger.debug("Control loop exited");
    }

    private void handleInput(NonBlockingReader reader, int c) {
        String key;
        try {
            key = KeyDecoder.decode(c, reader);
        } catch (IOException e) {
            logger.warn("Could not read key sequence: {}", e.getMessage());
            return;
        }
        if (key == null) {
            return;
        }
        try {
            if (!controller.keyPressed(key)) {
                logger.trace("Key '{}' not handled", key);
            }
        } catch (RuntimeException e) {
            logger.error("Error handling key '{}': {}", key, e.getMessage(), e);
        }
        dirty.set(true);
    }

    /**
     * Appends a message to the log section. Multi-line messages are split into lines.
     */
    public void addLogMessage(String message) {
        if (message == null) {
            return;
        }
        logLock.writeLock().lock();
        try {
            for (String line : message.split("\\R")) {
                logBuffer.addLast(line);
            }
            while (logBuffer.size() > maxLogLines) {
                logBuffer.removeFirst();
            }
        } finally {
            logLock.writeLock().unlock();
        }
        dirty.set(true);
    }

    /**
     * @return the node under the cursor, if any tree has rows
     */
    public Optional<TreeRenderer.RenderedRow> getCursorRow() {
        List<TreeRenderer.RenderedRow> rows = TreeRenderer.render(trees);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(rows.get(Math.min(cursor, rows.size() - 1)));
    }

    /**
     * @return the plain text of the last frame drawn
     */
    public List<String> getLastRenderSnapshot() {
        return lastRenderSnapshot;
    }

    public Controller getController() {
        return controller;
    }

    private void moveCursor(int delta) {
        int rowCount = TreeRenderer.render(trees).size();
        cursor = Math.max(0, Math.min(rowCount - 1, cursor + delta));
    }

    private void clickCursor() {
        getCursorRow().ifPresent(row -> controller.clicked(row.store(), row.id()));
    }

    private void refresh() {
        try {
            Size size = usableSize(terminal.getSize());
            display.resize(size.getRows(), size.getColumns());
            List<AttributedString> lines = renderFrame(size.getColumns(), size.getRows());
            display.update(lines, size.cursorPos(size.getRows() - 1, size.getColumns() - 1));
            terminal.flush();

            List<String> snapshot = new ArrayList<>(lines.size());
            for (AttributedString line : lines) {
                snapshot.add(line.toString());
            }
            lastRenderSnapshot = snapshot;
        } catch (RuntimeException e) {
            logger.error("Display update error: {}", e.getMessage(), e);
        }
    }

    List<AttributedString> renderFrame(int width, int height) {
        int logContentHeight = Math.max(1, Math.min(8, height / 4));
        int treeContentHeight = Math.max(1, height - logContentHeight - 5);
        int innerWidth = Math.max(10, width - 4);
        List<AttributedString> lines = new ArrayList<>(height);

        List<TreeRenderer.RenderedRow> rows = TreeRenderer.render(trees);
        cursor = rows.isEmpty() ? 0 : Math.min(cursor, rows.size() - 1);
        if (cursor < treeScrollOffset) {
            treeScrollOffset = cursor;
        } else if (cursor >= treeScrollOffset + treeContentHeight) {
            treeScrollOffset = cursor - treeContentHeight + 1;
        }
        lines.add(buildSectionBorder('╔', '╗', "Trees", width));
        for (int i = 0; i < treeContentHeight; i++) {
            int index = treeScrollOffset + i;
            if (index < rows.size()) {
                boolean atCursor = index == cursor;
                String text = (atCursor ? CURSOR_MARK : "  ") + rows.get(index).text();
                lines.add(renderBoxLine(text, atCursor ? STYLE_CURSOR : AttributedStyle.DEFAULT, innerWidth));
            } else {
                lines.add(renderBoxLine("", AttributedStyle.DEFAULT, innerWidth));
            }
        }
        lines.add(buildSectionBorder('╚', '╝', null, width));

        List<String> logTail;
        logLock.readLock().lock();
        try {
            int from = Math.max(0, logBuffer.size() - logContentHeight);
            logTail = new ArrayList<>(logBuffer.subList(from, logBuffer.size()));
        } finally {
            logLock.readLock().unlock();
        }
        lines.add(buildSectionBorder('╔', '╗', "Log", width));
        for (int i = 0; i < logContentHeight; i++) {
            String text = i < logTail.size() ? logTail.get(i) : "";
            lines.add(renderBoxLine(text, logStyle(text), innerWidth));
        }
        lines.add(buildSectionBorder('╚', '╝', null, width));

        AttributedStringBuilder bottom = new AttributedStringBuilder();
        if (controller.getCommandArea().isFocused()) {
            bottom.style(AttributedStyle.DEFAULT).append(fitLine(controller.getCommandArea().getText(), width));
        } else {
            bottom.style(style(STYLE_SECONDARY)).append(fitLine(HINT, width));
        }
        lines.add(bottom.toAttributedString());

        List<AttributedString> padded = new ArrayList<>(lines.size());
        for (AttributedString line : lines) {
            int padding = width - line.columnLength();
            if (padding > 0) {
                AttributedStringBuilder builder = new AttributedStringBuilder();
                builder.append(line).append(" ".repeat(padding));
                padded.add(builder.toAttributedString());
            } else {
                padded.add(line);
            }
        }
        return padded;
    }

    private AttributedStyle logStyle(String line) {
        if (line.contains("[ERROR]") || line.contains("[FATAL]")) {
            return style(STYLE_LOG_ERROR);
        }
        if (line.contains("[WARN ]")) {
            return style(STYLE_LOG_WARN);
        }
        if (line.contains("[DEBUG]") || line.contains("[TRACE]")) {
            return style(STYLE_LOG_DEBUG);
        }
        return AttributedStyle.DEFAULT;
    }

    private AttributedStyle style(AttributedStyle colored) {
        return useColors ? colored : AttributedStyle.DEFAULT;
    }

    private AttributedString renderBoxLine(String text, AttributedStyle lineStyle, int innerWidth) {
        String fitted = fitLine(text, innerWidth);
        int padding = Math.max(0, innerWidth - fitted.length());

        AttributedStringBuilder builder = new AttributedStringBuilder();
        builder.style(style(STYLE_BORDER)).append("║ ");
        builder.style(lineStyle).append(fitted);
        builder.style(style(STYLE_BORDER)).append(" ".repeat(padding)).append(" ║");
        return builder.toAttributedString();
    }

    private AttributedString buildSectionBorder(char left, char right, String title, int width) {
        int innerWidth = Math.max(0, width - 2);
        AttributedStringBuilder builder = new AttributedStringBuilder();
        builder.style(style(STYLE_BORDER)).append(String.valueOf(left));

        if (title != null && !title.isEmpty()) {
            String trimmed = fitLine(title.trim(), Math.max(1, innerWidth - 4));
            int remaining = Math.max(0, innerWidth - trimmed.length() - 4);
            int leftPad = remaining / 2;
            builder.append("═".repeat(leftPad + 1));
            builder.style(style(STYLE_BORDER_TITLE)).append(" " + trimmed + " ");
            builder.style(style(STYLE_BORDER)).append("═".repeat(remaining - leftPad + 1));
        } else {
            builder.append("═".repeat(innerWidth));
        }

        builder.append(String.valueOf(right));
        return builder.toAttributedString();
    }

    private static String fitLine(String text, int maxWidth) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxWidth) {
            return text;
        }
        if (maxWidth <= 1) {
            return text.substring(0, Math.max(0, maxWidth));
        }
        return text.substring(0, maxWidth - 1) + "…";
    }

    private static Size usableSize(Size size) {
        if (size == null || size.getRows() <= 0 || size.getColumns() <= 0) {
            return DEFAULT_SIZE;
        }
        return size;
    }

    /**
     * Stops the control loop, closes the control panel (killing a running helper) and
     * restores the terminal. Safe to call more than once and from the shutdown hook.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LogBuffer.clearActivePanel(this);

        if (controlPanel != null) {
            try {
                controlPanel.close();
            } catch (RuntimeException e) {
                logger.error("Error closing control panel: {}", e.getMessage(), e);
            }
        }

        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down: {}", e.getMessage());
            }
        }

        try {
            display.update(Collections.emptyList(), 0);
            terminal.puts(InfoCmp.Capability.clear_screen);
            terminal.puts(InfoCmp.Capability.cursor_home);
            terminal.writer().print("\033[0m");
            terminal.writer().print("\033[?25h");
            terminal.writer().flush();
            terminal.setAttributes(savedAttributes);
            terminal.flush();
            if (!usingCustomTerminal) {
                terminal.close();
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Error during terminal cleanup", e);
        }
    }

    public static class Builder {
        private boolean useColors = true;
        private int maxLogLines = 1000;
        private boolean shutdownHook = true;
        private final Map<String, Runnable> customKeyHandlers = new LinkedHashMap<>();
        private final List<NodeStore<?>> trees = new ArrayList<>();
        private Terminal terminalOverride;
        private Controller controller;
        private ControlPanel controlPanel;

        public Builder withColorOutput(boolean useColors) {
            this.useColors = useColors;
            return this;
        }

        public Builder withMaxLogLines(int maxLogLines) {
            if (maxLogLines <= 0) {
                throw new IllegalArgumentException("maxLogLines must be positive: " + maxLogLines);
            }
            this.maxLogLines = maxLogLines;
            return this;
        }

        /**
         * Provides a custom {@link Terminal} instead of the system terminal, for tests and
         * headless use. A custom terminal is not closed with the panel.
         */
        public Builder withTerminal(Terminal terminal) {
            this.terminalOverride = terminal;
            return this;
        }

        public Builder withController(Controller controller) {
            this.controller = controller;
            return this;
        }

        /**
         * Shows the control tree first and routes clicks on its status node to the supervisor.
         * The control panel is closed with the console panel.
         */
        public Builder withControlPanel(ControlPanel controlPanel) {
            this.controlPanel = controlPanel;
            return this;
        }

        /**
         * Adds a tree below the control tree, such as a directory tree.
         */
        public Builder withTree(NodeStore<?> tree) {
            this.trees.add(Objects.requireNonNull(tree, "tree"));
            return this;
        }

        /**
         * Binds an extra key on the controller's default bindings.
         *
         * @param key     the key name, as produced by {@link KeyDecoder}
         * @param handler runs on the control loop thread
         */
        public Builder withKeyHandler(String key, Runnable handler) {
            this.customKeyHandlers.put(key, Objects.requireNonNull(handler, "handler"));
            return this;
        }

        /**
         * @param install whether to close the panel from a JVM shutdown hook; default true
         */
        public Builder withShutdownHook(boolean install) {
            this.shutdownHook = install;
            return this;
        }

        public ConsolePanel build() {
            return new ConsolePanel(this);
        }
    }
}
