/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Espalier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.espalier.console;

import com.hellblazer.espalier.avl.AvlEngine;
import com.hellblazer.espalier.avl.OperationResult;
import com.hellblazer.espalier.avl.QueryKind;
import com.hellblazer.espalier.avl.Request;
import com.hellblazer.espalier.avl.render.CellStyler;
import com.hellblazer.espalier.avl.render.GridFormatter;
import com.hellblazer.espalier.avl.render.GridRenderer;
import com.hellblazer.espalier.avl.tree.TreeSnapshot;
import com.hellblazer.espalier.console.ConsoleCommand.ChangeSetting;
import com.hellblazer.espalier.console.ConsoleCommand.Clear;
import com.hellblazer.espalier.console.ConsoleCommand.EngineCommand;
import com.hellblazer.espalier.console.ConsoleCommand.Exit;
import com.hellblazer.espalier.console.ConsoleCommand.Help;
import com.hellblazer.espalier.console.ConsoleCommand.Invalid;
import com.hellblazer.espalier.console.ConsoleCommand.Setting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Read-print loop over an {@link AvlEngine}: one command per line until {@code exit} or end of input.
 *
 * @author hal.hildebrand
 */
public class PracticeSession {
    private static final Logger log = LoggerFactory.getLogger(PracticeSession.class);

    private static final String CLEAR_SCREEN = "\u001B[H\u001B[2J";

    private final EspalierCommandLine.Config config;
    private final AvlEngine                  engine;
    private final BufferedReader             in;
    private final PrintStream                out;
    private final CommandParser              parser    = new CommandParser();
    private final GridRenderer               renderer  = new GridRenderer();
    private final GridFormatter              formatter;

    public PracticeSession(EspalierCommandLine.Config config, BufferedReader in, PrintStream out) {
        this(config, new AvlEngine(config.toEngineConfiguration()), in, out);
    }

    public PracticeSession(EspalierCommandLine.Config config, AvlEngine engine, BufferedReader in, PrintStream out) {
        this.config = config;
        this.engine = engine;
        this.in = in;
        this.out = out;
        this.formatter = new GridFormatter(config.color ? CellStyler.ANSI : CellStyler.PLAIN);
    }

    public AvlEngine getEngine() {
        return engine;
    }

    /**
     * Handle one line of input.
     *
     * @return false when the session should end
     */
    public boolean handle(String line) {
        var command = parser.parse(line);
        if (command instanceof Exit) {
            return false;
        }
        if (command instanceof EngineCommand engineCommand) {
            execute(engineCommand.request());
        } else if (command instanceof ChangeSetting change) {
            changeSetting(change.setting(), change.enabled());
        } else if (command instanceof Help) {
            printHelp();
        } else if (command instanceof Clear) {
            if (config.color) {
                out.print(CLEAR_SCREEN);
            }
            printHeader();
            out.println("Screen cleared");
            if (config.autoShow && !engine.snapshot().isEmpty()) {
                printTree(engine.snapshot());
            }
        } else if (command instanceof Invalid invalid) {
            error(invalid.message());
        }
        return true;
    }

    /**
     * Run the loop until {@code exit} or end of input.
     *
     * @return the process exit code
     */
    public int run() {
        printHeader();
        try {
            while (true) {
                out.print("> ");
                out.flush();
                var line = in.readLine();
                if (line == null || (!line.isBlank() && !handle(line))) {
                    break;
                }
            }
            return 0;
        } catch (IOException e) {
            error("Input failed: " + e.getMessage());
            log.error("Input failed", e);
            return 1;
        }
    }

    private void changeSetting(Setting setting, boolean enabled) {
        switch (setting) {
            case AUTO_SHOW -> config.autoShow = enabled;
            case STEPS -> {
                config.showSteps = enabled;
                engine.setShowSteps(enabled);
            }
        }
        out.println(setting.getTitle() + (enabled ? " enabled" : " disabled"));
    }

    private void error(String message) {
        out.println("✗ " + message);
    }

    private void execute(Request request) {
        var result = engine.execute(request);
        if (!result.success()) {
            result.messages().forEach(this::error);
            return;
        }
        if (request instanceof Request.Query query && query.kind() == QueryKind.TREE) {
            printTree(result.snapshot());
            return;
        }
        result.messages().forEach(out::println);
        if (request.isMutating() && config.autoShow) {
            printFrames(result);
            printTree(result.snapshot());
        }
    }

    private void printFrames(OperationResult result) {
        for (var frame : result.frames()) {
            out.println();
            out.println(frame.caption() + ":");
            printTree(frame.snapshot());
        }
    }

    private void printHeader() {
        if (config.quiet) {
            return;
        }
        out.println("AVL Tree Practice Tool");
        out.println("Mode: " + engine.getMode().getTitle());
        out.println("Auto-show tree: " + (config.autoShow ? "On" : "Off"));
        out.println("Show steps: " + (engine.isShowSteps() ? "On" : "Off"));
        out.println();
        out.println("Type 'help' for commands.");
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  a <value>                 - Add a node");
        out.println("  d <value>                 - Delete a node");
        out.println("  rl <value>                - Left rotation");
        out.println("  rr <value>                - Right rotation");
        out.println("  rlr <value>               - Left-right double rotation");
        out.println("  rrl <value>               - Right-left double rotation");
        out.println("  rotate <kind> <value>     - Rotation by name: left, right, left-right, right-left");
        out.println("  undo                      - Undo the last operation, or abandon a pending correction");
        out.println("  redo                      - Redo the last undone operation");
        out.println("  tree                      - Display current tree");
        out.println("  clear                     - Clear screen");
        out.println("  reset                     - Reset tree");
        out.println("  status                    - Show configuration and tree status");
        out.println("  hint                      - Show balancing hints (practice mode)");
        out.println("  preorder                  - Show preorder traversal");
        out.println("  inorder                   - Show inorder traversal");
        out.println("  postorder                 - Show postorder traversal");
        out.println("  help                      - Show this");
        out.println("  exit                      - Quit");
        out.println();
        out.println("Configuration:");
        out.println("  config autoshow on/off    - Toggle auto-show tree");
        out.println("  config steps on/off       - Toggle show rotation steps");
        out.println("  config mode <mode>        - Set mode:");
        out.println("    automatic  - Auto-balance");
        out.println("    practice   - Guide learning (only allow correct rotations)");
        out.println();
        out.println("Values range from " + CommandParser.MIN_VALUE + " to " + CommandParser.MAX_VALUE + ".");
    }

    private void printTree(TreeSnapshot snapshot) {
        formatter.format(renderer.render(snapshot)).forEach(out::println);
    }
}
