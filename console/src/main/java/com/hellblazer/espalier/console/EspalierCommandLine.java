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

import com.hellblazer.espalier.avl.EngineConfiguration;
import com.hellblazer.espalier.avl.tree.BalanceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point for the interactive AVL practice session.
 *
 * <p>Options:
 * <ul>
 *   <li>--mode automatic|practice - initial balancing mode</li>
 *   <li>--no-autoshow - do not print the tree after each change</li>
 *   <li>--no-steps - do not report individual balancing steps</li>
 *   <li>--color - ANSI emphasis for new and unbalanced nodes</li>
 *   <li>--history-limit n - keep at most n undo entries, 0 for unbounded</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class EspalierCommandLine {
    private static final Logger log = LoggerFactory.getLogger(EspalierCommandLine.class);

    /**
     * Parse command-line arguments into configuration.
     */
    public static Config parse(String[] args) {
        var config = new Config();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            switch (arg) {
                case "-m", "--mode" -> {
                    if (i + 1 < args.length) {
                        var name = args[++i];
                        var mode = BalanceMode.fromName(name);
                        if (mode == null) {
                            config.problems.add("Unknown mode: " + name + " (use automatic or practice)");
                        } else {
                            config.mode = mode;
                        }
                    } else {
                        config.problems.add("--mode requires a value");
                    }
                }
                case "--history-limit" -> {
                    if (i + 1 < args.length) {
                        var text = args[++i];
                        try {
                            config.historyLimit = Integer.parseInt(text);
                        } catch (NumberFormatException e) {
                            config.problems.add("History limit must be a number: " + text);
                        }
                    } else {
                        config.problems.add("--history-limit requires a value");
                    }
                }
                case "--autoshow" -> config.autoShow = true;
                case "--no-autoshow" -> config.autoShow = false;
                case "--steps" -> config.showSteps = true;
                case "--no-steps" -> config.showSteps = false;
                case "--color" -> config.color = true;
                case "--no-color" -> config.color = false;
                case "-q", "--quiet" -> config.quiet = true;
                case "-h", "--help" -> config.help = true;
                default -> {
                    log.warn("Unknown option: {}", arg);
                    config.problems.add("Unknown option: " + arg);
                }
            }
        }
        return config;
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("Espalier - AVL Tree Practice Tool");
        out.println();
        out.println("Usage: espalier [options]");
        out.println();
        out.println("Options:");
        out.println("  -m, --mode <mode>        Initial mode: automatic (default) or practice");
        out.println("  --no-autoshow            Do not print the tree after each change");
        out.println("  --no-steps               Do not report individual balancing steps");
        out.println("  --color                  Highlight new and unbalanced nodes with ANSI colors");
        out.println("  --history-limit <n>      Maximum undo entries, 0 for unbounded (default: 0)");
        out.println("  -q, --quiet              Suppress the banner");
        out.println("  -h, --help               Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  espalier --mode practice --color");
        out.println("  espalier --no-steps --history-limit 50");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'espalier --help' for usage information.");
            return false;
        }
        return true;
    }

    /**
     * Main entry point for CLI.
     */
    public static void main(String[] args) {
        var config = parse(args);
        if (config.help) {
            printUsage(System.out);
            return;
        }
        if (!validate(config, System.err)) {
            System.exit(1);
        }
        log.debug("Configuration: {}", config);

        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(new PracticeSession(config, in, System.out).run());
    }

    /**
     * Configuration holder for all command-line options.
     */
    public static class Config {
        final List<String> problems = new ArrayList<>();

        public BalanceMode mode         = BalanceMode.AUTOMATIC;
        public boolean     autoShow     = true;
        public boolean     showSteps    = true;
        public boolean     color        = false;
        public int         historyLimit = 0;
        public boolean     quiet        = false;
        public boolean     help         = false;

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(problems);
            if (historyLimit < 0) {
                errors.add("History limit must not be negative");
            }
            return errors;
        }

        public EngineConfiguration toEngineConfiguration() {
            return EngineConfiguration.builder()
                                      .withInitialMode(mode)
                                      .withShowSteps(showSteps)
                                      .withHistoryLimit(historyLimit)
                                      .build();
        }

        @Override
        public String toString() {
            return String.format("Config{mode=%s, autoShow=%s, showSteps=%s, color=%s, historyLimit=%d}", mode,
                                 autoShow, showSteps, color, historyLimit);
        }
    }
}
