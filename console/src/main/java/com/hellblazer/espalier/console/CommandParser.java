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

import com.hellblazer.espalier.avl.QueryKind;
import com.hellblazer.espalier.avl.Request;
import com.hellblazer.espalier.avl.rotation.RotationKind;
import com.hellblazer.espalier.avl.tree.BalanceMode;
import com.hellblazer.espalier.console.ConsoleCommand.ChangeSetting;
import com.hellblazer.espalier.console.ConsoleCommand.Clear;
import com.hellblazer.espalier.console.ConsoleCommand.EngineCommand;
import com.hellblazer.espalier.console.ConsoleCommand.Exit;
import com.hellblazer.espalier.console.ConsoleCommand.Help;
import com.hellblazer.espalier.console.ConsoleCommand.Invalid;
import com.hellblazer.espalier.console.ConsoleCommand.Setting;

import java.util.Locale;

/**
 * Parses one line of user input. Parsing is case-insensitive and never throws; malformed input becomes
 * {@link Invalid}.
 *
 * @author hal.hildebrand
 */
public class CommandParser {

    public static final int    MIN_VALUE      = -99;
    public static final int    MAX_VALUE      = 999;
    public static final String INVALID_NUMBER = "Invalid number";
    public static final String UNKNOWN        = "Invalid command. Try 'help'.";

    private static ConsoleCommand query(QueryKind kind) {
        return new EngineCommand(Request.query(kind));
    }

    public ConsoleCommand parse(String line) {
        var parts = line == null ? new String[0] : line.trim().toLowerCase(Locale.ROOT).split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            return new Invalid(UNKNOWN);
        }
        var command = parts[0];
        return switch (command) {
            case "a", "insert" -> valueCommand(parts, Request::insert);
            case "d", "delete" -> valueCommand(parts, Request::delete);
            case "rl" -> valueCommand(parts, v -> Request.rotate(RotationKind.LEFT, v));
            case "rr" -> valueCommand(parts, v -> Request.rotate(RotationKind.RIGHT, v));
            case "rlr" -> valueCommand(parts, v -> Request.rotate(RotationKind.LEFT_RIGHT, v));
            case "rrl" -> valueCommand(parts, v -> Request.rotate(RotationKind.RIGHT_LEFT, v));
            case "rotate" -> rotate(parts);
            case "config" -> config(parts);
            default -> {
                if (parts.length != 1) {
                    yield new Invalid(UNKNOWN);
                }
                yield keyword(command);
            }
        };
    }

    private ConsoleCommand config(String[] parts) {
        if (parts.length != 3) {
            return new Invalid("Usage: config <setting> <value>");
        }
        var value = parts[2];
        if ("mode".equals(parts[1])) {
            var mode = BalanceMode.fromName(value);
            return mode == null ? new Invalid("Valid modes: automatic, practice")
                                : new EngineCommand(Request.setMode(mode));
        }
        var setting = Setting.fromName(parts[1]);
        if (setting == null) {
            return new Invalid("Unknown setting. Use: autoshow, mode, or steps");
        }
        return switch (value) {
            case "on", "true", "1" -> new ChangeSetting(setting, true);
            case "off", "false", "0" -> new ChangeSetting(setting, false);
            default -> new Invalid("Use 'on' or 'off'");
        };
    }

    private ConsoleCommand keyword(String command) {
        return switch (command) {
            case "undo" -> new EngineCommand(Request.undo());
            case "redo" -> new EngineCommand(Request.redo());
            case "reset" -> new EngineCommand(Request.reset());
            case "tree" -> query(QueryKind.TREE);
            case "status" -> query(QueryKind.STATUS);
            case "hint" -> query(QueryKind.HINT);
            case "preorder" -> query(QueryKind.PRE_ORDER);
            case "inorder" -> query(QueryKind.IN_ORDER);
            case "postorder" -> query(QueryKind.POST_ORDER);
            case "help", "?" -> new Help();
            case "clear" -> new Clear();
            case "exit", "quit" -> new Exit();
            default -> new Invalid(UNKNOWN);
        };
    }

    private ConsoleCommand rotate(String[] parts) {
        if (parts.length != 3) {
            return new Invalid("Usage: rotate <left|right|left-right|right-left> <value>");
        }
        var kind = RotationKind.fromCommand(parts[1]);
        if (kind == null) {
            return new Invalid("Use 'left', 'right', 'left-right' or 'right-left'");
        }
        return valueCommand(parts[2], v -> Request.rotate(kind, v));
    }

    private ConsoleCommand valueCommand(String[] parts, ValueRequest factory) {
        if (parts.length != 2) {
            return new Invalid("Usage: " + parts[0] + " <value>");
        }
        return valueCommand(parts[1], factory);
    }

    private ConsoleCommand valueCommand(String text, ValueRequest factory) {
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return new Invalid(INVALID_NUMBER);
        }
        if (value < MIN_VALUE || value > MAX_VALUE) {
            return new Invalid(String.format("Value must be between %d and %d", MIN_VALUE, MAX_VALUE));
        }
        return new EngineCommand(factory.create(value));
    }

    @FunctionalInterface
    private interface ValueRequest {
        Request create(int value);
    }
}
