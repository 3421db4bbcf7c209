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

import com.hellblazer.espalier.avl.Request;

import java.util.Objects;

/**
 * One parsed line of console input: either a request for the engine or an action the console handles itself.
 *
 * @author hal.hildebrand
 */
public sealed interface ConsoleCommand {

    /** Forward to the engine */
    record EngineCommand(Request request) implements ConsoleCommand {
        public EngineCommand {
            Objects.requireNonNull(request, "request cannot be null");
        }
    }

    record Help() implements ConsoleCommand {
    }

    record Exit() implements ConsoleCommand {
    }

    record Clear() implements ConsoleCommand {
    }

    /** A display toggle owned by the console */
    record ChangeSetting(Setting setting, boolean enabled) implements ConsoleCommand {
        public ChangeSetting {
            Objects.requireNonNull(setting, "setting cannot be null");
        }
    }

    /** Input that could not be parsed; {@code message} says why */
    record Invalid(String message) implements ConsoleCommand {
        public Invalid {
            Objects.requireNonNull(message, "message cannot be null");
        }
    }

    enum Setting {
        AUTO_SHOW("autoshow", "Auto-show tree"), STEPS("steps", "Show steps");

        private final String name;
        private final String title;

        Setting(String name, String title) {
            this.name = name;
            this.title = title;
        }

        public static Setting fromName(String name) {
            for (var setting : values()) {
                if (setting.name.equals(name)) {
                    return setting;
                }
            }
            return null;
        }

        public String getName() {
            return name;
        }

        public String getTitle() {
            return title;
        }
    }
}
