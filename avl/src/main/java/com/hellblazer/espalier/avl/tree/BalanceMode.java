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
package com.hellblazer.espalier.avl.tree;

/**
 * How the engine responds when a mutation leaves the tree out of balance.
 *
 * @author hal.hildebrand
 */
public enum BalanceMode {
    /** Apply the correcting rotations immediately */
    AUTOMATIC("automatic"),
    /** Hold the violated tree until the user supplies the correcting rotations */
    PRACTICE("practice");

    private final String name;

    BalanceMode(String name) {
        this.name = name;
    }

    public static BalanceMode fromName(String name) {
        for (var mode : values()) {
            if (mode.name.equalsIgnoreCase(name)) {
                return mode;
            }
        }
        return null;
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
