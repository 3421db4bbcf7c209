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
package com.hellblazer.espalier.avl.render;

import com.hellblazer.espalier.avl.tree.NodeMarker;

/**
 * Applies display emphasis to formatted grid text. Styling never changes cell widths as the terminal sees them.
 *
 * @author hal.hildebrand
 */
public interface CellStyler {

    /** No emphasis */
    CellStyler PLAIN = new CellStyler() {
    };

    /** ANSI terminal colors: bright green for new nodes, red for violations, dim connectors, cyan borders */
    CellStyler ANSI = new CellStyler() {
        private static final String RESET = "\u001B[0m";

        @Override
        public String border(String text) {
            return "\u001B[36m" + text + RESET;
        }

        @Override
        public String cell(GridCell cell, String padded) {
            return switch (cell.kind()) {
                case EMPTY -> padded;
                case CONNECTOR -> "\u001B[2m" + padded + RESET;
                case NODE -> cell.marker() == NodeMarker.RECENTLY_ADDED ? "\u001B[92m" + padded + RESET
                                                                       : cell.marker() == NodeMarker.UNBALANCED
                                                                         ? "\u001B[31m" + padded + RESET : padded;
            };
        }
    };

    default String border(String text) {
        return text;
    }

    default String cell(GridCell cell, String padded) {
        return padded;
    }
}
