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

import java.util.Objects;

/**
 * One fixed-width cell of a rendered tree grid.
 *
 * @param text   the cell content; blank for empty cells
 * @param kind   what the cell holds
 * @param marker display emphasis for node cells, NONE otherwise
 * @author hal.hildebrand
 */
public record GridCell(String text, Kind kind, NodeMarker marker) {

    public static final String   LEFT_CONNECTOR  = "<";
    public static final String   RIGHT_CONNECTOR = ">";
    public static final String   TRUNK           = "╩";
    public static final GridCell EMPTY           = new GridCell(" ", Kind.EMPTY, NodeMarker.NONE);

    public GridCell {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(marker, "marker cannot be null");
    }

    public static GridCell connector(String glyph) {
        return new GridCell(glyph, Kind.CONNECTOR, NodeMarker.NONE);
    }

    public static GridCell node(int value, NodeMarker marker) {
        return new GridCell(Integer.toString(value), Kind.NODE, marker);
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public enum Kind {
        EMPTY, NODE, CONNECTOR
    }
}
