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

import java.util.Arrays;
import java.util.List;

/**
 * Immutable rows-by-columns grid of cells produced by {@link GridRenderer}.
 *
 * @author hal.hildebrand
 */
public final class TreeGrid {

    public static final TreeGrid EMPTY = new TreeGrid(new GridCell[0][0]);

    private final GridCell[][] cells;

    TreeGrid(GridCell[][] cells) {
        this.cells = cells;
    }

    public GridCell cell(int row, int column) {
        return cells[row][column];
    }

    public int columns() {
        return cells.length == 0 ? 0 : cells[0].length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TreeGrid other && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    public boolean isEmpty() {
        return cells.length == 0;
    }

    public List<GridCell> row(int row) {
        return List.of(cells[row]);
    }

    public int rows() {
        return cells.length;
    }

    /**
     * @return the widest cell text, used to size every cell of the printed grid
     */
    public int widestText() {
        var widest = 0;
        for (var row : cells) {
            for (var cell : row) {
                widest = Math.max(widest, cell.text().length());
            }
        }
        return widest;
    }

    @Override
    public String toString() {
        var builder = new StringBuilder();
        for (var row : cells) {
            for (var cell : row) {
                builder.append('[').append(cell.text()).append(']');
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
