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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Prints a {@link TreeGrid} as a bordered table of equal-width cells with centered text.
 *
 * <pre>
 * +---+---+---+
 * |   | 20|   |
 * +---+---+---+
 * | 10| ╩ | 30|
 * +---+---+---+
 * </pre>
 *
 * @author hal.hildebrand
 */
public class GridFormatter {

    public static final String EMPTY_TREE = "Tree is empty";
    public static final int    MIN_WIDTH  = 3;

    private final CellStyler styler;

    public GridFormatter() {
        this(CellStyler.PLAIN);
    }

    public GridFormatter(CellStyler styler) {
        this.styler = Objects.requireNonNull(styler, "styler cannot be null");
    }

    static String center(String text, int width) {
        var padding = width - text.length();
        if (padding <= 0) {
            return text;
        }
        var left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }

    public List<String> format(TreeGrid grid) {
        if (grid.isEmpty()) {
            return List.of(EMPTY_TREE);
        }
        var width = Math.max(MIN_WIDTH, grid.widestText());
        var separator = separator(grid.columns(), width);
        var lines = new ArrayList<String>(grid.rows() * 2 + 1);
        lines.add(styler.border(separator));
        for (int r = 0; r < grid.rows(); r++) {
            var line = new StringBuilder(styler.border("|"));
            for (var cell : grid.row(r)) {
                line.append(styler.cell(cell, center(cell.text(), width))).append(styler.border("|"));
            }
            lines.add(line.toString());
            lines.add(styler.border(separator));
        }
        return lines;
    }

    public String formatToString(TreeGrid grid) {
        return String.join("\n", format(grid));
    }

    private String separator(int columns, int width) {
        var segment = "-".repeat(width);
        var builder = new StringBuilder("+");
        for (int c = 0; c < columns; c++) {
            builder.append(segment).append('+');
        }
        return builder.toString();
    }
}
