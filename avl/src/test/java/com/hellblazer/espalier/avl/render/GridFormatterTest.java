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

import com.hellblazer.espalier.avl.tree.AvlTree;
import com.hellblazer.espalier.avl.tree.NodeMarker;
import com.hellblazer.espalier.avl.tree.TreeSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GridFormatterTest {

    private final GridRenderer renderer = new GridRenderer();

    private static AvlTree treeOf(int... values) throws Exception {
        var tree = new AvlTree();
        for (var value : values) {
            tree.insertRaw(value);
        }
        return tree;
    }

    @Test
    public void testAnsiEmphasis() throws Exception {
        var tree = treeOf(20, 10, 30);
        tree.mark(10, NodeMarker.RECENTLY_ADDED);
        tree.mark(30, NodeMarker.UNBALANCED);
        var lines = new GridFormatter(CellStyler.ANSI).format(renderer.render(tree));

        assertTrue(lines.get(3).contains("\u001B[92m10 \u001B[0m"), lines.get(3));
        assertTrue(lines.get(3).contains("\u001B[31m30 \u001B[0m"), lines.get(3));
        assertTrue(lines.get(3).contains("\u001B[2m ╩ \u001B[0m"), lines.get(3));
        assertTrue(lines.get(0).startsWith("\u001B[36m+"));
    }

    @Test
    public void testCenter() {
        assertEquals(" 5 ", GridFormatter.center("5", 3));
        assertEquals("20 ", GridFormatter.center("20", 3));
        assertEquals("-99", GridFormatter.center("-99", 3));
        assertEquals(" 5  ", GridFormatter.center("5", 4));
    }

    @Test
    public void testEmptyTree() {
        var formatter = new GridFormatter();
        assertEquals(List.of("Tree is empty"), formatter.format(renderer.render(TreeSnapshot.EMPTY)));
    }

    @Test
    public void testPlainGrid() throws Exception {
        var text = new GridFormatter().formatToString(renderer.render(treeOf(20, 10, 30, 40)));
        var expected = String.join("\n",
                                   "+---+---+---+---+---+---+---+",
                                   "|   |   |   |20 |   |   |   |",
                                   "+---+---+---+---+---+---+---+",
                                   "|   |10 | < | ╩ | > |30 |   |",
                                   "+---+---+---+---+---+---+---+",
                                   "|   |   |   |   |   | ╩ |40 |",
                                   "+---+---+---+---+---+---+---+");
        assertEquals(expected, text);
    }

    @Test
    public void testWideValuesWidenEveryCell() throws Exception {
        var lines = new GridFormatter().format(renderer.render(treeOf(100, -1000, 999)));
        assertEquals(List.of("+-----+-----+-----+",
                             "|     | 100 |     |",
                             "+-----+-----+-----+",
                             "|-1000|  ╩  | 999 |",
                             "+-----+-----+-----+"), lines);
    }
}
