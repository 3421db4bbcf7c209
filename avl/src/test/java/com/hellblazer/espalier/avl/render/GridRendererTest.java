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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GridRendererTest {

    private GridRenderer renderer;

    private static AvlTree treeOf(int... values) throws Exception {
        var tree = new AvlTree();
        for (var value : values) {
            tree.insertRaw(value);
        }
        return tree;
    }

    private static List<String> texts(TreeGrid grid, int row) {
        return grid.row(row).stream().map(GridCell::text).toList();
    }

    @BeforeEach
    public void setUp() {
        renderer = new GridRenderer();
    }

    @Test
    public void testEmptyTree() {
        var grid = renderer.render(TreeSnapshot.EMPTY);
        assertTrue(grid.isEmpty());
        assertEquals(0, grid.rows());
        assertEquals(0, grid.columns());
    }

    @Test
    public void testMarkersDoNotChangeLayout() throws Exception {
        var tree = treeOf(20, 10, 30);
        var plain = renderer.render(tree);
        tree.mark(10, NodeMarker.RECENTLY_ADDED);
        var marked = renderer.render(tree);

        assertNotEquals(plain, marked);
        assertEquals(texts(plain, 1), texts(marked, 1));
        assertEquals(NodeMarker.RECENTLY_ADDED, marked.cell(1, 0).marker());
        assertEquals(GridCell.Kind.NODE, marked.cell(1, 0).kind());
    }

    @Test
    public void testMissingChildLeavesBlanks() throws Exception {
        var grid = renderer.render(treeOf(20, 10, 30, 40));
        assertEquals(3, grid.rows());
        assertEquals(7, grid.columns());
        assertEquals(List.of(" ", " ", " ", "20", " ", " ", " "), texts(grid, 0));
        assertEquals(List.of(" ", "10", "<", "╩", ">", "30", " "), texts(grid, 1));
        assertEquals(List.of(" ", " ", " ", " ", " ", "╩", "40"), texts(grid, 2));
        assertTrue(grid.cell(2, 0).isEmpty());
        assertEquals(GridCell.Kind.CONNECTOR, grid.cell(2, 5).kind());
    }

    @Test
    public void testRenderingIsIdempotent() throws Exception {
        var snapshot = treeOf(50, 30, 70, 20, 40, 60, 80, 10).snapshot();
        var first = renderer.render(snapshot);
        var second = renderer.render(snapshot);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void testSingleNode() throws Exception {
        var grid = renderer.render(treeOf(10));
        assertEquals(1, grid.rows());
        assertEquals(1, grid.columns());
        assertEquals("10", grid.cell(0, 0).text());
    }

    @Test
    public void testThreeLevelLayout() throws Exception {
        var grid = renderer.render(treeOf(40, 20, 60, 10, 30, 50, 70, 5, 25, 35, 55));
        assertEquals(15, grid.columns());
        assertEquals("40", grid.cell(0, 7).text());
        assertEquals(List.of(" ", " ", " ", "20", "<", "<", "<", "╩", ">", ">", ">", "60", " ", " ", " "),
                     texts(grid, 1));
        assertEquals(List.of(" ", "10", "<", "╩", ">", "30", " ", " ", " ", "50", "<", "╩", ">", "70", " "),
                     texts(grid, 2));
        assertEquals(List.of("5", "╩", " ", " ", "25", "╩", "35", " ", " ", "╩", "55", " ", " ", " ", " "),
                     texts(grid, 3));
    }

    @Test
    public void testTooTallTreeRejected() throws Exception {
        var tree = new AvlTree();
        for (int i = 0; i <= GridRenderer.MAX_HEIGHT; i++) {
            tree.insertRaw(i);
        }
        assertThrows(IllegalArgumentException.class, () -> renderer.render(tree));
    }
}
