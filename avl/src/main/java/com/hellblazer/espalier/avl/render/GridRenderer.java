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
import com.hellblazer.espalier.avl.tree.TreeSnapshot;
import com.hellblazer.espalier.avl.tree.TreeSnapshot.SnapshotNode;

import java.util.Arrays;

/**
 * Lays a tree out on a grid with one row per level.
 * <p>
 * A tree of height h gets 2^h - 1 columns and each node sits at its in-order position within the perfect binary tree
 * of that height, so left subtrees land strictly left of their parent and right subtrees strictly right. The row below
 * a parent carries its connectors: a trunk under the parent and a run of arrows toward each child that exists. Missing
 * children leave their cells blank.
 *
 * @author hal.hildebrand
 */
public class GridRenderer {

    /** Height above which the grid would be impractically wide (2^20 - 1 columns) */
    public static final int MAX_HEIGHT = 20;

    public TreeGrid render(AvlTree tree) {
        return render(tree.snapshot());
    }

    /**
     * @throws IllegalArgumentException if the tree is taller than {@link #MAX_HEIGHT}
     */
    public TreeGrid render(TreeSnapshot snapshot) {
        var height = snapshot.height();
        if (height == 0) {
            return TreeGrid.EMPTY;
        }
        if (height > MAX_HEIGHT) {
            throw new IllegalArgumentException("Tree of height " + height + " exceeds renderable height " + MAX_HEIGHT);
        }
        var columns = (1 << height) - 1;
        var cells = new GridCell[height][columns];
        for (var row : cells) {
            Arrays.fill(row, GridCell.EMPTY);
        }
        place(snapshot, snapshot.root(), 0, columns / 2, height, cells);
        return new TreeGrid(cells);
    }

    private void place(TreeSnapshot snapshot, SnapshotNode node, int depth, int column, int height,
                       GridCell[][] cells) {
        cells[depth][column] = GridCell.node(node.value(), snapshot.markerOf(node.value()));
        if (node.left() == null && node.right() == null) {
            return;
        }
        var below = depth + 1;
        var offset = 1 << (height - depth - 2);
        cells[below][column] = GridCell.connector(GridCell.TRUNK);
        if (node.left() != null) {
            for (int c = column - offset + 1; c < column; c++) {
                cells[below][c] = GridCell.connector(GridCell.LEFT_CONNECTOR);
            }
            place(snapshot, node.left(), below, column - offset, height, cells);
        }
        if (node.right() != null) {
            for (int c = column + 1; c < column + offset; c++) {
                cells[below][c] = GridCell.connector(GridCell.RIGHT_CONNECTOR);
            }
            place(snapshot, node.right(), below, column + offset, height, cells);
        }
    }
}
