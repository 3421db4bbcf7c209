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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable deep copy of a tree's structure. Snapshots are the unit of undo/redo history and the read-only input of
 * the grid renderer.
 *
 * @param root    the root of the copied structure, or null for an empty tree
 * @param size    the number of nodes
 * @param markers display markers by node value; values without an entry are unmarked
 * @author hal.hildebrand
 */
public record TreeSnapshot(SnapshotNode root, int size, Map<Integer, NodeMarker> markers) {

    public static final TreeSnapshot EMPTY = new TreeSnapshot(null, 0, Map.of());

    public TreeSnapshot {
        Objects.requireNonNull(markers, "markers cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        if ((root == null) != (size == 0)) {
            throw new IllegalArgumentException("size " + size + " inconsistent with root " + root);
        }
        markers = Map.copyOf(markers);
    }

    public int height() {
        return root == null ? 0 : root.height();
    }

    public List<Integer> inOrder() {
        var values = new ArrayList<Integer>(size);
        collect(root, values);
        return values;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public NodeMarker markerOf(int value) {
        return markers.getOrDefault(value, NodeMarker.NONE);
    }

    /**
     * @return true if both snapshots hold the same values in the same shape with the same heights, ignoring markers
     */
    public boolean sameShape(TreeSnapshot other) {
        return other != null && Objects.equals(root, other.root);
    }

    @Override
    public String toString() {
        return root == null ? "()" : root.toString();
    }

    private static void collect(SnapshotNode node, List<Integer> values) {
        if (node == null) {
            return;
        }
        collect(node.left(), values);
        values.add(node.value());
        collect(node.right(), values);
    }

    /**
     * An immutable node copy. Record equality makes two snapshot trees equal exactly when they have the same shape,
     * values and heights.
     */
    public record SnapshotNode(int value, int height, SnapshotNode left, SnapshotNode right) {

        @Override
        public String toString() {
            if (left == null && right == null) {
                return Integer.toString(value);
            }
            return "(" + (left == null ? "-" : left) + " " + value + " " + (right == null ? "-" : right) + ")";
        }
    }
}
