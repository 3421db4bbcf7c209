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
 * A node of the AVL tree. Children are exclusively owned by their parent; there are no parent back-links, so a
 * structural change that replaces a subtree root must be re-linked by whoever holds the parent.
 *
 * @author hal.hildebrand
 */
public final class AvlNode {
    private int        value;
    private int        height = 1;
    private AvlNode    left;
    private AvlNode    right;
    private NodeMarker marker = NodeMarker.NONE;

    public AvlNode(int value) {
        this.value = value;
    }

    public int balanceFactor() {
        return AvlTree.heightOf(left) - AvlTree.heightOf(right);
    }

    public int getHeight() {
        return height;
    }

    public AvlNode getLeft() {
        return left;
    }

    public NodeMarker getMarker() {
        return marker;
    }

    public AvlNode getRight() {
        return right;
    }

    public int getValue() {
        return value;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    public void setLeft(AvlNode left) {
        this.left = left;
    }

    public void setMarker(NodeMarker marker) {
        this.marker = marker == null ? NodeMarker.NONE : marker;
    }

    public void setRight(AvlNode right) {
        this.right = right;
    }

    @Override
    public String toString() {
        return "AvlNode[" + value + ", h=" + height + "]";
    }

    /**
     * Recompute this node's height from its children. Children must already be up to date.
     */
    public void updateHeight() {
        height = 1 + Math.max(AvlTree.heightOf(left), AvlTree.heightOf(right));
    }

    // two-child deletion moves the in-order successor's key into the doomed node
    void setValue(int value) {
        this.value = value;
    }

    void setHeight(int height) {
        this.height = height;
    }
}
