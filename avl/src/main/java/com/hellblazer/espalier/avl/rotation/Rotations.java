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
package com.hellblazer.espalier.avl.rotation;

import com.hellblazer.espalier.avl.error.InvalidRotationException;
import com.hellblazer.espalier.avl.tree.AvlNode;

/**
 * Pure structural rotations. Each takes the root of a subtree and returns the node that replaces it; the caller must
 * re-link the result into the parent or tree root. Heights of every node touched are recomputed bottom-up. A rotation
 * that cannot be applied throws before mutating anything.
 *
 * @author hal.hildebrand
 */
public final class Rotations {

    private Rotations() {
    }

    /**
     * Promote {@code node.right}. The promoted node's left subtree becomes {@code node}'s right subtree.
     */
    public static AvlNode rotateLeft(AvlNode node) throws InvalidRotationException {
        var pivot = node.getRight();
        if (pivot == null) {
            throw new InvalidRotationException(node.getValue(), RotationKind.LEFT, "it has no right child to promote");
        }
        node.setRight(pivot.getLeft());
        pivot.setLeft(node);
        node.updateHeight();
        pivot.updateHeight();
        return pivot;
    }

    /**
     * Rotate left on {@code node.left}, then right on {@code node}.
     */
    public static AvlNode rotateLeftRight(AvlNode node) throws InvalidRotationException {
        var left = node.getLeft();
        if (left == null || left.getRight() == null) {
            throw new InvalidRotationException(node.getValue(), RotationKind.LEFT_RIGHT,
                                               "it needs a left child that has a right child");
        }
        node.setLeft(rotateLeft(left));
        return rotateRight(node);
    }

    /**
     * Promote {@code node.left}. The promoted node's right subtree becomes {@code node}'s left subtree.
     */
    public static AvlNode rotateRight(AvlNode node) throws InvalidRotationException {
        var pivot = node.getLeft();
        if (pivot == null) {
            throw new InvalidRotationException(node.getValue(), RotationKind.RIGHT, "it has no left child to promote");
        }
        node.setLeft(pivot.getRight());
        pivot.setRight(node);
        node.updateHeight();
        pivot.updateHeight();
        return pivot;
    }

    /**
     * Rotate right on {@code node.right}, then left on {@code node}.
     */
    public static AvlNode rotateRightLeft(AvlNode node) throws InvalidRotationException {
        var right = node.getRight();
        if (right == null || right.getLeft() == null) {
            throw new InvalidRotationException(node.getValue(), RotationKind.RIGHT_LEFT,
                                               "it needs a right child that has a left child");
        }
        node.setRight(rotateRight(right));
        return rotateLeft(node);
    }
}
