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
 * The four AVL rotations. A double rotation is a single rotation on one child of the target node (the pivot)
 * followed by the opposite single rotation on the target itself.
 *
 * @author hal.hildebrand
 */
public enum RotationKind {
    LEFT("left", "Left", "Right-Right"),
    RIGHT("right", "Right", "Left-Left"),
    LEFT_RIGHT("left-right", "Left-Right", "Left-Right"),
    RIGHT_LEFT("right-left", "Right-Left", "Right-Left");

    private final String command;
    private final String displayName;
    private final String caseName;

    RotationKind(String command, String displayName, String caseName) {
        this.command = command;
        this.displayName = displayName;
        this.caseName = caseName;
    }

    public static RotationKind fromCommand(String command) {
        for (var kind : values()) {
            if (kind.command.equalsIgnoreCase(command)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Apply this rotation to the subtree rooted at {@code node}.
     *
     * @return the new subtree root, to be re-linked by the caller
     */
    public AvlNode apply(AvlNode node) throws InvalidRotationException {
        return switch (this) {
            case LEFT -> Rotations.rotateLeft(node);
            case RIGHT -> Rotations.rotateRight(node);
            case LEFT_RIGHT -> Rotations.rotateLeftRight(node);
            case RIGHT_LEFT -> Rotations.rotateRightLeft(node);
        };
    }

    /**
     * @return the single rotation applied to the pivot child; single rotations return themselves
     */
    public RotationKind firstStep() {
        return switch (this) {
            case LEFT_RIGHT -> LEFT;
            case RIGHT_LEFT -> RIGHT;
            default -> this;
        };
    }

    /**
     * @return the single rotation applied to the target node; single rotations return themselves
     */
    public RotationKind finalStep() {
        return switch (this) {
            case LEFT_RIGHT -> RIGHT;
            case RIGHT_LEFT -> LEFT;
            default -> this;
        };
    }

    /**
     * The conventional name of the imbalance this rotation corrects, e.g. "Left-Left" for a right rotation.
     */
    public String getCaseName() {
        return caseName;
    }

    public String getCommand() {
        return command;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isDouble() {
        return this == LEFT_RIGHT || this == RIGHT_LEFT;
    }

    /**
     * The child a double rotation starts on, or the node itself for a single rotation. May be null when the node lacks
     * that child.
     */
    public AvlNode pivotOf(AvlNode node) {
        return switch (this) {
            case LEFT_RIGHT -> node.getLeft();
            case RIGHT_LEFT -> node.getRight();
            default -> node;
        };
    }
}
