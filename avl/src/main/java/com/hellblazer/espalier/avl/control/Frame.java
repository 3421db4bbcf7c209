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
package com.hellblazer.espalier.avl.control;

import com.hellblazer.espalier.avl.tree.TreeSnapshot;

import java.util.Objects;

/**
 * An intermediate tree state captured while an operation was applied, e.g. the tree before balancing or after one
 * rotation of a double rotation.
 *
 * @param caption  what the snapshot shows
 * @param snapshot the tree at that point
 */
public record Frame(String caption, TreeSnapshot snapshot) {

    public Frame {
        Objects.requireNonNull(caption, "caption cannot be null");
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
    }
}
