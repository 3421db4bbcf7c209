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

import com.hellblazer.espalier.avl.tree.BalanceMode;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time summary of the engine.
 *
 * @param mode              the balancing mode
 * @param size              number of nodes
 * @param height            tree height, 0 when empty
 * @param correctionPending whether a practice-mode correction is owed
 * @param unbalanced        values of the nodes currently in violation
 */
public record TreeStatus(BalanceMode mode, int size, int height, boolean correctionPending, List<Integer> unbalanced) {

    public TreeStatus {
        Objects.requireNonNull(mode, "mode cannot be null");
        unbalanced = List.copyOf(unbalanced);
    }

    public boolean isBalanced() {
        return unbalanced.isEmpty();
    }
}
