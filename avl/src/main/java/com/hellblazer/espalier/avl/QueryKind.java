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
package com.hellblazer.espalier.avl;

import com.hellblazer.espalier.avl.tree.Traversal;

/**
 * Read-only requests. None of them changes the tree or the controller state.
 *
 * @author hal.hildebrand
 */
public enum QueryKind {
    PRE_ORDER, IN_ORDER, POST_ORDER, TREE, STATUS, HINT;

    /**
     * @return the traversal order for the three traversal queries, null otherwise
     */
    public Traversal traversal() {
        return switch (this) {
            case PRE_ORDER -> Traversal.PRE_ORDER;
            case IN_ORDER -> Traversal.IN_ORDER;
            case POST_ORDER -> Traversal.POST_ORDER;
            default -> null;
        };
    }
}
