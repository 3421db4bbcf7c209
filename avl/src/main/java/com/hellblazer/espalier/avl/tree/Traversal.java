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

/**
 * Depth-first traversal orders.
 *
 * @author hal.hildebrand
 */
public enum Traversal {
    PRE_ORDER("Preorder"), IN_ORDER("Inorder"), POST_ORDER("Postorder");

    private final String title;

    Traversal(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }

    public List<Integer> values(AvlTree tree) {
        var values = new ArrayList<Integer>(tree.size());
        visit(tree.getRoot(), values);
        return values;
    }

    private void visit(AvlNode node, List<Integer> values) {
        if (node == null) {
            return;
        }
        if (this == PRE_ORDER) {
            values.add(node.getValue());
        }
        visit(node.getLeft(), values);
        if (this == IN_ORDER) {
            values.add(node.getValue());
        }
        visit(node.getRight(), values);
        if (this == POST_ORDER) {
            values.add(node.getValue());
        }
    }
}
