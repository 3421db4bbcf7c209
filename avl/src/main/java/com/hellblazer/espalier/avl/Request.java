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

import com.hellblazer.espalier.avl.rotation.RotationKind;
import com.hellblazer.espalier.avl.tree.BalanceMode;

import java.util.Objects;

/**
 * The closed set of commands accepted by {@link AvlEngine#execute(Request)}.
 *
 * @author hal.hildebrand
 */
public sealed interface Request {

    static Request delete(int value) {
        return new Delete(value);
    }

    static Request insert(int value) {
        return new Insert(value);
    }

    static Request query(QueryKind kind) {
        return new Query(kind);
    }

    static Request redo() {
        return new Redo();
    }

    static Request reset() {
        return new Reset();
    }

    static Request rotate(RotationKind kind, int value) {
        return new Rotate(kind, value);
    }

    static Request setMode(BalanceMode mode) {
        return new SetMode(mode);
    }

    static Request undo() {
        return new Undo();
    }

    /**
     * @return true if the request can change the tree or the engine state
     */
    default boolean isMutating() {
        return !(this instanceof Query);
    }

    record Insert(int value) implements Request {
    }

    record Delete(int value) implements Request {
    }

    record Rotate(RotationKind kind, int value) implements Request {
        public Rotate {
            Objects.requireNonNull(kind, "kind cannot be null");
        }
    }

    record Undo() implements Request {
    }

    record Redo() implements Request {
    }

    record SetMode(BalanceMode mode) implements Request {
        public SetMode {
            Objects.requireNonNull(mode, "mode cannot be null");
        }
    }

    record Reset() implements Request {
    }

    record Query(QueryKind kind) implements Request {
        public Query {
            Objects.requireNonNull(kind, "kind cannot be null");
        }
    }
}
