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
package com.hellblazer.espalier.avl.error;

/**
 * Thrown when inserting a value that is already present in the tree.
 */
public final class DuplicateValueException extends EngineException {

    private final int value;

    public DuplicateValueException(int value) {
        super("Value " + value + " already exists in the tree! Cannot add duplicates.");
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_VALUE;
    }
}
