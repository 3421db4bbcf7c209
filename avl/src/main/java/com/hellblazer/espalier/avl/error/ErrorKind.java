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
 * User-facing error categories reported by the engine. Every kind is recoverable: a rejected command leaves the tree,
 * the controller state and the history untouched.
 *
 * @author hal.hildebrand
 */
public enum ErrorKind {
    DUPLICATE_VALUE, NOT_FOUND, INVALID_ROTATION, INCORRECT_ROTATION, OPERATION_PENDING, MODE_SWITCH_BLOCKED,
    NOTHING_TO_UNDO, NOTHING_TO_REDO
}
