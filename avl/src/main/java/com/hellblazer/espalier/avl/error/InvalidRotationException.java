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

import com.hellblazer.espalier.avl.rotation.RotationKind;

/**
 * Thrown when a rotation cannot be applied to a node: the child it would promote is missing, or there is no imbalance
 * for it to correct.
 */
public final class InvalidRotationException extends EngineException {

    private final int          nodeValue;
    private final RotationKind kind;

    public InvalidRotationException(int nodeValue, RotationKind kind, String reason) {
        super(String.format("Cannot perform %s rotation on node %d: %s", kind.getDisplayName().toLowerCase(),
                            nodeValue, reason));
        this.nodeValue = nodeValue;
        this.kind = kind;
    }

    public RotationKind getKind() {
        return kind;
    }

    public int getNodeValue() {
        return nodeValue;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_ROTATION;
    }
}
