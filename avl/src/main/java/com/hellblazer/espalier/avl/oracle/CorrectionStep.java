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
package com.hellblazer.espalier.avl.oracle;

import com.hellblazer.espalier.avl.rotation.RotationKind;

import java.util.Objects;

/**
 * One step of a correcting sequence: the rotation to apply and the value of the node it is applied to.
 *
 * @param nodeValue the value of the node to rotate
 * @param kind      the rotation
 * @author hal.hildebrand
 */
public record CorrectionStep(int nodeValue, RotationKind kind) {

    public CorrectionStep {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    /**
     * @return the step as the user would type it, e.g. "rotate right 30"
     */
    public String command() {
        return "rotate " + kind.getCommand() + " " + nodeValue;
    }

    public String describe() {
        return kind.getDisplayName().toLowerCase() + " rotation on node " + nodeValue;
    }

    public boolean matches(int value, RotationKind rotation) {
        return nodeValue == value && kind == rotation;
    }
}
