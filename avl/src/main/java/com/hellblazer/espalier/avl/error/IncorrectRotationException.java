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

import com.hellblazer.espalier.avl.oracle.CorrectionStep;
import com.hellblazer.espalier.avl.rotation.RotationKind;

/**
 * Practice mode rejection: the proposed rotation is not the next step of the correcting sequence. The message names
 * the expected step so the user can correct themselves.
 */
public final class IncorrectRotationException extends EngineException {

    private final CorrectionStep expected;
    private final CorrectionStep proposed;

    public IncorrectRotationException(CorrectionStep expected, int nodeValue, RotationKind kind) {
        super(String.format("Incorrect rotation: %s rotation on node %d is not the next step. Expected %s rotation on node %d.",
                            kind.getDisplayName().toLowerCase(), nodeValue,
                            expected.kind().getDisplayName().toLowerCase(), expected.nodeValue()));
        this.expected = expected;
        this.proposed = new CorrectionStep(nodeValue, kind);
    }

    public CorrectionStep getExpected() {
        return expected;
    }

    public CorrectionStep getProposed() {
        return proposed;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INCORRECT_ROTATION;
    }
}
