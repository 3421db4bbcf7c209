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

/**
 * Thrown when a mutation is requested while a practice-mode correction is still owed.
 */
public final class OperationPendingException extends EngineException {

    private final CorrectionStep pendingStep;

    public OperationPendingException(String operation, CorrectionStep pendingStep) {
        super(String.format("Tree is currently unbalanced! Please balance it before %s. Next step: %s", operation,
                            pendingStep.describe()));
        this.pendingStep = pendingStep;
    }

    public CorrectionStep getPendingStep() {
        return pendingStep;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.OPERATION_PENDING;
    }
}
