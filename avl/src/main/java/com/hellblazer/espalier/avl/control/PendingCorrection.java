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

import com.hellblazer.espalier.avl.oracle.CorrectionStep;
import com.hellblazer.espalier.avl.rotation.RotationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The rotations still owed after a practice-mode operation broke the AVL invariant. Immutable: advancing produces a
 * new instance.
 *
 * @author hal.hildebrand
 */
public final class PendingCorrection {

    private final String               operation;
    private final List<CorrectionStep> steps;
    private final int                  stepIndex;

    public PendingCorrection(String operation, List<CorrectionStep> steps) {
        this(operation, steps, 0);
    }

    private PendingCorrection(String operation, List<CorrectionStep> steps, int stepIndex) {
        this.operation = Objects.requireNonNull(operation, "operation cannot be null");
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("a pending correction needs at least one step");
        }
        this.steps = List.copyOf(steps);
        this.stepIndex = stepIndex;
    }

    /**
     * @return the correction with the current step done
     */
    public PendingCorrection advance() {
        return new PendingCorrection(operation, steps, stepIndex + 1);
    }

    public CorrectionStep expected() {
        if (isExhausted()) {
            throw new IllegalStateException("correction for " + operation + " is complete");
        }
        return steps.get(stepIndex);
    }

    public RotationKind expectedRotationKind() {
        return expected().kind();
    }

    public boolean isExhausted() {
        return stepIndex >= steps.size();
    }

    /**
     * The operation that caused the violation, e.g. "insert 10".
     */
    public String operation() {
        return operation;
    }

    public List<CorrectionStep> remainingSteps() {
        return steps.subList(Math.min(stepIndex, steps.size()), steps.size());
    }

    /**
     * @return the correction with the current step replaced, used when the first half of a double rotation has been
     * applied and only its final single rotation remains
     */
    public PendingCorrection replaceCurrent(CorrectionStep step) {
        var replaced = new ArrayList<>(steps);
        replaced.set(stepIndex, step);
        return new PendingCorrection(operation, replaced, stepIndex);
    }

    public int stepIndex() {
        return stepIndex;
    }

    public int targetNodeValue() {
        return expected().nodeValue();
    }

    @Override
    public String toString() {
        return "PendingCorrection[" + operation + ", step " + stepIndex + " of " + steps + "]";
    }
}
