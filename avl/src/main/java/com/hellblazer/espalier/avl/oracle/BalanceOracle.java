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

import com.hellblazer.espalier.avl.error.EngineException;
import com.hellblazer.espalier.avl.rotation.RotationKind;
import com.hellblazer.espalier.avl.tree.AvlNode;
import com.hellblazer.espalier.avl.tree.AvlTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Computes balance factors, locates AVL violations and derives the canonical sequence of rotations that restores the
 * AVL invariant after a structural change.
 * <p>
 * Violations are always fixed lowest first. After each fix the path from the mutation point is scanned again, so a
 * delete whose fix shortens a subtree and exposes a violation further up yields one step per affected ancestor.
 *
 * @author hal.hildebrand
 */
public class BalanceOracle {
    private static final Logger log = LoggerFactory.getLogger(BalanceOracle.class);

    public int balanceFactor(AvlNode node) {
        return node == null ? 0 : node.balanceFactor();
    }

    /**
     * Derive the correcting sequence for the tree. The tree itself is not modified: each step is simulated on a copy
     * before the scan resumes.
     *
     * @param tree        the tree after a raw insert or delete
     * @param mutatedPath the path from the mutation point up to the root, deepest first; its first node is the anchor
     *                    the scan restarts from after every simulated step. May be empty.
     * @return the steps in the order they must be applied; empty when the tree is already AVL-valid
     */
    public List<CorrectionStep> buildCorrectionSequence(AvlTree tree, List<AvlNode> mutatedPath) {
        var working = tree.copy();
        var anchor = mutatedPath.isEmpty() ? OptionalInt.empty() : OptionalInt.of(mutatedPath.get(0).getValue());
        var steps = new ArrayList<CorrectionStep>();
        var bound = working.size() + 1;
        while (true) {
            List<AvlNode> path = List.of();
            if (anchor.isPresent() && working.contains(anchor.getAsInt())) {
                path = working.findPathToRoot(anchor.getAsInt());
            }
            var violation = findFirstViolation(path).or(() -> findLowestViolation(working.getRoot()));
            if (violation.isEmpty()) {
                log.debug("correction sequence: {}", steps);
                return steps;
            }
            if (steps.size() >= bound) {
                throw new IllegalStateException("Correction sequence did not converge after " + steps.size() + " steps");
            }
            var node = violation.get();
            var step = new CorrectionStep(node.getValue(), determineRotation(node));
            try {
                working.rotateAt(step.nodeValue(), step.kind());
            } catch (EngineException e) {
                throw new IllegalStateException("Simulated " + step.describe() + " failed", e);
            }
            steps.add(step);
        }
    }

    public Heaviness classify(AvlNode node) {
        var balance = balanceFactor(node);
        if (balance > 0) {
            return Heaviness.LEFT_HEAVY;
        }
        return balance < 0 ? Heaviness.RIGHT_HEAVY : Heaviness.BALANCED;
    }

    /**
     * The rotation that corrects a violated node. A child with a balance factor of exactly 0, which only deletions
     * produce, resolves to the single rotation.
     *
     * @throws IllegalArgumentException if the node is not in violation
     */
    public RotationKind determineRotation(AvlNode node) {
        var balance = balanceFactor(node);
        if (balance >= 2) {
            return classify(node.getLeft()) == Heaviness.RIGHT_HEAVY ? RotationKind.LEFT_RIGHT : RotationKind.RIGHT;
        }
        if (balance <= -2) {
            return classify(node.getRight()) == Heaviness.LEFT_HEAVY ? RotationKind.RIGHT_LEFT : RotationKind.LEFT;
        }
        throw new IllegalArgumentException("Node " + node.getValue() + " is not in violation: balance " + balance);
    }

    /**
     * @param pathToRoot nodes ordered from the mutation point up to the root
     * @return the first, and therefore lowest, node on the path whose balance factor is outside [-1, 1]
     */
    public Optional<AvlNode> findFirstViolation(List<AvlNode> pathToRoot) {
        for (var node : pathToRoot) {
            if (isViolated(node)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Post-order scan of a whole subtree, returning the first violated node found below or at {@code node}.
     */
    public Optional<AvlNode> findLowestViolation(AvlNode node) {
        if (node == null) {
            return Optional.empty();
        }
        var below = findLowestViolation(node.getLeft());
        if (below.isPresent()) {
            return below;
        }
        below = findLowestViolation(node.getRight());
        if (below.isPresent()) {
            return below;
        }
        return isViolated(node) ? Optional.of(node) : Optional.empty();
    }

    public boolean isAvl(AvlTree tree) {
        return findLowestViolation(tree.getRoot()).isEmpty();
    }

    public boolean isViolated(AvlNode node) {
        return Math.abs(balanceFactor(node)) >= 2;
    }

    /**
     * @return every violated node in pre-order
     */
    public List<AvlNode> violations(AvlTree tree) {
        var violated = new ArrayList<AvlNode>();
        collectViolations(tree.getRoot(), violated);
        return violated;
    }

    private void collectViolations(AvlNode node, List<AvlNode> violated) {
        if (node == null) {
            return;
        }
        if (isViolated(node)) {
            violated.add(node);
        }
        collectViolations(node.getLeft(), violated);
        collectViolations(node.getRight(), violated);
    }
}
