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

import com.hellblazer.espalier.avl.EngineConfiguration;
import com.hellblazer.espalier.avl.error.DuplicateValueException;
import com.hellblazer.espalier.avl.error.EngineException;
import com.hellblazer.espalier.avl.error.IncorrectRotationException;
import com.hellblazer.espalier.avl.error.InvalidRotationException;
import com.hellblazer.espalier.avl.error.ModeSwitchBlockedException;
import com.hellblazer.espalier.avl.error.NotFoundException;
import com.hellblazer.espalier.avl.error.NothingToRedoException;
import com.hellblazer.espalier.avl.error.NothingToUndoException;
import com.hellblazer.espalier.avl.error.OperationPendingException;
import com.hellblazer.espalier.avl.history.HistoryManager;
import com.hellblazer.espalier.avl.oracle.BalanceOracle;
import com.hellblazer.espalier.avl.oracle.CorrectionStep;
import com.hellblazer.espalier.avl.rotation.RotationKind;
import com.hellblazer.espalier.avl.tree.AvlNode;
import com.hellblazer.espalier.avl.tree.AvlTree;
import com.hellblazer.espalier.avl.tree.BalanceMode;
import com.hellblazer.espalier.avl.tree.NodeMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The balancing state machine and the sole entry point for tree mutation.
 * <p>
 * In {@link ControllerState#IDLE} an insert or delete performs the raw structural change and asks the oracle for the
 * correcting sequence. Automatic mode applies it at once and commits. Practice mode leaves the tree violated and moves
 * to {@link ControllerState#AWAITING_CORRECTION}, where only the expected rotations are accepted until the sequence is
 * exhausted. A double-rotation step may be supplied whole or as its two single rotations.
 * <p>
 * Every rejected request throws before touching the tree, so a rejection never changes state. Only AVL-valid idle
 * states are committed to history.
 *
 * @author hal.hildebrand
 */
public class BalanceController {
    private static final Logger log = LoggerFactory.getLogger(BalanceController.class);

    private final EngineConfiguration configuration;
    private final AvlTree             tree;
    private final HistoryManager      history;
    private final BalanceOracle       oracle;
    private       ControllerState     state = ControllerState.IDLE;
    private       PendingCorrection   pending;
    private       boolean             showSteps;

    public BalanceController(EngineConfiguration configuration) {
        this(configuration, new AvlTree(configuration.getInitialMode()));
    }

    private BalanceController(EngineConfiguration configuration, AvlTree tree) {
        this(configuration, tree, new HistoryManager(tree.snapshot(), configuration.getHistoryLimit()),
             new BalanceOracle());
    }

    /**
     * @param configuration engine settings
     * @param tree          the live tree, which must be AVL-valid
     * @param history       the history whose current entry matches the tree
     * @param oracle        the balance oracle
     */
    public BalanceController(EngineConfiguration configuration, AvlTree tree, HistoryManager history,
                             BalanceOracle oracle) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.tree = Objects.requireNonNull(tree, "tree cannot be null");
        this.history = Objects.requireNonNull(history, "history cannot be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle cannot be null");
        if (!oracle.isAvl(tree)) {
            throw new IllegalArgumentException("initial tree must be AVL-valid");
        }
        this.showSteps = configuration.isShowSteps();
    }

    public Outcome delete(int value) throws EngineException {
        requireIdle("removing nodes");
        if (!tree.contains(value)) {
            throw new NotFoundException(value);
        }
        var anchor = tree.removalAnchor(value);
        tree.clearMarkers();
        tree.deleteRaw(value);
        log.debug("delete {}: anchor {}", value, anchor);

        var messages = new ArrayList<String>();
        messages.add("Removed " + value + " from the tree");
        var path = anchor.isPresent() ? tree.findPathToRoot(anchor.getAsInt()) : List.<AvlNode>of();
        return rebalance("delete " + value, "deletion", path, messages);
    }

    public BalanceMode getMode() {
        return tree.getMode();
    }

    public BalanceOracle getOracle() {
        return oracle;
    }

    public Optional<PendingCorrection> getPendingCorrection() {
        return Optional.ofNullable(pending);
    }

    public ControllerState getState() {
        return state;
    }

    /**
     * The live tree. Callers must treat it as read-only; all mutation goes through this controller.
     */
    public AvlTree getTree() {
        return tree;
    }

    public HistoryManager getHistory() {
        return history;
    }

    /**
     * @return the next rotation the user must supply, empty when no correction is pending
     */
    public Optional<CorrectionStep> hint() {
        return pending == null ? Optional.empty() : Optional.of(pending.expected());
    }

    public Outcome insert(int value) throws EngineException {
        requireIdle("adding nodes");
        if (tree.contains(value)) {
            throw new DuplicateValueException(value);
        }
        tree.clearMarkers();
        tree.insertRaw(value);
        tree.mark(value, NodeMarker.RECENTLY_ADDED);
        log.debug("insert {}", value);

        var messages = new ArrayList<String>();
        messages.add("Added " + value + " to the tree");
        return rebalance("insert " + value, "insertion", tree.findPathToRoot(value), messages);
    }

    public Outcome redo() throws EngineException {
        requireIdle("redoing");
        tree.restore(history.redo());
        return Outcome.of("Redid last operation");
    }

    /**
     * Empty the tree, abandoning any pending correction. Undoable when the tree was not already empty.
     */
    public Outcome reset() {
        clearPending();
        var hadNodes = !tree.isEmpty();
        tree.clear();
        if (hadNodes) {
            commit();
        }
        return Outcome.of("Tree reset");
    }

    /**
     * Submit a rotation while a practice-mode correction is pending.
     *
     * @throws NotFoundException          if no node holds the value
     * @throws InvalidRotationException   if no correction is pending
     * @throws IncorrectRotationException if the rotation is not the next expected step
     */
    public Outcome rotate(RotationKind kind, int value) throws EngineException {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (!tree.contains(value)) {
            throw new NotFoundException(value);
        }
        if (state != ControllerState.AWAITING_CORRECTION) {
            throw new InvalidRotationException(value, kind, "the tree is balanced and no correction is pending");
        }
        var expected = pending.expected();
        if (expected.matches(value, kind)) {
            applyStep(value, kind);
            pending = pending.advance();
        } else if (isFirstHalf(expected, value, kind)) {
            applyStep(value, kind);
            pending = pending.replaceCurrent(new CorrectionStep(expected.nodeValue(), expected.kind().finalStep()));
        } else {
            log.debug("rejected {} rotation on {}, expected {}", kind, value, expected);
            throw new IncorrectRotationException(expected, value, kind);
        }

        var messages = new ArrayList<String>();
        messages.add(String.format("Performed %s rotation on node %d", kind.getDisplayName().toLowerCase(), value));
        tree.clearMarkers();
        if (pending.isExhausted()) {
            log.debug("correction for {} complete", pending.operation());
            clearPending();
            commit();
            messages.add("Tree is balanced!");
        } else {
            markUnbalanced();
            var next = tree.find(pending.targetNodeValue());
            messages.add(String.format("Tree is still unbalanced! Node %d has balance factor %d", next.getValue(),
                                       oracle.balanceFactor(next)));
        }
        return new Outcome(messages, List.of());
    }

    /**
     * @throws ModeSwitchBlockedException while a correction is pending
     */
    public Outcome setMode(BalanceMode mode) throws ModeSwitchBlockedException {
        Objects.requireNonNull(mode, "mode cannot be null");
        if (state == ControllerState.AWAITING_CORRECTION) {
            throw new ModeSwitchBlockedException(mode);
        }
        tree.setMode(mode);
        log.debug("mode set to {}", mode);
        var note = mode == BalanceMode.AUTOMATIC ? "Note: Rotate commands are disabled in automatic mode"
                                                 : "Note: Only correct rotations are allowed in practice mode";
        return Outcome.of("Mode set to " + mode.getName(), note);
    }

    public boolean isShowSteps() {
        return showSteps;
    }

    /**
     * Toggle per-step reporting of automatic balancing. Starts from the configuration's setting.
     */
    public void setShowSteps(boolean showSteps) {
        this.showSteps = showSteps;
    }

    public TreeStatus status() {
        var unbalanced = oracle.violations(tree).stream().map(AvlNode::getValue).toList();
        return new TreeStatus(tree.getMode(), tree.size(), tree.height(), pending != null, unbalanced);
    }

    /**
     * Step back one committed state. While a correction is pending, undo abandons the pending operation instead and
     * restores the last committed tree without moving the history cursor.
     */
    public Outcome undo() throws NothingToUndoException {
        if (state == ControllerState.AWAITING_CORRECTION) {
            var operation = pending.operation();
            clearPending();
            tree.restore(history.current());
            log.debug("abandoned pending {}", operation);
            return Outcome.of("Abandoned " + operation + "; tree restored to its last balanced state");
        }
        tree.restore(history.undo());
        return Outcome.of("Undid last operation");
    }

    private void applyAutomatically(List<CorrectionStep> steps, List<String> messages, List<Frame> frames) {
        var number = 1;
        for (var step : steps) {
            var node = tree.find(step.nodeValue());
            var kind = step.kind();
            if (showSteps) {
                messages.add(String.format("Step %d: Balancing node %d (balance: %d)", number, step.nodeValue(),
                                           oracle.balanceFactor(node)));
            }
            if (kind.isDouble()) {
                var pivot = kind.pivotOf(node).getValue();
                var first = kind.firstStep();
                var last = kind.finalStep();
                messages.add(String.format("Performing %s rotation: first %s on %d, then %s on %d",
                                           kind.getDisplayName().toLowerCase(), first.getCommand(), pivot,
                                           last.getCommand(), step.nodeValue()));
                if (showSteps) {
                    messages.add(String.format("Step %da: %s rotation on node %d", number, first.getDisplayName(),
                                               pivot));
                }
                applyStep(pivot, first);
                if (showSteps) {
                    frames.add(new Frame("After step " + number + "a", tree.snapshot()));
                    messages.add(String.format("Step %db: %s rotation on node %d", number, last.getDisplayName(),
                                               step.nodeValue()));
                }
                applyStep(step.nodeValue(), last);
                if (showSteps) {
                    frames.add(new Frame("After step " + number + "b", tree.snapshot()));
                }
            } else {
                messages.add(String.format("Performing %s rotation on node %d", kind.getCommand(), step.nodeValue()));
                applyStep(step.nodeValue(), kind);
                if (showSteps) {
                    frames.add(new Frame("After step " + number, tree.snapshot()));
                }
            }
            number++;
        }
    }

    // steps come from the oracle, so failure here is a defect rather than a user error
    private void applyStep(int value, RotationKind kind) {
        try {
            tree.rotateAt(value, kind);
        } catch (EngineException e) {
            throw new IllegalStateException("Oracle step " + kind + " on " + value + " could not be applied", e);
        }
    }

    private void clearPending() {
        pending = null;
        state = ControllerState.IDLE;
    }

    private void commit() {
        if (configuration.isValidateInvariants()) {
            tree.checkInvariants(true);
        }
        history.commit(tree.snapshot());
    }

    private boolean isFirstHalf(CorrectionStep expected, int value, RotationKind kind) {
        if (!expected.kind().isDouble() || kind != expected.kind().firstStep()) {
            return false;
        }
        var pivot = expected.kind().pivotOf(tree.find(expected.nodeValue()));
        return pivot != null && pivot.getValue() == value;
    }

    private void markUnbalanced() {
        for (var node : oracle.violations(tree)) {
            node.setMarker(NodeMarker.UNBALANCED);
        }
    }

    private Outcome rebalance(String operation, String noun, List<AvlNode> path, List<String> messages) {
        var steps = oracle.buildCorrectionSequence(tree, path);
        var frames = new ArrayList<Frame>();
        if (steps.isEmpty()) {
            commit();
            messages.add("Tree is balanced!");
            return new Outcome(messages, frames);
        }

        var violated = tree.find(steps.get(0).nodeValue());
        var imbalance = String.format("Tree is unbalanced! Node %d has balance factor %d", violated.getValue(),
                                      oracle.balanceFactor(violated));
        if (tree.getMode() == BalanceMode.AUTOMATIC) {
            if (showSteps) {
                markUnbalanced();
                frames.add(new Frame("After " + noun + " (before balancing)", tree.snapshot()));
                messages.add(imbalance);
            }
            applyAutomatically(steps, messages, frames);
            tree.unmark(NodeMarker.UNBALANCED);
            commit();
            if (showSteps) {
                messages.add("Tree is now balanced!");
            }
            log.debug("{} balanced automatically with {} step(s)", operation, steps.size());
        } else {
            pending = new PendingCorrection(operation, steps);
            state = ControllerState.AWAITING_CORRECTION;
            markUnbalanced();
            messages.add(imbalance);
            messages.add("Use 'hint' if you need guidance on how to balance it.");
            log.debug("{} awaiting correction: {}", operation, steps);
        }
        return new Outcome(messages, frames);
    }

    private void requireIdle(String operation) throws OperationPendingException {
        if (state == ControllerState.AWAITING_CORRECTION) {
            throw new OperationPendingException(operation, pending.expected());
        }
    }
}
