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

import com.hellblazer.espalier.avl.control.BalanceController;
import com.hellblazer.espalier.avl.control.Outcome;
import com.hellblazer.espalier.avl.error.EngineException;
import com.hellblazer.espalier.avl.oracle.CorrectionStep;
import com.hellblazer.espalier.avl.render.GridRenderer;
import com.hellblazer.espalier.avl.render.TreeGrid;
import com.hellblazer.espalier.avl.tree.BalanceMode;
import com.hellblazer.espalier.avl.tree.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Single entry point for driving the AVL practice engine.
 * <p>
 * Each call to {@link #execute(Request)} runs one request to completion against the {@link BalanceController}. User
 * errors never escape: a rejected request comes back as a failed {@link OperationResult} carrying its
 * {@link com.hellblazer.espalier.avl.error.ErrorKind}, and the engine state is exactly as it was before the call.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * var engine = new AvlEngine(EngineConfiguration.getPracticeDefault());
 * engine.execute(Request.insert(30));
 * engine.execute(Request.insert(20));
 * var result = engine.execute(Request.insert(10));   // practice mode: correction now pending
 * engine.execute(Request.rotate(RotationKind.RIGHT, 30));
 * }</pre>
 *
 * @author hal.hildebrand
 */
public class AvlEngine {
    private static final Logger log = LoggerFactory.getLogger(AvlEngine.class);

    private final BalanceController controller;
    private final GridRenderer      renderer;

    public AvlEngine() {
        this(EngineConfiguration.getDefault());
    }

    public AvlEngine(EngineConfiguration configuration) {
        this(new BalanceController(configuration), new GridRenderer());
    }

    public AvlEngine(BalanceController controller, GridRenderer renderer) {
        this.controller = Objects.requireNonNull(controller, "controller cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer cannot be null");
    }

    private static String join(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(" -> "));
    }

    /**
     * Run one request.
     *
     * @param request the request, never null
     * @return the outcome; failed results carry the rejection reason and the unchanged tree
     */
    public OperationResult execute(Request request) {
        Objects.requireNonNull(request, "request cannot be null");
        try {
            if (request instanceof Request.Query query) {
                return query(query.kind());
            }
            return mutate(request);
        } catch (EngineException e) {
            log.debug("rejected {}: {}", request, e.getMessage());
            return OperationResult.failure(e.kind(), e.getMessage(), snapshot());
        }
    }

    public BalanceController getController() {
        return controller;
    }

    public BalanceMode getMode() {
        return controller.getMode();
    }

    public boolean isShowSteps() {
        return controller.isShowSteps();
    }

    public TreeGrid render() {
        return renderer.render(snapshot());
    }

    public void setShowSteps(boolean showSteps) {
        controller.setShowSteps(showSteps);
    }

    public TreeSnapshot snapshot() {
        return controller.getTree().snapshot();
    }

    private List<String> hintLines(Optional<CorrectionStep> hint) {
        if (hint.isEmpty()) {
            return List.of("Tree is already balanced! No hints needed.");
        }
        var step = hint.get();
        var target = controller.getTree().find(step.nodeValue());
        var lines = new ArrayList<String>();
        lines.add(String.format("Hint for balancing node %d (balance: %d):", step.nodeValue(),
                                controller.getOracle().balanceFactor(target)));
        var kind = step.kind();
        if (kind.isDouble()) {
            var pivot = kind.pivotOf(target).getValue();
            lines.add(String.format("→ First 'rotate %s %d', then 'rotate %s %d' (%s case)",
                                    kind.firstStep().getCommand(), pivot, kind.finalStep().getCommand(),
                                    step.nodeValue(), kind.getCaseName()));
            lines.add(String.format("  or all at once: '%s'", step.command()));
        } else {
            lines.add(String.format("→ Try '%s' (%s case)", step.command(), kind.getCaseName()));
        }
        return lines;
    }

    private OperationResult mutate(Request request) throws EngineException {
        Outcome outcome;
        if (request instanceof Request.Insert insert) {
            outcome = controller.insert(insert.value());
        } else if (request instanceof Request.Delete delete) {
            outcome = controller.delete(delete.value());
        } else if (request instanceof Request.Rotate rotate) {
            outcome = controller.rotate(rotate.kind(), rotate.value());
        } else if (request instanceof Request.Undo) {
            outcome = controller.undo();
        } else if (request instanceof Request.Redo) {
            outcome = controller.redo();
        } else if (request instanceof Request.SetMode setMode) {
            outcome = controller.setMode(setMode.mode());
        } else if (request instanceof Request.Reset) {
            outcome = controller.reset();
        } else {
            throw new IllegalArgumentException("Unsupported request: " + request);
        }
        return OperationResult.success(outcome.messages(), snapshot(), outcome.frames());
    }

    private OperationResult query(QueryKind kind) {
        var snapshot = snapshot();
        return switch (kind) {
            case PRE_ORDER, IN_ORDER, POST_ORDER -> {
                var traversal = kind.traversal();
                var values = traversal.values(controller.getTree());
                var message = values.isEmpty() ? "Tree is empty"
                                               : traversal.getTitle() + " traversal: " + join(values);
                yield OperationResult.success(List.of(message), snapshot).withValues(values);
            }
            case TREE -> OperationResult.success(List.of(), snapshot);
            case STATUS -> OperationResult.success(statusLines(), snapshot).withStatus(controller.status());
            case HINT -> {
                var hint = controller.hint();
                yield OperationResult.success(hintLines(hint), snapshot).withHint(hint);
            }
        };
    }

    private List<String> statusLines() {
        var status = controller.status();
        var lines = new ArrayList<String>();
        lines.add("Mode: " + status.mode().getTitle());
        lines.add("Show steps: " + (controller.isShowSteps() ? "On" : "Off"));
        if (status.size() == 0) {
            lines.add("Tree Status: Empty");
            return lines;
        }
        lines.add("Tree Status:");
        lines.add("  Size: " + status.size());
        lines.add("  Height: " + status.height());
        lines.add("  Balanced: " + (status.isBalanced() ? "Yes" : "No"));
        var oracle = controller.getOracle();
        oracle.findLowestViolation(controller.getTree().getRoot())
              .ifPresent(node -> lines.add(String.format("  Unbalanced node: %d (balance: %d)", node.getValue(),
                                                         oracle.balanceFactor(node))));
        controller.hint().ifPresent(step -> lines.add("  Correction pending, next step: " + step.command()));
        return lines;
    }
}
