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

import com.hellblazer.espalier.avl.control.Frame;
import com.hellblazer.espalier.avl.control.TreeStatus;
import com.hellblazer.espalier.avl.error.ErrorKind;
import com.hellblazer.espalier.avl.oracle.CorrectionStep;
import com.hellblazer.espalier.avl.tree.TreeSnapshot;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of executing one {@link Request}.
 *
 * @param success  whether the request was accepted
 * @param messages human-readable lines, in order
 * @param snapshot the tree to display after the request
 * @param frames   intermediate trees recorded while balancing, empty unless step display is on
 * @param values   traversal output, empty for other requests
 * @param status   present for status queries
 * @param hint     the next expected rotation, present for hint queries while a correction is pending
 * @param error    why the request was rejected, present exactly when {@code success} is false
 * @author hal.hildebrand
 */
public record OperationResult(boolean success, List<String> messages, TreeSnapshot snapshot, List<Frame> frames,
                              List<Integer> values, Optional<TreeStatus> status, Optional<CorrectionStep> hint,
                              Optional<ErrorKind> error) {

    public OperationResult {
        Objects.requireNonNull(messages, "messages cannot be null");
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Objects.requireNonNull(frames, "frames cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(hint, "hint cannot be null");
        Objects.requireNonNull(error, "error cannot be null");
        if (success == error.isPresent()) {
            throw new IllegalArgumentException("error must be present exactly when the request failed");
        }
        messages = List.copyOf(messages);
        frames = List.copyOf(frames);
        values = List.copyOf(values);
    }

    public static OperationResult failure(ErrorKind kind, String message, TreeSnapshot snapshot) {
        return new OperationResult(false, List.of(message), snapshot, List.of(), List.of(), Optional.empty(),
                                   Optional.empty(), Optional.of(kind));
    }

    public static OperationResult success(List<String> messages, TreeSnapshot snapshot) {
        return success(messages, snapshot, List.of());
    }

    public static OperationResult success(List<String> messages, TreeSnapshot snapshot, List<Frame> frames) {
        return new OperationResult(true, messages, snapshot, frames, List.of(), Optional.empty(), Optional.empty(),
                                   Optional.empty());
    }

    public OperationResult withHint(Optional<CorrectionStep> hint) {
        return new OperationResult(success, messages, snapshot, frames, values, status, hint, error);
    }

    public OperationResult withStatus(TreeStatus status) {
        return new OperationResult(success, messages, snapshot, frames, values, Optional.of(status), hint, error);
    }

    public OperationResult withValues(List<Integer> values) {
        return new OperationResult(success, messages, snapshot, frames, values, status, hint, error);
    }
}
