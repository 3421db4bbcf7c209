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

import java.util.List;
import java.util.Objects;

/**
 * What an accepted controller operation did.
 *
 * @param messages human-readable step descriptions, in order
 * @param frames   intermediate tree states, populated when step display is enabled
 * @author hal.hildebrand
 */
public record Outcome(List<String> messages, List<Frame> frames) {

    public Outcome {
        Objects.requireNonNull(messages, "messages cannot be null");
        Objects.requireNonNull(frames, "frames cannot be null");
        messages = List.copyOf(messages);
        frames = List.copyOf(frames);
    }

    public static Outcome of(String... messages) {
        return new Outcome(List.of(messages), List.of());
    }
}
