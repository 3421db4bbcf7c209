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

import com.hellblazer.espalier.avl.tree.BalanceMode;

/**
 * Thrown when the balancing mode is changed while a practice-mode correction is pending.
 */
public final class ModeSwitchBlockedException extends EngineException {

    private final BalanceMode requested;

    public ModeSwitchBlockedException(BalanceMode requested) {
        super("Cannot switch to " + requested.getName() + " mode while a correction is pending. Balance the tree first.");
        this.requested = requested;
    }

    public BalanceMode getRequested() {
        return requested;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MODE_SWITCH_BLOCKED;
    }
}
