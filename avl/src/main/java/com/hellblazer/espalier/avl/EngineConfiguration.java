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

import com.hellblazer.espalier.avl.tree.BalanceMode;

import java.util.Objects;

/**
 * Configuration for the AVL engine. Immutable; use the builder.
 *
 * @author hal.hildebrand
 */
public class EngineConfiguration {

    private final BalanceMode initialMode;
    private final boolean     showSteps;
    private final int         historyLimit;
    private final boolean     validateInvariants;

    private EngineConfiguration(Builder builder) {
        this.initialMode = builder.initialMode;
        this.showSteps = builder.showSteps;
        this.historyLimit = builder.historyLimit;
        this.validateInvariants = builder.validateInvariants;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the default configuration.
     * - Mode: AUTOMATIC
     * - Show steps: enabled
     * - History: unbounded
     * - Invariant validation: disabled
     */
    public static EngineConfiguration getDefault() {
        return new Builder().build();
    }

    /**
     * Get a configuration that starts in practice mode, otherwise default.
     */
    public static EngineConfiguration getPracticeDefault() {
        return new Builder().withInitialMode(BalanceMode.PRACTICE).build();
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public BalanceMode getInitialMode() {
        return initialMode;
    }

    public boolean isShowSteps() {
        return showSteps;
    }

    /**
     * When enabled, the full AVL and BST invariants are checked after every commit and a breach throws
     * {@link IllegalStateException}. Intended for tests.
     */
    public boolean isValidateInvariants() {
        return validateInvariants;
    }

    public Builder toBuilder() {
        return new Builder().withInitialMode(initialMode)
                            .withShowSteps(showSteps)
                            .withHistoryLimit(historyLimit)
                            .withValidateInvariants(validateInvariants);
    }

    @Override
    public String toString() {
        return String.format("EngineConfiguration[mode=%s, showSteps=%s, historyLimit=%d, validate=%s]",
                             initialMode.getName(), showSteps, historyLimit, validateInvariants);
    }

    /**
     * Builder for EngineConfiguration.
     */
    public static class Builder {
        private BalanceMode initialMode        = BalanceMode.AUTOMATIC;
        private boolean     showSteps          = true;
        private int         historyLimit       = 0;
        private boolean     validateInvariants = false;

        public EngineConfiguration build() {
            return new EngineConfiguration(this);
        }

        /**
         * @param limit maximum retained history entries, 0 for unbounded
         */
        public Builder withHistoryLimit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("historyLimit cannot be negative: " + limit);
            }
            this.historyLimit = limit;
            return this;
        }

        public Builder withInitialMode(BalanceMode mode) {
            this.initialMode = Objects.requireNonNull(mode, "mode cannot be null");
            return this;
        }

        public Builder withShowSteps(boolean enable) {
            this.showSteps = enable;
            return this;
        }

        public Builder withValidateInvariants(boolean enable) {
            this.validateInvariants = enable;
            return this;
        }
    }
}
