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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class EngineConfigurationTest {

    @Test
    public void testBuilderRejectsNegativeLimit() {
        var e = assertThrows(IllegalArgumentException.class, () -> EngineConfiguration.builder().withHistoryLimit(-1));
        assertTrue(e.getMessage().contains("-1"));
        assertThrows(NullPointerException.class, () -> EngineConfiguration.builder().withInitialMode(null));
    }

    @Test
    public void testDefaults() {
        var config = EngineConfiguration.getDefault();
        assertEquals(BalanceMode.AUTOMATIC, config.getInitialMode());
        assertTrue(config.isShowSteps());
        assertEquals(0, config.getHistoryLimit());
        assertFalse(config.isValidateInvariants());
        assertEquals(BalanceMode.PRACTICE, EngineConfiguration.getPracticeDefault().getInitialMode());
    }

    @Test
    public void testHistoryLimitReachesController() {
        var engine = new AvlEngine(EngineConfiguration.builder().withHistoryLimit(2).build());
        engine.execute(Request.insert(1));
        engine.execute(Request.insert(2));
        engine.execute(Request.insert(3));
        assertEquals(2, engine.getController().getHistory().size());
        assertTrue(engine.execute(Request.undo()).success());
        assertFalse(engine.execute(Request.undo()).success());
    }

    @Test
    public void testToBuilderCopies() {
        var config = EngineConfiguration.getPracticeDefault().toBuilder().withShowSteps(false).build();
        assertEquals(BalanceMode.PRACTICE, config.getInitialMode());
        assertFalse(config.isShowSteps());
        assertTrue(config.toString().contains("practice"));
    }
}
