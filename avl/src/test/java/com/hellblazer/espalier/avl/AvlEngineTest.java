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

import com.hellblazer.espalier.avl.error.ErrorKind;
import com.hellblazer.espalier.avl.oracle.CorrectionStep;
import com.hellblazer.espalier.avl.rotation.RotationKind;
import com.hellblazer.espalier.avl.tree.BalanceMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class AvlEngineTest {

    private AvlEngine engine;

    private void insertAll(int... values) {
        for (var value : values) {
            assertTrue(engine.execute(Request.insert(value)).success());
        }
    }

    @BeforeEach
    public void setUp() {
        engine = new AvlEngine(EngineConfiguration.builder().withValidateInvariants(true).build());
    }

    @Test
    public void testFailuresCarryErrorKind() {
        insertAll(10);
        var duplicate = engine.execute(Request.insert(10));
        assertFalse(duplicate.success());
        assertEquals(ErrorKind.DUPLICATE_VALUE, duplicate.error().orElseThrow());
        assertEquals(List.of("Value 10 already exists in the tree! Cannot add duplicates."), duplicate.messages());
        assertEquals(1, duplicate.snapshot().size());

        assertEquals(ErrorKind.NOT_FOUND, engine.execute(Request.delete(5)).error().orElseThrow());
        assertEquals(ErrorKind.INVALID_ROTATION,
                     engine.execute(Request.rotate(RotationKind.LEFT, 10)).error().orElseThrow());
        assertEquals(ErrorKind.NOTHING_TO_REDO, engine.execute(Request.redo()).error().orElseThrow());
    }

    @Test
    public void testHintForDoubleRotation() {
        engine.execute(Request.setMode(BalanceMode.PRACTICE));
        insertAll(30, 10, 20);

        var result = engine.execute(Request.query(QueryKind.HINT));
        assertEquals(new CorrectionStep(30, RotationKind.LEFT_RIGHT), result.hint().orElseThrow());
        assertEquals(List.of("Hint for balancing node 30 (balance: 2):",
                             "→ First 'rotate left 10', then 'rotate right 30' (Left-Right case)",
                             "  or all at once: 'rotate left-right 30'"), result.messages());
    }

    @Test
    public void testHintWhenBalanced() {
        insertAll(10);
        var result = engine.execute(Request.query(QueryKind.HINT));
        assertTrue(result.success());
        assertTrue(result.hint().isEmpty());
        assertEquals(List.of("Tree is already balanced! No hints needed."), result.messages());
    }

    @Test
    public void testNullRequestRejected() {
        assertThrows(NullPointerException.class, () -> engine.execute(null));
    }

    @Test
    public void testPracticeScenario() {
        assertTrue(engine.execute(Request.setMode(BalanceMode.PRACTICE)).success());
        insertAll(30, 20, 10);

        var hint = engine.execute(Request.query(QueryKind.HINT));
        assertEquals(List.of("Hint for balancing node 30 (balance: 2):", "→ Try 'rotate right 30' (Left-Left case)"),
                     hint.messages());

        var blocked = engine.execute(Request.setMode(BalanceMode.AUTOMATIC));
        assertEquals(ErrorKind.MODE_SWITCH_BLOCKED, blocked.error().orElseThrow());
        assertEquals(ErrorKind.OPERATION_PENDING, engine.execute(Request.insert(5)).error().orElseThrow());

        var wrong = engine.execute(Request.rotate(RotationKind.LEFT, 20));
        assertEquals(ErrorKind.INCORRECT_ROTATION, wrong.error().orElseThrow());
        assertEquals("((10 20 -) 30 -)", wrong.snapshot().toString());

        var right = engine.execute(Request.rotate(RotationKind.RIGHT, 30));
        assertTrue(right.success());
        assertEquals("(10 20 30)", right.snapshot().toString());
    }

    @Test
    public void testResetAndUndo() {
        insertAll(1, 2, 3);
        assertEquals(List.of("Tree reset"), engine.execute(Request.reset()).messages());
        assertTrue(engine.snapshot().isEmpty());
        var undone = engine.execute(Request.undo());
        assertEquals(List.of(1, 2, 3), undone.snapshot().inOrder());
        assertEquals(ErrorKind.NOTHING_TO_UNDO, new AvlEngine().execute(Request.undo()).error().orElseThrow());
    }

    @Test
    public void testStatus() {
        var empty = engine.execute(Request.query(QueryKind.STATUS));
        assertEquals(List.of("Mode: Automatic", "Show steps: On", "Tree Status: Empty"), empty.messages());

        engine.execute(Request.setMode(BalanceMode.PRACTICE));
        insertAll(30, 20, 10);
        var result = engine.execute(Request.query(QueryKind.STATUS));
        var status = result.status().orElseThrow();
        assertTrue(status.correctionPending());
        assertEquals(List.of("Mode: Practice", "Show steps: On", "Tree Status:", "  Size: 3", "  Height: 3",
                             "  Balanced: No", "  Unbalanced node: 30 (balance: 2)",
                             "  Correction pending, next step: rotate right 30"), result.messages());
    }

    @Test
    public void testTraversals() {
        assertEquals(List.of("Tree is empty"), engine.execute(Request.query(QueryKind.IN_ORDER)).messages());
        insertAll(10, 20, 30, 40, 50, 25);

        var pre = engine.execute(Request.query(QueryKind.PRE_ORDER));
        assertEquals(List.of(30, 20, 10, 25, 40, 50), pre.values());
        assertEquals(List.of("Preorder traversal: 30 -> 20 -> 10 -> 25 -> 40 -> 50"), pre.messages());
        assertEquals(List.of(10, 20, 25, 30, 40, 50), engine.execute(Request.query(QueryKind.IN_ORDER)).values());
        var post = engine.execute(Request.query(QueryKind.POST_ORDER));
        assertEquals(List.of("Postorder traversal: 10 -> 25 -> 20 -> 50 -> 40 -> 30"), post.messages());
    }

    @Test
    public void testTreeQueryDoesNotMutate() {
        insertAll(20, 10);
        var before = engine.snapshot();
        var result = engine.execute(Request.query(QueryKind.TREE));
        assertTrue(result.success());
        assertTrue(result.messages().isEmpty());
        assertTrue(before.sameShape(result.snapshot()));
        assertEquals(2, engine.render().rows());
    }

    @Test
    public void testAutomaticScenarioFrames() {
        insertAll(30, 20);
        var result = engine.execute(Request.insert(10));
        assertTrue(result.success());
        assertEquals("(10 20 30)", result.snapshot().toString());
        assertEquals(2, result.frames().size());

        engine.setShowSteps(false);
        assertFalse(engine.isShowSteps());
        assertTrue(engine.execute(Request.insert(5)).frames().isEmpty());
    }
}
