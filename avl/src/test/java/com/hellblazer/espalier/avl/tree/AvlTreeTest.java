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
package com.hellblazer.espalier.avl.tree;

import com.hellblazer.espalier.avl.error.DuplicateValueException;
import com.hellblazer.espalier.avl.error.InvalidRotationException;
import com.hellblazer.espalier.avl.error.NotFoundException;
import com.hellblazer.espalier.avl.rotation.RotationKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class AvlTreeTest {

    static AvlTree treeOf(int... values) throws DuplicateValueException {
        var tree = new AvlTree();
        for (var value : values) {
            tree.insertRaw(value);
        }
        return tree;
    }

    @Test
    public void testCheckInvariantsDetectsImbalance() throws Exception {
        var tree = treeOf(30, 20, 10);
        tree.checkInvariants(false);
        var e = assertThrows(IllegalStateException.class, () -> tree.checkInvariants(true));
        assertTrue(e.getMessage().contains("30"), e.getMessage());
    }

    @Test
    public void testClearAndMarkers() throws Exception {
        var tree = treeOf(20, 10, 30);
        tree.mark(10, NodeMarker.RECENTLY_ADDED);
        tree.mark(30, NodeMarker.UNBALANCED);
        tree.mark(99, NodeMarker.UNBALANCED);

        tree.unmark(NodeMarker.UNBALANCED);
        assertEquals(NodeMarker.RECENTLY_ADDED, tree.find(10).getMarker());
        assertEquals(NodeMarker.NONE, tree.find(30).getMarker());

        tree.clearMarkers();
        assertEquals(NodeMarker.NONE, tree.find(10).getMarker());

        tree.clear();
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertEquals(0, tree.height());
    }

    @Test
    public void testCopyIsIndependent() throws Exception {
        var tree = treeOf(20, 10, 30);
        tree.mark(10, NodeMarker.RECENTLY_ADDED);
        var copy = tree.copy();

        copy.insertRaw(40);
        assertFalse(tree.contains(40));
        assertEquals(3, tree.size());
        assertEquals(NodeMarker.NONE, copy.find(10).getMarker());
        assertEquals(tree.getMode(), copy.getMode());
    }

    @Test
    public void testDeleteLeafAndSingleChild() throws Exception {
        var tree = treeOf(20, 10, 30, 40);
        assertTrue(tree.deleteRaw(30));
        assertEquals(List.of(20, 10, 40), Traversal.PRE_ORDER.values(tree));
        assertTrue(tree.deleteRaw(10));
        assertEquals(List.of(20, 40), Traversal.PRE_ORDER.values(tree));
        assertEquals(2, tree.height());
        assertFalse(tree.deleteRaw(99));
        assertEquals(2, tree.size());
        tree.checkInvariants(true);
    }

    @Test
    public void testDeleteTwoChildrenUsesSuccessor() throws Exception {
        var tree = treeOf(50, 30, 70, 60, 80, 65);
        assertTrue(tree.deleteRaw(50));
        assertEquals(60, tree.getRoot().getValue());
        assertEquals(List.of(30, 60, 65, 70, 80), Traversal.IN_ORDER.values(tree));
        assertEquals(65, tree.find(70).getLeft().getValue());
        tree.checkInvariants(false);
    }

    @Test
    public void testFindPathToRoot() throws Exception {
        var tree = treeOf(20, 10, 30, 25);
        var path = tree.findPathToRoot(25).stream().map(AvlNode::getValue).toList();
        assertEquals(List.of(25, 30, 20), path);

        var missing = tree.findPathToRoot(27).stream().map(AvlNode::getValue).toList();
        assertEquals(List.of(25, 30, 20), missing);
        assertTrue(new AvlTree().findPathToRoot(1).isEmpty());
    }

    @Test
    public void testInsertRawKeepsHeights() throws Exception {
        var tree = treeOf(10, 20, 30);
        assertEquals(3, tree.height());
        assertEquals(3, tree.size());
        assertEquals(-2, tree.getRoot().balanceFactor());
        assertEquals(1, tree.find(30).getHeight());
        assertTrue(tree.find(30).isLeaf());
        tree.checkInvariants(false);
    }

    @Test
    public void testInsertRawRejectsDuplicate() throws Exception {
        var tree = treeOf(10, 20);
        var e = assertThrows(DuplicateValueException.class, () -> tree.insertRaw(20),
                             "duplicate insert should be rejected");
        assertEquals(20, e.getValue());
        assertEquals("Value 20 already exists in the tree! Cannot add duplicates.", e.getMessage());
        assertEquals(2, tree.size());
    }

    @Test
    public void testRemovalAnchor() throws Exception {
        var tree = treeOf(50, 30, 70, 20, 40, 60, 80, 65);
        // leaf: its parent
        assertEquals(30, tree.removalAnchor(20).getAsInt());
        // two children, successor is the right child
        assertEquals(40, tree.removalAnchor(30).getAsInt());
        // two children, successor deeper: successor's parent
        assertEquals(70, tree.removalAnchor(50).getAsInt());
        assertTrue(tree.removalAnchor(99).isEmpty());
        assertTrue(treeOf(5).removalAnchor(5).isEmpty());
    }

    @Test
    public void testRotateAtRelinksAndRecomputesHeights() throws Exception {
        var tree = treeOf(50, 30, 70, 20, 10);
        var promoted = tree.rotateAt(30, RotationKind.RIGHT);

        assertEquals(20, promoted.getValue());
        assertSame(promoted, tree.getRoot().getLeft());
        assertEquals(List.of(50, 20, 10, 30, 70), Traversal.PRE_ORDER.values(tree));
        assertEquals(3, tree.height());
        tree.checkInvariants(true);

        var root = tree.rotateAt(50, RotationKind.RIGHT);
        assertSame(root, tree.getRoot());
        assertEquals(20, root.getValue());
        tree.checkInvariants(false);
    }

    @Test
    public void testRotateAtRejects() throws Exception {
        var tree = treeOf(20, 10);
        assertThrows(NotFoundException.class, () -> tree.rotateAt(99, RotationKind.RIGHT));
        var e = assertThrows(InvalidRotationException.class, () -> tree.rotateAt(20, RotationKind.LEFT));
        assertEquals("Cannot perform left rotation on node 20: it has no right child to promote", e.getMessage());
        assertEquals(List.of(20, 10), Traversal.PRE_ORDER.values(tree));
    }

    @Test
    public void testSnapshotRestore() throws Exception {
        var tree = treeOf(20, 10, 30);
        tree.mark(10, NodeMarker.RECENTLY_ADDED);
        var snapshot = tree.snapshot();
        assertEquals(NodeMarker.RECENTLY_ADDED, snapshot.markerOf(10));
        assertEquals("(10 20 30)", snapshot.toString());

        tree.insertRaw(40);
        tree.deleteRaw(10);
        tree.restore(snapshot);

        assertEquals(3, tree.size());
        assertTrue(snapshot.sameShape(tree.snapshot()));
        assertEquals(NodeMarker.NONE, tree.find(10).getMarker());
        assertEquals(List.of(10, 20, 30), snapshot.inOrder());
    }

    @Test
    public void testTraversals() throws Exception {
        var tree = treeOf(20, 10, 30, 5, 15);
        assertEquals(List.of(20, 10, 5, 15, 30), Traversal.PRE_ORDER.values(tree));
        assertEquals(List.of(5, 10, 15, 20, 30), Traversal.IN_ORDER.values(tree));
        assertEquals(List.of(5, 15, 10, 30, 20), Traversal.POST_ORDER.values(tree));
        assertTrue(Traversal.IN_ORDER.values(new AvlTree()).isEmpty());
    }
}
