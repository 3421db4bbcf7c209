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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The AVL tree container: a single ownership tree of {@link AvlNode}s plus its size and balancing mode.
 * <p>
 * The raw structural operations here maintain BST ordering and node heights, but never rebalance. Detecting and
 * correcting violations is the job of the balance oracle and the mode controller that drives it.
 *
 * @author hal.hildebrand
 */
public class AvlTree {
    private static final Logger log = LoggerFactory.getLogger(AvlTree.class);

    private AvlNode     root;
    private int         size;
    private BalanceMode mode;

    public AvlTree() {
        this(BalanceMode.AUTOMATIC);
    }

    public AvlTree(BalanceMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    public static int heightOf(AvlNode node) {
        return node == null ? 0 : node.getHeight();
    }

    /**
     * Verify the structural invariants: stored heights, strict in-order ordering and size. When {@code requireAvl} is
     * set, every balance factor must also lie in [-1, 1].
     *
     * @throws IllegalStateException describing the first violated invariant
     */
    public void checkInvariants(boolean requireAvl) {
        var count = new int[1];
        check(root, null, null, requireAvl, count);
        if (count[0] != size) {
            throw new IllegalStateException("size is " + size + " but tree holds " + count[0] + " nodes");
        }
    }

    public void clear() {
        root = null;
        size = 0;
    }

    public void clearMarkers() {
        clearMarkers(root);
    }

    public boolean contains(int value) {
        return find(value) != null;
    }

    /**
     * @return an independent deep copy without markers
     */
    public AvlTree copy() {
        var copy = new AvlTree(mode);
        copy.restore(snapshot());
        return copy;
    }

    /**
     * Standard BST delete. A node with two children takes its in-order successor's value and the successor is unlinked
     * from the right subtree. Heights along the removal path are recomputed.
     *
     * @return false if the value is not present
     */
    public boolean deleteRaw(int value) {
        if (!contains(value)) {
            return false;
        }
        root = delete(root, value);
        size--;
        log.trace("deleted {} size={}", value, size);
        return true;
    }

    public AvlNode find(int value) {
        var current = root;
        while (current != null && current.getValue() != value) {
            current = value < current.getValue() ? current.getLeft() : current.getRight();
        }
        return current;
    }

    /**
     * The search path for a value, ordered from the node holding the value (or the deepest node visited when it is
     * absent) up to the root.
     */
    public List<AvlNode> findPathToRoot(int value) {
        var path = searchPath(value);
        Collections.reverse(path);
        return path;
    }

    public BalanceMode getMode() {
        return mode;
    }

    public AvlNode getRoot() {
        return root;
    }

    public int height() {
        return heightOf(root);
    }

    /**
     * Standard BST insert of a new leaf. Heights along the insertion path are recomputed.
     *
     * @return the new node
     * @throws DuplicateValueException if the value is already present
     */
    public AvlNode insertRaw(int value) throws DuplicateValueException {
        var path = searchPath(value);
        if (!path.isEmpty() && path.get(path.size() - 1).getValue() == value) {
            throw new DuplicateValueException(value);
        }
        var node = new AvlNode(value);
        if (path.isEmpty()) {
            root = node;
        } else {
            var parent = path.get(path.size() - 1);
            if (value < parent.getValue()) {
                parent.setLeft(node);
            } else {
                parent.setRight(node);
            }
        }
        for (int i = path.size() - 1; i >= 0; i--) {
            path.get(i).updateHeight();
        }
        size++;
        log.trace("inserted {} size={}", value, size);
        return node;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Mark the node holding the value; absent values are ignored.
     */
    public void mark(int value, NodeMarker marker) {
        var node = find(value);
        if (node != null) {
            node.setMarker(marker);
        }
    }

    /**
     * The value of the lowest node whose subtree loses height when {@code value} is deleted, computed before the
     * delete. Empty when the value is absent or when deleting it leaves no ancestor to re-examine.
     */
    public OptionalInt removalAnchor(int value) {
        AvlNode parent = null;
        var current = root;
        while (current != null && current.getValue() != value) {
            parent = current;
            current = value < current.getValue() ? current.getLeft() : current.getRight();
        }
        if (current == null) {
            return OptionalInt.empty();
        }
        if (current.getLeft() != null && current.getRight() != null) {
            var successorParent = current;
            var successor = current.getRight();
            while (successor.getLeft() != null) {
                successorParent = successor;
                successor = successor.getLeft();
            }
            // when the successor is the right child, the deleted node itself takes its value and loses height
            return OptionalInt.of(successorParent == current ? successor.getValue() : successorParent.getValue());
        }
        return parent == null ? OptionalInt.empty() : OptionalInt.of(parent.getValue());
    }

    /**
     * Reset every node carrying the given marker.
     */
    public void unmark(NodeMarker marker) {
        unmark(root, marker);
    }

    /**
     * Replace the live structure with the snapshot's. Markers are not restored.
     */
    public void restore(TreeSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        root = build(snapshot.root());
        size = snapshot.size();
    }

    /**
     * Rotate the subtree rooted at the node holding {@code value}, re-link the new subtree root into the parent (or
     * the tree root) and recompute the heights of every ancestor.
     *
     * @return the new subtree root
     */
    public AvlNode rotateAt(int value, RotationKind kind) throws NotFoundException, InvalidRotationException {
        var path = searchPath(value);
        if (path.isEmpty() || path.get(path.size() - 1).getValue() != value) {
            throw new NotFoundException(value);
        }
        var node = path.get(path.size() - 1);
        var subtree = kind.apply(node);
        if (path.size() == 1) {
            root = subtree;
        } else {
            var parent = path.get(path.size() - 2);
            if (parent.getLeft() == node) {
                parent.setLeft(subtree);
            } else {
                parent.setRight(subtree);
            }
            for (int i = path.size() - 2; i >= 0; i--) {
                path.get(i).updateHeight();
            }
        }
        log.trace("{} rotation at {} promoted {}", kind, value, subtree.getValue());
        return subtree;
    }

    public void setMode(BalanceMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    public int size() {
        return size;
    }

    public TreeSnapshot snapshot() {
        var markers = new HashMap<Integer, NodeMarker>();
        var copied = copy(root, markers);
        return new TreeSnapshot(copied, size, markers);
    }

    @Override
    public String toString() {
        return "AvlTree[" + mode.getName() + ", size=" + size + ", " + snapshot() + "]";
    }

    private AvlNode build(TreeSnapshot.SnapshotNode source) {
        if (source == null) {
            return null;
        }
        var node = new AvlNode(source.value());
        node.setLeft(build(source.left()));
        node.setRight(build(source.right()));
        node.setHeight(source.height());
        return node;
    }

    private int check(AvlNode node, Integer lower, Integer upper, boolean requireAvl, int[] count) {
        if (node == null) {
            return 0;
        }
        count[0]++;
        var value = node.getValue();
        if ((lower != null && value <= lower) || (upper != null && value >= upper)) {
            throw new IllegalStateException("BST order violated at " + value + " bounds (" + lower + ", " + upper + ")");
        }
        var leftHeight = check(node.getLeft(), lower, value, requireAvl, count);
        var rightHeight = check(node.getRight(), value, upper, requireAvl, count);
        var expected = 1 + Math.max(leftHeight, rightHeight);
        if (node.getHeight() != expected) {
            throw new IllegalStateException(
            "height of " + value + " is " + node.getHeight() + " but should be " + expected);
        }
        if (requireAvl && Math.abs(leftHeight - rightHeight) > 1) {
            throw new IllegalStateException(
            "AVL balance violated at " + value + ": balance factor " + (leftHeight - rightHeight));
        }
        return expected;
    }

    private void clearMarkers(AvlNode node) {
        if (node == null) {
            return;
        }
        node.setMarker(NodeMarker.NONE);
        clearMarkers(node.getLeft());
        clearMarkers(node.getRight());
    }

    private TreeSnapshot.SnapshotNode copy(AvlNode node, HashMap<Integer, NodeMarker> markers) {
        if (node == null) {
            return null;
        }
        if (node.getMarker() != NodeMarker.NONE) {
            markers.put(node.getValue(), node.getMarker());
        }
        return new TreeSnapshot.SnapshotNode(node.getValue(), node.getHeight(), copy(node.getLeft(), markers),
                                             copy(node.getRight(), markers));
    }

    private void unmark(AvlNode node, NodeMarker marker) {
        if (node == null) {
            return;
        }
        if (node.getMarker() == marker) {
            node.setMarker(NodeMarker.NONE);
        }
        unmark(node.getLeft(), marker);
        unmark(node.getRight(), marker);
    }

    private AvlNode delete(AvlNode node, int value) {
        if (node == null) {
            return null;
        }
        if (value < node.getValue()) {
            node.setLeft(delete(node.getLeft(), value));
        } else if (value > node.getValue()) {
            node.setRight(delete(node.getRight(), value));
        } else {
            if (node.getLeft() == null) {
                return node.getRight();
            }
            if (node.getRight() == null) {
                return node.getLeft();
            }
            var successor = node.getRight();
            while (successor.getLeft() != null) {
                successor = successor.getLeft();
            }
            node.setValue(successor.getValue());
            node.setRight(delete(node.getRight(), successor.getValue()));
        }
        node.updateHeight();
        return node;
    }

    // root first
    private List<AvlNode> searchPath(int value) {
        var path = new ArrayList<AvlNode>();
        var current = root;
        while (current != null) {
            path.add(current);
            if (current.getValue() == value) {
                break;
            }
            current = value < current.getValue() ? current.getLeft() : current.getRight();
        }
        return path;
    }
}
