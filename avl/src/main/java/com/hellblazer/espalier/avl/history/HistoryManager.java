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
package com.hellblazer.espalier.avl.history;

import com.hellblazer.espalier.avl.error.NothingToRedoException;
import com.hellblazer.espalier.avl.error.NothingToUndoException;
import com.hellblazer.espalier.avl.tree.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Linear undo/redo history of committed tree snapshots.
 * <p>
 * The oldest entry is the state the session started from. The cursor marks the entry matching the live tree.
 * Committing after an undo discards everything past the cursor; there is no redo branching. Entries are never
 * modified once recorded.
 *
 * @author hal.hildebrand
 */
public class HistoryManager {
    private static final Logger log = LoggerFactory.getLogger(HistoryManager.class);

    private final List<TreeSnapshot> entries = new ArrayList<>();
    private final int                limit;
    private       int                cursor;

    public HistoryManager(TreeSnapshot initial) {
        this(initial, 0);
    }

    /**
     * @param initial the starting state, which is the oldest undo target
     * @param limit   the maximum number of retained entries, or 0 for no limit
     */
    public HistoryManager(TreeSnapshot initial, int limit) {
        Objects.requireNonNull(initial, "initial cannot be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }
        this.limit = limit;
        entries.add(initial);
    }

    public boolean canRedo() {
        return cursor < entries.size() - 1;
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    /**
     * Record a new committed state, truncating any redo entries past the cursor.
     */
    public void commit(TreeSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        var discarded = entries.size() - cursor - 1;
        entries.subList(cursor + 1, entries.size()).clear();
        entries.add(snapshot);
        cursor++;
        if (limit > 0 && entries.size() > limit) {
            entries.remove(0);
            cursor--;
        }
        log.debug("commit #{} size={} discarded {} redo entries", cursor, snapshot.size(), discarded);
    }

    public TreeSnapshot current() {
        return entries.get(cursor);
    }

    public int getLimit() {
        return limit;
    }

    public int position() {
        return cursor;
    }

    /**
     * @return the snapshot the live tree must be restored to
     */
    public TreeSnapshot redo() throws NothingToRedoException {
        if (!canRedo()) {
            throw new NothingToRedoException();
        }
        cursor++;
        log.debug("redo to #{}", cursor);
        return entries.get(cursor);
    }

    /**
     * Discard all entries and start over from the given state.
     */
    public void reset(TreeSnapshot initial) {
        Objects.requireNonNull(initial, "initial cannot be null");
        entries.clear();
        entries.add(initial);
        cursor = 0;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return the snapshot the live tree must be restored to
     */
    public TreeSnapshot undo() throws NothingToUndoException {
        if (!canUndo()) {
            throw new NothingToUndoException();
        }
        cursor--;
        log.debug("undo to #{}", cursor);
        return entries.get(cursor);
    }
}
