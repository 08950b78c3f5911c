/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.grove.treewalk;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJECT_ID_LENGTH;
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJ_TREE;
import static org.apache.jackrabbit.grove.spi.store.Constants.TYPE_TREE;

import java.io.IOException;

import org.apache.jackrabbit.grove.spi.store.AnyObjectId;
import org.apache.jackrabbit.grove.spi.store.CorruptObjectException;
import org.apache.jackrabbit.grove.spi.store.FileMode;
import org.apache.jackrabbit.grove.spi.store.IncorrectObjectTypeException;
import org.apache.jackrabbit.grove.spi.store.MissingObjectException;
import org.apache.jackrabbit.grove.spi.store.MutableObjectId;
import org.apache.jackrabbit.grove.spi.store.ObjectDatabase;
import org.apache.jackrabbit.grove.spi.store.ObjectLoader;
import org.apache.jackrabbit.grove.spi.store.WindowCursor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Parses raw tree data in its canonical form.
 * <p>
 * Each entry is {@code <octal mode> SP <name> NUL <20 byte id>}, repeated
 * until the end of the data. Entries are decoded lazily, one at a time, so a
 * malformed entry surfaces as a {@link CorruptObjectException} when the
 * iterator moves onto it.
 */
public class CanonicalTreeParser extends AbstractTreeIterator {

    private static final byte[] EMPTY = {};

    private byte[] raw = EMPTY;

    /** First offset within {@link #raw} of the current entry's data. */
    private int currPtr;

    /** Offset one past the current entry (first offset of next entry). */
    private int nextPtr;

    /** Ordinal of the current entry; the entry count once at eof. */
    private int entryIndex;

    /** Create a new parser with no data. */
    public CanonicalTreeParser() {
        // nothing to parse yet
    }

    /**
     * Create a new parser over the given tree data.
     *
     * @param prefix position of this iterator in the tree, or null for the
     *            root.
     * @param treeData the raw tree content.
     * @throws CorruptObjectException the first entry is malformed.
     */
    public CanonicalTreeParser(@Nullable String prefix, @NotNull byte[] treeData)
            throws CorruptObjectException {
        super(prefix);
        reset(treeData);
    }

    /**
     * Create a new parser for a tree loaded from a database.
     *
     * @param prefix position of this iterator in the tree, as encoded bytes,
     *            or null for the root.
     * @param db database to read the tree from.
     * @param treeId identity of the tree being parsed.
     * @param curs cursor used during database access.
     * @throws MissingObjectException the tree is not in the database.
     * @throws IncorrectObjectTypeException the object is not a tree.
     * @throws IOException the tree could not be read.
     */
    public CanonicalTreeParser(@Nullable byte[] prefix, @NotNull ObjectDatabase db,
            @NotNull AnyObjectId treeId, @NotNull WindowCursor curs) throws IOException {
        super(prefix);
        reset(db, treeId, curs);
    }

    private CanonicalTreeParser(@NotNull CanonicalTreeParser p) {
        super(p);
    }

    /**
     * Reset this parser to walk through the given tree data.
     *
     * @param treeData the raw tree content.
     * @throws CorruptObjectException the first entry is malformed.
     */
    public void reset(@NotNull byte[] treeData) throws CorruptObjectException {
        raw = treeData;
        currPtr = 0;
        entryIndex = 0;
        if (!eof()) {
            parseEntry();
        }
    }

    /**
     * Reset this parser to walk through the given tree.
     *
     * @param db database to read the tree from.
     * @param id identity of the tree being parsed.
     * @param curs cursor used during database access.
     * @throws MissingObjectException the tree is not in the database.
     * @throws IncorrectObjectTypeException the object is not a tree.
     * @throws IOException the tree could not be read.
     */
    public void reset(@NotNull ObjectDatabase db, @NotNull AnyObjectId id,
            @NotNull WindowCursor curs) throws IOException {
        ObjectLoader ldr = db.openObject(curs, id);
        if (ldr == null) {
            throw new MissingObjectException(id, TYPE_TREE);
        }
        if (ldr.getType() != OBJ_TREE) {
            throw new IncorrectObjectTypeException(id, TYPE_TREE);
        }
        reset(ldr.getBytes());
    }

    @Override
    public void reset() throws CorruptObjectException {
        if (!first()) {
            reset(raw);
        }
    }

    @NotNull
    @Override
    public CanonicalTreeParser createSubtreeIterator(@NotNull ObjectDatabase db)
            throws IOException {
        WindowCursor curs = new WindowCursor();
        try {
            return createSubtreeIterator(db, curs.tempId(), curs);
        } finally {
            curs.release();
        }
    }

    @NotNull
    @Override
    public CanonicalTreeParser createSubtreeIterator(@NotNull ObjectDatabase db,
            @NotNull MutableObjectId idBuffer, @NotNull WindowCursor curs)
            throws IOException {
        checkState(!eof(), "No current entry");
        idBuffer.fromRaw(idBuffer(), idOffset());
        if (!FileMode.isTree(mode)) {
            throw new IncorrectObjectTypeException(idBuffer, TYPE_TREE);
        }
        CanonicalTreeParser p = new CanonicalTreeParser(this);
        p.reset(db, idBuffer, curs);
        return p;
    }

    @NotNull
    @Override
    public byte[] idBuffer() {
        return raw;
    }

    @Override
    public int idOffset() {
        return nextPtr - OBJECT_ID_LENGTH;
    }

    @Override
    public boolean first() {
        return currPtr == 0;
    }

    @Override
    public boolean eof() {
        return currPtr >= raw.length;
    }

    @Override
    public void next(int delta) throws CorruptObjectException {
        checkArgument(delta > 0, "delta must be positive: %s", delta);
        while (delta-- > 0 && !eof()) {
            currPtr = nextPtr;
            entryIndex++;
            if (!eof()) {
                parseEntry();
            }
        }
    }

    @Override
    public void back(int delta) throws CorruptObjectException {
        checkArgument(delta > 0 && delta <= entryIndex,
                "Cannot move back %s entries from entry %s", delta, entryIndex);
        int target = entryIndex - delta;
        // entries before the current one were parsed already, only their ends are needed
        int ptr = 0;
        for (int i = 0; i < target; i++) {
            ptr = entryEnd(ptr);
        }
        currPtr = ptr;
        entryIndex = target;
        parseEntry();
    }

    private int entryEnd(int ptr) {
        while (raw[ptr] != 0) {
            ptr++;
        }
        return ptr + 1 + OBJECT_ID_LENGTH;
    }

    private void parseEntry() throws CorruptObjectException {
        int end = raw.length;
        int ptr = currPtr;
        int bits = 0;
        byte c;
        while (ptr < end && (c = raw[ptr]) != ' ') {
            if (c < '0' || c > '7') {
                throw corrupt("invalid mode character");
            }
            bits = (bits << 3) + (c - '0');
            ptr++;
        }
        if (ptr == currPtr) {
            throw corrupt("empty mode");
        }
        if (ptr >= end) {
            throw corrupt("truncated entry");
        }
        int nameStart = ++ptr;
        while (ptr < end && raw[ptr] != 0) {
            ptr++;
        }
        if (ptr >= end || ptr + 1 + OBJECT_ID_LENGTH > end) {
            throw corrupt("truncated entry");
        }
        int nameLen = ptr - nameStart;
        if (nameLen == 0) {
            throw corrupt("empty name");
        }

        mode = bits;
        ensurePathCapacity(pathOffset + nameLen, pathOffset);
        System.arraycopy(raw, nameStart, path, pathOffset, nameLen);
        pathLen = pathOffset + nameLen;
        nextPtr = ptr + 1 + OBJECT_ID_LENGTH;
    }

    private CorruptObjectException corrupt(String why) {
        return new CorruptObjectException("Corrupt tree entry at offset " + currPtr + ": " + why);
    }

    @Override
    public String toString() {
        return eof() ? "CanonicalTreeParser[eof]" : super.toString();
    }
}
