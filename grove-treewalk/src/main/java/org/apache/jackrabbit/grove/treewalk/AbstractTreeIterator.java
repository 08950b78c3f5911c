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
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJECT_ID_LENGTH;
import static org.apache.jackrabbit.grove.spi.store.Constants.SEPARATOR;

import java.io.IOException;

import org.apache.jackrabbit.grove.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.grove.spi.store.AnyObjectId;
import org.apache.jackrabbit.grove.spi.store.Constants;
import org.apache.jackrabbit.grove.spi.store.CorruptObjectException;
import org.apache.jackrabbit.grove.spi.store.FileMode;
import org.apache.jackrabbit.grove.spi.store.IncorrectObjectTypeException;
import org.apache.jackrabbit.grove.spi.store.MutableObjectId;
import org.apache.jackrabbit.grove.spi.store.ObjectDatabase;
import org.apache.jackrabbit.grove.spi.store.ObjectId;
import org.apache.jackrabbit.grove.spi.store.WindowCursor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks one level of a tree in canonical tree order.
 * <p>
 * A new iterator is positioned on its first entry, or at eof if the tree is
 * empty. Data for the first entry is available immediately.
 * <p>
 * Entries sort by the raw bytes of their full path, except that a subtree
 * compares as if its name were followed by {@code '/'} and any other entry
 * as if followed by {@code '\0'}. That gives the order
 * <ul>
 * <li>{@code A.c}</li>
 * <li>{@code A/c}</li>
 * <li>{@code A0c}</li>
 * </ul>
 * where {@code A} is a subtree, {@code c} a file within it, and the other
 * two are files of the outer tree.
 * <p>
 * The path buffer is shared from a root iterator down into its subtree
 * iterators so that the current entry is always a full path from the root,
 * while each level only writes the part it owns. Iterators are not thread
 * safe; a walk over one chain of iterators is driven by one thread.
 */
public abstract class AbstractTreeIterator {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTreeIterator.class);

    /** Default size for the {@link #path} buffer. */
    public static final int DEFAULT_PATH_SIZE = SystemPropertySupplier
            .create("grove.treewalk.defaultPathSize", 128).loggingTo(LOG)
            .validateWith(n -> n > 0).get();

    /** A dummy id buffer that matches the zero id. */
    protected static final byte[] ZERO_ID = new byte[OBJECT_ID_LENGTH];

    /** Iterator for the parent tree; null if we are the root iterator. */
    @Nullable
    final AbstractTreeIterator parent;

    /** The iterator this current entry is path equal to. */
    @Nullable
    AbstractTreeIterator matches;

    /** Number of entries we moved forward to force a directory/file match. */
    int matchShift;

    /**
     * Mode bits for the current entry.
     * <p>
     * A numerical value is usually faster for an iterator to obtain from its
     * data source, so this is the preferred representation.
     */
    protected int mode;

    /**
     * Path buffer for the current entry.
     * <p>
     * Bytes {@code [0, pathOffset)} belong to the ancestors of this iterator
     * and must not be written by it. Bytes {@code [pathOffset, pathLen)} are
     * the name of the current entry. Anything after {@code pathLen} is garbage
     * left over from prior entries.
     */
    protected byte[] path;

    /**
     * Position within {@link #path} this iterator starts writing at.
     * <p>
     * This is 0 for a root iterator without prefix. For a subtree iterator
     * the byte before this position is {@code '/'}.
     */
    protected final int pathOffset;

    /**
     * Total length of the current entry's complete path from the root.
     */
    protected int pathLen;

    /**
     * Create a new iterator with no parent.
     */
    protected AbstractTreeIterator() {
        parent = null;
        path = new byte[DEFAULT_PATH_SIZE];
        pathOffset = 0;
    }

    /**
     * Create a new iterator with no parent and a prefix.
     * <p>
     * The prefix is inserted in front of all paths generated by this
     * iterator, so that an iterator over a part of the tree can be combined
     * with iterators running over the whole tree.
     *
     * @param prefix position of this iterator in the tree. May be null or
     *            empty to indicate the root. A trailing {@code '/'} is
     *            appended if the prefix does not end in one.
     */
    protected AbstractTreeIterator(@Nullable String prefix) {
        this(prefix == null ? null : Constants.encode(prefix));
    }

    /**
     * Create a new iterator with no parent and a prefix.
     *
     * @param prefix position of this iterator in the tree, as encoded bytes.
     *            May be null or empty to indicate the root. A trailing
     *            {@code '/'} is appended if the prefix does not end in one.
     */
    protected AbstractTreeIterator(@Nullable byte[] prefix) {
        parent = null;
        if (prefix != null && prefix.length > 0) {
            int len = prefix.length;
            path = new byte[Math.max(DEFAULT_PATH_SIZE, len + 1)];
            System.arraycopy(prefix, 0, path, 0, len);
            if (path[len - 1] != SEPARATOR) {
                path[len++] = SEPARATOR;
            }
            pathOffset = len;
            pathLen = len;
        } else {
            path = new byte[DEFAULT_PATH_SIZE];
            pathOffset = 0;
        }
    }

    /**
     * Create an iterator for a subtree of an existing iterator.
     *
     * @param p parent tree iterator, positioned on the subtree entry.
     */
    protected AbstractTreeIterator(@NotNull AbstractTreeIterator p) {
        parent = p;
        path = p.path;
        pathOffset = p.pathLen + 1;
        if (pathOffset > path.length) {
            growPath(p.pathLen);
        }
        path[pathOffset - 1] = SEPARATOR;
        pathLen = pathOffset;
    }

    /**
     * Create an iterator for a subtree of an existing iterator, with a path
     * set up by the caller.
     *
     * @param p parent tree iterator.
     * @param childPath path array to be used by the child iterator. It must
     *            hold the path from the top of the walk to the first child
     *            and end with a {@code '/'}.
     * @param childPathOffset position within {@code childPath} where the
     *            child can insert its data. The value at
     *            {@code childPath[childPathOffset - 1]} must be {@code '/'}.
     */
    protected AbstractTreeIterator(@NotNull AbstractTreeIterator p, @NotNull byte[] childPath,
            int childPathOffset) {
        checkArgument(childPathOffset > 0 && childPathOffset <= childPath.length
                && childPath[childPathOffset - 1] == SEPARATOR,
                "child path must end in '/' before offset %s", childPathOffset);
        parent = p;
        path = childPath;
        pathOffset = childPathOffset;
        pathLen = childPathOffset;
    }

    /**
     * Double the size of the path buffer.
     *
     * @param len number of live bytes in the path buffer. This many bytes are
     *            moved into the larger buffer.
     */
    protected void growPath(int len) {
        setPathCapacity(path.length << 1, len);
    }

    /**
     * Ensure the path buffer can hold at least {@code capacity} bytes.
     *
     * @param capacity the number of bytes the buffer must hold.
     * @param len number of live bytes in the path buffer, which are preserved.
     */
    protected void ensurePathCapacity(int capacity, int len) {
        if (path.length >= capacity) {
            return;
        }
        int newCapacity = path.length;
        while (newCapacity < capacity && newCapacity > 0) {
            newCapacity <<= 1;
        }
        if (newCapacity <= 0) {
            // doubling overflowed
            newCapacity = capacity;
        }
        setPathCapacity(newCapacity, len);
    }

    /**
     * Replace the path buffer with a larger one, and repoint every ancestor
     * still sharing the old buffer to the new one.
     */
    private void setPathCapacity(int capacity, int len) {
        byte[] oldPath = path;
        byte[] newPath = new byte[capacity];
        System.arraycopy(oldPath, 0, newPath, 0, len);
        for (AbstractTreeIterator p = this; p != null && p.path == oldPath; p = p.parent) {
            p.path = newPath;
        }
        LOG.trace("Grew path buffer from {} to {} bytes", oldPath.length, capacity);
    }

    /**
     * Compare the path of this current entry to another iterator's entry.
     *
     * @param p the other iterator to compare the path against.
     * @return -1 if this entry sorts first; 0 if the entries are equal; 1 if
     *         p's entry sorts first.
     */
    public int pathCompare(@NotNull AbstractTreeIterator p) {
        return pathCompare(p, p.mode);
    }

    /**
     * Compare the path of this current entry to another iterator's entry,
     * using the given mode for the other entry.
     *
     * @param p the other iterator to compare the path against.
     * @param pMode the mode bits to use for p's entry.
     * @return -1 if this entry sorts first; 0 if the entries are equal; 1 if
     *         p's entry sorts first.
     */
    public int pathCompare(@NotNull AbstractTreeIterator p, int pMode) {
        // When both parents already matched, path[0..pathOffset) is known
        // to be equal and does not need to be compared again.
        int cPos = alreadyMatch(this, p);
        return pathCompare(path, cPos, pathLen, mode, p.path, cPos, p.pathLen, pMode);
    }

    /**
     * Compare two paths in canonical tree order.
     * <p>
     * When one path runs out of bytes, it continues with {@code '/'} if its
     * mode is a subtree and with {@code '\0'} otherwise.
     *
     * @return -1, 0 or 1 as path {@code a[aPos, aEnd)} sorts before, equal to
     *         or after path {@code b[bPos, bEnd)}.
     */
    public static int pathCompare(byte[] a, int aPos, int aEnd, int aMode,
            byte[] b, int bPos, int bEnd, int bMode) {
        for (; aPos < aEnd && bPos < bEnd; aPos++, bPos++) {
            int cmp = (a[aPos] & 0xff) - (b[bPos] & 0xff);
            if (cmp != 0) {
                return Integer.signum(cmp);
            }
        }
        if (aPos < aEnd) {
            return Integer.signum((a[aPos] & 0xff) - lastPathChar(bMode));
        }
        if (bPos < bEnd) {
            return Integer.signum(lastPathChar(aMode) - (b[bPos] & 0xff));
        }
        return Integer.signum(lastPathChar(aMode) - lastPathChar(bMode));
    }

    private static int alreadyMatch(AbstractTreeIterator a, AbstractTreeIterator b) {
        for (;;) {
            AbstractTreeIterator ap = a.parent;
            AbstractTreeIterator bp = b.parent;
            if (ap == null || bp == null) {
                return 0;
            }
            if (ap.matches != null && ap.matches == bp.matches) {
                return a.pathOffset;
            }
            a = ap;
            b = bp;
        }
    }

    private static int lastPathChar(int mode) {
        return FileMode.isTree(mode) ? SEPARATOR : '\0';
    }

    /**
     * Check if the current entry of both iterators has the same id.
     * <p>
     * This is faster than comparing {@link #getEntryObjectId()} results as the
     * id bytes are compared in place.
     *
     * @param otherIterator the other iterator to test against.
     * @return true if both iterators have the same object id.
     */
    public boolean idEqual(@NotNull AbstractTreeIterator otherIterator) {
        return AnyObjectId.equals(idBuffer(), idOffset(),
                otherIterator.idBuffer(), otherIterator.idOffset());
    }

    /**
     * @return true if the entry has a valid object id, false if it does not
     *         (the id is then all zeros).
     */
    public boolean hasId() {
        return true;
    }

    /**
     * @return the object id of the current entry.
     */
    @NotNull
    public ObjectId getEntryObjectId() {
        return ObjectId.fromRaw(idBuffer(), idOffset());
    }

    /**
     * Copy the object id of the current entry into a reusable id.
     *
     * @param out the id to fill.
     */
    public void getEntryObjectId(@NotNull MutableObjectId out) {
        out.fromRaw(idBuffer(), idOffset());
    }

    /**
     * @return the file mode of the current entry.
     */
    @NotNull
    public FileMode getEntryFileMode() {
        return FileMode.fromBits(mode);
    }

    /**
     * @return the file mode of the current entry as raw bits.
     */
    public int getEntryRawMode() {
        return mode;
    }

    /**
     * @return the full path of the current entry, decoded as UTF-8.
     */
    @NotNull
    public String getEntryPathString() {
        return new String(path, 0, pathLen, Constants.CHARSET);
    }

    /**
     * @return the length of the full path of the current entry.
     */
    public int getEntryPathLength() {
        return pathLen;
    }

    /**
     * Get the byte array buffer object ids must be copied out of.
     * <p>
     * The buffer can be the same for all entries, or unique per entry.
     * Implementations are encouraged to expose their private buffer to avoid
     * copying.
     *
     * @return the array holding the id of the current entry.
     */
    @NotNull
    public abstract byte[] idBuffer();

    /**
     * @return offset into {@link #idBuffer()} where the id of the current
     *         entry starts.
     */
    public abstract int idOffset();

    /**
     * Create a new iterator for the current entry's subtree.
     * <p>
     * The parent of the returned iterator is {@code this}, so that the caller
     * can leave the subtree and continue walking {@code this}.
     *
     * @param db database to load the tree data from.
     * @return a new iterator that walks over the current subtree.
     * @throws IncorrectObjectTypeException the current entry is not a subtree.
     * @throws IOException the subtree could not be read.
     */
    @NotNull
    public abstract AbstractTreeIterator createSubtreeIterator(@NotNull ObjectDatabase db)
            throws IncorrectObjectTypeException, IOException;

    /**
     * Create a new iterator for the current entry's subtree, reusing caller
     * owned scratch space.
     *
     * @param db database to load the tree data from.
     * @param idBuffer temporary id buffer for use by this method.
     * @param curs cursor to use during database access.
     * @return a new iterator that walks over the current subtree.
     * @throws IncorrectObjectTypeException the current entry is not a subtree.
     * @throws IOException the subtree could not be read.
     */
    @NotNull
    public AbstractTreeIterator createSubtreeIterator(@NotNull ObjectDatabase db,
            @NotNull MutableObjectId idBuffer, @NotNull WindowCursor curs)
            throws IncorrectObjectTypeException, IOException {
        return createSubtreeIterator(db);
    }

    /**
     * Create a new iterator as though the current entry were an empty
     * subtree.
     *
     * @return a new empty tree iterator whose parent is {@code this}.
     */
    @NotNull
    public EmptyTreeIterator createEmptyTreeIterator() {
        return new EmptyTreeIterator(this);
    }

    /**
     * Is this iterator positioned on its first entry?
     * <p>
     * It is if {@code back(1)} would be an invalid request. An empty iterator
     * is {@code first() && eof()}.
     */
    public abstract boolean first();

    /**
     * Is this iterator past its last entry?
     */
    public abstract boolean eof();

    /**
     * Move forward, populating this iterator with the entry data.
     * <p>
     * Implementations must populate {@link #mode}, {@link #path} from
     * {@link #pathOffset} to {@link #pathLen}, and {@link #pathLen}, as well as
     * whatever {@link #idBuffer()} and {@link #idOffset()} need.
     *
     * @param delta number of entries to move by. Must be positive.
     * @throws CorruptObjectException the tree is invalid.
     */
    public abstract void next(int delta) throws CorruptObjectException;

    /**
     * Move backward, populating this iterator with the entry data.
     * <p>
     * The same members as for {@link #next(int)} must be populated.
     *
     * @param delta number of entries to move by. Must be positive.
     * @throws CorruptObjectException the tree is invalid.
     */
    public abstract void back(int delta) throws CorruptObjectException;

    /**
     * Position this iterator on its first entry.
     *
     * @throws CorruptObjectException the tree is invalid.
     */
    public void reset() throws CorruptObjectException {
        while (!first()) {
            back(1);
        }
    }

    /**
     * Advance to the next entry.
     * <p>
     * Behaves like {@code next(1)}, but is called only when a filter rejected
     * the current entry, giving the iterator a chance to skip it cheaply.
     *
     * @throws CorruptObjectException the tree is invalid.
     */
    public void skip() throws CorruptObjectException {
        next(1);
    }

    /**
     * Indicates that no more entries will be read.
     * <p>
     * Invoked when a walk is aborted early. Iterators holding external
     * resources should release them here.
     */
    public void stopWalk() {
        // Do nothing by default.  Most iterators do not care.
    }

    /**
     * @return the length of the name of the current entry.
     */
    public int getNameLength() {
        return pathLen - pathOffset;
    }

    /**
     * Copy the name of the current entry into a buffer.
     *
     * @param buffer receives the name; must hold {@link #getNameLength()}
     *            bytes from {@code offset}.
     * @param offset position in {@code buffer} to copy to.
     */
    public void getName(@NotNull byte[] buffer, int offset) {
        System.arraycopy(path, pathOffset, buffer, offset, pathLen - pathOffset);
    }

    /**
     * @return the name of the current entry, decoded as UTF-8.
     */
    @NotNull
    public String getNameString() {
        return new String(path, pathOffset, pathLen - pathOffset, Constants.CHARSET);
    }

    /**
     * @return the iterator of the parent tree, or null for a root iterator.
     */
    @Nullable
    public AbstractTreeIterator getParent() {
        return parent;
    }

    /**
     * @return the iterator of another tree whose current entry has the same
     *         path as this one, or null. Set by the walk driving this
     *         iterator; not owned.
     */
    @Nullable
    public AbstractTreeIterator getMatches() {
        return matches;
    }

    public void setMatches(@Nullable AbstractTreeIterator matches) {
        this.matches = matches;
    }

    /**
     * @return number of entries this iterator was moved forward to line up a
     *         subtree with a file of the same name in another tree.
     */
    public int getMatchShift() {
        return matchShift;
    }

    public void setMatchShift(int matchShift) {
        this.matchShift = matchShift;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getEntryPathString() + "]";
    }
}
