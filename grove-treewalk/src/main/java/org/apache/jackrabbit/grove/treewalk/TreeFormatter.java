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
import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJECT_ID_LENGTH;
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJ_TREE;
import static org.apache.jackrabbit.grove.spi.store.Constants.SEPARATOR;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.jackrabbit.grove.spi.store.AnyObjectId;
import org.apache.jackrabbit.grove.spi.store.Constants;
import org.apache.jackrabbit.grove.spi.store.FileMode;
import org.apache.jackrabbit.grove.spi.store.ObjectId;
import org.apache.jackrabbit.grove.spi.store.ObjectInserter;
import org.jetbrains.annotations.NotNull;

/**
 * Builds the canonical content of a tree object.
 * <p>
 * Entries may be appended in any order. They are written out sorted the same
 * way {@link AbstractTreeIterator} walks them, so the output can be read back
 * with a {@link CanonicalTreeParser}.
 */
public class TreeFormatter {

    private static final Comparator<Entry> ORDER = (a, b) -> AbstractTreeIterator.pathCompare(
            a.name, 0, a.name.length, a.mode.getBits(),
            b.name, 0, b.name.length, b.mode.getBits());

    private final List<Entry> entries = new ArrayList<>();

    /**
     * Add an entry.
     *
     * @param name name of the entry, a single path segment.
     * @param mode mode of the entry.
     * @param id object the entry points to.
     * @return this formatter
     * @throws IllegalArgumentException the name is invalid or already present.
     */
    @NotNull
    public TreeFormatter append(@NotNull String name, @NotNull FileMode mode,
            @NotNull AnyObjectId id) {
        return append(Constants.encode(name), mode, id);
    }

    /**
     * Add an entry.
     *
     * @param name encoded name of the entry, a single path segment.
     * @param mode mode of the entry.
     * @param id object the entry points to.
     * @return this formatter
     * @throws IllegalArgumentException the name is invalid or already present.
     */
    @NotNull
    public TreeFormatter append(@NotNull byte[] name, @NotNull FileMode mode,
            @NotNull AnyObjectId id) {
        checkNotNull(mode);
        checkNotNull(id);
        checkArgument(name.length > 0, "Empty entry name");
        for (byte b : name) {
            checkArgument(b != SEPARATOR && b != 0, "Invalid entry name: %s",
                    new String(name, Constants.CHARSET));
        }
        checkArgument(mode != FileMode.MISSING, "Missing mode for %s",
                new String(name, Constants.CHARSET));
        for (Entry e : entries) {
            checkArgument(!Arrays.equals(e.name, name), "Duplicate entry: %s",
                    new String(name, Constants.CHARSET));
        }
        entries.add(new Entry(name.clone(), mode, id.copy()));
        return this;
    }

    /**
     * @return number of entries appended so far
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return the canonical tree content of the entries appended so far
     */
    @NotNull
    public byte[] toByteArray() {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(ORDER);
        int size = 0;
        for (Entry e : sorted) {
            size += e.mode.copyToLength() + 1 + e.name.length + 1 + OBJECT_ID_LENGTH;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(size);
        byte[] raw = new byte[OBJECT_ID_LENGTH];
        for (Entry e : sorted) {
            try {
                e.mode.copyTo(out);
            } catch (IOException ioe) {
                // ByteArrayOutputStream does not throw
                throw new IllegalStateException(ioe);
            }
            out.write(' ');
            out.write(e.name, 0, e.name.length);
            out.write(0);
            e.id.copyRawTo(raw, 0);
            out.write(raw, 0, raw.length);
        }
        return out.toByteArray();
    }

    /**
     * @return the id the tree would have once stored
     */
    @NotNull
    public ObjectId computeId() {
        return ObjectId.forContent(OBJ_TREE, toByteArray());
    }

    /**
     * Store the tree.
     *
     * @param inserter destination of the tree object.
     * @return the id of the stored tree
     * @throws IOException the tree could not be stored.
     */
    @NotNull
    public ObjectId insertTo(@NotNull ObjectInserter inserter) throws IOException {
        return inserter.insert(OBJ_TREE, toByteArray());
    }

    private static final class Entry {

        final byte[] name;

        final FileMode mode;

        final ObjectId id;

        Entry(byte[] name, FileMode mode, ObjectId id) {
            this.name = name;
            this.mode = mode;
            this.id = id;
        }
    }
}
