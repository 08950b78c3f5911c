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

import static org.apache.jackrabbit.grove.spi.store.FileMode.EXECUTABLE_FILE;
import static org.apache.jackrabbit.grove.spi.store.FileMode.REGULAR_FILE;
import static org.apache.jackrabbit.grove.spi.store.FileMode.TREE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.jackrabbit.grove.spi.store.Constants;
import org.apache.jackrabbit.grove.spi.store.CorruptObjectException;
import org.apache.jackrabbit.grove.spi.store.FileMode;
import org.apache.jackrabbit.grove.spi.store.FileObjectDatabase;
import org.apache.jackrabbit.grove.spi.store.IncorrectObjectTypeException;
import org.apache.jackrabbit.grove.spi.store.MemoryObjectDatabase;
import org.apache.jackrabbit.grove.spi.store.MissingObjectException;
import org.apache.jackrabbit.grove.spi.store.ObjectDatabase;
import org.apache.jackrabbit.grove.spi.store.ObjectId;
import org.apache.jackrabbit.grove.spi.store.WindowCursor;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CanonicalTreeParserTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final WindowCursor curs = new WindowCursor();

    private final ObjectId blobA = blob("a");

    private final ObjectId blobB = blob("b");

    private static ObjectId blob(String content) {
        return ObjectId.forContent(Constants.OBJ_BLOB, Constants.encode(content));
    }

    private byte[] threeEntries() {
        return new TreeFormatter()
                .append("b", EXECUTABLE_FILE, blobB)
                .append("a", REGULAR_FILE, blobA)
                .append("c", TREE, ObjectId.zeroId())
                .toByteArray();
    }

    @Test
    public void emptyTree() throws CorruptObjectException {
        CanonicalTreeParser p = new CanonicalTreeParser();
        assertTrue(p.first());
        assertTrue(p.eof());

        p.reset(new byte[0]);
        assertTrue(p.first());
        assertTrue(p.eof());
    }

    @Test
    public void walkForward() throws CorruptObjectException {
        CanonicalTreeParser p = new CanonicalTreeParser(null, threeEntries());
        assertTrue(p.first());
        assertEquals("a", p.getEntryPathString());
        assertSame(REGULAR_FILE, p.getEntryFileMode());
        assertEquals(blobA, p.getEntryObjectId());

        p.next(1);
        assertFalse(p.first());
        assertEquals("b", p.getEntryPathString());
        assertSame(EXECUTABLE_FILE, p.getEntryFileMode());
        assertEquals(blobB, p.getEntryObjectId());

        p.next(1);
        assertEquals("c", p.getEntryPathString());
        assertEquals(FileMode.TYPE_TREE, p.getEntryRawMode());
        assertEquals(ObjectId.zeroId(), p.getEntryObjectId());

        p.next(1);
        assertTrue(p.eof());
        p.next(1);
        assertTrue(p.eof());
    }

    @Test
    public void multiStepMoves() throws CorruptObjectException {
        CanonicalTreeParser p = new CanonicalTreeParser(null, threeEntries());
        p.next(2);
        assertEquals("c", p.getNameString());
        p.back(2);
        assertTrue(p.first());
        assertEquals("a", p.getNameString());
        p.next(3);
        assertTrue(p.eof());
        p.back(1);
        assertEquals("c", p.getNameString());
        assertEquals(ObjectId.zeroId(), p.getEntryObjectId());
        p.back(1);
        assertEquals("b", p.getNameString());
        assertEquals(blobB, p.getEntryObjectId());
        p.reset();
        assertTrue(p.first());
        assertEquals(blobA, p.getEntryObjectId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void backBeforeFirst() throws CorruptObjectException {
        CanonicalTreeParser p = new CanonicalTreeParser(null, threeEntries());
        p.next(1);
        p.back(2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void stepMustBePositive() throws CorruptObjectException {
        new CanonicalTreeParser(null, threeEntries()).next(0);
    }

    @Test
    public void prefixAppliesToEntries() throws CorruptObjectException {
        CanonicalTreeParser bare = new CanonicalTreeParser("dir", threeEntries());
        CanonicalTreeParser slash = new CanonicalTreeParser("dir/", threeEntries());
        assertEquals("dir/a", bare.getEntryPathString());
        assertEquals(0, bare.pathCompare(slash));
    }

    @Test
    public void corruptEntries() {
        assertCorrupt("10x644 a\0");
        assertCorrupt(" a\0" + new String(new byte[20], Constants.CHARSET));
        assertCorrupt("100644 \0" + new String(new byte[20], Constants.CHARSET));
        assertCorrupt("100644 a\0short");
        assertCorrupt("100644");
        assertCorrupt("100644 abc");
    }

    private static void assertCorrupt(String tree) {
        try {
            new CanonicalTreeParser(null, Constants.encode(tree));
            fail("expected corrupt tree: " + tree);
        } catch (CorruptObjectException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("Corrupt tree entry at offset 0"));
        }
    }

    @Test
    public void corruptionSurfacesOnMove() throws CorruptObjectException {
        byte[] good = new TreeFormatter().append("a", REGULAR_FILE, blobA).toByteArray();
        byte[] tree = Arrays.copyOf(good, good.length + 3);
        tree[good.length] = '1';
        tree[good.length + 1] = '0';
        tree[good.length + 2] = '0';
        CanonicalTreeParser p = new CanonicalTreeParser(null, tree);
        assertEquals("a", p.getNameString());
        try {
            p.next(1);
            fail();
        } catch (CorruptObjectException e) {
            assertTrue(e.getMessage().contains("offset " + good.length));
        }
    }

    @Test
    public void descendIntoSubtree() throws IOException {
        MemoryObjectDatabase db = new MemoryObjectDatabase();
        ObjectId sub = new TreeFormatter().append("x", REGULAR_FILE, blobB).insertTo(db);
        ObjectId root = new TreeFormatter()
                .append("sub", TREE, sub)
                .append("a", REGULAR_FILE, blobA)
                .insertTo(db);

        CanonicalTreeParser p = new CanonicalTreeParser(null, db, root, curs);
        assertEquals("a", p.getEntryPathString());
        p.next(1);
        assertEquals("sub", p.getEntryPathString());

        CanonicalTreeParser child = p.createSubtreeIterator(db);
        assertSame(p, child.getParent());
        assertSame(p.path, child.path);
        assertEquals("sub/x", child.getEntryPathString());
        assertEquals("x", child.getNameString());
        assertEquals(blobB, child.getEntryObjectId());
        assertEquals(0, p.pathCompare(child));
        child.next(1);
        assertTrue(child.eof());

        // the parent keeps its own entry
        assertEquals("sub", p.getEntryPathString());
        p.next(1);
        assertTrue(p.eof());
    }

    @Test
    public void subtreeFoundInAlternate() throws IOException {
        MemoryObjectDatabase alternate = new MemoryObjectDatabase("alternate");
        ObjectId sub = new TreeFormatter().append("x", REGULAR_FILE, blobB).insertTo(alternate);

        MemoryObjectDatabase db = new MemoryObjectDatabase("primary");
        db.setAlternates(alternate);
        ObjectId root = new TreeFormatter().append("sub", TREE, sub).insertTo(db);

        CanonicalTreeParser p = new CanonicalTreeParser(
                Constants.encode("top"), db, root, curs);
        CanonicalTreeParser child = p.createSubtreeIterator(db);
        assertEquals("top/sub/x", child.getEntryPathString());
    }

    @Test
    public void subtreeErrors() throws IOException {
        MemoryObjectDatabase db = new MemoryObjectDatabase();
        ObjectId stored = db.insert(Constants.OBJ_BLOB, Constants.encode("a"));
        ObjectId missing = blob("nowhere");
        ObjectId root = new TreeFormatter()
                .append("blob-as-tree", TREE, stored)
                .append("file", REGULAR_FILE, stored)
                .append("gone", TREE, missing)
                .insertTo(db);
        CanonicalTreeParser p = new CanonicalTreeParser(null, db, root, curs);

        assertEquals("blob-as-tree", p.getNameString());
        try {
            p.createSubtreeIterator(db);
            fail();
        } catch (IncorrectObjectTypeException e) {
            assertEquals("Object " + stored.name() + " is not a tree.", e.getMessage());
        }

        p.next(1);
        assertEquals("file", p.getNameString());
        try {
            p.createSubtreeIterator(db);
            fail();
        } catch (IncorrectObjectTypeException expected) {
            // a blob entry
        }

        p.next(1);
        assertEquals("gone", p.getNameString());
        try {
            p.createSubtreeIterator(db);
            fail();
        } catch (MissingObjectException e) {
            assertEquals(missing, e.getObjectId());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void noSubtreeAtEof() throws IOException {
        new CanonicalTreeParser().createSubtreeIterator(new MemoryObjectDatabase());
    }

    @Test
    public void readBackFromDisk() throws IOException {
        FileObjectDatabase db = new FileObjectDatabase(folder.newFolder("objects"));
        db.create();
        ObjectId blobId = db.insert(Constants.OBJ_BLOB, Constants.encode("content"));
        ObjectId sub = new TreeFormatter().append("leaf", REGULAR_FILE, blobId).insertTo(db);
        ObjectId root = new TreeFormatter()
                .append("dir", TREE, sub)
                .append("dir.txt", REGULAR_FILE, blobId)
                .append("dir0", REGULAR_FILE, blobId)
                .insertTo(db);

        assertEquals(Arrays.asList("dir.txt", "dir/leaf", "dir0"), walkAll(db, root));
        db.close();
    }

    @Test
    public void recursiveWalkOverGrowingPaths() throws IOException {
        MemoryObjectDatabase db = new MemoryObjectDatabase();
        String segment = "segment-with-a-rather-long-name-0123456789";
        ObjectId tree = new TreeFormatter().append("end", REGULAR_FILE, blobA).insertTo(db);
        StringBuilder expected = new StringBuilder("end");
        for (int i = 0; i < 8; i++) {
            tree = new TreeFormatter().append(segment, TREE, tree).insertTo(db);
            expected.insert(0, segment + "/");
        }
        assertEquals(Arrays.asList(expected.toString()), walkAll(db, tree));
    }

    @Test
    public void siblingsShareBufferAfterChildGrows() throws IOException {
        MemoryObjectDatabase db = new MemoryObjectDatabase();
        String longName = new String(new char[300]).replace('\0', 'q');
        ObjectId sub = new TreeFormatter().append(longName, REGULAR_FILE, blobA).insertTo(db);
        ObjectId root = new TreeFormatter().append("d", TREE, sub).insertTo(db);

        CanonicalTreeParser p = new CanonicalTreeParser(null, db, root, curs);
        byte[] before = p.path;
        CanonicalTreeParser child = p.createSubtreeIterator(db);
        assertNotSame(before, p.path);
        assertSame(p.path, child.path);
        assertEquals("d", p.getEntryPathString());
        assertEquals("d/" + longName, child.getEntryPathString());
    }

    private List<String> walkAll(ObjectDatabase db, ObjectId root) throws IOException {
        List<String> paths = new ArrayList<>();
        walk(db, new CanonicalTreeParser(null, db, root, curs), paths);
        return paths;
    }

    private void walk(ObjectDatabase db, CanonicalTreeParser p, List<String> paths)
            throws IOException {
        for (; !p.eof(); p.next(1)) {
            if (FileMode.isTree(p.getEntryRawMode())) {
                walk(db, p.createSubtreeIterator(db), paths);
            } else {
                paths.add(p.getEntryPathString());
            }
        }
    }
}
