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
package org.apache.jackrabbit.grove.spi.store;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.jackrabbit.grove.commons.junit.LogCustomizer;
import org.junit.Before;
import org.junit.Test;

import ch.qos.logback.classic.Level;

public class ObjectDatabaseTest {

    private final ObjectId id = ObjectId.forContent(Constants.OBJ_BLOB, Constants.encode("hello"));

    private List<String> journal;

    private RecordingDatabase primary;

    private RecordingDatabase b;

    private RecordingDatabase c;

    @Before
    public void setUp() {
        journal = new ArrayList<>();
        b = new RecordingDatabase("B", journal);
        c = new RecordingDatabase("C", journal);
        primary = new RecordingDatabase("A", journal).withAlternates(b, c);
    }

    @Test
    public void fastHitInPrimaryStopsSearch() {
        primary.fast.add(id);
        assertTrue(primary.hasObject(id));
        assertEquals(ImmutableList.of("A.fast"), journal);
    }

    @Test
    public void fastPathsOfAllAlternatesBeforeAnySlowPath() {
        c.slow.add(id);
        assertTrue(primary.hasObject(id));
        assertEquals(ImmutableList.of(
                "A.fast", "B.fast", "B.retry", "C.fast", "C.retry", "A.retry",
                "A.slow", "B.slow", "C.slow"), journal);
    }

    @Test
    public void fastHitInLastAlternate() {
        primary.slow.add(id);
        c.fast.add(id);
        assertTrue(primary.hasObject(id));
        assertEquals(ImmutableList.of("A.fast", "B.fast", "B.retry", "C.fast"), journal);
    }

    @Test
    public void retryChecksPrimaryFastPathAgain() {
        primary.retry = true;
        assertFalse(primary.hasObject(id));
        assertEquals(ImmutableList.of(
                "A.fast", "B.fast", "B.retry", "C.fast", "C.retry", "A.retry", "A.fast",
                "A.slow", "B.slow", "C.slow"), journal);
    }

    @Test
    public void missingObjectIsNotAnError() throws IOException {
        assertFalse(primary.hasObject(id));
        assertNull(primary.openObject(new WindowCursor(), id));
    }

    @Test
    public void openObjectDoesNotRetryFastPath() throws IOException {
        primary.retry = true;
        b.slow.add(id);
        ObjectLoader ldr = primary.openObject(new WindowCursor(), id);
        assertNotNull(ldr);
        assertEquals("B", new String(ldr.getBytes(), Constants.CHARSET));
        assertEquals(ImmutableList.of(
                "A.open-fast", "B.open-fast", "C.open-fast",
                "A.open-slow:true", "B.open-slow:true"), journal);
    }

    @Test
    public void nestedAlternatesAreSearchedDepthFirst() {
        List<String> j = journal;
        RecordingDatabase d = new RecordingDatabase("D", j);
        RecordingDatabase e = new RecordingDatabase("E", j).withAlternates(d);
        RecordingDatabase root = new RecordingDatabase("R", j).withAlternates(e, b);
        b.fast.add(id);
        assertTrue(root.hasObject(id));
        assertEquals(ImmutableList.of("R.fast", "E.fast", "D.fast", "D.retry", "E.retry", "B.fast"), j);
    }

    @Test
    public void alternatesLoadedOnceAndCached() {
        assertSame(primary.getAlternates(), primary.getAlternates());
        primary.hasObject(id);
        assertEquals(1, primary.loads);
        assertEquals(ImmutableList.of(b, c), primary.getAlternates());
    }

    @Test
    public void closeReleasesAlternatesExactlyOnce() {
        ObjectDatabase alt1 = mock(ObjectDatabase.class);
        ObjectDatabase alt2 = mock(ObjectDatabase.class);
        RecordingDatabase db = new RecordingDatabase("X", journal).withAlternates(alt1, alt2);
        db.getAlternates();

        db.close();
        db.closeAlternates();
        verify(alt1, times(1)).close();
        verify(alt2, times(1)).close();

        // a new generation is loaded on demand
        assertEquals(2, db.getAlternates().size());
        assertEquals(2, db.loads);
    }

    @Test
    public void closeWithoutLoadedAlternatesDoesNotLoadThem() {
        primary.close();
        assertEquals(0, primary.loads);
    }

    @Test
    public void mockedAlternateAnswersFastPath() {
        ObjectDatabase alt1 = mock(ObjectDatabase.class);
        ObjectDatabase alt2 = mock(ObjectDatabase.class);
        when(alt1.hasObject1(any())).thenReturn(true);
        RecordingDatabase db = new RecordingDatabase("X", journal).withAlternates(alt1, alt2);

        assertTrue(db.hasObject(id));
        verify(alt1).hasObject1(id);
        verify(alt2, never()).hasObject1(any());
        verify(alt1, never()).hasObject2(any());
    }

    @Test
    public void failingAlternateLoadMeansNoAlternates() {
        LogCustomizer logs = LogCustomizer.forLogger(AlternateCache.class)
                .enable(Level.WARN).contains("Could not load alternates").create();
        logs.starting();
        try {
            ObjectDatabase db = new RecordingDatabase("F", journal) {
                @Override
                protected List<ObjectDatabase> loadAlternates() {
                    throw new IllegalStateException("broken alternates");
                }
            };
            assertTrue(db.getAlternates().isEmpty());
            assertFalse(db.hasObject(id));
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    @Test
    public void allPackCopiesAreCollected() throws IOException {
        MemoryObjectDatabase alt1 = new MemoryObjectDatabase("alt1");
        MemoryObjectDatabase alt2 = new MemoryObjectDatabase("alt2");
        byte[] data = Constants.encode("shared");
        ObjectId shared = alt1.addPack("pack-1", Constants.OBJ_BLOB, data).get(0);
        alt2.addPack("pack-2", Constants.OBJ_BLOB, data);
        alt1.scanPacks();
        alt2.scanPacks();
        MemoryObjectDatabase db = new MemoryObjectDatabase("main");
        db.setAlternates(alt1, alt2);

        List<PackedObjectLoader> out = new ArrayList<>();
        db.openObjectInAllPacks(out, new WindowCursor(), shared);
        assertEquals(2, out.size());
        assertEquals("pack-1", out.get(0).getPackName());
        assertEquals("pack-2", out.get(1).getPackName());
    }

    @Test
    public void defaultsOfAbstractDatabase() throws IOException {
        ObjectDatabase db = new ObjectDatabase() {
            @Override
            protected boolean hasObject1(AnyObjectId objectId) {
                return false;
            }

            @Override
            protected ObjectLoader openObject1(WindowCursor curs, AnyObjectId objectId) {
                return null;
            }
        };
        assertTrue(db.exists());
        db.create();
        assertTrue(db.exists());
        assertSame(ObjectDatabase.NO_ALTERNATES, db.getAlternates());

        List<PackedObjectLoader> out = new ArrayList<>();
        db.openObjectInAllPacks(out, new WindowCursor(), id);
        assertTrue(out.isEmpty());
        db.close();
    }
}
