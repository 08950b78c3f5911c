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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A heap backed object database. Useful for testing.
 * <p>
 * The fast half is a list of named in-memory packs. Packs added through
 * {@link #addPack(String, Map)} are only seen by the fast half once the pack
 * list is rescanned, which {@link #tryAgain1()} does on demand, so a lookup
 * racing with a pack being published still finds the object. The slow half
 * is a map of loose objects keyed by hex name.
 */
public class MemoryObjectDatabase extends ObjectDatabase implements ObjectInserter {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryObjectDatabase.class);

    private final String name;

    private final Map<String, ObjectLoader.SmallObject> loose = new ConcurrentHashMap<>();

    private final List<Pack> pendingPacks = new CopyOnWriteArrayList<>();

    private final AtomicReference<List<Pack>> scannedPacks =
            new AtomicReference<List<Pack>>(ImmutableList.<Pack>of());

    private volatile List<ObjectDatabase> configuredAlternates = NO_ALTERNATES;

    public MemoryObjectDatabase(@NotNull String name) {
        this.name = checkNotNull(name);
    }

    public MemoryObjectDatabase() {
        this("memory");
    }

    /**
     * Store a loose object. Loose objects are found by the slow half only.
     */
    @Override
    public ObjectId insert(int type, @NotNull byte[] data) {
        ObjectId id = ObjectId.forContent(type, data);
        loose.putIfAbsent(id.name(), new ObjectLoader.SmallObject(type, data.clone()));
        return id;
    }

    /**
     * Remove a loose object.
     *
     * @return true if it was present
     */
    public boolean removeLoose(@NotNull AnyObjectId id) {
        return loose.remove(id.name()) != null;
    }

    /**
     * Publish a pack. The pack becomes visible to the fast half on the next
     * rescan.
     *
     * @param packName name of the pack, unique within this database
     * @param objects the objects of the pack with their types
     */
    public synchronized void addPack(@NotNull String packName,
            @NotNull Map<ObjectId, ObjectLoader.SmallObject> objects) {
        checkNotNull(packName);
        for (Pack p : allPacks()) {
            checkArgument(!p.name.equals(packName), "Duplicate pack name %s in %s", packName, this);
        }
        pendingPacks.add(new Pack(packName, ImmutableMap.copyOf(objects)));
    }

    /**
     * Convenience for {@link #addPack(String, Map)}: pack the given contents
     * with the given type.
     *
     * @return the ids of the packed objects, in argument order
     */
    public List<ObjectId> addPack(@NotNull String packName, int type, @NotNull byte[]... contents) {
        ImmutableMap.Builder<ObjectId, ObjectLoader.SmallObject> objects = ImmutableMap.builder();
        List<ObjectId> ids = Lists.newArrayListWithCapacity(contents.length);
        for (byte[] data : contents) {
            ObjectId id = ObjectId.forContent(type, data);
            if (!ids.contains(id)) {
                objects.put(id, new ObjectLoader.SmallObject(type, data.clone()));
            }
            ids.add(id);
        }
        addPack(packName, objects.build());
        return ids;
    }

    /**
     * Read the pending pack list into the fast half.
     *
     * @return true if the set of packs visible to the fast half changed
     */
    public synchronized boolean scanPacks() {
        if (pendingPacks.isEmpty()) {
            return false;
        }
        List<Pack> pending = new ArrayList<>(pendingPacks);
        pendingPacks.removeAll(pending);
        scannedPacks.set(ImmutableList.<Pack>builder()
                .addAll(scannedPacks.get())
                .addAll(pending)
                .build());
        LOG.debug("{} scanned {} new pack(s)", this, pending.size());
        return true;
    }

    /**
     * Set the alternates returned by the next load of the alternate list.
     * Alternates already loaded stay in use until {@link #closeAlternates()}.
     */
    public void setAlternates(@NotNull ObjectDatabase... alternates) {
        this.configuredAlternates = ImmutableList.copyOf(alternates);
    }

    @Override
    protected boolean hasObject1(AnyObjectId objectId) {
        for (Pack p : scannedPacks.get()) {
            if (p.objects.containsKey(objectId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected boolean hasObject2(String objectName) {
        return loose.containsKey(objectName);
    }

    @Override
    protected ObjectLoader openObject1(WindowCursor curs, AnyObjectId objectId) {
        for (Pack p : scannedPacks.get()) {
            ObjectLoader.SmallObject o = p.objects.get(objectId);
            if (o != null) {
                return new PackedObjectLoader(p.name, o.getType(), o.getCachedBytes());
            }
        }
        return null;
    }

    @Override
    protected ObjectLoader openObject2(WindowCursor curs, String objectName, AnyObjectId objectId) {
        return loose.get(objectName);
    }

    @Override
    protected void openObjectInAllPacksImpl(Collection<PackedObjectLoader> out, WindowCursor curs,
            AnyObjectId objectId) {
        for (Pack p : scannedPacks.get()) {
            ObjectLoader.SmallObject o = p.objects.get(objectId);
            if (o != null) {
                out.add(new PackedObjectLoader(p.name, o.getType(), o.getCachedBytes()));
            }
        }
    }

    @Override
    protected boolean tryAgain1() {
        return scanPacks();
    }

    @Override
    protected List<ObjectDatabase> loadAlternates() {
        return configuredAlternates;
    }

    @Override
    public String toString() {
        return "MemoryObjectDatabase[" + name + "]";
    }

    /** Callers hold the monitor, so no pack moves from pending to scanned meanwhile. */
    private List<Pack> allPacks() {
        List<Pack> all = new ArrayList<>(scannedPacks.get());
        all.addAll(pendingPacks);
        return all;
    }

    private static final class Pack {

        final String name;

        final Map<ObjectId, ObjectLoader.SmallObject> objects;

        Pack(String name, Map<ObjectId, ObjectLoader.SmallObject> objects) {
            this.name = name;
            this.objects = objects;
        }
    }
}
