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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstraction of arbitrary object storage.
 * <p>
 * An object database stores objects indexed by their {@link ObjectId}.
 * Optionally it references alternates: other {@code ObjectDatabase} instances
 * that are searched in addition to this one, recursively.
 * <p>
 * Each database is split into a half that is fast to search (for example an
 * indexed pack) and a half that is slow to search (for example unindexed
 * loose files). The fast half of this database and of every alternate is
 * searched before any slow half is considered.
 * <p>
 * Instances are safe for use by concurrent callers. A {@link WindowCursor}
 * passed to the lookup methods belongs to the calling thread.
 */
public abstract class ObjectDatabase implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectDatabase.class);

    /** Constant indicating no alternate databases exist. */
    public static final List<ObjectDatabase> NO_ALTERNATES = ImmutableList.of();

    private final AlternateCache alternates;

    /**
     * Initialize a new database instance for access.
     */
    protected ObjectDatabase() {
        alternates = new AlternateCache(this, this::loadAlternates);
    }

    /**
     * Does this database exist yet?
     *
     * @return true if this database is already created; false if the caller
     *         should invoke {@link #create()} to create this database location.
     */
    public boolean exists() {
        return true;
    }

    /**
     * Initialize a new object database at this location. Calling it on an
     * existing database has no effect.
     *
     * @throws IOException the database could not be created.
     */
    public void create() throws IOException {
        // Assume no action is required.
    }

    /**
     * Close any resources held by this database and its loaded alternates.
     */
    @Override
    public void close() {
        closeSelf();
        closeAlternates();
    }

    /**
     * Close any resources held by this database only, ignoring alternates.
     * <p>
     * To fully close this database and its alternates, invoke
     * {@link #close()} instead.
     */
    public void closeSelf() {
        // Assume no action is required.
    }

    /**
     * Fully close all loaded alternates and clear the alternate list. The next
     * access to the alternates loads them again.
     */
    public void closeAlternates() {
        List<ObjectDatabase> alt = alternates.invalidate();
        if (alt != null) {
            for (ObjectDatabase d : alt) {
                d.close();
            }
        }
    }

    /**
     * Does the requested object exist in this database?
     * <p>
     * Alternates (if present) are searched automatically.
     *
     * @param objectId identity of the object to test for existence of.
     * @return true if the specified object is stored in this database, or any
     *         of the alternate databases.
     */
    public boolean hasObject(@NotNull AnyObjectId objectId) {
        checkNotNull(objectId);
        if (hasObjectImpl1(objectId)) {
            return true;
        }
        LOG.trace("{} not found by any fast search of {}", objectId, this);
        return hasObjectImpl2(objectId.name());
    }

    private boolean hasObjectImpl1(AnyObjectId objectId) {
        if (hasObject1(objectId)) {
            return true;
        }
        for (ObjectDatabase alt : getAlternates()) {
            if (alt.hasObjectImpl1(objectId)) {
                return true;
            }
        }
        return tryAgain1() && hasObject1(objectId);
    }

    private boolean hasObjectImpl2(String objectName) {
        if (hasObject2(objectName)) {
            return true;
        }
        for (ObjectDatabase alt : getAlternates()) {
            if (alt.hasObjectImpl2(objectName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fast half of {@link #hasObject(AnyObjectId)}.
     *
     * @param objectId identity of the object to test for existence of.
     * @return true if the specified object is stored in this database.
     */
    protected abstract boolean hasObject1(@NotNull AnyObjectId objectId);

    /**
     * Slow half of {@link #hasObject(AnyObjectId)}.
     *
     * @param objectName hex name of the object to test for existence of.
     * @return true if the specified object is stored in this database.
     */
    protected boolean hasObject2(@NotNull String objectName) {
        // Assume the search took place during hasObject1.
        return false;
    }

    /**
     * Open an object from this database.
     * <p>
     * Alternates (if present) are searched automatically.
     *
     * @param curs temporary working space associated with the calling thread.
     * @param objectId identity of the object to open.
     * @return a loader for the data of the named object, or null if the object
     *         does not exist.
     * @throws IOException the object exists but could not be read.
     */
    @Nullable
    public ObjectLoader openObject(@NotNull WindowCursor curs, @NotNull AnyObjectId objectId)
            throws IOException {
        checkNotNull(objectId);
        ObjectLoader ldr = openObjectImpl1(curs, objectId);
        if (ldr != null) {
            return ldr;
        }
        LOG.trace("{} not opened by any fast search of {}", objectId, this);
        return openObjectImpl2(curs, objectId.name(), objectId);
    }

    private ObjectLoader openObjectImpl1(WindowCursor curs, AnyObjectId objectId)
            throws IOException {
        ObjectLoader ldr = openObject1(curs, objectId);
        if (ldr != null) {
            return ldr;
        }
        for (ObjectDatabase alt : getAlternates()) {
            ldr = alt.openObjectImpl1(curs, objectId);
            if (ldr != null) {
                return ldr;
            }
        }
        return null;
    }

    private ObjectLoader openObjectImpl2(WindowCursor curs, String objectName, AnyObjectId objectId)
            throws IOException {
        ObjectLoader ldr = openObject2(curs, objectName, objectId);
        if (ldr != null) {
            return ldr;
        }
        for (ObjectDatabase alt : getAlternates()) {
            ldr = alt.openObjectImpl2(curs, objectName, objectId);
            if (ldr != null) {
                return ldr;
            }
        }
        return null;
    }

    /**
     * Fast half of {@link #openObject(WindowCursor, AnyObjectId)}.
     *
     * @param curs temporary working space associated with the calling thread.
     * @param objectId identity of the object to open.
     * @return a loader for the object, or null if it is not stored here.
     * @throws IOException the object exists but could not be read.
     */
    @Nullable
    protected abstract ObjectLoader openObject1(@NotNull WindowCursor curs, @NotNull AnyObjectId objectId)
            throws IOException;

    /**
     * Slow half of {@link #openObject(WindowCursor, AnyObjectId)}.
     *
     * @param curs temporary working space associated with the calling thread.
     * @param objectName hex name of the object to open.
     * @param objectId identity of the object to open.
     * @return a loader for the object, or null if it is not stored here.
     * @throws IOException the object exists but could not be read.
     */
    @Nullable
    protected ObjectLoader openObject2(@NotNull WindowCursor curs, @NotNull String objectName,
            @NotNull AnyObjectId objectId) throws IOException {
        // Assume the search took place during openObject1.
        return null;
    }

    /**
     * Open the object from every pack containing it.
     * <p>
     * Alternates are searched too, recursively, so that each physical copy of
     * the object contributes one loader.
     *
     * @param out receives one loader per pack holding the object.
     * @param curs temporary working space associated with the calling thread.
     * @param objectId identity of the object to search for.
     * @throws IOException a pack holding the object could not be read.
     */
    public void openObjectInAllPacks(@NotNull Collection<PackedObjectLoader> out,
            @NotNull WindowCursor curs, @NotNull AnyObjectId objectId) throws IOException {
        openObjectInAllPacksImpl(out, curs, objectId);
        for (ObjectDatabase alt : getAlternates()) {
            alt.openObjectInAllPacks(out, curs, objectId);
        }
    }

    /**
     * Contribute the loaders of this database only to
     * {@link #openObjectInAllPacks(Collection, WindowCursor, AnyObjectId)}.
     */
    protected void openObjectInAllPacksImpl(@NotNull Collection<PackedObjectLoader> out,
            @NotNull WindowCursor curs, @NotNull AnyObjectId objectId) throws IOException {
        // Assume no pack support
    }

    /**
     * Whether the fast half of {@link #hasObject(AnyObjectId)} should be
     * searched once more after all alternates missed. Typically true when the
     * fast index changed since it was last read.
     */
    protected boolean tryAgain1() {
        return false;
    }

    /**
     * Get the alternate databases known to this database.
     *
     * @return the alternate list, in search order. Never null, but may be
     *         empty.
     */
    @NotNull
    public List<ObjectDatabase> getAlternates() {
        return alternates.get();
    }

    /**
     * Load the list of alternate databases.
     * <p>
     * Invoked by {@link #getAlternates()} when the list has not been loaded
     * yet, or was cleared by {@link #closeAlternates()}. At most one thread
     * runs this method at a time for a given database.
     *
     * @return the alternate list for this database; {@link #NO_ALTERNATES}
     *         if there are none.
     * @throws IOException the alternate list could not be read. No alternates
     *             are assumed by the caller.
     */
    @NotNull
    protected List<ObjectDatabase> loadAlternates() throws IOException {
        return NO_ALTERNATES;
    }
}
