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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The lazily loaded alternate list of an {@link ObjectDatabase}.
 * <p>
 * The list is computed on first access by exactly one thread; concurrent
 * callers wait on the cache lock and then observe the published list. After
 * {@link #invalidate()} the next access loads a new list (a new generation).
 * A loader that fails yields an empty list for that generation.
 */
public final class AlternateCache {

    private static final Logger LOG = LoggerFactory.getLogger(AlternateCache.class);

    /**
     * Computes the alternate list.
     */
    public interface Loader {

        @Nullable
        List<ObjectDatabase> load() throws IOException;
    }

    private final AtomicReference<List<ObjectDatabase>> alternates = new AtomicReference<>();

    private final AtomicInteger generation = new AtomicInteger();

    private final Object lock = new Object();

    private final Object owner;

    private final Loader loader;

    public AlternateCache(@NotNull Object owner, @NotNull Loader loader) {
        this.owner = owner;
        this.loader = loader;
    }

    /**
     * @return the published list, loading it first if needed. Never null.
     */
    @NotNull
    public List<ObjectDatabase> get() {
        List<ObjectDatabase> r = alternates.get();
        if (r == null) {
            synchronized (lock) {
                r = alternates.get();
                if (r == null) {
                    r = load();
                    alternates.set(r);
                }
            }
        }
        return r;
    }

    /**
     * @return the published list, or null if none is loaded
     */
    @Nullable
    public List<ObjectDatabase> peek() {
        return alternates.get();
    }

    /**
     * Drop the published list. A load in progress completes first, so the
     * list it publishes is the one returned here rather than one published
     * after this call.
     *
     * @return the list that was published, or null if none was. Each list is
     *         returned by at most one call.
     */
    @Nullable
    public List<ObjectDatabase> invalidate() {
        synchronized (lock) {
            return alternates.getAndSet(null);
        }
    }

    /**
     * @return number of times the loader has been invoked
     */
    public int generation() {
        return generation.get();
    }

    private List<ObjectDatabase> load() {
        int gen = generation.incrementAndGet();
        try {
            List<ObjectDatabase> loaded = loader.load();
            List<ObjectDatabase> r = loaded == null || loaded.isEmpty()
                    ? ObjectDatabase.NO_ALTERNATES
                    : ImmutableList.copyOf(loaded);
            LOG.debug("Loaded {} alternate(s) for {} (generation {})", r.size(), owner, gen);
            return r;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not load alternates of {}, continuing without them", owner, e);
            return ObjectDatabase.NO_ALTERNATES;
        }
    }
}
