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

import java.io.ByteArrayInputStream;
import java.io.InputStream;

import org.jetbrains.annotations.NotNull;

/**
 * Gives access to the type, size and bytes of one stored object.
 * <p>
 * How the bytes were obtained (loose file, pack, memory) is up to the
 * database that created the loader.
 */
public abstract class ObjectLoader {

    /**
     * @return the object type, one of the {@code OBJ_*} constants of
     *         {@link Constants}
     */
    public abstract int getType();

    /**
     * @return the size of the object in bytes
     */
    public abstract long getSize();

    /**
     * Obtain the object content without copying it.
     * <p>
     * Callers must not modify the returned array.
     */
    @NotNull
    protected abstract byte[] getCachedBytes();

    /**
     * @return a copy of the object content
     */
    @NotNull
    public byte[] getBytes() {
        return getCachedBytes().clone();
    }

    /**
     * @return a new stream over the object content
     */
    @NotNull
    public InputStream openStream() {
        return new ByteArrayInputStream(getCachedBytes());
    }

    /**
     * An object held fully in memory.
     */
    public static class SmallObject extends ObjectLoader {

        private final int type;

        private final byte[] data;

        public SmallObject(int type, @NotNull byte[] data) {
            this.type = type;
            this.data = data;
        }

        @Override
        public int getType() {
            return type;
        }

        @Override
        public long getSize() {
            return data.length;
        }

        @Override
        protected byte[] getCachedBytes() {
            return data;
        }
    }
}
