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

/**
 * Per call scratch space for object access.
 * <p>
 * A cursor is owned by one caller at a time and must not be shared between
 * concurrent lookups. Call {@link #release()} when done to drop the buffers
 * it holds.
 */
public final class WindowCursor {

    private byte[] tempBuffer;

    private final MutableObjectId tempId = new MutableObjectId();

    /**
     * Obtain a temporary buffer of at least the given size.
     * <p>
     * The returned array may be the one handed out by a previous call, so its
     * content must be considered garbage.
     */
    public byte[] tempBuffer(int minSize) {
        if (tempBuffer == null || tempBuffer.length < minSize) {
            tempBuffer = new byte[Math.max(minSize, 8192)];
        }
        return tempBuffer;
    }

    /**
     * @return a scratch id that lives as long as this cursor
     */
    public MutableObjectId tempId() {
        return tempId;
    }

    /**
     * Release the buffers held by this cursor.
     */
    public void release() {
        tempBuffer = null;
        tempId.clear();
    }
}
