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

import org.jetbrains.annotations.NotNull;

/**
 * A reusable object id, filled in place to avoid allocating an
 * {@link ObjectId} per visited entry.
 */
public class MutableObjectId extends AnyObjectId {

    /**
     * Load this id from a raw byte buffer.
     */
    public void fromRaw(byte[] buf, int off) {
        w1 = readInt(buf, off);
        w2 = readInt(buf, off + 4);
        w3 = readInt(buf, off + 8);
        w4 = readInt(buf, off + 12);
        w5 = readInt(buf, off + 16);
    }

    /**
     * Load this id from another one.
     */
    public void fromObjectId(@NotNull AnyObjectId src) {
        w1 = src.w1;
        w2 = src.w2;
        w3 = src.w3;
        w4 = src.w4;
        w5 = src.w5;
    }

    /**
     * Reset this id to the zero id.
     */
    public void clear() {
        w1 = 0;
        w2 = 0;
        w3 = 0;
        w4 = 0;
        w5 = 0;
    }

    @Override
    public ObjectId copy() {
        return new ObjectId(w1, w2, w3, w4, w5);
    }
}
