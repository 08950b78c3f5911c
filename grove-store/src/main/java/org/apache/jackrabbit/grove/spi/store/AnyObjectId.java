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

import static org.apache.jackrabbit.grove.spi.store.Constants.OBJECT_ID_LENGTH;

import org.apache.jackrabbit.grove.commons.StringUtils;
import org.jetbrains.annotations.NotNull;

/**
 * A content address: the fixed length binary hash naming an object.
 * <p>
 * The 20 raw bytes are held as five big endian ints so that comparisons do
 * not need to touch a byte array. Instances order by unsigned byte value.
 * <p>
 * Two {@code AnyObjectId}s are equal when their bytes are equal, regardless
 * of whether one is mutable.
 */
public abstract class AnyObjectId implements Comparable<AnyObjectId> {

    int w1;
    int w2;
    int w3;
    int w4;
    int w5;

    /**
     * Compare two ids stored in raw form inside larger buffers.
     *
     * @return true if the {@link Constants#OBJECT_ID_LENGTH} bytes starting
     *         at {@code aOff} equal those starting at {@code bOff}
     */
    public static boolean equals(byte[] a, int aOff, byte[] b, int bOff) {
        for (int i = 0; i < OBJECT_ID_LENGTH; i++) {
            if (a[aOff + i] != b[bOff + i]) {
                return false;
            }
        }
        return true;
    }

    static int readInt(byte[] buf, int off) {
        return (buf[off] & 0xff) << 24
                | (buf[off + 1] & 0xff) << 16
                | (buf[off + 2] & 0xff) << 8
                | (buf[off + 3] & 0xff);
    }

    static void writeInt(byte[] buf, int off, int v) {
        buf[off] = (byte) (v >>> 24);
        buf[off + 1] = (byte) (v >>> 16);
        buf[off + 2] = (byte) (v >>> 8);
        buf[off + 3] = (byte) v;
    }

    /**
     * Copy the raw bytes of this id into a buffer.
     */
    public void copyRawTo(byte[] buf, int off) {
        writeInt(buf, off, w1);
        writeInt(buf, off + 4, w2);
        writeInt(buf, off + 8, w3);
        writeInt(buf, off + 12, w4);
        writeInt(buf, off + 16, w5);
    }

    /**
     * Compare this id with one stored in raw form.
     */
    public boolean equals(byte[] buf, int off) {
        return w1 == readInt(buf, off)
                && w2 == readInt(buf, off + 4)
                && w3 == readInt(buf, off + 8)
                && w4 == readInt(buf, off + 12)
                && w5 == readInt(buf, off + 16);
    }

    /**
     * @return the lower case hex form of this id
     */
    @NotNull
    public final String name() {
        byte[] raw = new byte[OBJECT_ID_LENGTH];
        copyRawTo(raw, 0);
        return StringUtils.convertBytesToHex(raw);
    }

    /**
     * @return an immutable copy, or this instance if already immutable
     */
    @NotNull
    public abstract ObjectId copy();

    @Override
    public final int compareTo(AnyObjectId other) {
        if (this == other) {
            return 0;
        }
        int cmp = Integer.compareUnsigned(w1, other.w1);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compareUnsigned(w2, other.w2);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compareUnsigned(w3, other.w3);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compareUnsigned(w4, other.w4);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compareUnsigned(w5, other.w5);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnyObjectId)) {
            return false;
        }
        AnyObjectId other = (AnyObjectId) o;
        return w1 == other.w1 && w2 == other.w2 && w3 == other.w3
                && w4 == other.w4 && w5 == other.w5;
    }

    @Override
    public final int hashCode() {
        // already uniformly distributed
        return w2;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + "]";
    }
}
