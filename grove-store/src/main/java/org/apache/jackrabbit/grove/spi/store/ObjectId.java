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
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJECT_ID_LENGTH;
import static org.apache.jackrabbit.grove.spi.store.Constants.OBJECT_ID_STRING_LENGTH;

import java.security.MessageDigest;

import org.apache.jackrabbit.grove.commons.StringUtils;
import org.jetbrains.annotations.NotNull;

/**
 * An immutable object id.
 */
public final class ObjectId extends AnyObjectId {

    private static final ObjectId ZERO_ID = new ObjectId(0, 0, 0, 0, 0);

    ObjectId(int w1, int w2, int w3, int w4, int w5) {
        this.w1 = w1;
        this.w2 = w2;
        this.w3 = w3;
        this.w4 = w4;
        this.w5 = w5;
    }

    /**
     * @return the id made of {@link Constants#OBJECT_ID_LENGTH} zero bytes
     */
    @NotNull
    public static ObjectId zeroId() {
        return ZERO_ID;
    }

    /**
     * Whether the string is a well formed, full length object name.
     */
    public static boolean isId(String name) {
        return name != null
                && name.length() == OBJECT_ID_STRING_LENGTH
                && StringUtils.isHex(name);
    }

    /**
     * Read an id from a raw byte buffer.
     *
     * @param buf buffer holding at least {@code off + 20} bytes
     * @param off position of the first id byte
     */
    @NotNull
    public static ObjectId fromRaw(@NotNull byte[] buf, int off) {
        checkArgument(off >= 0 && off + OBJECT_ID_LENGTH <= buf.length,
                "no object id at offset %s of a %s byte buffer", off, buf.length);
        return new ObjectId(
                readInt(buf, off),
                readInt(buf, off + 4),
                readInt(buf, off + 8),
                readInt(buf, off + 12),
                readInt(buf, off + 16));
    }

    @NotNull
    public static ObjectId fromRaw(@NotNull byte[] raw) {
        return fromRaw(raw, 0);
    }

    /**
     * Parse a hex encoded id.
     *
     * @throws IllegalArgumentException if the name is not a full length hex id
     */
    @NotNull
    public static ObjectId fromString(@NotNull String name) {
        checkNotNull(name);
        checkArgument(isId(name), "Invalid object id: %s", name);
        return fromRaw(StringUtils.convertHexToBytes(name));
    }

    /**
     * Compute the name of an object from its type and content, as
     * {@code SHA-1("<type> <length>\0" + data)}.
     */
    @NotNull
    public static ObjectId forContent(int type, @NotNull byte[] data) {
        return forContent(type, data, 0, data.length);
    }

    @NotNull
    public static ObjectId forContent(int type, @NotNull byte[] data, int off, int len) {
        MessageDigest md = Constants.newMessageDigest();
        md.update(Constants.encode(Constants.typeString(type)));
        md.update((byte) ' ');
        md.update(Constants.encode(Integer.toString(len)));
        md.update((byte) 0);
        md.update(data, off, len);
        return fromRaw(md.digest());
    }

    @Override
    public ObjectId copy() {
        return this;
    }
}
