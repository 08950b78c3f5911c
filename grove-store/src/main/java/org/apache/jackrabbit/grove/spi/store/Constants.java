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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.jetbrains.annotations.NotNull;

/**
 * Constants of the object model.
 */
public final class Constants {

    /** Hash function used natively to compute object names. */
    public static final String HASH_FUNCTION = "SHA-1";

    /** Number of bytes in a raw object id. */
    public static final int OBJECT_ID_LENGTH = 20;

    /** Number of characters in a hex encoded object id. */
    public static final int OBJECT_ID_STRING_LENGTH = OBJECT_ID_LENGTH * 2;

    /** Separator between path segments. */
    public static final byte SEPARATOR = '/';

    public static final int OBJ_BAD = -1;
    public static final int OBJ_COMMIT = 1;
    public static final int OBJ_TREE = 2;
    public static final int OBJ_BLOB = 3;
    public static final int OBJ_TAG = 4;

    public static final String TYPE_COMMIT = "commit";
    public static final String TYPE_TREE = "tree";
    public static final String TYPE_BLOB = "blob";
    public static final String TYPE_TAG = "tag";

    /** Encoding used for paths and object headers. */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    private Constants() {}

    /**
     * @return a new digest for computing object names
     */
    @NotNull
    public static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(HASH_FUNCTION);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Required hash function " + HASH_FUNCTION + " not available", e);
        }
    }

    /**
     * Convert an object type code to its canonical name.
     *
     * @throws IllegalArgumentException for an unknown type code
     */
    @NotNull
    public static String typeString(int type) {
        switch (type) {
            case OBJ_COMMIT:
                return TYPE_COMMIT;
            case OBJ_TREE:
                return TYPE_TREE;
            case OBJ_BLOB:
                return TYPE_BLOB;
            case OBJ_TAG:
                return TYPE_TAG;
            default:
                throw new IllegalArgumentException("Bad object type: " + type);
        }
    }

    /**
     * Convert a canonical type name to its code.
     *
     * @return the type code, or {@link #OBJ_BAD} if the name is unknown
     */
    public static int typeCode(String name) {
        switch (name) {
            case TYPE_COMMIT:
                return OBJ_COMMIT;
            case TYPE_TREE:
                return OBJ_TREE;
            case TYPE_BLOB:
                return OBJ_BLOB;
            case TYPE_TAG:
                return OBJ_TAG;
            default:
                return OBJ_BAD;
        }
    }

    /**
     * Encode a string in {@link #CHARSET}.
     */
    @NotNull
    public static byte[] encode(@NotNull String str) {
        return str.getBytes(CHARSET);
    }
}
