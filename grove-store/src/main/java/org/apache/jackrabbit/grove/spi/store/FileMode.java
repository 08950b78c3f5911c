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
import java.io.OutputStream;

import org.jetbrains.annotations.NotNull;

/**
 * Type and permission bits of a tree entry.
 * <p>
 * Only the bits under {@link #TYPE_MASK} decide the kind of an entry; the
 * remaining bits are permissions. A mode is usually handled as a raw int,
 * this class gives the well known values a name.
 */
public abstract class FileMode {

    /** Mask to apply to a raw mode to get its type bits. */
    public static final int TYPE_MASK = 0170000;

    public static final int TYPE_TREE = 0040000;
    public static final int TYPE_SYMLINK = 0120000;
    public static final int TYPE_FILE = 0100000;
    public static final int TYPE_GITLINK = 0160000;
    public static final int TYPE_MISSING = 0000000;

    /** Mode of a subtree. */
    public static final FileMode TREE = new FileMode(TYPE_TREE, Constants.OBJ_TREE) {
        @Override
        public boolean equals(int modeBits) {
            return (modeBits & TYPE_MASK) == TYPE_TREE;
        }
    };

    /** Mode of a symbolic link. */
    public static final FileMode SYMLINK = new FileMode(TYPE_SYMLINK, Constants.OBJ_BLOB) {
        @Override
        public boolean equals(int modeBits) {
            return (modeBits & TYPE_MASK) == TYPE_SYMLINK;
        }
    };

    /** Mode of a non-executable file. */
    public static final FileMode REGULAR_FILE = new FileMode(0100644, Constants.OBJ_BLOB) {
        @Override
        public boolean equals(int modeBits) {
            return (modeBits & TYPE_MASK) == TYPE_FILE && (modeBits & 0111) == 0;
        }
    };

    /** Mode of an executable file. */
    public static final FileMode EXECUTABLE_FILE = new FileMode(0100755, Constants.OBJ_BLOB) {
        @Override
        public boolean equals(int modeBits) {
            return (modeBits & TYPE_MASK) == TYPE_FILE && (modeBits & 0111) != 0;
        }
    };

    /** Mode of a link to a commit of another repository. */
    public static final FileMode GITLINK = new FileMode(TYPE_GITLINK, Constants.OBJ_COMMIT) {
        @Override
        public boolean equals(int modeBits) {
            return (modeBits & TYPE_MASK) == TYPE_GITLINK;
        }
    };

    /** Mode of an entry that does not exist. */
    public static final FileMode MISSING = new FileMode(TYPE_MISSING, Constants.OBJ_BAD) {
        @Override
        public boolean equals(int modeBits) {
            return modeBits == 0;
        }
    };

    private final int modeBits;

    private final int objectType;

    private final byte[] octalBytes;

    private FileMode(int mode, int objectType) {
        this.modeBits = mode;
        this.objectType = objectType;
        this.octalBytes = Constants.encode(Integer.toOctalString(mode));
    }

    /**
     * Convert a set of raw mode bits into one of the well known modes.
     * <p>
     * Unknown types map to an anonymous mode carrying the raw bits.
     */
    @NotNull
    public static FileMode fromBits(final int bits) {
        switch (bits & TYPE_MASK) {
            case TYPE_MISSING:
                if (bits == 0) {
                    return MISSING;
                }
                break;
            case TYPE_TREE:
                return TREE;
            case TYPE_FILE:
                if ((bits & 0111) != 0) {
                    return EXECUTABLE_FILE;
                }
                return REGULAR_FILE;
            case TYPE_SYMLINK:
                return SYMLINK;
            case TYPE_GITLINK:
                return GITLINK;
            default:
                break;
        }
        return new FileMode(bits, Constants.OBJ_BAD) {
            @Override
            public boolean equals(int a) {
                return bits == a;
            }
        };
    }

    /**
     * Whether raw mode bits denote a subtree.
     */
    public static boolean isTree(int modeBits) {
        return (modeBits & TYPE_MASK) == TYPE_TREE;
    }

    /**
     * Test a raw mode against this mode.
     *
     * @return true if the bits represent the same kind of entry as this mode
     */
    public abstract boolean equals(int modeBits);

    /**
     * @return the raw mode bits of this mode
     */
    public int getBits() {
        return modeBits;
    }

    /**
     * @return the object type an entry of this mode names, one of the
     *         {@code OBJ_*} constants of {@link Constants}
     */
    public int getObjectType() {
        return objectType;
    }

    /**
     * Write the octal ASCII form of this mode, as used in canonical trees.
     */
    public void copyTo(OutputStream os) throws IOException {
        os.write(octalBytes);
    }

    /**
     * @return the number of bytes {@link #copyTo(OutputStream)} writes
     */
    public int copyToLength() {
        return octalBytes.length;
    }

    @Override
    public String toString() {
        return Integer.toOctalString(modeBits);
    }
}
