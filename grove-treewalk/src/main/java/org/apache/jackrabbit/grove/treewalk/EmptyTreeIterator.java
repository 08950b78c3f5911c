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
package org.apache.jackrabbit.grove.treewalk;

import org.apache.jackrabbit.grove.spi.store.ObjectDatabase;
import org.jetbrains.annotations.NotNull;

/**
 * Iterator over an empty tree (a directory with no files).
 */
public class EmptyTreeIterator extends AbstractTreeIterator {

    /** Create a new iterator with no parent. */
    public EmptyTreeIterator() {
        // Create a root empty tree.
    }

    EmptyTreeIterator(@NotNull AbstractTreeIterator p) {
        super(p);
        pathLen = pathOffset - 1;
    }

    /**
     * Create an iterator for a subtree of an existing iterator.
     * <p>
     * The caller is responsible for setting up the path of the child
     * iterator.
     *
     * @param p parent tree iterator.
     * @param childPath path array to be used by the child iterator. It must
     *            end with a {@code '/'}.
     * @param childPathOffset position within {@code childPath} where the
     *            child can insert its data.
     */
    public EmptyTreeIterator(@NotNull AbstractTreeIterator p, @NotNull byte[] childPath,
            int childPathOffset) {
        super(p, childPath, childPathOffset);
        pathLen = childPathOffset - 1;
    }

    @NotNull
    @Override
    public AbstractTreeIterator createSubtreeIterator(@NotNull ObjectDatabase db) {
        return new EmptyTreeIterator(this);
    }

    @Override
    public boolean hasId() {
        return false;
    }

    @NotNull
    @Override
    public byte[] idBuffer() {
        return ZERO_ID;
    }

    @Override
    public int idOffset() {
        return 0;
    }

    @Override
    public boolean first() {
        return true;
    }

    @Override
    public boolean eof() {
        return true;
    }

    @Override
    public void next(int delta) {
        // Do nothing.
    }

    @Override
    public void back(int delta) {
        // Do nothing.
    }

    @Override
    public void stopWalk() {
        if (parent != null) {
            parent.stopWalk();
        }
    }

    @Override
    public int getNameLength() {
        return 0;
    }

    @Override
    public void getName(@NotNull byte[] buffer, int offset) {
        // no name
    }

    @NotNull
    @Override
    public String getNameString() {
        return "";
    }
}
