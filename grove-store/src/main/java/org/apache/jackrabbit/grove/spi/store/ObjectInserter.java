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

import org.jetbrains.annotations.NotNull;

/**
 * A database that accepts new objects.
 */
public interface ObjectInserter {

    /**
     * Store an object, unless an object with the same content is already
     * stored.
     *
     * @param type object type, one of the {@code OBJ_*} constants of
     *            {@link Constants}
     * @param data the object content
     * @return the name of the object
     * @throws IOException if the object could not be written
     */
    @NotNull
    ObjectId insert(int type, @NotNull byte[] data) throws IOException;
}
