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
 * A loader for an object found through a pack index, remembering which pack
 * produced it so that callers holding several copies can tell them apart.
 */
public class PackedObjectLoader extends ObjectLoader.SmallObject {

    private final String packName;

    public PackedObjectLoader(@NotNull String packName, int type, @NotNull byte[] data) {
        super(type, data);
        this.packName = packName;
    }

    /**
     * @return name of the pack this copy was read from
     */
    @NotNull
    public String getPackName() {
        return packName;
    }

    @Override
    public String toString() {
        return "PackedObjectLoader[" + packName + "]";
    }
}
