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
package org.apache.jackrabbit.grove.commons.properties;

import static org.junit.Assert.assertEquals;

import org.apache.jackrabbit.grove.commons.junit.LogCustomizer;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

public class SystemPropertySupplierTest {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplierTest.class);

    @Test
    public void unsetUsesDefault() {
        assertEquals(Boolean.TRUE, SystemPropertySupplier.create("grove.x", Boolean.TRUE)
                .usingSystemPropertyReader((n) -> null).get());
        assertEquals(Integer.valueOf(128), SystemPropertySupplier.create("grove.x", 128)
                .usingSystemPropertyReader((n) -> null).get());
        assertEquals("bar", SystemPropertySupplier.create("grove.x", "bar")
                .usingSystemPropertyReader((n) -> null).get());
    }

    @Test
    public void parsesSupportedTypes() {
        assertEquals(Boolean.FALSE, SystemPropertySupplier.create("grove.x", Boolean.TRUE)
                .usingSystemPropertyReader((n) -> "false").get());
        assertEquals(Integer.valueOf(512), SystemPropertySupplier.create("grove.x", 128)
                .usingSystemPropertyReader((n) -> " 512 ").get());
        assertEquals(Long.valueOf(7), SystemPropertySupplier.create("grove.x", Long.MAX_VALUE)
                .usingSystemPropertyReader((n) -> "7").get());
    }

    @Test
    public void invalidValueFallsBackAndLogs() {
        LogCustomizer logs = LogCustomizer.forLogger(SystemPropertySupplierTest.class)
                .enable(Level.ERROR).contains("Ignoring invalid value").create();
        logs.starting();
        try {
            int size = SystemPropertySupplier.create("grove.x", 128).loggingTo(LOG)
                    .usingSystemPropertyReader((n) -> "-4").validateWith(n -> n > 0).get();
            assertEquals(128, size);
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    @Test
    public void malformedValueFallsBackAndLogs() {
        LogCustomizer logs = LogCustomizer.forLogger(SystemPropertySupplierTest.class)
                .enable(Level.ERROR).contains("Ignoring malformed value").create();
        logs.starting();
        try {
            int size = SystemPropertySupplier.create("grove.x", 128).loggingTo(LOG)
                    .usingSystemPropertyReader((n) -> "big").get();
            assertEquals(128, size);
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    @Test
    public void changedValueIsReported() {
        LogCustomizer logs = LogCustomizer.forLogger(SystemPropertySupplierTest.class)
                .enable(Level.INFO).contains("grove.x").create();
        logs.starting();
        try {
            SystemPropertySupplier.create("grove.x", 128).loggingTo(LOG)
                    .usingSystemPropertyReader((n) -> "256").get();
            SystemPropertySupplier.create("grove.x", 128).loggingTo(LOG)
                    .usingSystemPropertyReader((n) -> "128").get();
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedType() {
        SystemPropertySupplier.create("grove.x", new Object());
    }
}
