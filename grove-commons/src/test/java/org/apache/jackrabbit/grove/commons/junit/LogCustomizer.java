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
package org.apache.jackrabbit.grove.commons.junit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.AppenderBase;

/**
 * Captures the messages a logger emits while a test runs.
 *
 * <pre>
 * LogCustomizer logs = LogCustomizer.forLogger(ObjectDatabase.class)
 *         .enable(Level.WARN).contains("alternates").create();
 * logs.starting();
 * try {
 *     ...
 *     assertEquals(1, logs.getLogs().size());
 * } finally {
 *     logs.finished();
 * }
 * </pre>
 */
public class LogCustomizer {

    public static LogCustomizerBuilder forLogger(Class<?> type) {
        return forLogger(type.getName());
    }

    public static LogCustomizerBuilder forLogger(String name) {
        return new LogCustomizerBuilder(name);
    }

    public static class LogCustomizerBuilder {

        private final String name;
        private Level enableLevel;
        private Level filterLevel;
        private String matchContainsMessage;

        private LogCustomizerBuilder(String name) {
            this.name = name;
        }

        public LogCustomizerBuilder enable(Level level) {
            this.enableLevel = level;
            return this;
        }

        public LogCustomizerBuilder filter(Level level) {
            this.filterLevel = level;
            return this;
        }

        public LogCustomizerBuilder contains(String message) {
            this.matchContainsMessage = message;
            return this;
        }

        public LogCustomizer create() {
            return new LogCustomizer(name, enableLevel, filterLevel, matchContainsMessage);
        }
    }

    private final Logger logger;
    private final List<String> logs = new CopyOnWriteArrayList<>();
    private final Level enableLevel;
    private final Level originalLevel;
    private final Appender<ILoggingEvent> appender;

    private LogCustomizer(String name, Level enableLevel, final Level filterLevel,
                          final String matchContainsMessage) {
        this.logger = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(name);
        this.enableLevel = enableLevel;
        this.originalLevel = logger.getLevel();
        this.appender = new AppenderBase<ILoggingEvent>() {
            @Override
            protected void append(ILoggingEvent e) {
                if (filterLevel != null && !e.getLevel().isGreaterOrEqual(filterLevel)) {
                    return;
                }
                String message = e.getFormattedMessage();
                if (matchContainsMessage != null && !message.contains(matchContainsMessage)) {
                    return;
                }
                logs.add(message);
            }
        };
    }

    public List<String> getLogs() {
        return logs;
    }

    public void starting() {
        appender.start();
        if (enableLevel != null) {
            logger.setLevel(enableLevel);
        }
        logger.addAppender(appender);
    }

    public void finished() {
        if (enableLevel != null) {
            logger.setLevel(originalLevel);
        }
        logger.detachAppender(appender);
        appender.stop();
        logs.clear();
    }
}
