/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.junction;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;

/**
 * log messages start at 1000
 */
@MessageLogger(projectCode = "JCT")
public interface JunctionLogger extends BasicLogger {

    JunctionLogger ROOT_LOGGER = Logger.getMessageLogger(JunctionLogger.class, JunctionLogger.class.getPackage().getName());

    /**
     * Registration time events: layers defined, routers mounted, prefixes applied.
     */
    JunctionLogger ROUTER_LOGGER = Logger.getMessageLogger(JunctionLogger.class, JunctionLogger.class.getPackage().getName() + ".router");

    /**
     * Per request events. Most of these are at DEBUG or TRACE as they are emitted for every dispatch.
     */
    JunctionLogger REQUEST_LOGGER = Logger.getMessageLogger(JunctionLogger.class, JunctionLogger.class.getPackage().getName() + ".request");

    @LogMessage(level = DEBUG)
    @Message(id = 1001, value = "Could not decode value of path parameter %s, keeping raw value %s")
    void failedToDecodeParameter(String name, String value, @Cause IllegalArgumentException cause);

    @LogMessage(level = DEBUG)
    @Message(id = 1002, value = "Mounted %s layers from %s under path '%s'")
    void mountedRouter(int layers, Object router, String path);

    @LogMessage(level = DEBUG)
    @Message(id = 1003, value = "Generating URL for unknown route name %s")
    void urlForUnknownRoute(String name);
}
