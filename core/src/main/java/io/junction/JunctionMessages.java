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

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import io.junction.server.InvalidMiddlewareException;
import io.junction.server.RouteNotFoundException;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exceptions and message strings used by the router. Log messages live in {@link JunctionLogger} and start at 1000.
 */
@MessageBundle(projectCode = "JCT")
public interface JunctionMessages {

    JunctionMessages MESSAGES = Messages.getBundle(JunctionMessages.class);

    @Message(id = 1, value = "%s `%s`: `middleware` must be a Middleware, not `null`")
    InvalidMiddlewareException invalidMiddleware(String methods, String route);

    @Message(id = 2, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(String argument);

    @Message(id = 3, value = "No route found for name: %s")
    RouteNotFoundException noRouteFoundForName(String name);

    @Message(id = 4, value = "Cannot generate a URL for regular expression path %s of route %s")
    IllegalStateException cannotGenerateUrlForPattern(Pattern pattern, String name);

    @Message(id = 5, value = "next() called multiple times")
    IllegalStateException nextCalledMultipleTimes();

    @Message(id = 6, value = "Could not compile path pattern %s")
    IllegalArgumentException couldNotCompilePathPattern(String path, @Cause PatternSyntaxException cause);

    @Message(id = 7, value = "Failed to decode URL component %s")
    IllegalArgumentException failedToDecodeURL(String s, @Cause Exception cause);

    @Message(value = "Not Implemented")
    String notImplemented();

    @Message(value = "Method Not Allowed")
    String methodNotAllowed();

    @Message(id = 8, value = "Route name cannot be empty")
    IllegalArgumentException routeNameCannotBeEmpty();
}
