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


package io.junction.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import io.junction.testutils.category.UnitTest;
import io.junction.util.AttachmentKey;
import io.junction.util.StatusCodes;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class RoutingContextTestCase {

    private static final AttachmentKey<String> USER = AttachmentKey.create(String.class);

    @Test
    public void testDefaults() {
        RoutingContext context = new RoutingContext("get", "/users");
        assertEquals("GET", context.getRequestMethod());
        assertEquals("/users", context.getRequestPath());
        assertEquals(StatusCodes.NOT_FOUND, context.getStatusCode());
        assertNull(context.getMatchPath());
        assertNull(context.getRouter());
    }

    @Test
    public void testResponseHeadersAreCaseInsensitive() {
        RoutingContext context = new RoutingContext("GET", "/");
        context.setResponseHeader("X-Test", "1");
        assertEquals("1", context.getResponseHeader("x-test"));
        context.setResponseHeader("x-TEST", "2");
        assertEquals(1, context.getResponseHeaders().size());
        assertEquals("2", context.getResponseHeader("X-Test"));
    }

    @Test
    public void testRedirect() {
        RoutingContext context = new RoutingContext("GET", "/");
        context.redirect("/elsewhere");
        assertEquals(StatusCodes.FOUND, context.getStatusCode());
        assertEquals("/elsewhere", context.getResponseHeader("Location"));
    }

    @Test
    public void testAttachments() {
        RoutingContext context = new RoutingContext("GET", "/");
        assertNull(context.getAttachment(USER));
        assertNull(context.putAttachment(USER, "alice"));
        assertEquals("alice", context.getAttachment(USER));
        assertEquals("alice", context.putAttachment(USER, "bob"));
        assertEquals("bob", context.removeAttachment(USER));
        assertNull(context.getAttachment(USER));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullAttachmentKey() {
        new RoutingContext("GET", "/").putAttachment(null, "x");
    }
}
