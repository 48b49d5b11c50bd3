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


package io.junction.server.handlers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.concurrent.CompletionException;

import io.junction.JunctionOptions;
import io.junction.server.HttpStatusException;
import io.junction.server.Middleware;
import io.junction.server.MiddlewareChain;
import io.junction.server.Router;
import io.junction.server.RoutingContext;
import io.junction.testutils.category.UnitTest;
import io.junction.util.Headers;
import io.junction.util.StatusCodes;
import org.junit.Before;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.xnio.OptionMap;
import org.xnio.Sequence;

@Category(UnitTest.class)
public class AllowedMethodsHandlerTestCase {

    private static final Middleware OK = (ctx, next) -> {
        ctx.setStatusCode(StatusCodes.OK);
        return MiddlewareChain.completed();
    };

    private Router router;

    @Before
    public void setup() {
        router = new Router();
        router.get("/users", OK);
        router.put("/users", OK);
    }

    private RoutingContext run(final Middleware allowedMethods, final String method, final String path) {
        RoutingContext context = new RoutingContext(method, path);
        MiddlewareChain.compose(Arrays.asList(router.routes(), allowedMethods))
                .handle(context, null).toCompletableFuture().join();
        return context;
    }

    private Throwable failure(final Middleware allowedMethods, final String method, final String path) {
        try {
            run(allowedMethods, method, path);
        } catch (CompletionException e) {
            return e.getCause();
        }
        fail("expected failure");
        return null;
    }

    @Test
    public void testOptions() {
        RoutingContext context = run(router.allowedMethods(), "OPTIONS", "/users");
        assertEquals(StatusCodes.OK, context.getStatusCode());
        assertEquals("HEAD, GET, PUT", context.getResponseHeader(Headers.ALLOW));
        assertEquals("", context.getResponseBody());
    }

    @Test
    public void testMethodNotAllowed() {
        RoutingContext context = run(router.allowedMethods(), "POST", "/users");
        assertEquals(StatusCodes.METHOD_NOT_ALLOWED, context.getStatusCode());
        assertEquals("HEAD, GET, PUT", context.getResponseHeader("allow"));
    }

    @Test
    public void testMethodNotAllowedThrows() {
        Throwable cause = failure(router.allowedMethods(AllowedMethodsOptions.create().setThrowErrors(true)), "POST", "/users");
        assertTrue(cause instanceof HttpStatusException);
        assertEquals(StatusCodes.METHOD_NOT_ALLOWED, ((HttpStatusException) cause).getStatusCode());
        assertEquals("Method Not Allowed", cause.getMessage());
    }

    @Test
    public void testThrowModeSetsNoHeader() {
        RoutingContext context = new RoutingContext("POST", "/users");
        try {
            MiddlewareChain.compose(Arrays.asList(router.routes(),
                    router.allowedMethods(AllowedMethodsOptions.create().setThrowErrors(true))))
                    .handle(context, null).toCompletableFuture().join();
            fail("expected failure");
        } catch (CompletionException expected) {
            assertNull(context.getResponseHeader(Headers.ALLOW));
            assertEquals(StatusCodes.NOT_FOUND, context.getStatusCode());
        }
    }

    @Test
    public void testCustomMethodNotAllowedError() {
        final IllegalStateException custom = new IllegalStateException("custom");
        Throwable cause = failure(router.allowedMethods(AllowedMethodsOptions.create()
                .setThrowErrors(true)
                .setMethodNotAllowed(() -> custom)), "POST", "/users");
        assertSame(custom, cause);
    }

    @Test
    public void testNotImplemented() {
        RoutingContext context = run(router.allowedMethods(), "SEARCH", "/users");
        assertEquals(StatusCodes.NOT_IMPLEMENTED, context.getStatusCode());
        assertEquals("HEAD, GET, PUT", context.getResponseHeader(Headers.ALLOW));

        Throwable cause = failure(router.allowedMethods(AllowedMethodsOptions.create().setThrowErrors(true)), "SEARCH", "/users");
        assertEquals(StatusCodes.NOT_IMPLEMENTED, ((HttpStatusException) cause).getStatusCode());
        assertEquals("Not Implemented", cause.getMessage());

        final UnsupportedOperationException custom = new UnsupportedOperationException();
        cause = failure(router.allowedMethods(AllowedMethodsOptions.create()
                .setThrowErrors(true)
                .setNotImplemented(() -> custom)), "SEARCH", "/users");
        assertSame(custom, cause);
    }

    @Test
    public void testImplementedMethodsOption() {
        router = new Router(OptionMap.create(JunctionOptions.METHODS, Sequence.of("GET", "HEAD", "OPTIONS")));
        router.get("/users", OK);
        assertEquals(Arrays.asList("GET", "HEAD", "OPTIONS"), router.getMethods());
        RoutingContext context = run(router.allowedMethods(), "PUT", "/users");
        assertEquals(StatusCodes.NOT_IMPLEMENTED, context.getStatusCode());
        assertEquals("HEAD, GET", context.getResponseHeader(Headers.ALLOW));
    }

    @Test
    public void testMatchedRouteIsLeftAlone() {
        RoutingContext context = run(router.allowedMethods(), "GET", "/users");
        assertEquals(StatusCodes.OK, context.getStatusCode());
        assertNull(context.getResponseHeader(Headers.ALLOW));
    }

    @Test
    public void testUnknownPathIsLeftAlone() {
        RoutingContext context = run(router.allowedMethods(), "POST", "/nothing");
        assertEquals(StatusCodes.NOT_FOUND, context.getStatusCode());
        assertNull(context.getResponseHeader(Headers.ALLOW));
    }

    @Test
    public void testStatusSetDownstreamIsLeftAlone() {
        Middleware teapot = (ctx, next) -> {
            ctx.setStatusCode(418);
            return MiddlewareChain.completed();
        };
        RoutingContext context = new RoutingContext("POST", "/users");
        MiddlewareChain.compose(Arrays.asList(router.routes(), router.allowedMethods(), teapot))
                .handle(context, null).toCompletableFuture().join();
        assertEquals(418, context.getStatusCode());
        assertNull(context.getResponseHeader(Headers.ALLOW));
    }
}
