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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import io.junction.testutils.category.UnitTest;
import io.junction.util.Methods;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class LayerTestCase {

    private static final Middleware HANDLER = (ctx, next) -> MiddlewareChain.completed();
    private static final ParamMiddleware NOOP_PARAM = (value, ctx, next) -> next.proceed();

    private static Layer layer(final String path, final String... methods) {
        return new Layer(path, Arrays.asList(methods), Collections.singletonList(HANDLER), null);
    }

    @Test
    public void testGetImpliesHead() {
        assertEquals(Arrays.asList("HEAD", "GET"), layer("/users", "get").getMethods());
        assertEquals(Arrays.asList("HEAD", "PUT", "GET"), layer("/users", "PUT", "GET").getMethods());
        assertEquals(Arrays.asList("HEAD", "GET"), layer("/users", "HEAD", "GET", "GET").getMethods());
        assertEquals(Collections.emptyList(), layer("/users").getMethods());
    }

    @Test
    public void testStandardMethodsAreDeduplicated() {
        Layer all = new Layer("/users", Methods.STANDARD_METHODS, Collections.singletonList(HANDLER), null);
        assertEquals(Methods.STANDARD_METHODS.size(), all.getMethods().size());
        assertEquals("HEAD", all.getMethods().get(0));
    }

    @Test
    public void testNullMiddlewareRejected() {
        try {
            new Layer("/users", Collections.singletonList("GET"), Arrays.asList(HANDLER, null), null);
            fail("expected InvalidMiddlewareException");
        } catch (InvalidMiddlewareException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("GET `/users`"));
        }
        try {
            new Layer("/users", Collections.singletonList("GET"), Arrays.asList((Middleware) null), RouteOptions.named("users"));
            fail("expected InvalidMiddlewareException");
        } catch (InvalidMiddlewareException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("GET `users`"));
        }
    }

    @Test
    public void testParamsAreDecoded() {
        Layer layer = layer("/users/:name", "GET");
        List<String> captures = layer.captures("/users/j%C3%B6rg");
        assertEquals(Collections.singletonMap("name", "jörg"), layer.params("/users/j%C3%B6rg", captures, null));
    }

    @Test
    public void testMalformedParamKeepsRawValue() {
        Layer layer = layer("/users/:name", "GET");
        List<String> captures = layer.captures("/users/%E0%A4%A");
        assertEquals("%E0%A4%A", layer.params("/users/%E0%A4%A", captures, null).get("name"));
    }

    @Test
    public void testParamsMergeIntoExisting() {
        Layer layer = layer("/posts/:pid", "GET");
        Map<String, String> existing = new LinkedHashMap<>();
        existing.put("fid", "1");
        Map<String, String> params = layer.params("/posts/2", layer.captures("/posts/2"), existing);
        assertSame(existing, params);
        assertEquals(Arrays.asList("fid", "pid"), Arrays.asList(params.keySet().toArray()));
        assertEquals("2", params.get("pid"));
    }

    @Test
    public void testIgnoreCaptures() {
        Layer layer = new Layer("/users/:id", Collections.<String>emptyList(), Collections.singletonList(HANDLER),
                RouteOptions.create().setIgnoreCaptures(true));
        assertTrue(layer.match("/users/1"));
        assertTrue(layer.captures("/users/1").isEmpty());
    }

    @Test
    public void testUrl() {
        Layer layer = layer("/users/:id", "GET");
        assertEquals("/users/123", layer.url(123));
        assertEquals("/users/123", layer.url("123"));
        assertEquals("/users/123", layer.url(Collections.singletonMap("id", 123)));
        assertEquals("/users/123?limit=1", layer.url(123, UrlOptions.query("limit=1")));
        assertEquals("/users/3?limit=1", layer.url(Collections.singletonMap("id", 3),
                Collections.singletonMap("query", Collections.singletonMap("limit", 1))));
        assertEquals("/users/:id", layer.url());
    }

    @Test
    public void testUrlWithoutParameters() {
        Layer layer = layer("/users", "GET");
        assertEquals("/users?page=2", layer.url(UrlOptions.query(Collections.singletonMap("page", 2))));
        assertEquals("/users?a=b", layer.url(Collections.singletonMap("query", "a=b")));
        assertEquals("/files/", layer("/files/(.*)", "GET").url());
    }

    @Test
    public void testRegularExpressionPathParams() {
        Layer layer = new Layer(Pattern.compile("^/users/(?<name>[^/]+)$"), Collections.singletonList("GET"), Collections.singletonList(HANDLER), null);
        assertEquals(Collections.singletonList("0"), layer.getParamNames());
        List<String> captures = layer.captures("/users/x");
        assertEquals(Collections.singletonMap("0", "x"), layer.params("/users/x", captures, null));
    }

    @Test(expected = IllegalStateException.class)
    public void testUrlForRegularExpressionPath() {
        new Layer(Pattern.compile("^/users/(\\d+)$"), Collections.singletonList("GET"), Collections.singletonList(HANDLER), null).url(1);
    }

    @Test
    public void testParamValidatorOrder() {
        Layer layer = layer("/:a/:b/:c/:d", "GET");
        layer.param("d", NOOP_PARAM);
        layer.param("c", NOOP_PARAM);
        layer.param("a", NOOP_PARAM);
        layer.param("b", NOOP_PARAM);
        List<Middleware> stack = layer.getStack();
        assertEquals(5, stack.size());
        assertEquals("a", ((ParamValidator) stack.get(0)).getParam());
        assertEquals("b", ((ParamValidator) stack.get(1)).getParam());
        assertEquals("c", ((ParamValidator) stack.get(2)).getParam());
        assertEquals("d", ((ParamValidator) stack.get(3)).getParam());
        assertSame(HANDLER, stack.get(4));
    }

    @Test
    public void testParamForUnknownName() {
        Layer layer = layer("/users/:id", "GET");
        layer.param("other", NOOP_PARAM);
        assertEquals(Collections.singletonList(HANDLER), layer.getStack());
    }

    @Test
    public void testSetPrefix() {
        Layer layer = layer("/users/:id", "GET");
        layer.setPrefix("/things/:thingId");
        assertEquals("/things/:thingId/users/:id", layer.getPath());
        assertEquals(Arrays.asList("thingId", "id"), layer.getParamNames());
        assertTrue(layer.match("/things/1/users/2"));
        assertFalse(layer.match("/users/2"));

        Layer empty = layer("", "GET");
        empty.setPrefix("/api");
        assertEquals("", empty.getPath());

        Layer regex = new Layer(Pattern.compile("^/r$"), Collections.singletonList("GET"), Collections.singletonList(HANDLER), null);
        regex.setPrefix("/api");
        assertTrue(regex.match("/r"));
    }

    @Test
    public void testCopyIsIndependent() {
        Layer original = layer("/users/:id", "GET");
        Layer copy = original.copy();
        assertNotSame(original, copy);
        copy.setPrefix("/api");
        copy.param("id", NOOP_PARAM);
        assertEquals("/users/:id", original.getPath());
        assertEquals(1, original.getStack().size());
        assertEquals("/api/users/:id", copy.getPath());
        assertEquals(2, copy.getStack().size());
        assertEquals(original.getMethods(), copy.getMethods());
    }

    @Test
    public void testMatchHasNoSideEffects() {
        Layer layer = layer("/users/:id", "GET");
        Map<String, Object> before = new HashMap<>();
        before.put("path", layer.getPath());
        before.put("names", layer.getParamNames());
        assertTrue(layer.match("/users/1"));
        assertTrue(layer.match("/users/1"));
        assertEquals(before.get("path"), layer.getPath());
        assertEquals(before.get("names"), layer.getParamNames());
    }
}
