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


package io.junction.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import io.junction.testutils.category.UnitTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class PathPatternTestCase {

    @Test
    public void testNamedParameter() {
        PathPattern pattern = PathPattern.compile("/users/:id");
        assertEquals(Collections.singletonList("id"), pattern.getKeyNames());
        assertTrue(pattern.matches("/users/42"));
        assertTrue(pattern.matches("/users/42/"));
        assertTrue(pattern.matches("/USERS/42"));
        assertFalse(pattern.matches("/users"));
        assertFalse(pattern.matches("/users/42/posts"));
        assertEquals(Collections.singletonList("42"), pattern.capture("/users/42"));
        assertEquals(Collections.emptyList(), pattern.capture("/posts/42"));
    }

    @Test
    public void testCaseSensitive() {
        PathPattern pattern = PathPattern.compile("/Users", PathPatternOptions.DEFAULT.withSensitive(true));
        assertTrue(pattern.matches("/Users"));
        assertFalse(pattern.matches("/users"));
    }

    @Test
    public void testStrictTrailingSlash() {
        PathPatternOptions strict = PathPatternOptions.DEFAULT.withStrict(true);
        assertFalse(PathPattern.compile("/users", strict).matches("/users/"));
        assertTrue(PathPattern.compile("/users/", strict).matches("/users/"));
        assertFalse(PathPattern.compile("/users/", strict).matches("/users"));
        assertTrue(PathPattern.compile("/users/").matches("/users"));
    }

    @Test
    public void testPrefixMatch() {
        PathPattern pattern = PathPattern.compile("/api", PathPatternOptions.DEFAULT.withEnd(false));
        assertTrue(pattern.matches("/api"));
        assertTrue(pattern.matches("/api/v1/users"));
        assertFalse(pattern.matches("/apix"));
    }

    @Test
    public void testOptionalParameter() {
        PathPattern pattern = PathPattern.compile("/users/:id?");
        assertTrue(pattern.matches("/users"));
        assertTrue(pattern.matches("/users/5"));
        assertEquals(Collections.singletonList((String) null), pattern.capture("/users"));
        assertEquals(Collections.singletonList("5"), pattern.capture("/users/5"));
    }

    @Test
    public void testCustomExpression() {
        PathPattern pattern = PathPattern.compile("/users/:id(\\d+)");
        assertTrue(pattern.matches("/users/12"));
        assertFalse(pattern.matches("/users/ab"));
    }

    @Test
    public void testRepeatedParameter() {
        PathPattern zeroOrMore = PathPattern.compile("/files/:path*");
        assertEquals(Collections.singletonList("a/b/c"), zeroOrMore.capture("/files/a/b/c"));
        assertEquals(Collections.singletonList((String) null), zeroOrMore.capture("/files"));

        PathPattern oneOrMore = PathPattern.compile("/files/:path+");
        assertTrue(oneOrMore.matches("/files/a/b"));
        assertFalse(oneOrMore.matches("/files"));
    }

    @Test
    public void testUnnamedGroups() {
        PathPattern pattern = PathPattern.compile("/user/(.*)");
        assertEquals(Collections.singletonList("0"), pattern.getKeyNames());
        assertEquals(Collections.singletonList("x/y"), pattern.capture("/user/x/y"));

        PathPattern catchAll = PathPattern.compile("(.*)", PathPatternOptions.DEFAULT.withEnd(false));
        assertTrue(catchAll.matches("/anything/at/all"));
        assertTrue(catchAll.matches(""));
    }

    @Test
    public void testAsterisk() {
        PathPattern pattern = PathPattern.compile("/static/*");
        assertTrue(pattern.getKeys().get(0).isAsterisk());
        assertEquals(Collections.singletonList("css/site.css"), pattern.capture("/static/css/site.css"));
    }

    @Test
    public void testPartialSegments() {
        PathPattern pattern = PathPattern.compile("/:from-:to");
        assertTrue(pattern.getKeys().get(0).isPartial());
        assertEquals(Arrays.asList("a", "b"), pattern.capture("/a-b"));
    }

    @Test
    public void testEscapedCharacters() {
        PathPattern pattern = PathPattern.compile("/a\\:b");
        assertTrue(pattern.getKeys().isEmpty());
        assertTrue(pattern.matches("/a:b"));
        assertTrue(PathPattern.compile("/file.json").matches("/file.json"));
        assertFalse(PathPattern.compile("/file.json").matches("/fileXjson"));
    }

    @Test
    public void testRegularExpressionPath() {
        PathPattern pattern = PathPattern.compile(Pattern.compile("^/api/(\\w+)/(\\d+)$"));
        assertEquals(Arrays.asList("0", "1"), pattern.getKeyNames());
        assertEquals(Arrays.asList("users", "7"), pattern.capture("/api/users/7"));

        PathPattern unanchored = PathPattern.compile(Pattern.compile("/b(?:/|$)"));
        assertTrue(unanchored.getKeys().isEmpty());
        assertTrue(unanchored.matches("/a/b"));
    }

    @Test
    public void testRegularExpressionPathGroupCount() {
        PathPattern escaped = PathPattern.compile(Pattern.compile("^/a\\(b\\)/(\\d+)$"));
        assertEquals(Collections.singletonList("0"), escaped.getKeyNames());
        assertEquals(Collections.singletonList("7"), escaped.capture("/a(b)/7"));

        PathPattern named = PathPattern.compile(Pattern.compile("^/users/(?<name>[^/]+)$"));
        assertEquals(Collections.singletonList("0"), named.getKeyNames());
        assertEquals(Collections.singletonList("x"), named.capture("/users/x"));

        PathPattern mixed = PathPattern.compile(Pattern.compile("^/(?:v1|v2)/(?<kind>\\w+)/([\\(\\)\\d]+)$"));
        assertEquals(Arrays.asList("0", "1"), mixed.getKeyNames());
        assertEquals(Arrays.asList("users", "(5)"), mixed.capture("/v2/users/(5)"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidCustomExpression() {
        PathPattern.compile("/:id(\\d+[)");
    }

    @Test
    public void testParserTokens() {
        List<PathPatternParser.Token> tokens = PathPatternParser.parse("/users/:id.:format?");
        assertEquals(3, tokens.size());
        assertEquals("/users", ((PathPatternParser.Literal) tokens.get(0)).getText());
        PathPatternParser.Key id = (PathPatternParser.Key) tokens.get(1);
        assertEquals("id", id.getName());
        assertEquals("/", id.getPrefix());
        PathPatternParser.Key format = (PathPatternParser.Key) tokens.get(2);
        assertEquals(".", format.getPrefix());
        assertTrue(format.isOptional());
        assertFalse(format.isRepeat());

        PathPattern pattern = PathPattern.compile("/users/:id.:format?");
        assertEquals(Arrays.asList("5", "json"), pattern.capture("/users/5.json"));
        List<String> withoutFormat = pattern.capture("/users/5");
        assertEquals("5", withoutFormat.get(0));
        assertNull(withoutFormat.get(1));
    }
}
