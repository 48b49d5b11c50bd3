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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import io.junction.testutils.category.UnitTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class QueryParameterUtilsTestCase {

    @Test
    public void testBuildQueryString() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page", 3);
        params.put("limit", 10);
        assertEquals("page=3&limit=10", QueryParameterUtils.buildQueryString(params));
    }

    @Test
    public void testMultipleValuesAndBareKeys() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tags", Arrays.asList("a", "b"));
        params.put("ids", new Integer[]{1, 2});
        params.put("flag", null);
        params.put("q", "x y");
        assertEquals("tags=a&tags=b&ids=1&ids=2&flag&q=x+y", QueryParameterUtils.buildQueryString(params));
    }

    @Test
    public void testReplaceQueryString() {
        assertEquals("/a?y=2", QueryParameterUtils.replaceQueryString("/a?x=1", "y=2"));
        assertEquals("/a?y=2", QueryParameterUtils.replaceQueryString("/a", "?y=2"));
        assertEquals("/a", QueryParameterUtils.replaceQueryString("/a?x=1", ""));
    }
}
