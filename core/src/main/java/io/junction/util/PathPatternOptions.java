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

/**
 * Options used when compiling a route path into a {@link PathPattern}.
 *
 * @see PathPattern#compile(String, PathPatternOptions)
 */
public final class PathPatternOptions {

    public static final PathPatternOptions DEFAULT = new PathPatternOptions(false, false, true);

    private final boolean sensitive;
    private final boolean strict;
    private final boolean end;

    private PathPatternOptions(final boolean sensitive, final boolean strict, final boolean end) {
        this.sensitive = sensitive;
        this.strict = strict;
        this.end = end;
    }

    public static PathPatternOptions create(final boolean sensitive, final boolean strict, final boolean end) {
        return new PathPatternOptions(sensitive, strict, end);
    }

    /**
     * @return true if literal text is matched case sensitively
     */
    public boolean isSensitive() {
        return sensitive;
    }

    /**
     * @return true if a trailing slash has to match exactly
     */
    public boolean isStrict() {
        return strict;
    }

    /**
     * @return true if the whole path has to match, false if matching a leading part of the path is enough
     */
    public boolean isEnd() {
        return end;
    }

    public PathPatternOptions withSensitive(final boolean sensitive) {
        return new PathPatternOptions(sensitive, strict, end);
    }

    public PathPatternOptions withStrict(final boolean strict) {
        return new PathPatternOptions(sensitive, strict, end);
    }

    public PathPatternOptions withEnd(final boolean end) {
        return new PathPatternOptions(sensitive, strict, end);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathPatternOptions)) {
            return false;
        }
        final PathPatternOptions that = (PathPatternOptions) o;
        return sensitive == that.sensitive && strict == that.strict && end == that.end;
    }

    @Override
    public int hashCode() {
        int result = sensitive ? 1 : 0;
        result = 31 * result + (strict ? 1 : 0);
        result = 31 * result + (end ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "PathPatternOptions{sensitive=" + sensitive + ", strict=" + strict + ", end=" + end + '}';
    }
}
