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

import java.util.Collections;
import java.util.List;

/**
 * The layers of a router that match a path and method.
 *
 * @see Router#match(String, String)
 */
public final class MatchResult {

    private final List<Layer> matchedByPath;
    private final List<Layer> matchedByPathAndMethod;
    private final boolean routeMatch;

    MatchResult(final List<Layer> matchedByPath, final List<Layer> matchedByPathAndMethod, final boolean routeMatch) {
        this.matchedByPath = Collections.unmodifiableList(matchedByPath);
        this.matchedByPathAndMethod = Collections.unmodifiableList(matchedByPathAndMethod);
        this.routeMatch = routeMatch;
    }

    /**
     * @return every layer whose path matches, whatever its methods, in registration order
     */
    public List<Layer> getMatchedByPath() {
        return matchedByPath;
    }

    /**
     * @return the layers whose path matches and which answer the method or any method, in registration order
     */
    public List<Layer> getMatchedByPathAndMethod() {
        return matchedByPathAndMethod;
    }

    /**
     * @return true if at least one layer with an explicit method list matched. Middleware registered for any method
     *         does not count.
     */
    public boolean hasRouteMatch() {
        return routeMatch;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchResult)) {
            return false;
        }
        final MatchResult that = (MatchResult) o;
        return routeMatch == that.routeMatch
                && matchedByPath.equals(that.matchedByPath)
                && matchedByPathAndMethod.equals(that.matchedByPathAndMethod);
    }

    @Override
    public int hashCode() {
        int result = matchedByPath.hashCode();
        result = 31 * result + matchedByPathAndMethod.hashCode();
        result = 31 * result + (routeMatch ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "MatchResult{path=" + matchedByPath + ", pathAndMethod=" + matchedByPathAndMethod + ", route=" + routeMatch + '}';
    }
}
