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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import io.junction.util.AbstractAttachable;
import io.junction.util.Headers;
import io.junction.util.StatusCodes;

/**
 * The state of a single request as it passes through one or more routers.
 * <p>
 * The host creates a context with the request method and path. Routers record what they matched on it, most notably the
 * decoded path parameters, and handlers write the response status, headers and body back to it for the host to send.
 * <p>
 * A context belongs to a single request and is not thread safe.
 */
public class RoutingContext extends AbstractAttachable {

    private final String requestMethod;
    private final String requestPath;
    private String matchPath;

    private final Map<String, String> params = new LinkedHashMap<>();
    private List<String> captures = new ArrayList<>();
    private final List<Layer> matched = new ArrayList<>();
    private Router router;
    private String routerName;
    private String routerPath;
    private String matchedRoute;
    private String matchedRouteName;

    private int statusCode = StatusCodes.NOT_FOUND;
    private final Map<String, String> responseHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private Object responseBody;

    public RoutingContext(final String requestMethod, final String requestPath) {
        this.requestMethod = Objects.requireNonNull(requestMethod).toUpperCase(Locale.ENGLISH);
        this.requestPath = Objects.requireNonNull(requestPath);
    }

    public String getRequestMethod() {
        return requestMethod;
    }

    public String getRequestPath() {
        return requestPath;
    }

    /**
     * @return the path routers match against instead of the request path, or {@code null} if none was set
     */
    public String getMatchPath() {
        return matchPath;
    }

    /**
     * Overrides the path routers match against, for hosts that route on something other than the request path.
     */
    public RoutingContext setMatchPath(final String matchPath) {
        this.matchPath = matchPath;
        return this;
    }

    /**
     * The decoded path parameters of every layer that has run so far. Parameters of a later layer replace those of the
     * same name from an earlier one. A parameter whose group did not match maps to {@code null}.
     */
    public Map<String, String> getParams() {
        return params;
    }

    /**
     * @return the raw captures of the layer that is currently running
     */
    public List<String> getCaptures() {
        return captures;
    }

    void setCaptures(final List<String> captures) {
        this.captures = captures;
    }

    /**
     * Every layer that matched the path, in every router the request went through, in the order they matched.
     */
    public List<Layer> getMatched() {
        return matched;
    }

    public Router getRouter() {
        return router;
    }

    void setRouter(final Router router) {
        this.router = router;
    }

    public String getRouterName() {
        return routerName;
    }

    public String getRouterPath() {
        return routerPath;
    }

    /**
     * @return the path of the layer that is currently running, as it was registered
     */
    public String getMatchedRoute() {
        return matchedRoute;
    }

    /**
     * @return the name of the layer that is currently running, {@code null} for unnamed layers
     */
    public String getMatchedRouteName() {
        return matchedRouteName;
    }

    void setMatchedLayer(final Layer layer) {
        this.routerName = layer.getName();
        this.routerPath = layer.getPath();
        this.matchedRouteName = layer.getName();
        this.matchedRoute = layer.getPath();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public RoutingContext setStatusCode(final int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    /**
     * @return the response headers, with case insensitive names
     */
    public Map<String, String> getResponseHeaders() {
        return responseHeaders;
    }

    public String getResponseHeader(final String name) {
        return responseHeaders.get(name);
    }

    public RoutingContext setResponseHeader(final String name, final String value) {
        responseHeaders.put(name, value);
        return this;
    }

    public Object getResponseBody() {
        return responseBody;
    }

    public RoutingContext setResponseBody(final Object responseBody) {
        this.responseBody = responseBody;
        return this;
    }

    /**
     * Sends a temporary redirect to the given location.
     */
    public RoutingContext redirect(final String location) {
        setResponseHeader(Headers.LOCATION, location);
        setStatusCode(StatusCodes.FOUND);
        return this;
    }

    @Override
    public String toString() {
        return "RoutingContext{" + requestMethod + ' ' + requestPath + ", status=" + statusCode + '}';
    }
}
