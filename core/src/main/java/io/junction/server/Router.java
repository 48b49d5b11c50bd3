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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.junction.JunctionLogger;
import io.junction.JunctionMessages;
import io.junction.JunctionOptions;
import io.junction.server.handlers.AllowedMethodsHandler;
import io.junction.server.handlers.AllowedMethodsOptions;
import io.junction.server.handlers.RedirectHandler;
import io.junction.util.AttachmentKey;
import io.junction.util.Methods;
import io.junction.util.StatusCodes;
import io.junction.util.URLUtils;
import org.xnio.OptionMap;

/**
 * A router that dispatches requests to the layers registered on it.
 * <p>
 * Routes are matched in the order they were registered, and every layer that matches the path and method runs, each
 * one passing the request on to the next by calling {@link Next#proceed()}. There is no ordering by specificity: a
 * catch all registered first runs first.
 * <p>
 * Routers nest. Passing the {@link #routes()} middleware of one router to {@link #use(String, Middleware...)} of
 * another mounts it under a path. The parent takes independent copies of the child's layers at that point, so later
 * prefix changes on the parent never reach the child.
 * <p>
 * Routers are configured before they serve requests and are not safe for concurrent registration.
 *
 * @see JunctionOptions
 */
public class Router {

    /**
     * The match of the last router that dispatched the request. Set before any matched middleware runs.
     */
    public static final AttachmentKey<MatchResult> MATCH_RESULT = AttachmentKey.create(MatchResult.class);

    private static final String CATCH_ALL = "(.*)";
    private static final Pattern PLACEHOLDER = Pattern.compile(":([a-zA-Z_]\\w*)");

    private final OptionMap options;
    private final boolean sensitive;
    private final boolean strict;
    private final String routerPath;
    private final List<String> methods;
    private final List<Layer> layers = new ArrayList<>();
    private final Map<String, ParamMiddleware> params = new LinkedHashMap<>();
    private final List<Router> mounted = new ArrayList<>();
    private String prefix;

    public Router() {
        this(OptionMap.EMPTY);
    }

    public Router(final OptionMap options) {
        this.options = options;
        this.prefix = options.get(JunctionOptions.PREFIX, "");
        this.sensitive = options.get(JunctionOptions.CASE_SENSITIVE, false);
        this.strict = options.get(JunctionOptions.STRICT_SLASH, false);
        this.routerPath = options.get(JunctionOptions.ROUTER_PATH);
        this.methods = Collections.unmodifiableList(new ArrayList<>(options.get(JunctionOptions.METHODS, JunctionOptions.DEFAULT_METHODS)));
    }

    /**
     * Registers middleware that runs for every request that reaches this router, whatever its path or method.
     * Passing the {@link #routes()} of another router mounts that router.
     */
    public Router use(final Middleware... middleware) {
        return use(null, false, middleware);
    }

    /**
     * Registers middleware for a path and everything below it, or mounts other routers under the path.
     */
    public Router use(final String path, final Middleware... middleware) {
        return use(path, true, middleware);
    }

    public Router use(final List<String> paths, final Middleware... middleware) {
        for (String path : paths) {
            use(path, middleware);
        }
        return this;
    }

    private Router use(final String path, final boolean hasPath, final Middleware... middleware) {
        for (Middleware m : middleware) {
            if (m instanceof RouterMiddleware) {
                mount(path, ((RouterMiddleware) m).getRouter());
            } else {
                register(path == null || path.isEmpty() ? CATCH_ALL : path, Collections.<String>emptyList(),
                        Collections.singletonList(m), RouteOptions.create().setEnd(false).setIgnoreCaptures(!hasPath));
            }
        }
        return this;
    }

    private void mount(final String path, final Router router) {
        int count = 0;
        for (Layer nested : router.layers) {
            final Layer layer = nested.copy();
            if (path != null && !path.isEmpty()) {
                layer.setPrefix(path);
            }
            if (!prefix.isEmpty()) {
                layer.setPrefix(prefix);
            }
            for (Map.Entry<String, ParamMiddleware> entry : params.entrySet()) {
                layer.param(entry.getKey(), entry.getValue());
            }
            layers.add(layer);
            ++count;
        }
        for (Map.Entry<String, ParamMiddleware> entry : params.entrySet()) {
            router.param(entry.getKey(), entry.getValue());
        }
        if (!mounted.contains(router)) {
            mounted.add(router);
        }
        JunctionLogger.ROUTER_LOGGER.mountedRouter(count, router, path == null ? "" : path);
    }

    /**
     * Sets the path prefix of this router, and applies it to the layers that are already registered. A single trailing
     * slash is removed.
     *
     * @param prefix the prefix, for example {@code /things/:thingId}
     * @return this router
     */
    public Router prefix(final String prefix) {
        final String p = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        this.prefix = p;
        for (Layer layer : layers) {
            layer.setPrefix(p);
        }
        return this;
    }

    public Router get(final String path, final Middleware... middleware) {
        return verb(Methods.GET, path, middleware);
    }

    public Router get(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.GET, name, path, middleware);
    }

    public Router get(final Pattern path, final Middleware... middleware) {
        return verb(Methods.GET, path, middleware);
    }

    public Router get(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.GET, name, path, middleware);
    }

    public Router get(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.GET, paths, middleware);
    }

    public Router head(final String path, final Middleware... middleware) {
        return verb(Methods.HEAD, path, middleware);
    }

    public Router head(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.HEAD, name, path, middleware);
    }

    public Router head(final Pattern path, final Middleware... middleware) {
        return verb(Methods.HEAD, path, middleware);
    }

    public Router head(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.HEAD, name, path, middleware);
    }

    public Router head(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.HEAD, paths, middleware);
    }

    public Router options(final String path, final Middleware... middleware) {
        return verb(Methods.OPTIONS, path, middleware);
    }

    public Router options(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.OPTIONS, name, path, middleware);
    }

    public Router options(final Pattern path, final Middleware... middleware) {
        return verb(Methods.OPTIONS, path, middleware);
    }

    public Router options(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.OPTIONS, name, path, middleware);
    }

    public Router options(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.OPTIONS, paths, middleware);
    }

    public Router put(final String path, final Middleware... middleware) {
        return verb(Methods.PUT, path, middleware);
    }

    public Router put(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.PUT, name, path, middleware);
    }

    public Router put(final Pattern path, final Middleware... middleware) {
        return verb(Methods.PUT, path, middleware);
    }

    public Router put(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.PUT, name, path, middleware);
    }

    public Router put(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.PUT, paths, middleware);
    }

    public Router patch(final String path, final Middleware... middleware) {
        return verb(Methods.PATCH, path, middleware);
    }

    public Router patch(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.PATCH, name, path, middleware);
    }

    public Router patch(final Pattern path, final Middleware... middleware) {
        return verb(Methods.PATCH, path, middleware);
    }

    public Router patch(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.PATCH, name, path, middleware);
    }

    public Router patch(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.PATCH, paths, middleware);
    }

    public Router post(final String path, final Middleware... middleware) {
        return verb(Methods.POST, path, middleware);
    }

    public Router post(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.POST, name, path, middleware);
    }

    public Router post(final Pattern path, final Middleware... middleware) {
        return verb(Methods.POST, path, middleware);
    }

    public Router post(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.POST, name, path, middleware);
    }

    public Router post(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.POST, paths, middleware);
    }

    public Router delete(final String path, final Middleware... middleware) {
        return verb(Methods.DELETE, path, middleware);
    }

    public Router delete(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.DELETE, name, path, middleware);
    }

    public Router delete(final Pattern path, final Middleware... middleware) {
        return verb(Methods.DELETE, path, middleware);
    }

    public Router delete(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.DELETE, name, path, middleware);
    }

    public Router delete(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.DELETE, paths, middleware);
    }

    // alias of delete
    public Router del(final String path, final Middleware... middleware) {
        return verb(Methods.DELETE, path, middleware);
    }

    public Router del(final String name, final String path, final Middleware... middleware) {
        return verb(Methods.DELETE, name, path, middleware);
    }

    public Router del(final Pattern path, final Middleware... middleware) {
        return verb(Methods.DELETE, path, middleware);
    }

    public Router del(final String name, final Pattern path, final Middleware... middleware) {
        return verb(Methods.DELETE, name, path, middleware);
    }

    public Router del(final List<String> paths, final Middleware... middleware) {
        return verb(Methods.DELETE, paths, middleware);
    }

    /**
     * Registers a route that answers every standard HTTP method.
     */
    public Router all(final String path, final Middleware... middleware) {
        return register(Collections.singletonList(path), Methods.STANDARD_METHODS, null, middleware);
    }

    public Router all(final String name, final String path, final Middleware... middleware) {
        return register(Collections.singletonList(path), Methods.STANDARD_METHODS, name, middleware);
    }

    public Router all(final Pattern path, final Middleware... middleware) {
        register(path, Methods.STANDARD_METHODS, Arrays.asList(middleware), RouteOptions.create());
        return this;
    }

    public Router all(final String name, final Pattern path, final Middleware... middleware) {
        register(path, Methods.STANDARD_METHODS, Arrays.asList(middleware), RouteOptions.named(checkName(name)));
        return this;
    }

    public Router all(final List<String> paths, final Middleware... middleware) {
        return register(paths, Methods.STANDARD_METHODS, null, middleware);
    }

    /**
     * Registers a route for any HTTP method, including extension methods such as {@code PROPFIND}.
     */
    public Router verb(final String method, final String path, final Middleware... middleware) {
        return register(Collections.singletonList(path), Collections.singletonList(method), null, middleware);
    }

    public Router verb(final String method, final String name, final String path, final Middleware... middleware) {
        return register(Collections.singletonList(path), Collections.singletonList(method), name, middleware);
    }

    public Router verb(final String method, final Pattern path, final Middleware... middleware) {
        register(path, Collections.singletonList(method), Arrays.asList(middleware), RouteOptions.create());
        return this;
    }

    public Router verb(final String method, final String name, final Pattern path, final Middleware... middleware) {
        register(path, Collections.singletonList(method), Arrays.asList(middleware), RouteOptions.named(checkName(name)));
        return this;
    }

    public Router verb(final String method, final List<String> paths, final Middleware... middleware) {
        return register(paths, Collections.singletonList(method), null, middleware);
    }

    private Router register(final List<String> paths, final Collection<String> methods, final String name,
                            final Middleware... middleware) {
        register(paths, methods, Arrays.asList(middleware), name == null ? RouteOptions.create() : RouteOptions.named(checkName(name)));
        return this;
    }

    private static String checkName(final String name) {
        if (name.isEmpty()) {
            throw JunctionMessages.MESSAGES.routeNameCannotBeEmpty();
        }
        return name;
    }

    /**
     * Creates and registers a layer for each path.
     *
     * @param paths      the paths
     * @param methods    the methods the layers answer, empty for any method
     * @param middleware the middleware stack
     * @param options    route options, unset values are inherited from this router
     * @return the new layers
     */
    public List<Layer> register(final List<String> paths, final Collection<String> methods,
                                final List<? extends Middleware> middleware, final RouteOptions options) {
        final List<Layer> result = new ArrayList<>(paths.size());
        for (String path : paths) {
            result.add(register(path, methods, middleware, options));
        }
        return result;
    }

    public Layer register(final String path, final Collection<String> methods,
                          final List<? extends Middleware> middleware, final RouteOptions options) {
        return addLayer(new Layer(path, methods, middleware, layerOptions(options)));
    }

    public Layer register(final Pattern path, final Collection<String> methods,
                          final List<? extends Middleware> middleware, final RouteOptions options) {
        return addLayer(new Layer(path, methods, middleware, layerOptions(options)));
    }

    private RouteOptions layerOptions(final RouteOptions options) {
        final RouteOptions opts = options == null ? RouteOptions.create() : options.copy();
        if (opts.getSensitive() == null) {
            opts.setSensitive(sensitive);
        }
        if (opts.getStrict() == null) {
            opts.setStrict(strict);
        }
        if (opts.getPrefix() == null) {
            opts.setPrefix(prefix);
        }
        return opts;
    }

    private Layer addLayer(final Layer layer) {
        if (!prefix.isEmpty()) {
            layer.setPrefix(prefix);
        }
        for (Map.Entry<String, ParamMiddleware> entry : params.entrySet()) {
            layer.param(entry.getKey(), entry.getValue());
        }
        layers.add(layer);
        return layer;
    }

    /**
     * Registers a handler for a named path parameter. The handler runs before the handlers of every route with that
     * parameter, including routes registered later and routes of routers mounted on this one.
     *
     * <pre>
     * router.param("user", (id, ctx, next) -> {
     *     ctx.putAttachment(USER, users.get(id));
     *     return next.proceed();
     * }).get("/users/:user", handler);
     * </pre>
     *
     * @param param   the parameter name
     * @param handler the handler, passed the decoded parameter value
     * @return this router
     */
    public Router param(final String param, final ParamMiddleware handler) {
        params.put(param, handler);
        for (Layer layer : layers) {
            layer.param(param, handler);
        }
        for (Router router : mounted) {
            router.param(param, handler);
        }
        return this;
    }

    /**
     * Redirects {@code source} to {@code destination} with a 301 status.
     */
    public Router redirect(final String source, final String destination) {
        return redirect(source, destination, StatusCodes.MOVED_PERMANENTLY);
    }

    /**
     * Redirects {@code source} to {@code destination}. Either may be a route name instead of a path; anything that does
     * not start with a {@code /} is looked up by name.
     *
     * @throws RouteNotFoundException if a route name is not registered
     */
    public Router redirect(final String source, final String destination, final int status) {
        final String from = source.startsWith("/") ? source : url(source).orElseThrow();
        final String to = destination.startsWith("/") ? destination : url(destination).orElseThrow();
        return all(from, new RedirectHandler(to, status));
    }

    /**
     * @param name the route name
     * @return the first layer registered under the name
     */
    public Optional<Layer> route(final String name) {
        for (Layer layer : layers) {
            if (name.equals(layer.getName())) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    /**
     * Generates a URL for a named route.
     *
     * <pre>
     * router.get("user", "/users/:id", handler);
     * router.url("user", 3);                                   // "/users/3"
     * router.url("user", Map.of("id", 3));                     // "/users/3"
     * router.url("user", Map.of("id", 3), UrlOptions.query(Map.of("limit", 1))); // "/users/3?limit=1"
     * </pre>
     *
     * @param name the route name
     * @param args the parameters and options, see {@link Layer#url(Object...)}
     * @return the URL, or a result carrying a {@link RouteNotFoundException} if no route has the name
     */
    public UrlResult url(final String name, final Object... args) {
        final Optional<Layer> route = route(name);
        if (route.isPresent()) {
            return UrlResult.of(route.get().url(args));
        }
        JunctionLogger.ROUTER_LOGGER.urlForUnknownRoute(name);
        return UrlResult.notFound(JunctionMessages.MESSAGES.noRouteFoundForName(name));
    }

    /**
     * Generates a path for a named route from a flat map of parameters. Entries whose key appears as a
     * {@code :name} placeholder are written into the path; every other entry is appended to the query string, once per
     * element for {@link Iterable} and array values.
     *
     * <pre>
     * router.get("edit_post", "/posts/:id/edit", handler);
     * router.pathFor("edit_post", Map.of("id", 1, "page", 2)); // "/posts/1/edit?page=2"
     * </pre>
     *
     * @param name   the route name
     * @param params the parameters, may be {@code null}
     * @return the path, or an empty string if no route has the name
     * @throws IllegalStateException if the route was registered with a regular expression
     */
    public String pathFor(final String name, final Map<String, ?> params) {
        final Optional<Layer> route = route(name);
        if (!route.isPresent()) {
            JunctionLogger.ROUTER_LOGGER.urlForUnknownRoute(name);
            return "";
        }
        final Layer layer = route.get();
        if (layer.getRegexPath() != null) {
            throw JunctionMessages.MESSAGES.cannotGenerateUrlForPattern(layer.getRegexPath(), name);
        }
        String url = layer.getPath();
        if (params == null || params.isEmpty()) {
            return url;
        }

        final Set<String> replaced = new HashSet<>();
        final Matcher matcher = PLACEHOLDER.matcher(url);
        final StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            final String key = matcher.group(1);
            if (params.containsKey(key)) {
                final List<Object> values = valuesOf(params.get(key));
                sb.append(url, last, matcher.start());
                sb.append(URLUtils.encodeURIComponent(String.valueOf(values.isEmpty() ? null : values.get(0))));
                last = matcher.end();
                replaced.add(key);
            }
        }
        sb.append(url, last, url.length());
        url = sb.toString();

        final StringBuilder query = new StringBuilder();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (replaced.contains(entry.getKey())) {
                continue;
            }
            final String key = URLUtils.encodeURIComponent(entry.getKey());
            for (Object value : valuesOf(entry.getValue())) {
                if (query.length() > 0) {
                    query.append('&');
                }
                query.append(key).append('=').append(URLUtils.encodeURIComponent(String.valueOf(value)));
            }
        }
        if (query.length() == 0) {
            return url;
        }
        return url + (url.indexOf('?') == -1 ? '?' : '&') + query;
    }

    private static List<Object> valuesOf(final Object value) {
        if (value instanceof Iterable) {
            final List<Object> values = new ArrayList<>();
            for (Object o : (Iterable<?>) value) {
                values.add(o);
            }
            return values;
        } else if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        return Collections.singletonList(value);
    }

    /**
     * Finds the layers matching a path and method. This has no side effects.
     *
     * @param path   the path
     * @param method the request method, upper case
     * @return the matching layers
     */
    public MatchResult match(final String path, final String method) {
        final List<Layer> byPath = new ArrayList<>();
        final List<Layer> byPathAndMethod = new ArrayList<>();
        boolean route = false;
        for (Layer layer : layers) {
            JunctionLogger.REQUEST_LOGGER.tracef("test %s %s", layer.getPath(), layer.getPattern());
            if (layer.match(path)) {
                byPath.add(layer);
                if (layer.getMethods().isEmpty() || layer.getMethods().contains(method)) {
                    byPathAndMethod.add(layer);
                    if (!layer.getMethods().isEmpty()) {
                        route = true;
                    }
                }
            }
        }
        return new MatchResult(byPath, byPathAndMethod, route);
    }

    /**
     * @return the middleware that dispatches requests to this router
     */
    public RouterMiddleware routes() {
        return new Dispatcher();
    }

    /**
     * Same as {@link #routes()}.
     */
    public RouterMiddleware middleware() {
        return routes();
    }

    /**
     * Returns middleware that answers {@code OPTIONS} requests and sets 405 and 501 responses for requests whose path
     * matched but whose method did not. It should be registered after {@link #routes()}.
     */
    public AllowedMethodsHandler allowedMethods() {
        return allowedMethods(AllowedMethodsOptions.create());
    }

    public AllowedMethodsHandler allowedMethods(final AllowedMethodsOptions options) {
        return new AllowedMethodsHandler(methods, options);
    }

    public List<Layer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public Map<String, ParamMiddleware> getParams() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * @return the methods this router implements
     */
    public List<String> getMethods() {
        return methods;
    }

    public String getPrefix() {
        return prefix;
    }

    public OptionMap getOptions() {
        return options;
    }

    /**
     * @return the routers mounted on this one
     */
    public List<Router> getMountedRouters() {
        return Collections.unmodifiableList(mounted);
    }

    String matchPath(final RoutingContext context) {
        if (context.getMatchPath() != null) {
            return context.getMatchPath();
        }
        return routerPath != null ? routerPath : context.getRequestPath();
    }

    private final class Dispatcher implements RouterMiddleware {

        @Override
        public CompletionStage<Void> handle(final RoutingContext context, final Next next) {
            final String path = matchPath(context);
            final MatchResult matched = match(path, context.getRequestMethod());
            JunctionLogger.REQUEST_LOGGER.debugf("dispatch: %s %s, routerPath: %s, matched: %s",
                    context.getRequestMethod(), context.getRequestPath(), path, matched.hasRouteMatch());

            context.getMatched().addAll(matched.getMatchedByPath());
            context.setRouter(Router.this);
            context.putAttachment(MATCH_RESULT, matched);

            if (!matched.hasRouteMatch()) {
                if (next == null) {
                    return MiddlewareChain.completed();
                }
                return next.proceed();
            }

            final List<Middleware> chain = new ArrayList<>();
            for (Layer layer : matched.getMatchedByPathAndMethod()) {
                chain.add(new LayerEntry(layer, path));
                chain.addAll(layer.getStack());
            }
            return MiddlewareChain.compose(chain).handle(context, next);
        }

        @Override
        public Router getRouter() {
            return Router.this;
        }

        @Override
        public String toString() {
            return "routes( " + layers.size() + " layers )";
        }
    }

    /**
     * Runs ahead of a layer's stack and records the layer's captures and params on the context.
     */
    private static final class LayerEntry implements Middleware {

        private final Layer layer;
        private final String path;

        LayerEntry(final Layer layer, final String path) {
            this.layer = layer;
            this.path = path;
        }

        @Override
        public CompletionStage<Void> handle(final RoutingContext context, final Next next) {
            final List<String> captures = layer.captures(path);
            context.setCaptures(captures);
            layer.params(path, captures, context.getParams());
            context.setMatchedLayer(layer);
            return next.proceed();
        }
    }

    @Override
    public String toString() {
        return "Router{prefix='" + prefix + "', layers=" + layers.size() + '}';
    }
}
