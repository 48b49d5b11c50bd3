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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import io.junction.JunctionLogger;
import io.junction.JunctionMessages;
import io.junction.util.Methods;
import io.junction.util.PathPattern;
import io.junction.util.PathPatternOptions;
import io.junction.util.PathPatternParser;
import io.junction.util.PathTemplate;
import io.junction.util.QueryParameterUtils;
import io.junction.util.URLUtils;

/**
 * A single route: a path, the methods it answers and the middleware stack that runs when it matches.
 * <p>
 * Layers are created by {@link Router}. A layer whose method list is empty answers any method; this is the case for
 * middleware registered with {@link Router#use(Middleware...)}. A layer answering {@code GET} also answers
 * {@code HEAD}.
 */
public class Layer {

    private static final String CATCH_ALL_GROUP = "(.*)";
    private static final String QUERY = "query";

    private final String name;
    private final String prefix;
    private final List<String> methods;
    private final List<Middleware> stack;
    private final PathPatternOptions patternOptions;
    private final boolean ignoreCaptures;
    private final Pattern regexPath;
    private String path;
    private PathPattern pattern;
    private List<String> paramNames;

    public Layer(final String path, final Collection<String> methods, final List<? extends Middleware> middleware,
                 final RouteOptions options) {
        this(path, null, methods, middleware, options);
    }

    public Layer(final Pattern path, final Collection<String> methods, final List<? extends Middleware> middleware,
                 final RouteOptions options) {
        this(null, path, methods, middleware, options);
    }

    private Layer(final String path, final Pattern regexPath, final Collection<String> methods,
                  final List<? extends Middleware> middleware, final RouteOptions options) {
        final RouteOptions opts = options == null ? RouteOptions.create() : options;
        this.name = opts.getName();
        this.prefix = opts.getPrefix() == null ? "" : opts.getPrefix();
        this.methods = normalizeMethods(methods);
        this.stack = new ArrayList<>(middleware.size());
        for (Middleware m : middleware) {
            if (m == null) {
                throw JunctionMessages.MESSAGES.invalidMiddleware(String.join(",", methods),
                        name != null ? name : String.valueOf(path != null ? path : regexPath));
            }
            this.stack.add(m);
        }
        this.patternOptions = PathPatternOptions.create(
                Boolean.TRUE.equals(opts.getSensitive()),
                Boolean.TRUE.equals(opts.getStrict()),
                !Boolean.FALSE.equals(opts.getEnd()));
        this.ignoreCaptures = Boolean.TRUE.equals(opts.getIgnoreCaptures());
        this.regexPath = regexPath;
        this.path = path;
        compile();

        JunctionLogger.ROUTER_LOGGER.debugf("defined route %s %s", this.methods, this.prefix + getPath());
    }

    private Layer(final Layer other) {
        this.name = other.name;
        this.prefix = other.prefix;
        this.methods = other.methods;
        this.stack = new ArrayList<>(other.stack);
        this.patternOptions = other.patternOptions;
        this.ignoreCaptures = other.ignoreCaptures;
        this.regexPath = other.regexPath;
        this.path = other.path;
        this.pattern = other.pattern;
        this.paramNames = other.paramNames;
    }

    private static List<String> normalizeMethods(final Collection<String> methods) {
        final List<String> result = new ArrayList<>(methods.size() + 1);
        for (String method : methods) {
            final String m = method.toUpperCase(Locale.ENGLISH);
            if (result.contains(m)) {
                continue;
            }
            result.add(m);
            if (m.equals(Methods.GET)) {
                result.remove(Methods.HEAD);
                result.add(0, Methods.HEAD);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private void compile() {
        if (regexPath != null) {
            pattern = PathPattern.compile(regexPath);
        } else {
            pattern = PathPattern.compile(path, patternOptions);
        }
        paramNames = Collections.unmodifiableList(pattern.getKeyNames());
    }

    /**
     * @param path the path to test
     * @return true if the path matches this layer
     */
    public boolean match(final String path) {
        return pattern.matches(path);
    }

    /**
     * Returns the raw values captured from the path, in the order of {@link #getParamNames()}. The list is empty if the
     * path does not match or this layer ignores captures.
     */
    public List<String> captures(final String path) {
        if (ignoreCaptures) {
            return new ArrayList<>();
        }
        return pattern.capture(path);
    }

    /**
     * Decodes captures into named parameters.
     * <p>
     * Values that can't be percent decoded are kept as they are.
     *
     * @param path           the matched path
     * @param captures       the captures, as returned by {@link #captures(String)}
     * @param existingParams parameters to add to, may be {@code null}
     * @return the parameters, the same map as {@code existingParams} if one was given
     */
    public Map<String, String> params(final String path, final List<String> captures, final Map<String, String> existingParams) {
        final Map<String, String> params = existingParams == null ? new LinkedHashMap<>() : existingParams;
        for (int i = 0; i < captures.size() && i < paramNames.size(); ++i) {
            final String paramName = paramNames.get(i);
            final String c = captures.get(i);
            params.put(paramName, c == null || c.isEmpty() ? c : safeDecode(paramName, c));
        }
        return params;
    }

    private static String safeDecode(final String paramName, final String value) {
        try {
            return URLUtils.decodeURIComponent(value);
        } catch (IllegalArgumentException e) {
            JunctionLogger.REQUEST_LOGGER.failedToDecodeParameter(paramName, value, e);
            return value;
        }
    }

    /**
     * Generates a URL for this layer.
     * <p>
     * The arguments take one of these forms:
     * <ul>
     * <li>a {@link Map} of parameter values, optionally followed by {@link UrlOptions} or a {@link Map} with a
     * {@code query} entry</li>
     * <li>parameter values in path order, optionally followed by {@link UrlOptions} or a {@link Map} with the
     * options</li>
     * <li>only options, for paths without parameters</li>
     * </ul>
     * Parameters without a value are left in the URL as written in the path.
     *
     * <pre>
     * new Layer("/users/:id", ...).url(123);                        // "/users/123"
     * new Layer("/users/:id", ...).url(Map.of("id", 123));          // "/users/123"
     * new Layer("/users/:id", ...).url(123, UrlOptions.query("a=b")); // "/users/123?a=b"
     * </pre>
     *
     * @param args the parameters and options
     * @return the URL
     * @throws IllegalStateException if this layer's path is a regular expression
     */
    public String url(final Object... args) {
        if (regexPath != null) {
            throw JunctionMessages.MESSAGES.cannotGenerateUrlForPattern(regexPath, name);
        }
        return toUrl(path, args);
    }

    /**
     * Generates a URL from a path, without registering a route.
     *
     * @param path the route path
     * @param args the parameters and options, as for {@link #url(Object...)}
     * @return the URL
     */
    public static String toUrl(final String path, final Object... args) {
        final PathTemplate template = PathTemplate.parse(path.replace(CATCH_ALL_GROUP, ""));
        final Object[] arguments = args == null ? new Object[0] : args;
        final Object first = arguments.length > 0 ? arguments[0] : null;

        Object options = null;
        Map<String, ?> replace = Collections.emptyMap();

        if (first != null && !isOptionsLike(first)) {
            // url(value1, value2, ..., options)
            int count = arguments.length;
            if (isOptionsLike(arguments[count - 1])) {
                options = arguments[--count];
            }
            final Map<String, Object> positional = new HashMap<>();
            int j = 0;
            for (PathPatternParser.Token token : template.getTokens()) {
                if (token instanceof PathPatternParser.Key && j < count) {
                    positional.put(((PathPatternParser.Key) token).getName(), arguments[j++]);
                }
            }
            replace = positional;
        } else if (first instanceof Map && hasKeys(template)) {
            // url(params, options)
            replace = asMap(first);
            if (arguments.length > 1 && hasQuery(arguments[1])) {
                options = arguments[1];
            }
        } else {
            // url(options)
            options = first;
        }

        final String replaced = template.render(replace);
        final Object query = queryOf(options);
        if (query == null) {
            return replaced;
        }
        if (query instanceof Map) {
            return QueryParameterUtils.replaceQueryString(replaced, QueryParameterUtils.buildQueryString(asMap(query)));
        }
        final String q = query.toString();
        return q.isEmpty() ? replaced : QueryParameterUtils.replaceQueryString(replaced, q);
    }

    private static boolean isOptionsLike(final Object o) {
        return o instanceof Map || o instanceof UrlOptions;
    }

    private static boolean hasQuery(final Object o) {
        return o instanceof UrlOptions || (o instanceof Map && ((Map<?, ?>) o).containsKey(QUERY));
    }

    private static boolean hasKeys(final PathTemplate template) {
        for (PathPatternParser.Token token : template.getTokens()) {
            if (token instanceof PathPatternParser.Key) {
                return true;
            }
        }
        return false;
    }

    private static Object queryOf(final Object options) {
        if (options instanceof UrlOptions) {
            return ((UrlOptions) options).getQuery();
        } else if (options instanceof Map) {
            return ((Map<?, ?>) options).get(QUERY);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(final Object o) {
        return (Map<String, ?>) o;
    }

    /**
     * Adds a validator for a parameter of this layer. Validators run before the rest of the stack, in the order their
     * parameters appear in the path, whatever order they were added in. Nothing happens if this layer's path has no
     * parameter of that name, or if the same handler is already installed for it.
     *
     * @param param   the parameter name
     * @param handler the handler
     * @return this layer
     */
    public Layer param(final String param, final ParamMiddleware handler) {
        final int x = paramNames.indexOf(param);
        if (x > -1 && !hasValidator(param, handler)) {
            for (int i = 0; i < stack.size(); ++i) {
                final Middleware m = stack.get(i);
                if (!(m instanceof ParamValidator) || paramNames.indexOf(((ParamValidator) m).getParam()) > x) {
                    stack.add(i, new ParamValidator(param, handler));
                    break;
                }
            }
        }
        return this;
    }

    private boolean hasValidator(final String param, final ParamMiddleware handler) {
        for (Middleware m : stack) {
            if (m instanceof ParamValidator) {
                final ParamValidator validator = (ParamValidator) m;
                if (validator.getParam().equals(param) && validator.getHandler() == handler) {
                    return true;
                }
            } else {
                break;
            }
        }
        return false;
    }

    /**
     * Prepends a prefix to the path and recompiles it. Calling this twice applies the prefix twice. Layers with an
     * empty path or a regular expression path are left alone.
     *
     * @param prefix the prefix
     * @return this layer
     */
    public Layer setPrefix(final String prefix) {
        if (path != null && !path.isEmpty()) {
            path = prefix + path;
            compile();
        }
        return this;
    }

    /**
     * @return an independent layer with the same path, methods and options and a copy of the stack
     */
    public Layer copy() {
        return new Layer(this);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the path, or the source of the regular expression for regular expression layers
     */
    public String getPath() {
        return path != null ? path : regexPath.pattern();
    }

    /**
     * @return the regular expression this layer was registered with, or {@code null} for string paths
     */
    public Pattern getRegexPath() {
        return regexPath;
    }

    public List<String> getMethods() {
        return methods;
    }

    /**
     * @return the middleware stack, including parameter validators
     */
    public List<Middleware> getStack() {
        return Collections.unmodifiableList(stack);
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public PathPattern getPattern() {
        return pattern;
    }

    public PathPatternOptions getPatternOptions() {
        return patternOptions;
    }

    public boolean isIgnoreCaptures() {
        return ignoreCaptures;
    }

    @Override
    public String toString() {
        return "Layer{" + methods + ' ' + getPath() + (name != null ? ", name=" + name : "") + '}';
    }
}
