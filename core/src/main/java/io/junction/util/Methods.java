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

import java.util.List;

/**
 * HTTP method names.
 */
public final class Methods {

    private Methods() {
    }

    public static final String ACL = "ACL";
    public static final String BIND = "BIND";
    public static final String CHECKOUT = "CHECKOUT";
    public static final String CONNECT = "CONNECT";
    public static final String COPY = "COPY";
    public static final String DELETE = "DELETE";
    public static final String GET = "GET";
    public static final String HEAD = "HEAD";
    public static final String LINK = "LINK";
    public static final String LOCK = "LOCK";
    public static final String M_SEARCH = "M-SEARCH";
    public static final String MERGE = "MERGE";
    public static final String MKACTIVITY = "MKACTIVITY";
    public static final String MKCALENDAR = "MKCALENDAR";
    public static final String MKCOL = "MKCOL";
    public static final String MOVE = "MOVE";
    public static final String NOTIFY = "NOTIFY";
    public static final String OPTIONS = "OPTIONS";
    public static final String PATCH = "PATCH";
    public static final String POST = "POST";
    public static final String PROPFIND = "PROPFIND";
    public static final String PROPPATCH = "PROPPATCH";
    public static final String PURGE = "PURGE";
    public static final String PUT = "PUT";
    public static final String REBIND = "REBIND";
    public static final String REPORT = "REPORT";
    public static final String SEARCH = "SEARCH";
    public static final String SOURCE = "SOURCE";
    public static final String SUBSCRIBE = "SUBSCRIBE";
    public static final String TRACE = "TRACE";
    public static final String UNBIND = "UNBIND";
    public static final String UNLINK = "UNLINK";
    public static final String UNLOCK = "UNLOCK";
    public static final String UNSUBSCRIBE = "UNSUBSCRIBE";

    /**
     * Every method a route registered with {@code all} answers to, in alphabetical order.
     */
    public static final List<String> STANDARD_METHODS = List.of(
            ACL, BIND, CHECKOUT, CONNECT, COPY, DELETE, GET, HEAD, LINK, LOCK, M_SEARCH, MERGE, MKACTIVITY,
            MKCALENDAR, MKCOL, MOVE, NOTIFY, OPTIONS, PATCH, POST, PROPFIND, PROPPATCH, PURGE, PUT, REBIND,
            REPORT, SEARCH, SOURCE, SUBSCRIBE, TRACE, UNBIND, UNLINK, UNLOCK, UNSUBSCRIBE);
}
