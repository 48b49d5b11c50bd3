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

import java.util.function.Supplier;

/**
 * Options for {@link AllowedMethodsHandler}.
 */
public class AllowedMethodsOptions {

    private boolean throwErrors;
    private Supplier<? extends Exception> notImplemented;
    private Supplier<? extends Exception> methodNotAllowed;

    public static AllowedMethodsOptions create() {
        return new AllowedMethodsOptions();
    }

    public boolean isThrowErrors() {
        return throwErrors;
    }

    /**
     * If true the handler fails with an exception instead of setting the response status and {@code Allow} header.
     */
    public AllowedMethodsOptions setThrowErrors(final boolean throwErrors) {
        this.throwErrors = throwErrors;
        return this;
    }

    public Supplier<? extends Exception> getNotImplemented() {
        return notImplemented;
    }

    /**
     * Supplies the exception for methods the router does not implement, when throwing errors.
     */
    public AllowedMethodsOptions setNotImplemented(final Supplier<? extends Exception> notImplemented) {
        this.notImplemented = notImplemented;
        return this;
    }

    public Supplier<? extends Exception> getMethodNotAllowed() {
        return methodNotAllowed;
    }

    /**
     * Supplies the exception for methods no matching route answers, when throwing errors.
     */
    public AllowedMethodsOptions setMethodNotAllowed(final Supplier<? extends Exception> methodNotAllowed) {
        this.methodNotAllowed = methodNotAllowed;
        return this;
    }
}
