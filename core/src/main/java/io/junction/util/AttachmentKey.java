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
 * Identity-keyed, typed slot on a {@link AbstractAttachable}, such as the user loaded by a parameter handler or the
 * {@link io.junction.server.Router#MATCH_RESULT} of the last dispatch.
 *
 * @param <T> the attachment type
 */
public final class AttachmentKey<T> {

    private final Class<? super T> valueClass;

    private AttachmentKey(final Class<? super T> valueClass) {
        this.valueClass = valueClass;
    }

    @SuppressWarnings("unchecked")
    T cast(final Object value) {
        return (T) valueClass.cast(value);
    }

    public static <T> AttachmentKey<T> create(final Class<? super T> valueClass) {
        return new AttachmentKey<>(valueClass);
    }

    @Override
    public String toString() {
        return "AttachmentKey{" + valueClass.getSimpleName() + "}";
    }
}
