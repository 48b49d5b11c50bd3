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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

import io.junction.JunctionMessages;

/**
 * Utilities for encoding and decoding URL components.
 * <p>
 * The encoders follow the rules browsers use for {@code encodeURIComponent} and {@code encodeURI}, so URLs generated
 * by the router look the same as ones built client side.
 */
public class URLUtils {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /**
     * Characters left alone by {@link #encodeURIComponent(String)}.
     */
    private static final BitSet COMPONENT_SAFE = new BitSet(128);

    /**
     * Characters left alone by {@link #encodeURI(String)}.
     */
    private static final BitSet URI_SAFE = new BitSet(128);

    /**
     * Characters left alone by {@link #encodeQueryComponent(String)}.
     */
    private static final BitSet QUERY_SAFE = new BitSet(128);

    static {
        for (char c = 'a'; c <= 'z'; ++c) {
            QUERY_SAFE.set(c);
        }
        for (char c = 'A'; c <= 'Z'; ++c) {
            QUERY_SAFE.set(c);
        }
        for (char c = '0'; c <= '9'; ++c) {
            QUERY_SAFE.set(c);
        }
        for (char c : "-_.~".toCharArray()) {
            QUERY_SAFE.set(c);
        }
        COMPONENT_SAFE.or(QUERY_SAFE);
        for (char c : "!*'()".toCharArray()) {
            COMPONENT_SAFE.set(c);
        }
        URI_SAFE.or(COMPONENT_SAFE);
        for (char c : ";,/?:@&=+$#".toCharArray()) {
            URI_SAFE.set(c);
        }
    }

    private URLUtils() {

    }

    /**
     * Encodes a single path segment or parameter value. Everything except letters, digits and {@code -_.!~*'()} is
     * percent encoded as UTF-8.
     *
     * @param s the value to encode
     * @return the encoded value
     */
    public static String encodeURIComponent(final String s) {
        return encode(s, COMPONENT_SAFE);
    }

    /**
     * Encodes a string that may contain URI delimiters, which are kept as is.
     *
     * @param s the value to encode
     * @return the encoded value
     */
    public static String encodeURI(final String s) {
        return encode(s, URI_SAFE);
    }

    /**
     * Encodes a query string key or value. This is stricter than {@link #encodeURIComponent(String)}, and spaces are
     * written as {@code +}.
     *
     * @param s the value to encode
     * @return the encoded value
     */
    public static String encodeQueryComponent(final String s) {
        return encode(s, QUERY_SAFE).replace("%20", "+");
    }

    private static String encode(final String s, final BitSet safe) {
        int i = 0;
        final int length = s.length();
        while (i < length && s.charAt(i) < 128 && safe.get(s.charAt(i))) {
            ++i;
        }
        if (i == length) {
            return s;
        }
        final StringBuilder sb = new StringBuilder(length + 16);
        sb.append(s, 0, i);
        while (i < length) {
            final char c = s.charAt(i);
            if (c < 128 && safe.get(c)) {
                sb.append(c);
                ++i;
                continue;
            }
            final int end = Character.isHighSurrogate(c) && i + 1 < length ? i + 2 : i + 1;
            for (byte b : s.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%');
                sb.append(HEX[(b >> 4) & 0xF]);
                sb.append(HEX[b & 0xF]);
            }
            i = end;
        }
        return sb.toString();
    }

    /**
     * Decodes a percent encoded component. Unlike form decoding a {@code +} is left alone. If the string contains a
     * truncated or non hex escape, or the escaped bytes are not valid UTF-8, an IllegalArgumentException is thrown.
     *
     * @param s The string to decode
     * @return The decoded string
     */
    public static String decodeURIComponent(final String s) {
        if (s.indexOf('%') == -1) {
            return s;
        }
        final int numChars = s.length();
        final StringBuilder buffer = new StringBuilder(numChars);
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        byte[] bytes = null;
        int i = 0;
        while (i < numChars) {
            char c = s.charAt(i);
            if (c != '%') {
                buffer.append(c);
                ++i;
                continue;
            }
            // consecutive %xy sequences form one UTF-8 byte run
            if (bytes == null) {
                bytes = new byte[(numChars - i) / 3 + 1];
            }
            int pos = 0;
            while (i < numChars && s.charAt(i) == '%') {
                if (i + 2 >= numChars) {
                    throw JunctionMessages.MESSAGES.failedToDecodeURL(s, null);
                }
                final int hi = hexValue(s.charAt(i + 1));
                final int lo = hexValue(s.charAt(i + 2));
                if (hi == -1 || lo == -1) {
                    throw JunctionMessages.MESSAGES.failedToDecodeURL(s, null);
                }
                bytes[pos++] = (byte) ((hi << 4) + lo);
                i += 3;
            }
            try {
                buffer.append(decoder.decode(ByteBuffer.wrap(bytes, 0, pos)));
            } catch (CharacterCodingException e) {
                throw JunctionMessages.MESSAGES.failedToDecodeURL(s, e);
            }
        }
        return buffer.toString();
    }

    private static int hexValue(final char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        } else if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
