/*
 * This file is part of EntryKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) The EntryKit Authors. All Rights Reserved.
 */
package org.entrykit.common.config;

import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses flat override strings such as {@code key1=value1,slice[0]=value0,cred[0].endpoint=host:2379}
 * into a {@link MappingValue}.
 * <p>
 * Grammar:
 * <ul>
 *     <li>Entries are separated by {@code ,}.</li>
 *     <li>Key and value are separated by {@code =}.</li>
 *     <li>{@code name[index]} addresses an element of a sequence. Missing lower indices
 *     are filled with absent values. Only one level of indexing per segment is supported,
 *     and indices must not exceed {@value #MAX_INDEX}.</li>
 *     <li>{@code .} navigates into a mapping.</li>
 *     <li>A value of the form <code>{a,b}</code> is a sequence literal.</li>
 *     <li>A backslash escapes the following character.</li>
 *     <li>{@code true}, {@code false}, {@code null} and integers without leading zero are typed;
 *     everything else is a string.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class FlatOverrideParser {

    static final int MAX_INDEX = 65536;

    private static final int EOF = -1;
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?[1-9][0-9]*$");

    private final String input;
    private int position;

    private FlatOverrideParser(String input) {
        this.input = input;
    }

    /**
     * @param input The override string. May be {@code null} or blank.
     * @return The parsed overrides.
     * @throws ConfigParseException When the string is malformed.
     */
    public static MappingValue parse(@Nullable String input) throws ConfigParseException {
        if (input == null || input.isBlank()) {
            return MappingValue.EMPTY;
        }

        return new FlatOverrideParser(input).parse();
    }

    private MappingValue parse() throws ConfigParseException {
        final var root = new LinkedHashMap<String, Object>();
        while (position < input.length()) {
            parseEntry(root);
        }

        return toMapping(root);
    }

    private void parseEntry(Map<String, Object> root) throws ConfigParseException {
        Map<String, Object> current = root;

        while (true) {
            final int keyStart = position;
            final var name = new StringBuilder();
            final int stop = readUntil(name, "=[,.");
            if (name.isEmpty()) {
                throw new ConfigParseException("Empty key at position %d of override string".formatted(keyStart));
            }

            final String key = name.toString();
            switch (stop) {
                case '.' -> current = childMapping(current, key);
                case '=' -> {
                    current.put(key, readValue());
                    return;
                }
                case '[' -> {
                    final int index = readIndex(key);
                    final List<Object> list = childSequence(current, key);

                    final int next = read();
                    if (next == '=') {
                        setIndex(list, index, readValue());
                        return;
                    } else if (next == '.') {
                        current = elementMapping(list, index);
                    } else if (next == '[') {
                        throw new ConfigParseException("Nested index is not supported for key %s".formatted(key));
                    } else {
                        throw new ConfigParseException("Unexpected data after index of key %s".formatted(key));
                    }
                }
                default -> throw new ConfigParseException("Key %s has no value".formatted(key));
            }
        }
    }

    private int readIndex(String key) throws ConfigParseException {
        final var digits = new StringBuilder();
        if (readUntil(digits, "]") != ']') {
            throw new ConfigParseException("Index of key %s is not terminated with ]".formatted(key));
        }

        final int index;
        try {
            index = Integer.parseInt(digits.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigParseException(
                    "Index of key %s is not numeric: %s".formatted(key, digits), e);
        }

        if (index < 0) {
            throw new ConfigParseException("Index of key %s must not be negative: %d".formatted(key, index));
        }
        if (index > MAX_INDEX) {
            throw new ConfigParseException("Index of key %s must not exceed %d: %d".formatted(key, MAX_INDEX, index));
        }

        return index;
    }

    private Value readValue() throws ConfigParseException {
        if (position < input.length() && input.charAt(position) == '{') {
            position++;
            return readSequenceLiteral();
        }

        final var text = new StringBuilder();
        readUntil(text, ",");
        return typedValue(text.toString());
    }

    private Value readSequenceLiteral() throws ConfigParseException {
        final var elements = new ArrayList<Value>();
        while (true) {
            final var text = new StringBuilder();
            final int stop = readUntil(text, ",}");
            if (stop == EOF) {
                throw new ConfigParseException("Sequence literal must terminate with }");
            }

            elements.add(typedValue(text.toString()));
            if (stop == '}') {
                if (position < input.length() && input.charAt(position) == ',') {
                    position++;
                }
                return new SequenceValue(elements);
            }
        }
    }

    private int readUntil(StringBuilder target, String stopChars) throws ConfigParseException {
        while (position < input.length()) {
            final char c = input.charAt(position++);
            if (stopChars.indexOf(c) >= 0) {
                return c;
            }
            if (c == '\\') {
                if (position >= input.length()) {
                    throw new ConfigParseException("Dangling escape at end of override string");
                }
                target.append(input.charAt(position++));
                continue;
            }
            target.append(c);
        }

        return EOF;
    }

    private int read() {
        return position < input.length() ? input.charAt(position++) : EOF;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> childMapping(Map<String, Object> parent, String key) throws ConfigParseException {
        final Object existing = parent.get(key);
        if (existing == null) {
            final var child = new LinkedHashMap<String, Object>();
            parent.put(key, child);
            return child;
        }
        if (existing instanceof Map<?, ?>) {
            return (Map<String, Object>) existing;
        }

        throw new ConfigParseException("Key %s is used both as a mapping and as another type".formatted(key));
    }

    @SuppressWarnings("unchecked")
    private static List<Object> childSequence(Map<String, Object> parent, String key) throws ConfigParseException {
        final Object existing = parent.get(key);
        if (existing == null) {
            final var child = new ArrayList<>();
            parent.put(key, child);
            return child;
        }
        if (existing instanceof List<?>) {
            return (List<Object>) existing;
        }

        throw new ConfigParseException("Key %s is used both as a sequence and as another type".formatted(key));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> elementMapping(List<Object> list, int index) {
        if (index < list.size() && list.get(index) instanceof Map<?, ?>) {
            return (Map<String, Object>) list.get(index);
        }

        final var child = new LinkedHashMap<String, Object>();
        setIndex(list, index, child);
        return child;
    }

    private static void setIndex(List<Object> list, int index, Object element) {
        while (list.size() <= index) {
            list.add(null);
        }
        list.set(index, element);
    }

    static Value typedValue(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return new ScalarValue(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(text)) {
            return new ScalarValue(Boolean.FALSE);
        }
        if ("null".equalsIgnoreCase(text)) {
            return ScalarValue.NULL;
        }
        if ("0".equals(text)) {
            return new ScalarValue(0L);
        }
        if (INTEGER_PATTERN.matcher(text).matches()) {
            final var number = new BigInteger(text);
            return number.bitLength() < Long.SIZE
                    ? new ScalarValue(number.longValue())
                    : new ScalarValue(number);
        }

        return new ScalarValue(text);
    }

    private static MappingValue toMapping(Map<String, Object> raw) {
        final var entries = new LinkedHashMap<String, Value>(raw.size());
        raw.forEach((key, value) -> entries.put(key, toValue(value)));
        return new MappingValue(entries);
    }

    @SuppressWarnings("unchecked")
    private static Value toValue(@Nullable Object raw) {
        if (raw == null) {
            return ScalarValue.NULL;
        }
        if (raw instanceof Map<?, ?>) {
            return toMapping((Map<String, Object>) raw);
        }
        if (raw instanceof final List<?> list) {
            return new SequenceValue(list.stream().map(FlatOverrideParser::toValue).toList());
        }

        return (Value) raw;
    }

}
