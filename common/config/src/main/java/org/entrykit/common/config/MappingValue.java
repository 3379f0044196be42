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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A string-keyed mapping of values. Iteration order is insertion order.
 *
 * @since 1.0.0
 */
public record MappingValue(Map<String, Value> entries) implements Value {

    public static final MappingValue EMPTY = new MappingValue(Map.of());

    public MappingValue {
        requireNonNull(entries, "entries must not be null");
        final var copy = new LinkedHashMap<String, Value>(entries.size());
        entries.forEach((key, value) -> copy.put(
                requireNonNull(key, "key must not be null"),
                requireNonNull(value, "value must not be null")));
        entries = Collections.unmodifiableMap(copy);
    }

    @Override
    public Kind kind() {
        return Kind.MAPPING;
    }

    public @Nullable Value get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Resolve a dotted path such as {@code database.hosts[1].port}.
     *
     * @param path The path to resolve.
     * @return The value at the given path, if any.
     */
    public Optional<Value> find(String path) {
        requireNonNull(path, "path must not be null");

        Value current = this;
        for (final String segment : path.split("\\.")) {
            String name = segment;
            Integer index = null;

            final int bracketIndex = segment.indexOf('[');
            if (bracketIndex >= 0 && segment.endsWith("]")) {
                name = segment.substring(0, bracketIndex);
                try {
                    index = Integer.parseInt(segment.substring(bracketIndex + 1, segment.length() - 1));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }

            if (current instanceof final MappingValue mapping) {
                current = mapping.get(name);
            } else if (current instanceof final RecordValue recordValue) {
                current = recordValue.fields().get(name);
            } else {
                return Optional.empty();
            }

            if (current != null && index != null) {
                if (!(current instanceof final SequenceValue sequence)
                        || index < 0
                        || index >= sequence.size()) {
                    return Optional.empty();
                }
                current = sequence.get(index);
            }

            if (current == null) {
                return Optional.empty();
            }
        }

        return Optional.of(current);
    }

}
