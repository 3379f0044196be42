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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Deep-merges a default value tree with a partial override tree.
 * <p>
 * Rules, applied recursively:
 * <ul>
 *     <li>An absent override leaves the base unchanged.</li>
 *     <li>A scalar override replaces a scalar base.</li>
 *     <li>Mappings keep base-only keys, merge shared keys and add override-only keys.</li>
 *     <li>Sequences merge element-wise by index. An element whose shape or scalar type
 *     differs from the base element is discarded, as are elements beyond the base length.</li>
 *     <li>Records merge field-wise from a record of the same type or from a mapping.
 *     Unknown fields are discarded.</li>
 *     <li>Any other shape mismatch keeps the base.</li>
 * </ul>
 * Neither input is modified; the result is a new tree sharing unchanged subtrees.
 *
 * @since 1.0.0
 */
public final class ValueMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValueMerger.class);

    private ValueMerger() {
    }

    public static Value merge(Value base, @Nullable Value override) {
        requireNonNull(base, "base must not be null");
        return merge(base, override, "");
    }

    public static MappingValue merge(MappingValue base, @Nullable MappingValue override) {
        requireNonNull(base, "base must not be null");
        return (MappingValue) merge(base, override, "");
    }

    private static Value merge(Value base, @Nullable Value override, String path) {
        if (override == null || override.isAbsent()) {
            return base;
        }
        if (base.isAbsent()) {
            return override;
        }

        return switch (base.kind()) {
            case SCALAR -> override.kind() == Value.Kind.SCALAR
                    ? override
                    : discard(base, override, path);
            case MAPPING -> override instanceof final MappingValue overrideMapping
                    ? mergeMapping((MappingValue) base, overrideMapping, path)
                    : discard(base, override, path);
            case SEQUENCE -> override instanceof final SequenceValue overrideSequence
                    ? mergeSequence((SequenceValue) base, overrideSequence, path)
                    : discard(base, override, path);
            case RECORD -> mergeRecord((RecordValue) base, override, path);
        };
    }

    private static MappingValue mergeMapping(MappingValue base, MappingValue override, String path) {
        final var merged = new LinkedHashMap<>(base.entries());
        for (final Map.Entry<String, Value> entry : override.entries().entrySet()) {
            final Value baseValue = merged.get(entry.getKey());
            if (baseValue == null) {
                merged.put(entry.getKey(), entry.getValue());
            } else {
                merged.put(entry.getKey(), merge(baseValue, entry.getValue(), childPath(path, entry.getKey())));
            }
        }

        return new MappingValue(merged);
    }

    private static SequenceValue mergeSequence(SequenceValue base, SequenceValue override, String path) {
        final var merged = new ArrayList<>(base.elements());
        for (int i = 0; i < override.size(); i++) {
            final Value overrideElement = override.get(i);
            if (overrideElement.isAbsent()) {
                continue;
            }

            final String elementPath = path + "[" + i + "]";
            if (i >= merged.size()) {
                LOGGER.debug("Discarding override for {}: index exceeds base length {}", elementPath, merged.size());
                continue;
            }

            final Value baseElement = merged.get(i);
            if (!isCompatible(baseElement, overrideElement)) {
                discard(baseElement, overrideElement, elementPath);
                continue;
            }

            merged.set(i, merge(baseElement, overrideElement, elementPath));
        }

        return new SequenceValue(merged);
    }

    private static Value mergeRecord(RecordValue base, Value override, String path) {
        final Map<String, Value> overrideFields;
        if (override instanceof final RecordValue overrideRecord
                && overrideRecord.typeName().equals(base.typeName())) {
            overrideFields = overrideRecord.fields();
        } else if (override instanceof final MappingValue overrideMapping) {
            overrideFields = overrideMapping.entries();
        } else {
            return discard(base, override, path);
        }

        final var merged = new LinkedHashMap<>(base.fields());
        for (final Map.Entry<String, Value> entry : overrideFields.entrySet()) {
            final String fieldPath = childPath(path, entry.getKey());
            final Value baseField = merged.get(entry.getKey());
            if (baseField == null) {
                LOGGER.warn("Discarding override for {}: {} has no such field", fieldPath, base.typeName());
                continue;
            }
            if (entry.getValue().isAbsent()) {
                continue;
            }
            if (!isCompatible(baseField, entry.getValue())) {
                discard(baseField, entry.getValue(), fieldPath);
                continue;
            }

            merged.put(entry.getKey(), merge(baseField, entry.getValue(), fieldPath));
        }

        return new RecordValue(base.typeName(), merged);
    }

    private static boolean isCompatible(Value base, Value override) {
        if (base.isAbsent()) {
            return true;
        }
        if (base instanceof final ScalarValue baseScalar) {
            return override instanceof final ScalarValue overrideScalar
                    && baseScalar.isSameTypeAs(overrideScalar);
        }
        if (base instanceof RecordValue) {
            return override.kind() == Value.Kind.RECORD || override.kind() == Value.Kind.MAPPING;
        }

        return base.kind() == override.kind();
    }

    private static Value discard(Value base, Value override, String path) {
        LOGGER.warn("Discarding override for {}: expected {} but got {}",
                path.isEmpty() ? "<root>" : path, describe(base), describe(override));
        return base;
    }

    private static String describe(Value value) {
        if (value instanceof final ScalarValue scalar && scalar.content() != null) {
            return "scalar of type " + scalar.content().getClass().getSimpleName();
        }

        return value.kind().name().toLowerCase(Locale.ROOT);
    }

    private static String childPath(String path, String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

}
