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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Conversions between {@link Value} trees, Jackson trees and typed objects.
 *
 * @since 1.0.0
 */
public final class Values {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Values() {
    }

    public static Value fromJsonNode(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ScalarValue.NULL;
        }

        if (node instanceof final ObjectNode objectNode) {
            final var entries = new LinkedHashMap<String, Value>();
            final Iterator<Map.Entry<String, JsonNode>> fields = objectNode.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromJsonNode(field.getValue()));
            }
            return new MappingValue(entries);
        }

        if (node instanceof final ArrayNode arrayNode) {
            final var elements = new ArrayList<Value>(arrayNode.size());
            arrayNode.forEach(element -> elements.add(fromJsonNode(element)));
            return new SequenceValue(elements);
        }

        if (node.isBoolean()) {
            return new ScalarValue(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong()
                    ? new ScalarValue(node.longValue())
                    : new ScalarValue(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new ScalarValue(node.doubleValue());
        }
        return new ScalarValue(node.asText());
    }

    public static JsonNode toJsonNode(Value value) {
        requireNonNull(value, "value must not be null");
        final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;

        if (value instanceof final MappingValue mapping) {
            final ObjectNode objectNode = nodeFactory.objectNode();
            mapping.entries().forEach((key, child) -> objectNode.set(key, toJsonNode(child)));
            return objectNode;
        }
        if (value instanceof final RecordValue recordValue) {
            final ObjectNode objectNode = nodeFactory.objectNode();
            recordValue.fields().forEach((key, child) -> objectNode.set(key, toJsonNode(child)));
            return objectNode;
        }
        if (value instanceof final SequenceValue sequence) {
            final ArrayNode arrayNode = nodeFactory.arrayNode();
            sequence.elements().forEach(element -> arrayNode.add(toJsonNode(element)));
            return arrayNode;
        }

        final Object content = ((ScalarValue) value).content();
        if (content == null) {
            return nodeFactory.nullNode();
        } else if (content instanceof final Boolean bool) {
            return nodeFactory.booleanNode(bool);
        } else if (content instanceof final Long number) {
            return nodeFactory.numberNode(number);
        } else if (content instanceof final Double number) {
            return nodeFactory.numberNode(number);
        } else if (content instanceof final BigInteger number) {
            return nodeFactory.numberNode(number);
        }

        return nodeFactory.textNode(content.toString());
    }

    /**
     * Lift a typed object into a {@link RecordValue}, so that it can serve as the
     * base of a {@link ValueMerger#merge(Value, Value)} call.
     *
     * @param object The object to lift. Must serialize to a JSON object.
     * @return The record.
     */
    public static RecordValue fromObject(Object object) {
        requireNonNull(object, "object must not be null");

        final JsonNode node = OBJECT_MAPPER.valueToTree(object);
        if (!(node instanceof final ObjectNode objectNode)) {
            throw new IllegalArgumentException(
                    "%s does not serialize to an object".formatted(object.getClass().getName()));
        }

        final var mapping = (MappingValue) fromJsonNode(objectNode);
        return new RecordValue(object.getClass().getName(), mapping.entries());
    }

    /**
     * Bind a value tree to a typed object.
     *
     * @param value The value to bind.
     * @param type  The target type.
     * @return The bound object.
     * @throws ConfigParseException When the value does not fit the target type.
     */
    public static <T> T toObject(Value value, Class<T> type) throws ConfigParseException {
        return toObject(OBJECT_MAPPER, value, type);
    }

    public static <T> T toObject(ObjectMapper objectMapper, Value value, Class<T> type) throws ConfigParseException {
        requireNonNull(objectMapper, "objectMapper must not be null");
        requireNonNull(type, "type must not be null");

        try {
            return objectMapper.treeToValue(toJsonNode(value), type);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new ConfigParseException("Failed to bind config to %s".formatted(type.getName()), e);
        }
    }

    /**
     * @param value The value tree.
     * @return A copy of the tree with all mapping keys converted to lower case.
     * Record field names are left untouched.
     */
    public static Value lowerCaseKeys(Value value) {
        if (value instanceof final MappingValue mapping) {
            final var entries = new LinkedHashMap<String, Value>(mapping.entries().size());
            mapping.entries().forEach((key, child) ->
                    entries.put(key.toLowerCase(Locale.ROOT), lowerCaseKeys(child)));
            return new MappingValue(entries);
        }
        if (value instanceof final SequenceValue sequence) {
            return new SequenceValue(sequence.elements().stream()
                    .map(Values::lowerCaseKeys)
                    .toList());
        }

        return value;
    }

}
