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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A structured record with a fixed set of fields, typically lifted from a typed
 * default object via {@link Values#fromObject(Object)}.
 * <p>
 * Unlike a {@link MappingValue}, merging never adds fields to a record.
 *
 * @param typeName Fully qualified name of the type the record was lifted from.
 * @param fields   Field values by field name.
 * @since 1.0.0
 */
public record RecordValue(String typeName, Map<String, Value> fields) implements Value {

    public RecordValue {
        requireNonNull(typeName, "typeName must not be null");
        requireNonNull(fields, "fields must not be null");
        final var copy = new LinkedHashMap<String, Value>(fields.size());
        fields.forEach((key, value) -> copy.put(
                requireNonNull(key, "key must not be null"),
                requireNonNull(value, "value must not be null")));
        fields = Collections.unmodifiableMap(copy);
    }

    @Override
    public Kind kind() {
        return Kind.RECORD;
    }

}
