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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class MappingValueTest {

    private static final MappingValue MAPPING = new MappingValue(Map.of(
            "database", new MappingValue(Map.of(
                    "hosts", SequenceValue.of(
                            new MappingValue(Map.of("port", new ScalarValue(5432L))),
                            new MappingValue(Map.of("port", new ScalarValue(5433L))))))));

    @Test
    void shouldFindNestedValues() {
        assertThat(MAPPING.find("database.hosts[1].port")).contains(new ScalarValue(5433L));
        assertThat(MAPPING.find("database.hosts[0]")).contains(new MappingValue(Map.of("port", new ScalarValue(5432L))));
    }

    @Test
    void shouldNotFindMissingValues() {
        assertThat(MAPPING.find("database.users")).isEmpty();
        assertThat(MAPPING.find("database.hosts[2].port")).isEmpty();
        assertThat(MAPPING.find("database.hosts[x].port")).isEmpty();
        assertThat(MAPPING.find("database.hosts[0].port.foo")).isEmpty();
    }

    @Test
    void shouldRejectNullValues() {
        final var entries = new HashMap<String, Value>();
        entries.put("foo", null);

        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> new MappingValue(entries))
                .withMessage("value must not be null");
    }

    @Test
    void shouldBeImmutable() {
        assertThatExceptionOfType(UnsupportedOperationException.class)
                .isThrownBy(() -> MAPPING.entries().put("foo", ScalarValue.NULL));
    }

}
