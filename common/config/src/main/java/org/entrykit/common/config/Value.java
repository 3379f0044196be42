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

/**
 * A node of a configuration tree.
 * <p>
 * The set of shapes is closed: every tree built from a boot document, a flat
 * override string or a typed default object consists of exactly these four variants.
 *
 * @since 1.0.0
 */
public sealed interface Value permits ScalarValue, SequenceValue, MappingValue, RecordValue {

    enum Kind {
        SCALAR,
        SEQUENCE,
        MAPPING,
        RECORD
    }

    Kind kind();

    /**
     * @return Whether this value denotes the absence of a value,
     * i.e. a {@code null} scalar or a gap in a sequence.
     */
    default boolean isAbsent() {
        return false;
    }

}
