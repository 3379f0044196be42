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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ordered list of values. Gaps are represented by {@link ScalarValue#NULL}.
 *
 * @since 1.0.0
 */
public record SequenceValue(List<Value> elements) implements Value {

    public SequenceValue {
        requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    public static SequenceValue of(Value... elements) {
        return new SequenceValue(List.of(elements));
    }

    @Override
    public Kind kind() {
        return Kind.SEQUENCE;
    }

    public int size() {
        return elements.size();
    }

    public Value get(int index) {
        return elements.get(index);
    }

}
