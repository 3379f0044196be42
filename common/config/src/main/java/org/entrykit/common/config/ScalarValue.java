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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A leaf of a configuration tree.
 * <p>
 * Integral numbers are normalized to {@link Long} (or {@link BigInteger} when they
 * do not fit), floating point numbers to {@link Double}. A {@code null} content
 * represents an absent value.
 *
 * @since 1.0.0
 */
public record ScalarValue(@Nullable Object content) implements Value {

    public static final ScalarValue NULL = new ScalarValue(null);

    public ScalarValue {
        if (content != null
                && !(content instanceof String)
                && !(content instanceof Boolean)
                && !(content instanceof Long)
                && !(content instanceof Double)
                && !(content instanceof BigInteger)) {
            throw new IllegalArgumentException(
                    "Unsupported scalar type: " + content.getClass().getName());
        }
    }

    public static ScalarValue of(@Nullable Object content) {
        if (content == null) {
            return NULL;
        }

        if (content instanceof final Integer i) {
            return new ScalarValue(i.longValue());
        } else if (content instanceof final Short s) {
            return new ScalarValue(s.longValue());
        } else if (content instanceof final Byte b) {
            return new ScalarValue(b.longValue());
        } else if (content instanceof final Float f) {
            return new ScalarValue(f.doubleValue());
        } else if (content instanceof final BigDecimal d) {
            return new ScalarValue(d.doubleValue());
        } else if (content instanceof final Character c) {
            return new ScalarValue(c.toString());
        }

        return new ScalarValue(content);
    }

    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    @Override
    public boolean isAbsent() {
        return content == null;
    }

    public @Nullable String asString() {
        return content != null ? content.toString() : null;
    }

    /**
     * @param other The scalar to compare with.
     * @return Whether both scalars hold content of the same Java type.
     * An absent scalar is compatible with any other scalar.
     */
    public boolean isSameTypeAs(ScalarValue other) {
        if (content == null || other.content == null) {
            return true;
        }

        return content.getClass() == other.content.getClass();
    }

    @Override
    public String toString() {
        return String.valueOf(content);
    }

}
