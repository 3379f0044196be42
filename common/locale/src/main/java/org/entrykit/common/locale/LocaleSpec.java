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
package org.entrykit.common.locale;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A {@code realm::region::az::domain} selector that scopes a configuration fragment
 * to a deployment environment. Each component is either a literal or the wildcard {@code *}.
 * <p>
 * A spec with any other number of components than four is kept, but never matches.
 *
 * @since 1.0.0
 */
public final class LocaleSpec {

    public static final String WILDCARD = "*";
    public static final String SEPARATOR = "::";
    public static final LocaleSpec ANY = parse(null);

    private static final int COMPONENT_COUNT = 4;

    private final String raw;
    private final List<String> components;

    private LocaleSpec(String raw, List<String> components) {
        this.raw = raw;
        this.components = components;
    }

    /**
     * @param text The spec text. {@code null} or blank text yields {@code *::*::*::*}.
     * @return The parsed spec.
     */
    public static LocaleSpec parse(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return new LocaleSpec("*::*::*::*", List.of(WILDCARD, WILDCARD, WILDCARD, WILDCARD));
        }

        return new LocaleSpec(text, List.of(text.split(SEPARATOR, -1)));
    }

    public boolean isValid() {
        return components.size() == COMPONENT_COUNT;
    }

    public List<String> components() {
        return components;
    }

    /**
     * @return Whether every component of this spec is the wildcard.
     */
    public boolean isWildcard() {
        return isValid() && components.stream().allMatch(WILDCARD::equals);
    }

    /**
     * @return The number of non-wildcard components. Higher is more specific.
     */
    public int specificity() {
        if (!isValid()) {
            return 0;
        }

        return (int) components.stream()
                .filter(component -> !WILDCARD.equals(component))
                .count();
    }

    boolean matches(Environment environment) {
        if (!isValid()) {
            return false;
        }

        final List<String> actual = environment.components();
        for (int i = 0; i < COMPONENT_COUNT; i++) {
            if (!componentMatches(components.get(i), actual.get(i))) {
                return false;
            }
        }

        return true;
    }

    private static boolean componentMatches(String expected, String actual) {
        return WILDCARD.equals(expected) || expected.equals(actual);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof final LocaleSpec other && raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }

}
