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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Filters named, locale-scoped configuration fragments down to those that apply
 * to the current environment.
 * <p>
 * Fragments with a blank name are dropped. When several matching fragments share a
 * name, the one with the most specific locale wins. Among equally specific fragments,
 * the first one in declaration order is kept; this is a chosen rule for what is a
 * configuration error, and it is logged as such.
 *
 * @since 1.0.0
 */
public final class FragmentSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentSelector.class);

    private final LocaleMatcher localeMatcher;

    public FragmentSelector(LocaleMatcher localeMatcher) {
        this.localeMatcher = requireNonNull(localeMatcher, "localeMatcher must not be null");
    }

    /**
     * @param fragments      The fragments in declaration order.
     * @param nameFunction   Extracts the name of a fragment.
     * @param localeFunction Extracts the locale spec text of a fragment. May return {@code null}.
     * @return The selected fragments, ordered by the first appearance of their name.
     */
    public <T> List<T> select(
            List<T> fragments,
            Function<T, String> nameFunction,
            Function<T, String> localeFunction) {
        requireNonNull(fragments, "fragments must not be null");
        requireNonNull(nameFunction, "nameFunction must not be null");
        requireNonNull(localeFunction, "localeFunction must not be null");

        final Environment environment = localeMatcher.environment();
        final var selected = new LinkedHashMap<String, Candidate<T>>();

        for (final T fragment : fragments) {
            final String name = nameFunction.apply(fragment);
            if (name == null || name.isBlank()) {
                LOGGER.debug("Dropping fragment without name");
                continue;
            }

            final LocaleSpec locale = LocaleSpec.parse(localeFunction.apply(fragment));
            if (!LocaleMatcher.matches(locale, environment)) {
                LOGGER.debug("Skipping fragment {} with locale {}; Environment is {}", name, locale, environment);
                continue;
            }

            final Candidate<T> existing = selected.get(name);
            if (existing == null) {
                selected.put(name, new Candidate<>(fragment, locale));
            } else if (locale.specificity() > existing.locale().specificity()) {
                LOGGER.debug("Fragment {} with locale {} supersedes locale {}", name, locale, existing.locale());
                selected.put(name, new Candidate<>(fragment, locale));
            } else if (locale.specificity() == existing.locale().specificity() && !locale.isWildcard()) {
                LOGGER.warn("""
                        Fragments named {} with locales {} and {} both match environment {} \
                        with equal specificity; Keeping the first one""", name, existing.locale(), locale, environment);
            }
        }

        final var result = new ArrayList<T>(selected.size());
        for (final Map.Entry<String, Candidate<T>> entry : selected.entrySet()) {
            result.add(entry.getValue().fragment());
        }

        return result;
    }

    private record Candidate<T>(T fragment, LocaleSpec locale) {
    }

}
