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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FragmentSelectorTest {

    private record Fragment(String name, String locale, String id) {
    }

    private FragmentSelector selector;

    @BeforeEach
    void beforeEach() {
        final var environment = new Environment("rk", "us-east-1", "az-1", "prod");
        selector = new FragmentSelector(new LocaleMatcher(() -> environment));
    }

    @Test
    void shouldDropFragmentsWithoutName() {
        final List<Fragment> selected = select(List.of(
                new Fragment("", null, "1"),
                new Fragment(null, null, "2"),
                new Fragment("foo", null, "3")));

        assertThat(selected).extracting(Fragment::id).containsExactly("3");
    }

    @Test
    void shouldSkipFragmentsWithMismatchingLocale() {
        final List<Fragment> selected = select(List.of(
                new Fragment("foo", "other::*::*::*", "1"),
                new Fragment("bar", "rk::*::*::*", "2"),
                new Fragment("baz", "rk::*::*", "3")));

        assertThat(selected).extracting(Fragment::id).containsExactly("2");
    }

    @Test
    void shouldPreferSpecificOverWildcardLocale() {
        final List<Fragment> selected = select(List.of(
                new Fragment("foo", "*::*::*::*", "wildcard"),
                new Fragment("foo", "rk::us-east-1::*::*", "specific"),
                new Fragment("foo", "rk::*::*::*", "less-specific")));

        assertThat(selected).extracting(Fragment::id).containsExactly("specific");
    }

    @Test
    void shouldKeepFirstOfEquallySpecificLocales() {
        final List<Fragment> selected = select(List.of(
                new Fragment("foo", "rk::*::*::*", "first"),
                new Fragment("foo", "*::us-east-1::*::*", "second")));

        assertThat(selected).extracting(Fragment::id).containsExactly("first");
    }

    @Test
    void shouldKeepOrderOfFirstAppearance() {
        final List<Fragment> selected = select(List.of(
                new Fragment("foo", null, "foo-wildcard"),
                new Fragment("bar", null, "bar"),
                new Fragment("foo", "rk::*::*::*", "foo-specific")));

        assertThat(selected).extracting(Fragment::id).containsExactly("foo-specific", "bar");
    }

    private List<Fragment> select(final List<Fragment> fragments) {
        return selector.select(fragments, Fragment::name, Fragment::locale);
    }

}
