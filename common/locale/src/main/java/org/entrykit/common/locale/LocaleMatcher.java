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

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a {@link LocaleSpec} applies to the current {@link Environment}.
 * <p>
 * A component matches when it is the wildcard, or when it equals the environment
 * value exactly (case-sensitive; an empty component thus matches an unset variable).
 * All four components must match. Invalid specs never match.
 * <p>
 * The environment is obtained anew for every call, so changes made before
 * bootstrap are observed.
 *
 * @since 1.0.0
 */
public final class LocaleMatcher {

    private final Supplier<Environment> environmentSupplier;

    public LocaleMatcher(Supplier<Environment> environmentSupplier) {
        this.environmentSupplier = requireNonNull(environmentSupplier, "environmentSupplier must not be null");
    }

    public static LocaleMatcher systemEnvironment() {
        return new LocaleMatcher(Environment::current);
    }

    public static boolean matches(LocaleSpec spec, Environment environment) {
        requireNonNull(spec, "spec must not be null");
        requireNonNull(environment, "environment must not be null");
        return spec.matches(environment);
    }

    public boolean matches(LocaleSpec spec) {
        return matches(spec, environmentSupplier.get());
    }

    public boolean matches(@Nullable String spec) {
        return matches(LocaleSpec.parse(spec));
    }

    public Environment environment() {
        return environmentSupplier.get();
    }

}
