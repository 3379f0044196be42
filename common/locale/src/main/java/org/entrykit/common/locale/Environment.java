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

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The deployment environment a process runs in, as described by the
 * {@code REALM}, {@code REGION}, {@code AZ} and {@code DOMAIN} environment variables.
 * Unset variables are represented as empty strings.
 *
 * @since 1.0.0
 */
public record Environment(String realm, String region, String az, String domain) {

    public static final String REALM_VARIABLE = "REALM";
    public static final String REGION_VARIABLE = "REGION";
    public static final String AZ_VARIABLE = "AZ";
    public static final String DOMAIN_VARIABLE = "DOMAIN";

    public Environment {
        requireNonNull(realm, "realm must not be null");
        requireNonNull(region, "region must not be null");
        requireNonNull(az, "az must not be null");
        requireNonNull(domain, "domain must not be null");
    }

    public static Environment fromMap(Map<String, String> variables) {
        requireNonNull(variables, "variables must not be null");
        return new Environment(
                variables.getOrDefault(REALM_VARIABLE, ""),
                variables.getOrDefault(REGION_VARIABLE, ""),
                variables.getOrDefault(AZ_VARIABLE, ""),
                variables.getOrDefault(DOMAIN_VARIABLE, ""));
    }

    public static Environment current() {
        return fromMap(System.getenv());
    }

    List<String> components() {
        return List.of(realm, region, az, domain);
    }

    @Override
    public String toString() {
        return String.join(LocaleSpec.SEPARATOR, components());
    }

}
