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

import io.smallrye.config.ExpressionConfigSourceInterceptor;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Builds the process-level runtime {@link Config}.
 * <p>
 * Sources, highest priority first: system properties, environment variables,
 * {@code application.properties} files, and the given default values.
 *
 * @since 1.0.0
 */
public final class RuntimeConfigFactory {

    private RuntimeConfigFactory() {
    }

    public static Config create() {
        return create(Map.of());
    }

    /**
     * @param defaults Values to fall back to when no other source defines a property.
     * @return The {@link Config}.
     */
    public static Config create(Map<String, String> defaults) {
        requireNonNull(defaults, "defaults must not be null");

        return new SmallRyeConfigBuilder()
                // System properties, environment variables, application.properties.
                // https://smallrye.io/smallrye-config/Main/config/getting-started/#config-sources
                .addDefaultSources()
                .addDiscoveredSources()
                .withInterceptors(new ExpressionConfigSourceInterceptor())
                .withDefaultValues(defaults)
                .build();
    }

}
