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
package org.entrykit.secret.management.provider;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The backing stores secrets and certificates can be retrieved from.
 *
 * @since 1.0.0
 */
public enum ProviderKind {

    LOCAL_FS("localFs"),
    ETCD("etcd"),
    CONSUL("consul"),
    REMOTE_FS("remoteFs");

    private final String configName;

    ProviderKind(String configName) {
        this.configName = configName;
    }

    /**
     * @return The name used for this provider in boot configuration.
     */
    public String configName() {
        return configName;
    }

    /**
     * @param name The provider name, compared case-insensitively.
     * @return The matching provider.
     * @throws IllegalArgumentException When no provider with the given name exists.
     */
    public static ProviderKind of(@Nullable String name) {
        for (final ProviderKind kind : values()) {
            if (kind.configName.equalsIgnoreCase(name)) {
                return kind;
            }
        }

        throw new IllegalArgumentException("Unknown provider %s; Supported providers are: %s".formatted(
                name, Arrays.stream(values()).map(ProviderKind::configName).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return configName;
    }

}
