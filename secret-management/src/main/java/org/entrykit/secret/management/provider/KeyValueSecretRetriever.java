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

import org.entrykit.secret.management.RetrieveContext;
import org.entrykit.secret.management.SecretRetriever;
import org.entrykit.secret.management.SecretStore;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SecretRetriever} for any of the supported {@link ProviderSettings}.
 *
 * @since 1.0.0
 */
public final class KeyValueSecretRetriever implements SecretRetriever {

    private final ProviderSettings settings;
    private final List<String> paths;

    public KeyValueSecretRetriever(ProviderSettings settings, List<String> paths) {
        this.settings = requireNonNull(settings, "settings must not be null");
        requireNonNull(paths, "paths must not be null");
        this.paths = paths.stream()
                .filter(path -> path != null && !path.isBlank())
                .distinct()
                .toList();
    }

    @Override
    public SecretStore retrieve(RetrieveContext context) {
        requireNonNull(context, "context must not be null");

        final Map<String, byte @Nullable []> values = KeyFetchLoop.fetchAll(settings, paths, context);

        final SecretStore.Builder storeBuilder = SecretStore.builder();
        values.forEach(storeBuilder::put);
        return storeBuilder.build();
    }

    @Override
    public String provider() {
        return settings.kind().configName();
    }

    @Override
    public String endpoint() {
        return settings.endpoint();
    }

    @Override
    public String locale() {
        return settings.locale();
    }

    @Override
    public List<String> listPaths() {
        return paths;
    }

    public ProviderSettings settings() {
        return settings;
    }

}
