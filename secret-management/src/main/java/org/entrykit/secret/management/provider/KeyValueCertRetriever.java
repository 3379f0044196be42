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

import org.entrykit.secret.management.CertPaths;
import org.entrykit.secret.management.CertRetriever;
import org.entrykit.secret.management.CertSlot;
import org.entrykit.secret.management.CertStore;
import org.entrykit.secret.management.RetrieveContext;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CertRetriever} for any of the supported {@link ProviderSettings}.
 * Slots are fetched in {@link CertSlot} order.
 *
 * @since 1.0.0
 */
public final class KeyValueCertRetriever implements CertRetriever {

    private final ProviderSettings settings;
    private final CertPaths paths;

    public KeyValueCertRetriever(ProviderSettings settings, CertPaths paths) {
        this.settings = requireNonNull(settings, "settings must not be null");
        this.paths = requireNonNull(paths, "paths must not be null");
    }

    @Override
    public CertStore retrieve(RetrieveContext context) {
        requireNonNull(context, "context must not be null");

        final Map<CertSlot, String> pathsBySlot = paths.bySlot();
        final List<String> keys = pathsBySlot.values().stream().distinct().toList();
        final Map<String, byte @Nullable []> values = KeyFetchLoop.fetchAll(settings, keys, context);

        final CertStore.Builder storeBuilder = CertStore.builder();
        pathsBySlot.forEach((slot, path) -> storeBuilder.put(slot, values.get(path)));
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
    public CertPaths paths() {
        return paths;
    }

}
