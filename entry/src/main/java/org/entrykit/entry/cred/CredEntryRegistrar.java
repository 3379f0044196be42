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
package org.entrykit.entry.cred;

import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.locale.FragmentSelector;
import org.entrykit.entry.EntryRegistrar;
import org.entrykit.entry.ProviderSettingsFactory;
import org.entrykit.entry.SectionBinder;
import org.entrykit.secret.management.provider.KeyValueSecretRetriever;
import org.entrykit.secret.management.provider.ProviderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Creates a {@link CredEntry} for every fragment of the {@code cred} section
 * that applies to the current environment.
 * <pre>
 * cred:
 *   - name: redis
 *     provider: etcd
 *     locale: "*::*::*::*"
 *     endpoint: localhost:2379
 *     basicAuth: "root:secret"
 *     paths:
 *       - redis-pass
 * </pre>
 *
 * @since 1.0.0
 */
public final class CredEntryRegistrar implements EntryRegistrar {

    public static final String SECTION = "cred";

    private static final Logger LOGGER = LoggerFactory.getLogger(CredEntryRegistrar.class);

    private final FragmentSelector fragmentSelector;
    private final ProviderSettingsFactory settingsFactory;

    public CredEntryRegistrar(FragmentSelector fragmentSelector, ProviderSettingsFactory settingsFactory) {
        this.fragmentSelector = requireNonNull(fragmentSelector, "fragmentSelector must not be null");
        this.settingsFactory = requireNonNull(settingsFactory, "settingsFactory must not be null");
    }

    @Override
    public String section() {
        return SECTION;
    }

    @Override
    public List<CredEntry> register(MappingValue boot) throws ConfigParseException {
        final List<CredFragment> fragments = fragmentSelector.select(
                SectionBinder.bindList(boot, SECTION, CredFragment.class),
                CredFragment::name,
                CredFragment::locale);

        final var entries = new ArrayList<CredEntry>(fragments.size());
        for (final CredFragment fragment : fragments) {
            final ProviderSettings settings = settingsFactory.create(
                    fragment.name(),
                    fragment.provider(),
                    fragment.locale(),
                    fragment.endpoint(),
                    fragment.datacenter(),
                    fragment.token(),
                    fragment.basicAuth());

            final var retriever = new KeyValueSecretRetriever(settings, fragment.pathsOrEmpty());
            entries.add(new CredEntry(fragment.name(), fragment.description(), List.of(retriever)));
            LOGGER.debug("Created {} {} with {} retriever for {} paths",
                    CredEntry.TYPE, fragment.name(), settings.kind(), retriever.listPaths().size());
        }

        return entries;
    }

}
