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
package org.entrykit.entry.cert;

import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.locale.FragmentSelector;
import org.entrykit.common.locale.LocaleMatcher;
import org.entrykit.entry.EntryRegistrar;
import org.entrykit.entry.ProviderSettingsFactory;
import org.entrykit.entry.SectionBinder;
import org.entrykit.secret.management.CertRetriever;
import org.entrykit.secret.management.provider.KeyValueCertRetriever;
import org.entrykit.secret.management.provider.ProviderKind;
import org.entrykit.secret.management.provider.ProviderSettings;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Creates a {@link CertEntry} for every fragment of the {@code cert} section
 * that applies to the current environment.
 * <pre>
 * cert:
 *   - name: server
 *     locale: "*::*::*::*"
 *     local:
 *       serverCertPath: certs/server.pem
 *       serverKeyPath: certs/server.key
 *     etcd:
 *       endpoint: localhost:2379
 *       clientCertPath: client.pem
 * </pre>
 * Provider blocks are retrieved in the order {@code local}, {@code etcd}, {@code consul},
 * {@code remoteFileStore}. A block may narrow the fragment's locale with its own {@code locale}.
 *
 * @since 1.0.0
 */
public final class CertEntryRegistrar implements EntryRegistrar {

    public static final String SECTION = "cert";

    private static final Logger LOGGER = LoggerFactory.getLogger(CertEntryRegistrar.class);

    private final LocaleMatcher localeMatcher;
    private final FragmentSelector fragmentSelector;
    private final ProviderSettingsFactory settingsFactory;

    public CertEntryRegistrar(LocaleMatcher localeMatcher, ProviderSettingsFactory settingsFactory) {
        this.localeMatcher = requireNonNull(localeMatcher, "localeMatcher must not be null");
        this.fragmentSelector = new FragmentSelector(localeMatcher);
        this.settingsFactory = requireNonNull(settingsFactory, "settingsFactory must not be null");
    }

    @Override
    public String section() {
        return SECTION;
    }

    @Override
    public List<CertEntry> register(MappingValue boot) throws ConfigParseException {
        final List<CertFragment> fragments = fragmentSelector.select(
                SectionBinder.bindList(boot, SECTION, CertFragment.class),
                CertFragment::name,
                CertFragment::locale);

        final var entries = new ArrayList<CertEntry>(fragments.size());
        for (final CertFragment fragment : fragments) {
            final var retrievers = new ArrayList<CertRetriever>(4);
            addRetriever(retrievers, fragment, ProviderKind.LOCAL_FS, fragment.local());
            addRetriever(retrievers, fragment, ProviderKind.ETCD, fragment.etcd());
            addRetriever(retrievers, fragment, ProviderKind.CONSUL, fragment.consul());
            addRetriever(retrievers, fragment, ProviderKind.REMOTE_FS, fragment.remoteFileStore());

            entries.add(new CertEntry(fragment.name(), fragment.description(), retrievers));
            LOGGER.debug("Created {} {} with {} retrievers", CertEntry.TYPE, fragment.name(), retrievers.size());
        }

        return entries;
    }

    private void addRetriever(
            List<CertRetriever> retrievers,
            CertFragment fragment,
            ProviderKind kind,
            CertFragment.@Nullable Block block) throws ConfigParseException {
        if (block == null) {
            return;
        }

        final String locale = block.locale() != null ? block.locale() : fragment.locale();
        if (!localeMatcher.matches(locale)) {
            LOGGER.debug("Skipping {} block of {}, because locale {} does not match {}",
                    kind, fragment.name(), locale, localeMatcher.environment());
            return;
        }

        final String fragmentName = "%s.%s".formatted(fragment.name(), kind);
        final ProviderSettings settings = settingsFactory.create(
                fragmentName,
                kind,
                locale,
                block.endpoint(),
                block.datacenter(),
                block.token(),
                block.basicAuth());

        retrievers.add(new KeyValueCertRetriever(settings, block.paths()));
    }

}
