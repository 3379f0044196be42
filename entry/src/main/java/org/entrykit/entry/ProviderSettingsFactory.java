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
package org.entrykit.entry;

import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.locale.LocaleSpec;
import org.entrykit.secret.management.BasicAuth;
import org.entrykit.secret.management.provider.ConsulSettings;
import org.entrykit.secret.management.provider.EtcdSettings;
import org.entrykit.secret.management.provider.LocalFsSettings;
import org.entrykit.secret.management.provider.ProviderKind;
import org.entrykit.secret.management.provider.ProviderSettings;
import org.entrykit.secret.management.provider.RemoteFsSettings;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link ProviderSettings} from the connection parameters of a configuration fragment.
 *
 * @since 1.0.0
 */
public final class ProviderSettingsFactory {

    private final Path baseDirectory;

    /**
     * @param baseDirectory Directory that relative {@code localFs} paths are resolved against.
     */
    public ProviderSettingsFactory(Path baseDirectory) {
        this.baseDirectory = requireNonNull(baseDirectory, "baseDirectory must not be null");
    }

    public ProviderSettings create(
            String fragmentName,
            ProviderKind kind,
            @Nullable String locale,
            @Nullable String endpoint,
            @Nullable String datacenter,
            @Nullable String token,
            @Nullable String basicAuth) throws ConfigParseException {
        requireNonNull(fragmentName, "fragmentName must not be null");
        requireNonNull(kind, "kind must not be null");

        final String normalizedLocale = LocaleSpec.parse(locale).toString();

        return switch (kind) {
            case LOCAL_FS -> new LocalFsSettings(normalizedLocale, baseDirectory);
            case ETCD -> new EtcdSettings(
                    normalizedLocale,
                    requireEndpoint(fragmentName, kind, endpoint),
                    BasicAuth.parse(basicAuth));
            case CONSUL -> new ConsulSettings(
                    normalizedLocale,
                    requireEndpoint(fragmentName, kind, endpoint),
                    datacenter,
                    token,
                    BasicAuth.parse(basicAuth));
            case REMOTE_FS -> new RemoteFsSettings(
                    normalizedLocale,
                    requireEndpoint(fragmentName, kind, endpoint),
                    BasicAuth.parse(basicAuth));
        };
    }

    public ProviderSettings create(
            String fragmentName,
            @Nullable String provider,
            @Nullable String locale,
            @Nullable String endpoint,
            @Nullable String datacenter,
            @Nullable String token,
            @Nullable String basicAuth) throws ConfigParseException {
        final ProviderKind kind;
        try {
            kind = ProviderKind.of(provider);
        } catch (IllegalArgumentException e) {
            throw new ConfigParseException("Invalid provider for %s: %s".formatted(fragmentName, e.getMessage()), e);
        }

        return create(fragmentName, kind, locale, endpoint, datacenter, token, basicAuth);
    }

    private static String requireEndpoint(String fragmentName, ProviderKind kind, @Nullable String endpoint) throws ConfigParseException {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigParseException(
                    "No endpoint configured for %s, but provider %s requires one".formatted(fragmentName, kind));
        }

        return endpoint.trim();
    }

}
