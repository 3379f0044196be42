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

import org.entrykit.secret.management.BasicAuth;
import org.entrykit.secret.management.RetrieveContext;
import org.jspecify.annotations.Nullable;

import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * @param locale    Locale spec of the fragment.
 * @param endpoint  Endpoint of the etcd server, with or without {@code http://}.
 * @param basicAuth Optional etcd user credentials.
 * @since 1.0.0
 */
public record EtcdSettings(String locale, String endpoint, @Nullable BasicAuth basicAuth) implements ProviderSettings {

    public EtcdSettings {
        requireNonNull(locale, "locale must not be null");
        requireNonNull(endpoint, "endpoint must not be null");
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ETCD;
    }

    @Override
    public KeyFetcher openFetcher(RetrieveContext context) throws IOException, InterruptedException {
        return EtcdKeyFetcher.open(this, context);
    }

}
