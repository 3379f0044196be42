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
import org.entrykit.secret.management.BasicAuth;
import org.entrykit.secret.management.provider.ConsulSettings;
import org.entrykit.secret.management.provider.EtcdSettings;
import org.entrykit.secret.management.provider.LocalFsSettings;
import org.entrykit.secret.management.provider.ProviderSettings;
import org.entrykit.secret.management.provider.RemoteFsSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class ProviderSettingsFactoryTest {

    private final ProviderSettingsFactory factory = new ProviderSettingsFactory(Path.of("/etc/entrykit"));

    @Test
    void shouldCreateLocalFsSettings() throws Exception {
        final ProviderSettings settings = factory.create(
                "redis", "localFs", null, "ignored", null, null, null);

        assertThat(settings).isEqualTo(new LocalFsSettings("*::*::*::*", Path.of("/etc/entrykit")));
    }

    @Test
    void shouldCreateEtcdSettings() throws Exception {
        final ProviderSettings settings = factory.create(
                "redis", "ETCD", "rk::*::*::*", " localhost:2379 ", null, null, "root:etcd");

        assertThat(settings).isEqualTo(
                new EtcdSettings("rk::*::*::*", "localhost:2379", new BasicAuth("root", "etcd")));
    }

    @Test
    void shouldCreateConsulSettings() throws Exception {
        final ProviderSettings settings = factory.create(
                "redis", "consul", "", "localhost:8500", "dc1", "acl-token", null);

        assertThat(settings).isEqualTo(
                new ConsulSettings("*::*::*::*", "localhost:8500", "dc1", "acl-token", null));
        assertThat(settings.toString()).doesNotContain("acl-token");
    }

    @Test
    void shouldCreateRemoteFsSettings() throws Exception {
        final ProviderSettings settings = factory.create(
                "redis", "remoteFs", null, "http://files:8080/secrets", null, null, null);

        assertThat(settings).isEqualTo(
                new RemoteFsSettings("*::*::*::*", "http://files:8080/secrets", null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"etcd", "consul", "remoteFs"})
    void shouldThrowWhenEndpointIsMissing(final String provider) {
        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> factory.create("redis", provider, null, " ", null, null, null))
                .withMessage("No endpoint configured for redis, but provider %s requires one".formatted(provider));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"vault"})
    void shouldThrowWhenProviderIsUnknown(final String provider) {
        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> factory.create("redis", provider, null, null, null, null, null))
                .withMessageStartingWith("Invalid provider for redis: Unknown provider")
                .withMessageEndingWith("Supported providers are: localFs, etcd, consul, remoteFs");
    }

}
