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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.entrykit.common.config.BootConfigLoader;
import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.locale.Environment;
import org.entrykit.common.locale.FragmentSelector;
import org.entrykit.common.locale.LocaleMatcher;
import org.entrykit.entry.BootstrapContext;
import org.entrykit.entry.ProviderSettingsFactory;
import org.entrykit.secret.management.RetrieveContext;
import org.entrykit.secret.management.SecretRetriever;
import org.entrykit.secret.management.SecretStore;
import org.entrykit.secret.management.provider.KeyValueSecretRetriever;
import org.entrykit.secret.management.provider.LocalFsSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CredEntryTest {

    @TempDir
    private Path tempDir;

    private CredEntryRegistrar registrar;

    @BeforeEach
    void beforeEach() {
        final var localeMatcher = new LocaleMatcher(() -> new Environment("rk", "us-east", "az1", "prod"));
        registrar = new CredEntryRegistrar(
                new FragmentSelector(localeMatcher),
                new ProviderSettingsFactory(tempDir));
    }

    private static MappingValue parse(String yaml) throws ConfigParseException {
        return BootConfigLoader.parseYaml(yaml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldRegisterMostSpecificFragmentPerName() throws Exception {
        final List<CredEntry> entries = registrar.register(parse("""
                cred:
                  - name: redis
                    provider: localFs
                    locale: "*::*::*::*"
                    paths:
                      - default.pass
                  - name: redis
                    provider: localFs
                    locale: "rk::us-east::*::*"
                    paths:
                      - rk.pass
                  - name: mysql
                    provider: localFs
                    locale: "jd::*::*::*"
                    paths:
                      - mysql.pass
                """));

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).name()).isEqualTo("redis");
        assertThat(entries.get(0).type()).isEqualTo("CredEntry");
        assertThat(entries.get(0).retrievers()).satisfiesExactly(retriever -> {
            assertThat(retriever.provider()).isEqualTo("localFs");
            assertThat(retriever.locale()).isEqualTo("rk::us-east::*::*");
            assertThat(retriever.listPaths()).containsExactly("rk.pass");
        });
    }

    @Test
    void shouldRetrieveCredentialsOnBootstrap() throws Exception {
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");

        final CredEntry entry = registrar.register(parse("""
                cred:
                  - name: redis
                    provider: localFs
                    paths:
                      - redis.pass
                      - missing.pass
                """)).get(0);

        assertThat(entry.store().isEmpty()).isTrue();

        entry.bootstrap(BootstrapContext.withDefaults());

        final SecretStore store = entry.store();
        assertThat(store.keys()).containsExactly("redis.pass", "missing.pass");
        assertThat(entry.getCredential("redis.pass")).isEqualTo("redis-secret".getBytes(StandardCharsets.UTF_8));
        assertThat(store.isRequested("missing.pass")).isTrue();
        assertThat(store.isAvailable("missing.pass")).isFalse();
    }

    @Test
    void shouldBootstrapOnlyOnce() throws Exception {
        final var entry = new CredEntry("redis", null, List.of(
                new KeyValueSecretRetriever(new LocalFsSettings("*::*::*::*", tempDir), List.of("redis.pass"))));

        entry.bootstrap(BootstrapContext.withDefaults());
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");
        entry.bootstrap(BootstrapContext.withDefaults());

        assertThat(entry.store().isRequested("redis.pass")).isTrue();
        assertThat(entry.store().isAvailable("redis.pass")).isFalse();
    }

    @Test
    void shouldInvokeEachRetrieverOnce() {
        final var retrieverMock = mock(SecretRetriever.class);
        when(retrieverMock.listPaths()).thenReturn(List.of("redis.pass"));
        when(retrieverMock.retrieve(any(RetrieveContext.class))).thenReturn(
                SecretStore.builder().put("redis.pass", "redis-secret".getBytes(StandardCharsets.UTF_8)).build());

        final var entry = new CredEntry("redis", null, List.of(retrieverMock));
        entry.bootstrap(BootstrapContext.withDefaults());
        entry.bootstrap(BootstrapContext.withDefaults());

        verify(retrieverMock, times(1)).retrieve(any(RetrieveContext.class));
        assertThat(entry.store().isAvailable("redis.pass")).isTrue();
    }

    @Test
    void shouldNotEraseCredentialsOfEarlierRetrievers(@TempDir final Path emptyDir) throws Exception {
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");

        final var entry = new CredEntry("redis", null, List.of(
                new KeyValueSecretRetriever(new LocalFsSettings("*::*::*::*", tempDir), List.of("redis.pass")),
                new KeyValueSecretRetriever(new LocalFsSettings("*::*::*::*", emptyDir), List.of("redis.pass"))));

        entry.bootstrap(BootstrapContext.withDefaults());

        assertThat(entry.getCredential("redis.pass")).isEqualTo("redis-secret".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldUseDefaultsForMissingNameAndDescription() {
        final var entry = new CredEntry(null, " ", List.of());

        assertThat(entry.name()).isEqualTo("CredDefault");
        assertThat(entry.description()).isEqualTo(CredEntry.DEFAULT_DESCRIPTION);
    }

    @Test
    void shouldNotExposeCredentialsInToString() throws Exception {
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");

        final CredEntry entry = registrar.register(parse("""
                cred:
                  - name: redis
                    provider: localFs
                    paths:
                      - redis.pass
                  - name: mysql
                    provider: etcd
                    endpoint: localhost:2379
                    basicAuth: "root:etcd-password"
                    paths:
                      - mysql.pass
                """)).get(0);
        entry.bootstrap(BootstrapContext.withDefaults());

        final JsonNode json = new ObjectMapper().readTree(entry.toString());
        assertThat(json.get("entryName").asText()).isEqualTo("redis");
        assertThat(json.get("entryType").asText()).isEqualTo("CredEntry");
        assertThat(json.get("store").get("redis.pass").asBoolean()).isTrue();
        assertThat(json.get("retrievers").get(0).get("provider").asText()).isEqualTo("localFs");
        assertThat(entry.toString()).doesNotContain("redis-secret");

        final CredEntry etcdEntry = registrar.register(parse("""
                cred:
                  - name: mysql
                    provider: etcd
                    endpoint: localhost:2379
                    basicAuth: "root:etcd-password"
                    paths:
                      - mysql.pass
                """)).get(0);
        assertThat(etcdEntry.toString())
                .contains("\"endpoint\":\"localhost:2379\"")
                .doesNotContain("etcd-password");
    }

    @Test
    void shouldThrowForUnknownProvider() {
        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> registrar.register(parse("""
                        cred:
                          - name: redis
                            provider: vault
                        """)))
                .withMessage("Invalid provider for redis: Unknown provider vault; "
                        + "Supported providers are: localFs, etcd, consul, remoteFs");
    }

    @Test
    void shouldThrowForMissingEndpoint() {
        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> registrar.register(parse("""
                        cred:
                          - name: redis
                            provider: consul
                        """)))
                .withMessage("No endpoint configured for redis, but provider consul requires one");
    }

}
