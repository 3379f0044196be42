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
import org.entrykit.secret.management.CertSlot;
import org.entrykit.secret.management.CertStore;
import org.entrykit.secret.management.RetrieveContext;
import org.entrykit.secret.management.SecretStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalFsRetrieverTest {

    @TempDir
    private Path tempDir;

    @Test
    void shouldRetrieveExistingAndMarkMissingAsAbsent() throws Exception {
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");

        final var retriever = new KeyValueSecretRetriever(
                new LocalFsSettings("*::*::*::*", tempDir), List.of("redis.pass", "missing.pass"));

        final SecretStore store = retriever.retrieve(RetrieveContext.withDefaults());

        assertThat(store.keys()).containsExactly("redis.pass", "missing.pass");
        assertThat(store.getSecret("redis.pass")).isEqualTo("redis-secret".getBytes(StandardCharsets.UTF_8));
        assertThat(store.isRequested("missing.pass")).isTrue();
        assertThat(store.getSecret("missing.pass")).isNull();
    }

    @Test
    void shouldResolveAbsolutePaths(@TempDir final Path otherDir) throws Exception {
        final Path secretFile = otherDir.resolve("absolute.pass");
        Files.writeString(secretFile, "absolute");

        final var retriever = new KeyValueSecretRetriever(
                new LocalFsSettings("*::*::*::*", tempDir), List.of(secretFile.toString()));

        assertThat(retriever.retrieve(RetrieveContext.withDefaults()).getSecret(secretFile.toString()))
                .isEqualTo("absolute".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldIgnoreBlankAndDuplicatePaths() {
        final var retriever = new KeyValueSecretRetriever(
                new LocalFsSettings("*::*::*::*", tempDir), Arrays.asList("a", "", null, " ", "a", "b"));

        assertThat(retriever.listPaths()).containsExactly("a", "b");
    }

    @Test
    void shouldDescribeProvider() {
        final var retriever = new KeyValueSecretRetriever(
                new LocalFsSettings("rk::*::*::*", tempDir), List.of("a"));

        assertThat(retriever.provider()).isEqualTo("localFs");
        assertThat(retriever.endpoint()).isEqualTo("local");
        assertThat(retriever.locale()).isEqualTo("rk::*::*::*");
    }

    @Test
    void shouldMarkAllKeysAbsentWhenDeadlineHasPassed() throws Exception {
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");

        final var retriever = new KeyValueSecretRetriever(
                new LocalFsSettings("*::*::*::*", tempDir), List.of("redis.pass"));

        final SecretStore store = retriever.retrieve(
                RetrieveContext.withDefaults().withDeadline(Instant.now().minusSeconds(1)));

        assertThat(store.isRequested("redis.pass")).isTrue();
        assertThat(store.isAvailable("redis.pass")).isFalse();
    }

    @Test
    void shouldStopWhenInterrupted() throws Exception {
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");

        final var retriever = new KeyValueSecretRetriever(
                new LocalFsSettings("*::*::*::*", tempDir), List.of("redis.pass"));

        Thread.currentThread().interrupt();
        try {
            final SecretStore store = retriever.retrieve(RetrieveContext.withDefaults());

            assertThat(store.isAvailable("redis.pass")).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldRetrieveCertificates() throws Exception {
        Files.writeString(tempDir.resolve("server.pem"), "server-cert");
        Files.writeString(tempDir.resolve("server.key"), "server-key");

        final var retriever = new KeyValueCertRetriever(
                new LocalFsSettings("*::*::*::*", tempDir),
                new CertPaths("server.pem", "server.key", "client.pem", null));

        final CertStore store = retriever.retrieve(RetrieveContext.withDefaults());

        assertThat(store.slots()).containsExactly(CertSlot.SERVER_CERT, CertSlot.SERVER_KEY, CertSlot.CLIENT_CERT);
        assertThat(store.getServerCert()).isEqualTo("server-cert".getBytes(StandardCharsets.UTF_8));
        assertThat(store.getServerKey()).isEqualTo("server-key".getBytes(StandardCharsets.UTF_8));
        assertThat(store.getClientCert()).isNull();
    }

    @Test
    void shouldRetrieveSameFileForMultipleSlots() throws Exception {
        Files.writeString(tempDir.resolve("bundle.pem"), "bundle");

        final CertStore store = new KeyValueCertRetriever(
                new LocalFsSettings("*::*::*::*", tempDir),
                new CertPaths("bundle.pem", "bundle.pem", null, null))
                .retrieve(RetrieveContext.withDefaults());

        assertThat(store.getServerCert()).isEqualTo("bundle".getBytes(StandardCharsets.UTF_8));
        assertThat(store.getServerKey()).isEqualTo("bundle".getBytes(StandardCharsets.UTF_8));
    }

}
