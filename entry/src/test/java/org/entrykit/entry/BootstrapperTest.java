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

import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.entrykit.common.locale.Environment;
import org.entrykit.common.locale.LocaleMatcher;
import org.entrykit.entry.config.ConfigEntry;
import org.entrykit.entry.cred.CredEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BootstrapperTest {

    @TempDir
    private Path tempDir;

    private Path bootFile;

    @BeforeEach
    void beforeEach() throws Exception {
        bootFile = tempDir.resolve("boot.yaml");
        Files.writeString(bootFile, """
                config:
                  - name: app
                    path: app.yaml
                cred:
                  - name: redis
                    provider: localFs
                    paths:
                      - redis.pass
                """);
        Files.writeString(tempDir.resolve("app.yaml"), "greeting: hello");
        Files.writeString(tempDir.resolve("redis.pass"), "redis-secret");
        Files.writeString(tempDir.resolve("override.pass"), "override-secret");
    }

    private Bootstrapper createBootstrapper(final Map<String, String> environment) {
        final Config config = new SmallRyeConfigBuilder()
                .withDefaultValues(Map.of(
                        "entrykit.boot.base-directory", tempDir.toString(),
                        "entrykit.boot.env-override-prefix", "EKTEST",
                        "entrykit.boot.deadline", "PT10S"))
                .build();

        return new Bootstrapper(
                config,
                new LocaleMatcher(() -> new Environment("rk", "", "", "")),
                environment);
    }

    @Test
    void shouldRegisterAndBootstrapEntries() {
        final Bootstrapper bootstrapper = createBootstrapper(Map.of());

        assertThat(bootstrapper.run(new String[]{bootFile.toString()})).isEqualTo(Bootstrapper.EXIT_OK);

        assertThat(bootstrapper.registry().getAll())
                .extracting(Entry::type)
                .containsExactly("ConfigEntry", "CredEntry");
        assertThat(bootstrapper.registry().get(ConfigEntry.class, "app"))
                .hasValueSatisfying(entry -> assertThat(entry.getString("greeting")).contains("hello"));
        assertThat(bootstrapper.registry().get(CredEntry.class, "redis"))
                .hasValueSatisfying(entry -> assertThat(entry.getCredential("redis.pass"))
                        .isEqualTo("redis-secret".getBytes(StandardCharsets.UTF_8)));

        bootstrapper.interrupt();
    }

    @Test
    void shouldApplyFlagOverrides() {
        final Bootstrapper bootstrapper = createBootstrapper(Map.of());

        final int exitCode = bootstrapper.run(new String[]{
                "--set", "cred[0].paths[0]=override.pass",
                "--set=cred[0].description=Overridden",
                bootFile.toString()});

        assertThat(exitCode).isEqualTo(Bootstrapper.EXIT_OK);
        assertThat(bootstrapper.registry().get(CredEntry.class, "redis"))
                .hasValueSatisfying(entry -> {
                    assertThat(entry.description()).isEqualTo("Overridden");
                    assertThat(entry.store().keys()).containsExactly("override.pass");
                    assertThat(entry.getCredential("override.pass"))
                            .isEqualTo("override-secret".getBytes(StandardCharsets.UTF_8));
                });
    }

    @Test
    void shouldApplyEnvironmentOverrides() {
        final Bootstrapper bootstrapper = createBootstrapper(Map.of(
                "EKTEST_CRED_0_NAME", "cache",
                "EK_CRED_0_NAME", "ignored"));

        assertThat(bootstrapper.run(new String[]{bootFile.toString()})).isEqualTo(Bootstrapper.EXIT_OK);

        assertThat(bootstrapper.registry().get(CredEntry.class, "cache")).isPresent();
        assertThat(bootstrapper.registry().get(CredEntry.class, "redis")).isEmpty();
    }

    @Test
    void shouldFailWithConfigErrorWhenBootFileDoesNotExist() {
        final Bootstrapper bootstrapper = createBootstrapper(Map.of());

        assertThat(bootstrapper.run(new String[]{tempDir.resolve("missing.yaml").toString()}))
                .isEqualTo(Bootstrapper.EXIT_CONFIG_ERROR);
        assertThat(bootstrapper.registry().getAll()).isEmpty();
    }

    @Test
    void shouldFailWithConfigErrorWhenSectionIsMalformed() throws Exception {
        Files.writeString(bootFile, """
                cred:
                  name: redis
                """);

        assertThat(createBootstrapper(Map.of()).run(new String[]{bootFile.toString()}))
                .isEqualTo(Bootstrapper.EXIT_CONFIG_ERROR);
    }

    @Test
    void shouldFailWithConfigErrorWhenFlagOverrideIsMalformed() {
        assertThat(createBootstrapper(Map.of()).run(new String[]{"--set", "cred[0].name", bootFile.toString()}))
                .isEqualTo(Bootstrapper.EXIT_CONFIG_ERROR);
    }

    @Test
    void shouldFailWithUsageError() {
        final Bootstrapper bootstrapper = createBootstrapper(Map.of());

        assertThat(bootstrapper.run(new String[0])).isEqualTo(Bootstrapper.EXIT_USAGE_ERROR);
        assertThat(bootstrapper.run(new String[]{"--verbose", bootFile.toString()})).isEqualTo(Bootstrapper.EXIT_USAGE_ERROR);
        assertThat(bootstrapper.run(new String[]{bootFile.toString(), "--set"})).isEqualTo(Bootstrapper.EXIT_USAGE_ERROR);
        assertThat(bootstrapper.run(new String[]{bootFile.toString(), bootFile.toString()})).isEqualTo(Bootstrapper.EXIT_USAGE_ERROR);
    }

}
