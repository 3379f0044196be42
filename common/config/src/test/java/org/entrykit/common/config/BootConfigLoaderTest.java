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
package org.entrykit.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class BootConfigLoaderTest {

    private static final byte[] BOOT_YAML = """
            cred:
              - name: redis
                provider: etcd
                endpoint: localhost:2379
                basicAuth: "root:secret"
                paths:
                  - redis-pass
              - name: mysql
                provider: localFs
                paths:
                  - mysql.pass
            Gin:
              - port: 1949
                commonService:
                  enabled: true
            """.getBytes(StandardCharsets.UTF_8);

    @Test
    void shouldLoadAndLowerCaseKeys() throws Exception {
        final var loader = new BootConfigLoader(Map.of(), "EK");

        final MappingValue boot = loader.load(BOOT_YAML, List.of());

        assertThat(boot.entries()).containsOnlyKeys("cred", "gin");
        assertThat(boot.find("cred[0].basicauth")).contains(new ScalarValue("root:secret"));
        assertThat(boot.find("gin[0].commonservice.enabled")).contains(new ScalarValue(true));
    }

    @Test
    void shouldApplyEnvironmentOverrides() throws Exception {
        final var loader = new BootConfigLoader(Map.of(
                "EK_GIN_0_PORT", "2008",
                "EK_CRED_1_NAME", "mysql,replica",
                "OTHER_GIN_0_PORT", "1"), "ek");

        final MappingValue boot = loader.load(BOOT_YAML, List.of());

        assertThat(boot.find("gin[0].port")).contains(new ScalarValue(2008L));
        assertThat(boot.find("cred[1].name")).contains(new ScalarValue("mysql,replica"));
        assertThat(boot.find("cred[0].name")).contains(new ScalarValue("redis"));
    }

    @Test
    void shouldSkipEnvironmentVariablesThatAreNotValidOverrides() throws Exception {
        final var loader = new BootConfigLoader(Map.of(
                "EK_BUILD_2024_01", "nested",
                "EK_CRED_999999999_NAME", "huge",
                "EK_GIN_0_PORT", "2008"), "EK");

        final MappingValue boot = loader.load(BOOT_YAML, List.of());

        assertThat(boot.entries()).containsOnlyKeys("cred", "gin");
        assertThat(boot.find("gin[0].port")).contains(new ScalarValue(2008L));
        assertThat(boot.find("cred")).hasValueSatisfying(
                cred -> assertThat(((SequenceValue) cred).size()).isEqualTo(2));
    }

    @Test
    void shouldThrowWhenFlagOverrideIndexIsTooLarge() {
        final var loader = new BootConfigLoader(Map.of(), "EK");

        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> loader.load(BOOT_YAML, List.of("cred[2147483646].name=huge")))
                .withMessage("Index of key cred must not exceed 65536: 2147483646");
    }

    @Test
    void shouldApplyFlagOverridesAfterEnvironmentOverrides() throws Exception {
        final var loader = new BootConfigLoader(Map.of("EK_CRED_0_ENDPOINT", "env:2379"), "EK");

        final MappingValue boot = loader.load(BOOT_YAML, List.of(
                "cred[0].endpoint=flag:2379",
                "gin[0].commonservice.enabled=false"));

        assertThat(boot.find("cred[0].endpoint")).contains(new ScalarValue("flag:2379"));
        assertThat(boot.find("gin[0].commonservice.enabled")).contains(new ScalarValue(false));
    }

    @Test
    void shouldDiscardOverridesBeyondDeclaredSequence() throws Exception {
        final var loader = new BootConfigLoader(Map.of(), "EK");

        final MappingValue boot = loader.load(BOOT_YAML, List.of("cred[5].name=ghost"));

        assertThat(boot.find("cred[5]")).isEmpty();
        assertThat(boot.find("cred")).hasValueSatisfying(
                cred -> assertThat(((SequenceValue) cred).size()).isEqualTo(2));
    }

    @Test
    void shouldLoadFromFile(@TempDir final Path tempDir) throws Exception {
        final Path bootFile = tempDir.resolve("boot.yaml");
        Files.write(bootFile, BOOT_YAML);

        final MappingValue boot = new BootConfigLoader(Map.of(), "EK").load(bootFile, List.of());

        assertThat(boot.find("cred[1].provider")).contains(new ScalarValue("localFs"));
    }

    @Test
    void shouldThrowWhenFileDoesNotExist(@TempDir final Path tempDir) {
        final var loader = new BootConfigLoader(Map.of(), "EK");

        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> loader.load(tempDir.resolve("missing.yaml"), List.of()))
                .withMessageEndingWith("does not exist");
    }

    @Test
    void shouldThrowOnMalformedYaml() {
        final var loader = new BootConfigLoader(Map.of(), "EK");

        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> loader.load("cred: [unterminated".getBytes(StandardCharsets.UTF_8), List.of()))
                .withMessage("Malformed YAML document");
    }

    @Test
    void shouldThrowWhenRootIsNotMapping() {
        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> BootConfigLoader.parseYaml("- foo\n- bar\n".getBytes(StandardCharsets.UTF_8)))
                .withMessage("Expected a mapping at the root of the YAML document, but got sequence");
    }

    @Test
    void shouldThrowOnMalformedFlagOverride() {
        final var loader = new BootConfigLoader(Map.of(), "EK");

        assertThatExceptionOfType(ConfigParseException.class)
                .isThrownBy(() -> loader.load(BOOT_YAML, List.of("cred[x].name=foo")));
    }

    @Test
    void shouldReturnEmptyMappingForEmptyDocument() throws Exception {
        assertThat(BootConfigLoader.parseYaml(new byte[0])).isEqualTo(MappingValue.EMPTY);
    }

    @Test
    void shouldConvertEnvironmentVariableNames() {
        assertThat(BootConfigLoader.toOverridePath("GIN_0_NAME")).isEqualTo("gin[0].name");
        assertThat(BootConfigLoader.toOverridePath("CRED_1_PATHS_0")).isEqualTo("cred[1].paths[0]");
        assertThat(BootConfigLoader.toOverridePath("LOGGER_LEVEL")).isEqualTo("logger.level");
        assertThat(BootConfigLoader.toOverridePath("0_NAME")).isEqualTo("name");
    }

}
