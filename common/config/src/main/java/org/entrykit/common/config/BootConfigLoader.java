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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Loads a boot configuration document.
 * <p>
 * Loading happens in four steps:
 * <ol>
 *     <li>The YAML document is parsed into a {@link MappingValue}.</li>
 *     <li>All mapping keys are converted to lower case.</li>
 *     <li>Environment variables starting with {@code <PREFIX>_} are applied as overrides.
 *     {@code EK_CRED_0_ENDPOINT=host:2379} overrides {@code cred[0].endpoint}.</li>
 *     <li>Flag overrides in {@link FlatOverrideParser} syntax are applied.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class BootConfigLoader {

    public static final String DEFAULT_ENV_PREFIX = "EK";

    private static final Logger LOGGER = LoggerFactory.getLogger(BootConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, String> environment;
    private final String envPrefix;

    public BootConfigLoader(Map<String, String> environment, String envPrefix) {
        this.environment = requireNonNull(environment, "environment must not be null");
        requireNonNull(envPrefix, "envPrefix must not be null");
        if (envPrefix.isBlank()) {
            throw new IllegalArgumentException("envPrefix must not be blank");
        }
        this.envPrefix = envPrefix.toUpperCase(Locale.ROOT) + "_";
    }

    public static BootConfigLoader forSystemEnvironment(String envPrefix) {
        return new BootConfigLoader(System.getenv(), envPrefix);
    }

    public MappingValue load(Path file, List<String> flagOverrides) throws ConfigParseException {
        requireNonNull(file, "file must not be null");

        final byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new ConfigParseException("Boot config file %s does not exist".formatted(file), e);
        } catch (IOException e) {
            throw new ConfigParseException("Failed to read boot config file %s".formatted(file), e);
        }

        return load(content, flagOverrides);
    }

    public MappingValue load(byte[] content, List<String> flagOverrides) throws ConfigParseException {
        requireNonNull(content, "content must not be null");
        requireNonNull(flagOverrides, "flagOverrides must not be null");

        MappingValue boot = (MappingValue) Values.lowerCaseKeys(parseYaml(content));

        final MappingValue envOverrides = envOverrides();
        if (!envOverrides.isEmpty()) {
            LOGGER.debug("Applying environment overrides: {}", envOverrides.entries().keySet());
            boot = ValueMerger.merge(boot, envOverrides);
        }

        final MappingValue flagOverridesValue = FlatOverrideParser.parse(String.join(",", flagOverrides));
        if (!flagOverridesValue.isEmpty()) {
            LOGGER.debug("Applying flag overrides: {}", flagOverridesValue.entries().keySet());
            boot = ValueMerger.merge(boot, flagOverridesValue);
        }

        return boot;
    }

    /**
     * Parse a YAML document into a {@link MappingValue}, keeping the keys as they are.
     *
     * @param content The raw document.
     * @return The parsed document. An empty document yields an empty mapping.
     * @throws ConfigParseException When the document is not valid YAML, or its root is not a mapping.
     */
    public static MappingValue parseYaml(byte[] content) throws ConfigParseException {
        requireNonNull(content, "content must not be null");

        final JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigParseException("Malformed YAML document", e);
        } catch (IOException e) {
            throw new ConfigParseException("Failed to read YAML document", e);
        }

        final Value value = Values.fromJsonNode(root);
        if (value.isAbsent()) {
            return MappingValue.EMPTY;
        }
        if (!(value instanceof final MappingValue mapping)) {
            throw new ConfigParseException(
                    "Expected a mapping at the root of the YAML document, but got %s".formatted(
                            value.kind().name().toLowerCase(Locale.ROOT)));
        }

        return mapping;
    }

    /**
     * Environment variables that do not form a valid override are logged and skipped.
     * Only the boot document itself and flag overrides are fatal.
     */
    MappingValue envOverrides() {
        final var overrides = new ArrayList<String>();
        MappingValue parsed = MappingValue.EMPTY;

        // Sorted for a deterministic override order.
        for (final Map.Entry<String, String> entry : new TreeMap<>(environment).entrySet()) {
            final String name = entry.getKey();
            if (!name.startsWith(envPrefix) || name.length() == envPrefix.length()) {
                continue;
            }

            final String path = toOverridePath(name.substring(envPrefix.length()));
            if (path.isEmpty()) {
                continue;
            }

            overrides.add(path + "=" + escapeValue(entry.getValue()));
            try {
                parsed = FlatOverrideParser.parse(String.join(",", overrides));
            } catch (ConfigParseException e) {
                LOGGER.warn("Ignoring environment variable {}, because it does not form a valid override for {}",
                        name, path, e);
                overrides.remove(overrides.size() - 1);
            }
        }

        return parsed;
    }

    /**
     * Convert the remainder of an environment variable name into an override path.
     * <p>
     * {@code CRED_0_ENDPOINT} becomes {@code cred[0].endpoint}. A numeric token addresses
     * an element of the sequence named by the preceding token; a leading numeric token is dropped.
     */
    static String toOverridePath(String name) {
        final var segments = new ArrayList<String>();
        for (final String token : name.toLowerCase(Locale.ROOT).split("_")) {
            if (token.isEmpty()) {
                continue;
            }

            if (isNumeric(token)) {
                if (!segments.isEmpty()) {
                    final int last = segments.size() - 1;
                    segments.set(last, "%s[%d]".formatted(segments.get(last), Integer.parseInt(token)));
                }
                continue;
            }

            segments.add(token);
        }

        return String.join(".", segments);
    }

    private static boolean isNumeric(String token) {
        if (token.length() > 9) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String escapeValue(String value) {
        final var escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '\\' || c == ',' || (i == 0 && c == '{')) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

}
