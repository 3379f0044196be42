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
package org.entrykit.entry.config;

import org.entrykit.common.config.BootConfigLoader;
import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.locale.FragmentSelector;
import org.entrykit.entry.EntryRegistrar;
import org.entrykit.entry.SectionBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Creates a {@link ConfigEntry} for every fragment of the {@code config} section
 * that applies to the current environment.
 * <pre>
 * config:
 *   - name: app
 *     locale: "*::*::*::*"
 *     path: config/app.yaml
 *   - name: app
 *     locale: "prod::*::*::*"
 *     path: config/app-prod.yaml
 * </pre>
 *
 * @since 1.0.0
 */
public final class ConfigEntryRegistrar implements EntryRegistrar {

    public static final String SECTION = "config";

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigEntryRegistrar.class);

    private final FragmentSelector fragmentSelector;
    private final Path baseDirectory;

    public ConfigEntryRegistrar(FragmentSelector fragmentSelector, Path baseDirectory) {
        this.fragmentSelector = requireNonNull(fragmentSelector, "fragmentSelector must not be null");
        this.baseDirectory = requireNonNull(baseDirectory, "baseDirectory must not be null");
    }

    @Override
    public String section() {
        return SECTION;
    }

    @Override
    public List<ConfigEntry> register(MappingValue boot) throws ConfigParseException {
        final List<ConfigFragment> fragments = fragmentSelector.select(
                SectionBinder.bindList(boot, SECTION, ConfigFragment.class),
                ConfigFragment::name,
                ConfigFragment::locale);

        final var entries = new ArrayList<ConfigEntry>(fragments.size());
        for (final ConfigFragment fragment : fragments) {
            if (fragment.path() == null || fragment.path().isBlank()) {
                throw new ConfigParseException("No path configured for %s".formatted(fragment.name()));
            }

            final Path path = baseDirectory.resolve(fragment.path());
            entries.add(new ConfigEntry(fragment.name(), fragment.description(), path, load(fragment.name(), path)));
        }

        return entries;
    }

    private static MappingValue load(String name, Path path) throws ConfigParseException {
        final byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            LOGGER.warn("Config file {} of {} does not exist; Continuing with empty config", path, name);
            return MappingValue.EMPTY;
        } catch (IOException e) {
            throw new ConfigParseException("Failed to read config file %s of %s".formatted(path, name), e);
        }

        try {
            return BootConfigLoader.parseYaml(content);
        } catch (ConfigParseException e) {
            throw new ConfigParseException("Malformed config file %s of %s".formatted(path, name), e);
        }
    }

}
