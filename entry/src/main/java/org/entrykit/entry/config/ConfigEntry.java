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

import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;
import org.entrykit.common.config.ScalarValue;
import org.entrykit.common.config.Value;
import org.entrykit.common.config.Values;
import org.entrykit.entry.BootstrapContext;
import org.entrykit.entry.Entry;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * An application configuration document selected for the current environment.
 *
 * @since 1.0.0
 */
public final class ConfigEntry implements Entry {

    public static final String TYPE = "ConfigEntry";
    public static final String DEFAULT_DESCRIPTION = "Application configuration loaded from a YAML file.";

    private final String name;
    private final String description;
    private final Path path;
    private final MappingValue values;

    public ConfigEntry(String name, @Nullable String description, Path path, MappingValue values) {
        this.name = requireNonNull(name, "name must not be null");
        this.description = description != null && !description.isBlank() ? description : DEFAULT_DESCRIPTION;
        this.path = requireNonNull(path, "path must not be null");
        this.values = requireNonNull(values, "values must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String description() {
        return description;
    }

    public Path path() {
        return path;
    }

    public MappingValue values() {
        return values;
    }

    /**
     * @param path Dotted path, e.g. {@code server.tls.enabled} or {@code hosts[1]}.
     */
    public Optional<Value> get(String path) {
        return values.find(path);
    }

    public Optional<String> getString(String path) {
        return get(path)
                .filter(ScalarValue.class::isInstance)
                .map(ScalarValue.class::cast)
                .map(ScalarValue::asString);
    }

    public <T> T bind(Class<T> type) throws ConfigParseException {
        return Values.toObject(values, type);
    }

    @Override
    public void bootstrap(BootstrapContext context) {
        // Loaded on registration.
    }

    @Override
    public void interrupt(BootstrapContext context) {
    }

    @Override
    public String toString() {
        return "ConfigEntry[name=%s, path=%s, keys=%s]".formatted(name, path, values.entries().keySet());
    }

}
