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

import org.eclipse.microprofile.config.Config;
import org.entrykit.common.config.BootConfigLoader;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public final class BootstrapConfig {

    private static final String PREFIX = "entrykit.boot.";

    private final Config config;

    public BootstrapConfig(Config config) {
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * @return Prefix of environment variables that override boot configuration values.
     */
    public String getEnvOverridePrefix() {
        return config.getOptionalValue(PREFIX + "env-override-prefix", String.class)
                .orElse(BootConfigLoader.DEFAULT_ENV_PREFIX);
    }

    /**
     * @return Upper bound for the duration of the bootstrap phase, if any.
     */
    public Optional<Duration> getDeadline() {
        return config.getOptionalValue(PREFIX + "deadline", Duration.class);
    }

    /**
     * @return Directory that relative file paths in the boot configuration are resolved against.
     */
    public Path getBaseDirectory() {
        return config.getOptionalValue(PREFIX + "base-directory", String.class)
                .map(Path::of)
                .orElseGet(() -> Path.of(""))
                .toAbsolutePath();
    }

}
