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
package org.entrykit.secret.management;

import org.eclipse.microprofile.config.Config;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public final class RetrievalConfig {

    private static final String PREFIX = "entrykit.retrieval.";

    private final Config config;

    public RetrievalConfig(Config config) {
        this.config = requireNonNull(config, "config must not be null");
    }

    public Duration getDialTimeout() {
        return config.getOptionalValue(PREFIX + "dial-timeout", Duration.class)
                .orElse(RetrieveContext.DEFAULT_TIMEOUT);
    }

    public Duration getRequestTimeout() {
        return config.getOptionalValue(PREFIX + "request-timeout", Duration.class)
                .orElse(RetrieveContext.DEFAULT_TIMEOUT);
    }

}
