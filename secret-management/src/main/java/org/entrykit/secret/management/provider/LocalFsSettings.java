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

import org.entrykit.secret.management.RetrieveContext;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * @param locale        Locale spec of the fragment.
 * @param baseDirectory Directory relative paths are resolved against.
 * @since 1.0.0
 */
public record LocalFsSettings(String locale, Path baseDirectory) implements ProviderSettings {

    public LocalFsSettings {
        requireNonNull(locale, "locale must not be null");
        requireNonNull(baseDirectory, "baseDirectory must not be null");
    }

    public static LocalFsSettings inWorkingDirectory(String locale) {
        return new LocalFsSettings(locale, Path.of("").toAbsolutePath());
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.LOCAL_FS;
    }

    @Override
    public String endpoint() {
        return "local";
    }

    @Override
    public KeyFetcher openFetcher(RetrieveContext context) {
        return new LocalFsKeyFetcher(baseDirectory);
    }

}
