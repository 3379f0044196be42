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

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static java.util.Objects.requireNonNull;

/**
 * Credentials for HTTP basic authentication, configured as {@code user:pass}.
 *
 * @since 1.0.0
 */
public record BasicAuth(String username, String password) {

    public BasicAuth {
        requireNonNull(username, "username must not be null");
        requireNonNull(password, "password must not be null");
    }

    /**
     * @param text Credentials in {@code user:pass} notation. The password may contain colons.
     * @return The parsed credentials, or {@code null} when {@code text} is {@code null} or blank.
     */
    public static @Nullable BasicAuth parse(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        final int separatorIndex = text.indexOf(':');
        if (separatorIndex < 0) {
            return new BasicAuth(text, "");
        }

        return new BasicAuth(text.substring(0, separatorIndex), text.substring(separatorIndex + 1));
    }

    public boolean isComplete() {
        return !username.isEmpty() && !password.isEmpty();
    }

    public String toHeaderValue() {
        final String credentials = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BasicAuth[username=%s, password=***]".formatted(username);
    }

}
