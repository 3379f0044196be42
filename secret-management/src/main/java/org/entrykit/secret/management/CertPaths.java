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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Locations of certificate material in a backing store. Blank paths are not retrieved.
 *
 * @since 1.0.0
 */
public record CertPaths(
        @Nullable String serverCertPath,
        @Nullable String serverKeyPath,
        @Nullable String clientCertPath,
        @Nullable String clientKeyPath) {

    /**
     * @return The configured paths by slot, in slot order.
     */
    public Map<CertSlot, String> bySlot() {
        final var paths = new EnumMap<CertSlot, String>(CertSlot.class);
        putIfNotBlank(paths, CertSlot.SERVER_CERT, serverCertPath);
        putIfNotBlank(paths, CertSlot.SERVER_KEY, serverKeyPath);
        putIfNotBlank(paths, CertSlot.CLIENT_CERT, clientCertPath);
        putIfNotBlank(paths, CertSlot.CLIENT_KEY, clientKeyPath);
        return Collections.unmodifiableMap(paths);
    }

    public boolean isEmpty() {
        return bySlot().isEmpty();
    }

    private static void putIfNotBlank(Map<CertSlot, String> paths, CertSlot slot, @Nullable String path) {
        if (path != null && !path.isBlank()) {
            paths.put(slot, path);
        }
    }

}
