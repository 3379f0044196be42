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

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;

/**
 * A client of a backing store, used for the duration of a single retrieval.
 *
 * @since 1.0.0
 */
public interface KeyFetcher extends AutoCloseable {

    /**
     * @param key     The key to fetch.
     * @param timeout Timeout of the request.
     * @return The value, or {@code null} when the key does not exist.
     * @throws IOException When the request failed.
     */
    byte @Nullable [] fetch(String key, Duration timeout) throws IOException, InterruptedException;

    @Override
    default void close() {
    }

}
