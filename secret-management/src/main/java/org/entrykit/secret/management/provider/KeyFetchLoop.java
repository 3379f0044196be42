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

import org.entrykit.secret.management.MdcKeys;
import org.entrykit.secret.management.RetrieveContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches a list of keys from one backing store, isolating failures per key.
 * <p>
 * Keys are fetched sequentially in the given order. The result contains every key;
 * keys that could not be fetched map to {@code null}. When no client can be opened,
 * all keys map to {@code null}.
 *
 * @since 1.0.0
 */
final class KeyFetchLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeyFetchLoop.class);

    private KeyFetchLoop() {
    }

    static Map<String, byte @Nullable []> fetchAll(
            ProviderSettings settings,
            List<String> keys,
            RetrieveContext context) {
        final var results = new LinkedHashMap<String, byte @Nullable []>(keys.size());
        keys.forEach(key -> results.put(key, null));
        if (keys.isEmpty()) {
            return results;
        }

        try (var ignoredMdcProvider = MDC.putCloseable(MdcKeys.PROVIDER, settings.kind().configName());
             var ignoredMdcEndpoint = MDC.putCloseable(MdcKeys.ENDPOINT, settings.endpoint());
             var ignoredMdcLocale = MDC.putCloseable(MdcKeys.LOCALE, settings.locale())) {
            final KeyFetcher fetcher;
            try {
                fetcher = settings.openFetcher(context);
            } catch (IOException | RuntimeException e) {
                LOGGER.warn("Failed to create {} client for endpoint {} (locale {}); None of {} keys will be retrieved",
                        settings.kind(), settings.endpoint(), settings.locale(), keys.size(), e);
                return results;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while creating {} client for endpoint {} (locale {})",
                        settings.kind(), settings.endpoint(), settings.locale());
                return results;
            }

            try (fetcher) {
                for (final String key : keys) {
                    if (Thread.currentThread().isInterrupted()) {
                        LOGGER.warn("Interrupted before fetching {} from {} {} (locale {}); Skipping remaining keys",
                                key, settings.kind(), settings.endpoint(), settings.locale());
                        break;
                    }

                    final Duration timeout = context.effectiveRequestTimeout();
                    if (timeout.isZero()) {
                        LOGGER.warn("Deadline exceeded before fetching {} from {} {} (locale {}); Skipping remaining keys",
                                key, settings.kind(), settings.endpoint(), settings.locale());
                        break;
                    }

                    try {
                        final byte[] value = fetcher.fetch(key, timeout);
                        if (value == null) {
                            LOGGER.warn("Key {} does not exist in {} {} (locale {})",
                                    key, settings.kind(), settings.endpoint(), settings.locale());
                        } else {
                            LOGGER.debug("Fetched key {} ({} bytes)", key, value.length);
                        }
                        results.put(key, value);
                    } catch (IOException | RuntimeException e) {
                        LOGGER.warn("Failed to fetch key {} from {} {} (locale {})",
                                key, settings.kind(), settings.endpoint(), settings.locale(), e);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        LOGGER.warn("Interrupted while fetching key {} from {} {} (locale {}); Skipping remaining keys",
                                key, settings.kind(), settings.endpoint(), settings.locale());
                        break;
                    }
                }
            }
        }

        return results;
    }

}
