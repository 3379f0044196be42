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
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches keys from the consul KV store via {@code GET /v1/kv/<key>?raw}.
 *
 * @since 1.0.0
 */
final class ConsulKeyFetcher extends AbstractHttpKeyFetcher {

    private final ConsulSettings settings;

    ConsulKeyFetcher(ConsulSettings settings, RetrieveContext context) throws IOException {
        super(settings.endpoint(), context);
        this.settings = settings;
    }

    @Override
    public byte @Nullable [] fetch(String key, Duration timeout) throws IOException, InterruptedException {
        final var pathAndQuery = new StringBuilder("/v1/kv/")
                .append(encodePath(stripLeadingSlash(key)))
                .append("?raw");
        if (settings.datacenter() != null && !settings.datacenter().isBlank()) {
            pathAndQuery.append("&dc=").append(URLEncoder.encode(settings.datacenter(), StandardCharsets.UTF_8));
        }

        final HttpRequest.Builder requestBuilder = HttpRequest
                .newBuilder(resolve(pathAndQuery.toString()))
                .GET();
        if (settings.token() != null && !settings.token().isBlank()) {
            requestBuilder.header("X-Consul-Token", settings.token());
        }
        applyBasicAuth(requestBuilder, settings.basicAuth());

        final HttpResponse<byte[]> response = send(requestBuilder, timeout);
        if (response.statusCode() == 404) {
            return null;
        }
        if (!isSuccessful(response)) {
            throw unexpectedResponse(response);
        }

        return response.body();
    }

    private static String stripLeadingSlash(String key) {
        return key.startsWith("/") ? key.substring(1) : key;
    }

}
