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

import org.entrykit.secret.management.BasicAuth;
import org.entrykit.secret.management.RetrieveContext;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Base class for {@link KeyFetcher}s that talk to their backend over HTTP.
 *
 * @since 1.0.0
 */
abstract class AbstractHttpKeyFetcher implements KeyFetcher {

    private final HttpClient httpClient;
    private final URI baseUri;

    AbstractHttpKeyFetcher(String endpoint, RetrieveContext context) throws IOException {
        requireNonNull(endpoint, "endpoint must not be null");
        requireNonNull(context, "context must not be null");

        final Duration connectTimeout = context.effectiveDialTimeout();
        if (connectTimeout.isZero()) {
            throw new HttpTimeoutException("Deadline exceeded before connecting to " + endpoint);
        }

        this.baseUri = toBaseUri(endpoint);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    URI baseUri() {
        return baseUri;
    }

    URI resolve(String pathAndQuery) {
        return URI.create(baseUri + pathAndQuery);
    }

    HttpResponse<byte[]> send(HttpRequest.Builder requestBuilder, Duration timeout) throws IOException, InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new HttpTimeoutException("Deadline exceeded");
        }

        final HttpRequest request = requestBuilder.timeout(timeout).build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    static void applyBasicAuth(HttpRequest.Builder requestBuilder, @Nullable BasicAuth basicAuth) {
        if (basicAuth != null && basicAuth.isComplete()) {
            requestBuilder.header("Authorization", basicAuth.toHeaderValue());
        }
    }

    static boolean isSuccessful(HttpResponse<?> response) {
        return response.statusCode() >= 200 && response.statusCode() <= 299;
    }

    static IOException unexpectedResponse(HttpResponse<?> response) {
        return new IOException("Request to %s failed with unexpected response code: %d".formatted(
                response.uri(), response.statusCode()));
    }

    /**
     * Percent-encode each segment of a slash-separated key, keeping the slashes.
     */
    static String encodePath(String key) {
        return Arrays.stream(key.split("/", -1))
                .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("/"));
    }

    static URI toBaseUri(String endpoint) throws IOException {
        String normalized = endpoint.trim();
        if (!normalized.contains("://")) {
            normalized = "http://" + normalized;
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }

        try {
            final var uri = new URI(normalized);
            if (uri.getHost() == null) {
                throw new IOException("Endpoint %s does not specify a host".formatted(endpoint));
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IOException("Invalid endpoint: " + endpoint, e);
        }
    }

}
