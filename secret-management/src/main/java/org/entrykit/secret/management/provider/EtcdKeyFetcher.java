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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.entrykit.secret.management.BasicAuth;
import org.entrykit.secret.management.RetrieveContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Fetches keys through the JSON gateway of the etcd v3 API.
 * <p>
 * When credentials are configured, a token is obtained via {@code /v3/auth/authenticate}
 * when the fetcher is opened, and sent with every subsequent range request.
 *
 * @since 1.0.0
 */
final class EtcdKeyFetcher extends AbstractHttpKeyFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(EtcdKeyFetcher.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private @Nullable String authToken;

    private EtcdKeyFetcher(String endpoint, RetrieveContext context) throws IOException {
        super(endpoint, context);
    }

    static EtcdKeyFetcher open(EtcdSettings settings, RetrieveContext context) throws IOException, InterruptedException {
        final var fetcher = new EtcdKeyFetcher(settings.endpoint(), context);
        final BasicAuth basicAuth = settings.basicAuth();
        if (basicAuth != null && basicAuth.isComplete()) {
            fetcher.authenticate(basicAuth, context.effectiveRequestTimeout());
        } else if (basicAuth != null) {
            LOGGER.debug("Not authenticating as {}, because the credentials are incomplete", basicAuth.username());
        }

        return fetcher;
    }

    private void authenticate(BasicAuth basicAuth, Duration timeout) throws IOException, InterruptedException {
        final byte[] requestBody = OBJECT_MAPPER.writeValueAsBytes(Map.of(
                "name", basicAuth.username(),
                "password", basicAuth.password()));

        final HttpResponse<byte[]> response = send(HttpRequest
                .newBuilder(resolve("/v3/auth/authenticate"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody)), timeout);
        if (!isSuccessful(response)) {
            throw new IOException("Authentication as %s failed with response code %d".formatted(
                    basicAuth.username(), response.statusCode()));
        }

        final JsonNode token = OBJECT_MAPPER.readTree(response.body()).path("token");
        if (!token.isTextual() || token.asText().isEmpty()) {
            throw new IOException("Authentication response does not contain a token");
        }

        LOGGER.debug("Authenticated as {}", basicAuth.username());
        this.authToken = token.asText();
    }

    @Override
    public byte @Nullable [] fetch(String key, Duration timeout) throws IOException, InterruptedException {
        final byte[] requestBody = OBJECT_MAPPER.writeValueAsBytes(Map.of("key", base64(key)));

        final HttpRequest.Builder requestBuilder = HttpRequest
                .newBuilder(resolve("/v3/kv/range"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody));
        if (authToken != null) {
            requestBuilder.header("Authorization", authToken);
        }

        final HttpResponse<byte[]> response = send(requestBuilder, timeout);
        if (!isSuccessful(response)) {
            throw unexpectedResponse(response);
        }

        final JsonNode kvs = OBJECT_MAPPER.readTree(response.body()).path("kvs");
        if (!kvs.isArray() || kvs.isEmpty()) {
            return null;
        }

        final JsonNode value = kvs.get(0).path("value");
        return value.isTextual()
                ? Base64.getDecoder().decode(value.asText())
                : new byte[0];
    }

    private static String base64(String key) {
        return Base64.getEncoder().encodeToString(key.getBytes(StandardCharsets.UTF_8));
    }

}
