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

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Secrets retrieved for a set of requested keys.
 * <p>
 * A key that was requested but could not be retrieved is present with an absent value.
 * Callers must distinguish {@link #isAvailable(String)} from {@link #isRequested(String)}.
 * Instances are immutable and safe for concurrent reads.
 *
 * @since 1.0.0
 */
public final class SecretStore {

    private static final SecretStore EMPTY = new SecretStore(Map.of());

    private final Map<String, byte @Nullable []> secrets;

    private SecretStore(Map<String, byte @Nullable []> secrets) {
        this.secrets = Collections.unmodifiableMap(secrets);
    }

    public static SecretStore empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param key The logical key.
     * @return A copy of the secret, or {@code null} when it is not available.
     */
    public byte @Nullable [] getSecret(String key) {
        requireNonNull(key, "key must not be null");
        final byte[] secret = secrets.get(key);
        return secret != null ? secret.clone() : null;
    }

    public boolean isRequested(String key) {
        return secrets.containsKey(key);
    }

    public boolean isAvailable(String key) {
        return secrets.get(key) != null;
    }

    /**
     * @return All requested keys, in request order.
     */
    public Set<String> keys() {
        return secrets.keySet();
    }

    public boolean isEmpty() {
        return secrets.isEmpty();
    }

    /**
     * @return Whether a secret is available, by key. Never contains secret content.
     */
    @JsonValue
    public Map<String, Boolean> marshalSafe() {
        final var presence = new LinkedHashMap<String, Boolean>(secrets.size());
        secrets.forEach((key, secret) -> presence.put(key, secret != null));
        return presence;
    }

    @Override
    public String toString() {
        return "SecretStore" + marshalSafe();
    }

    public static final class Builder {

        private final Map<String, byte @Nullable []> secrets = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Record the outcome of retrieving {@code key}.
         * <p>
         * An absent {@code secret} never replaces a secret that is already available.
         */
        public Builder put(String key, byte @Nullable [] secret) {
            requireNonNull(key, "key must not be null");
            if (secret == null) {
                secrets.putIfAbsent(key, null);
            } else {
                secrets.put(key, secret.clone());
            }
            return this;
        }

        public Builder putAll(SecretStore store) {
            requireNonNull(store, "store must not be null");
            store.secrets.forEach(this::put);
            return this;
        }

        public SecretStore build() {
            return secrets.isEmpty() ? EMPTY : new SecretStore(new LinkedHashMap<>(secrets));
        }

    }

}
