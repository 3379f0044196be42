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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Certificate material retrieved for the requested {@link CertSlot}s.
 * <p>
 * Like {@link SecretStore}, a requested slot whose retrieval failed is present with an
 * absent value. Instances are immutable.
 *
 * @since 1.0.0
 */
public final class CertStore {

    private static final CertStore EMPTY = new CertStore(new EnumMap<>(CertSlot.class));

    private final Map<CertSlot, byte @Nullable []> material;

    private CertStore(Map<CertSlot, byte @Nullable []> material) {
        this.material = Collections.unmodifiableMap(material);
    }

    public static CertStore empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte @Nullable [] get(CertSlot slot) {
        requireNonNull(slot, "slot must not be null");
        final byte[] value = material.get(slot);
        return value != null ? value.clone() : null;
    }

    public byte @Nullable [] getServerCert() {
        return get(CertSlot.SERVER_CERT);
    }

    public byte @Nullable [] getServerKey() {
        return get(CertSlot.SERVER_KEY);
    }

    public byte @Nullable [] getClientCert() {
        return get(CertSlot.CLIENT_CERT);
    }

    public byte @Nullable [] getClientKey() {
        return get(CertSlot.CLIENT_KEY);
    }

    public boolean isRequested(CertSlot slot) {
        return material.containsKey(slot);
    }

    public boolean isAvailable(CertSlot slot) {
        return material.get(slot) != null;
    }

    public Set<CertSlot> slots() {
        return material.keySet();
    }

    public boolean isEmpty() {
        return material.isEmpty();
    }

    /**
     * @return Whether material is available, by slot field name. Never contains certificate content.
     */
    @JsonValue
    public Map<String, Boolean> marshalSafe() {
        final var presence = new LinkedHashMap<String, Boolean>();
        material.forEach((slot, value) -> presence.put(slot.fieldName(), value != null));
        return presence;
    }

    @Override
    public String toString() {
        return "CertStore" + marshalSafe();
    }

    public static final class Builder {

        private final Map<CertSlot, byte @Nullable []> material = new EnumMap<>(CertSlot.class);

        private Builder() {
        }

        /**
         * Record the outcome of retrieving {@code slot}.
         * <p>
         * An absent {@code value} never replaces material that is already available.
         */
        public Builder put(CertSlot slot, byte @Nullable [] value) {
            requireNonNull(slot, "slot must not be null");
            if (value == null) {
                material.putIfAbsent(slot, null);
            } else {
                material.put(slot, value.clone());
            }
            return this;
        }

        public Builder putAll(CertStore store) {
            requireNonNull(store, "store must not be null");
            store.material.forEach(this::put);
            return this;
        }

        public CertStore build() {
            return material.isEmpty() ? EMPTY : new CertStore(new EnumMap<>(material));
        }

    }

}
