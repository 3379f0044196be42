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
package org.entrykit.entry.cert;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.entrykit.entry.BootstrapContext;
import org.entrykit.entry.Entry;
import org.entrykit.secret.management.CertRetriever;
import org.entrykit.secret.management.CertSlot;
import org.entrykit.secret.management.CertStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Retrieves TLS certificate material during bootstrap.
 * <p>
 * Retrievers run in order. Material retrieved by an earlier retriever is never
 * erased by a later retriever that failed to provide the same slot.
 *
 * @since 1.0.0
 */
public final class CertEntry implements Entry {

    public static final String TYPE = "CertEntry";
    public static final String DEFAULT_NAME = "CertDefault";
    public static final String DEFAULT_DESCRIPTION = "Retrieves certificates from localFs, remoteFs, etcd or consul.";

    private static final Logger LOGGER = LoggerFactory.getLogger(CertEntry.class);

    private final String name;
    private final String description;
    private final List<CertRetriever> retrievers;
    private final AtomicBoolean bootstrapped = new AtomicBoolean();
    private volatile CertStore store = CertStore.empty();

    public CertEntry(@Nullable String name, @Nullable String description, List<CertRetriever> retrievers) {
        this.name = name != null && !name.isBlank() ? name : DEFAULT_NAME;
        this.description = description != null && !description.isBlank() ? description : DEFAULT_DESCRIPTION;
        this.retrievers = List.copyOf(requireNonNull(retrievers, "retrievers must not be null"));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String description() {
        return description;
    }

    public List<CertRetriever> retrievers() {
        return retrievers;
    }

    public CertStore store() {
        return store;
    }

    @Override
    public void bootstrap(BootstrapContext context) {
        requireNonNull(context, "context must not be null");
        if (!bootstrapped.compareAndSet(false, true)) {
            LOGGER.debug("{} {} is already bootstrapped", TYPE, name);
            return;
        }

        final CertStore.Builder storeBuilder = CertStore.builder();
        for (final CertRetriever retriever : retrievers) {
            storeBuilder.putAll(retriever.retrieve(context.retrieveContext()));
        }

        store = storeBuilder.build();
        LOGGER.info("Retrieved certificate material for {}: {}", name, store.marshalSafe());
    }

    @Override
    public void interrupt(BootstrapContext context) {
        LOGGER.debug("Interrupted {} {}", TYPE, name);
    }

    /**
     * @return The server certificate, or {@code null} when it was not retrieved.
     * @throws CertificateException When the retrieved material is not a valid X.509 certificate.
     */
    public @Nullable X509Certificate getServerCertificate() throws CertificateException {
        return parseCertificate(store.getServerCert());
    }

    /**
     * @return The client certificate, or {@code null} when it was not retrieved.
     * @throws CertificateException When the retrieved material is not a valid X.509 certificate.
     */
    public @Nullable X509Certificate getClientCertificate() throws CertificateException {
        return parseCertificate(store.getClientCert());
    }

    private static @Nullable X509Certificate parseCertificate(byte @Nullable [] pem) throws CertificateException {
        if (pem == null) {
            return null;
        }

        final var certificateFactory = CertificateFactory.getInstance("X.509");
        return (X509Certificate) certificateFactory.generateCertificate(new ByteArrayInputStream(pem));
    }

    @Override
    public String toString() {
        final ObjectNode node = JsonNodeFactory.instance.objectNode()
                .put("entryName", name)
                .put("entryType", TYPE)
                .put("entryDescription", description);

        final ObjectNode storeNode = node.putObject("store");
        store.marshalSafe().forEach(storeNode::put);

        final ArrayNode retrieversNode = node.putArray("retrievers");
        for (final CertRetriever retriever : retrievers) {
            final ObjectNode retrieverNode = retrieversNode.addObject()
                    .put("provider", retriever.provider())
                    .put("endpoint", retriever.endpoint())
                    .put("locale", retriever.locale());
            final ObjectNode pathsNode = retrieverNode.putObject("paths");
            for (final Map.Entry<CertSlot, String> path : retriever.paths().bySlot().entrySet()) {
                pathsNode.put(path.getKey().fieldName() + "Path", path.getValue());
            }
        }

        return node.toString();
    }

}
