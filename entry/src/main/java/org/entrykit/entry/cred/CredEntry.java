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
package org.entrykit.entry.cred;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.entrykit.entry.BootstrapContext;
import org.entrykit.entry.Entry;
import org.entrykit.secret.management.SecretRetriever;
import org.entrykit.secret.management.SecretStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Retrieves credentials from one or more {@link SecretRetriever}s during bootstrap.
 * <p>
 * Retrievers run in order, each exactly once. Their results accumulate into a single
 * {@link SecretStore}: a later retriever overwrites a key it retrieved successfully,
 * but never erases a key an earlier retriever provided.
 *
 * @since 1.0.0
 */
public final class CredEntry implements Entry {

    public static final String TYPE = "CredEntry";
    public static final String DEFAULT_NAME = "CredDefault";
    public static final String DEFAULT_DESCRIPTION = "Retrieves credentials from localFs, remoteFs, etcd or consul.";

    private static final Logger LOGGER = LoggerFactory.getLogger(CredEntry.class);

    private final String name;
    private final String description;
    private final List<SecretRetriever> retrievers;
    private final AtomicBoolean bootstrapped = new AtomicBoolean();
    private volatile SecretStore store = SecretStore.empty();

    public CredEntry(@Nullable String name, @Nullable String description, List<SecretRetriever> retrievers) {
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

    public List<SecretRetriever> retrievers() {
        return retrievers;
    }

    /**
     * @return The retrieved credentials. Empty until {@link #bootstrap(BootstrapContext)} completed.
     */
    public SecretStore store() {
        return store;
    }

    public byte @Nullable [] getCredential(String path) {
        return store.getSecret(path);
    }

    @Override
    public void bootstrap(BootstrapContext context) {
        requireNonNull(context, "context must not be null");
        if (!bootstrapped.compareAndSet(false, true)) {
            LOGGER.debug("{} {} is already bootstrapped", TYPE, name);
            return;
        }

        final SecretStore.Builder storeBuilder = SecretStore.builder();
        for (final SecretRetriever retriever : retrievers) {
            LOGGER.debug("Retrieving {} paths from {} {}",
                    retriever.listPaths().size(), retriever.provider(), retriever.endpoint());
            storeBuilder.putAll(retriever.retrieve(context.retrieveContext()));
        }

        store = storeBuilder.build();

        final long available = store.keys().stream().filter(store::isAvailable).count();
        LOGGER.info("Retrieved {} of {} credentials for {}", available, store.keys().size(), name);
    }

    @Override
    public void interrupt(BootstrapContext context) {
        LOGGER.debug("Interrupted {} {}", TYPE, name);
    }

    /**
     * @return A JSON description of this entry. Credential values, tokens and
     * basic auth credentials are never included.
     */
    @Override
    public String toString() {
        final JsonNodeFactory nodeFactory = JsonNodeFactory.instance;
        final ObjectNode node = nodeFactory.objectNode()
                .put("entryName", name)
                .put("entryType", TYPE)
                .put("entryDescription", description);

        final ObjectNode storeNode = node.putObject("store");
        store.marshalSafe().forEach(storeNode::put);

        final ArrayNode retrieversNode = node.putArray("retrievers");
        for (final SecretRetriever retriever : retrievers) {
            final ObjectNode retrieverNode = retrieversNode.addObject()
                    .put("provider", retriever.provider())
                    .put("endpoint", retriever.endpoint())
                    .put("locale", retriever.locale());
            final ArrayNode pathsNode = retrieverNode.putArray("paths");
            retriever.listPaths().forEach(pathsNode::add);
        }

        return node.toString();
    }

}
