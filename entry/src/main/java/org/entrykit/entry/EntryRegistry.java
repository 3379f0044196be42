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
package org.entrykit.entry;

import org.entrykit.secret.management.MdcKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Holds the entries of a process, in registration order.
 * <p>
 * Owned by the {@link Bootstrapper}; entries are not looked up from global state.
 *
 * @since 1.0.0
 */
public final class EntryRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntryRegistry.class);

    private record Key(String type, String name) {
    }

    private final Map<Key, Entry> entries = new LinkedHashMap<>();

    /**
     * @param entry The entry to add.
     * @throws IllegalStateException When an entry of the same type and name was already added.
     */
    public synchronized void add(Entry entry) {
        requireNonNull(entry, "entry must not be null");

        final var key = new Key(entry.type(), entry.name());
        final Entry existing = entries.putIfAbsent(key, entry);
        if (existing != null) {
            throw new IllegalStateException(
                    "An entry of type %s with name %s was already registered".formatted(entry.type(), entry.name()));
        }

        LOGGER.debug("Registered {} {}", entry.type(), entry.name());
    }

    public synchronized Optional<Entry> get(String type, String name) {
        return Optional.ofNullable(entries.get(new Key(type, name)));
    }

    public synchronized <T extends Entry> Optional<T> get(Class<T> entryClass, String name) {
        return entries.values().stream()
                .filter(entryClass::isInstance)
                .map(entryClass::cast)
                .filter(entry -> entry.name().equals(name))
                .findFirst();
    }

    public synchronized <T extends Entry> List<T> getAll(Class<T> entryClass) {
        return entries.values().stream()
                .filter(entryClass::isInstance)
                .map(entryClass::cast)
                .toList();
    }

    public synchronized List<Entry> getAll() {
        return List.copyOf(entries.values());
    }

    /**
     * Bootstrap all entries in registration order.
     * <p>
     * A failing entry is logged and does not prevent the remaining entries from bootstrapping.
     */
    public void bootstrapAll(BootstrapContext context) {
        requireNonNull(context, "context must not be null");

        for (final Entry entry : getAll()) {
            try (var ignoredMdcEntry = MDC.putCloseable(MdcKeys.ENTRY, entry.name())) {
                LOGGER.debug("Bootstrapping {} {}", entry.type(), entry.name());
                entry.bootstrap(context);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to bootstrap {} {}", entry.type(), entry.name(), e);
            }
        }
    }

    /**
     * Interrupt all entries in reverse registration order.
     */
    public void interruptAll(BootstrapContext context) {
        requireNonNull(context, "context must not be null");

        final List<Entry> reversed = new ArrayList<>(getAll());
        Collections.reverse(reversed);

        for (final Entry entry : reversed) {
            try (var ignoredMdcEntry = MDC.putCloseable(MdcKeys.ENTRY, entry.name())) {
                LOGGER.debug("Interrupting {} {}", entry.type(), entry.name());
                entry.interrupt(context);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to interrupt {} {}", entry.type(), entry.name(), e);
            }
        }
    }

}
