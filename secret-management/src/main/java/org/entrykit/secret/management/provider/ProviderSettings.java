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

import java.io.IOException;

/**
 * Connection settings of one backing store.
 * <p>
 * The set of variants is closed; each carries only what its backend needs.
 *
 * @since 1.0.0
 */
public sealed interface ProviderSettings
        permits LocalFsSettings, EtcdSettings, ConsulSettings, RemoteFsSettings {

    ProviderKind kind();

    String locale();

    String endpoint();

    /**
     * Open a client for a single retrieval.
     *
     * @param context Bounds of the retrieval.
     * @return The client.
     * @throws IOException When the client could not be created.
     */
    KeyFetcher openFetcher(RetrieveContext context) throws IOException, InterruptedException;

}
