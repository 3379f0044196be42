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

import java.util.List;

/**
 * Retrieves secrets for a fixed list of keys from one backing store.
 *
 * @since 1.0.0
 */
public interface SecretRetriever {

    /**
     * Retrieve all keys, in the order returned by {@link #listPaths()}.
     * <p>
     * Never throws because of an unavailable backing store. Keys that could not be
     * retrieved are contained in the result with an absent value.
     *
     * @param context Bounds of the retrieval.
     * @return The retrieved secrets.
     */
    SecretStore retrieve(RetrieveContext context);

    /**
     * @return Name of the provider, e.g. {@code etcd}.
     */
    String provider();

    String endpoint();

    String locale();

    List<String> listPaths();

}
