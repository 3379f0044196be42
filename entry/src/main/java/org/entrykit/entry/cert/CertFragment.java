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

import com.fasterxml.jackson.annotation.JsonProperty;
import org.entrykit.secret.management.CertPaths;
import org.jspecify.annotations.Nullable;

/**
 * One element of the {@code cert} section.
 *
 * @since 1.0.0
 */
public record CertFragment(
        @JsonProperty("name") @Nullable String name,
        @JsonProperty("description") @Nullable String description,
        @JsonProperty("locale") @Nullable String locale,
        @JsonProperty("local") @Nullable Block local,
        @JsonProperty("etcd") @Nullable Block etcd,
        @JsonProperty("consul") @Nullable Block consul,
        @JsonProperty("remotefilestore") @Nullable Block remoteFileStore) {

    /**
     * Connection parameters and certificate paths of one provider.
     */
    public record Block(
            @JsonProperty("locale") @Nullable String locale,
            @JsonProperty("endpoint") @Nullable String endpoint,
            @JsonProperty("datacenter") @Nullable String datacenter,
            @JsonProperty("token") @Nullable String token,
            @JsonProperty("basicauth") @Nullable String basicAuth,
            @JsonProperty("servercertpath") @Nullable String serverCertPath,
            @JsonProperty("serverkeypath") @Nullable String serverKeyPath,
            @JsonProperty("clientcertpath") @Nullable String clientCertPath,
            @JsonProperty("clientkeypath") @Nullable String clientKeyPath) {

        CertPaths paths() {
            return new CertPaths(serverCertPath, serverKeyPath, clientCertPath, clientKeyPath);
        }

    }

}
