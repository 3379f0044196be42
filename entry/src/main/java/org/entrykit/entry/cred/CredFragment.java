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

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One element of the {@code cred} section.
 *
 * @since 1.0.0
 */
public record CredFragment(
        @JsonProperty("name") @Nullable String name,
        @JsonProperty("description") @Nullable String description,
        @JsonProperty("provider") @Nullable String provider,
        @JsonProperty("locale") @Nullable String locale,
        @JsonProperty("endpoint") @Nullable String endpoint,
        @JsonProperty("datacenter") @Nullable String datacenter,
        @JsonProperty("token") @Nullable String token,
        @JsonProperty("basicauth") @Nullable String basicAuth,
        @JsonProperty("paths") @Nullable List<String> paths) {

    List<String> pathsOrEmpty() {
        return paths != null ? paths : List.of();
    }

}
