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

import org.entrykit.secret.management.RetrieveContext;

import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @param retrieveContext Bounds for retrievals performed during bootstrap.
 * @since 1.0.0
 */
public record BootstrapContext(RetrieveContext retrieveContext) {

    public BootstrapContext {
        requireNonNull(retrieveContext, "retrieveContext must not be null");
    }

    public static BootstrapContext withDefaults() {
        return new BootstrapContext(RetrieveContext.withDefaults());
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(retrieveContext.deadline());
    }

}
