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

import org.entrykit.common.config.ConfigParseException;
import org.entrykit.common.config.MappingValue;

import java.util.List;

/**
 * Creates entries from one section of a boot configuration document.
 *
 * @since 1.0.0
 */
public interface EntryRegistrar {

    /**
     * @return Name of the top-level section this registrar reads, e.g. {@code cred}.
     */
    String section();

    /**
     * @param boot The complete boot configuration.
     * @return The entries to register, in declaration order. Empty when the section is absent.
     * @throws ConfigParseException When the section is malformed.
     */
    List<? extends Entry> register(MappingValue boot) throws ConfigParseException;

}
