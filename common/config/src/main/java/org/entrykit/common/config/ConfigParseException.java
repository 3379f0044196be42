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
package org.entrykit.common.config;

/**
 * Signals a malformed boot configuration document or override string.
 * <p>
 * This is the only failure the bootstrap phase treats as fatal.
 *
 * @since 1.0.0
 */
public class ConfigParseException extends Exception {

    public ConfigParseException(String message) {
        super(message);
    }

    public ConfigParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
