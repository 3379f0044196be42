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

/**
 * A unit of functionality that is registered from boot configuration and
 * receives lifecycle calls.
 *
 * @since 1.0.0
 */
public interface Entry {

    String name();

    String type();

    String description();

    /**
     * Prepare the entry for use. Called once, during process startup.
     * Calling it again has no effect.
     *
     * @param context Bounds of the bootstrap phase.
     */
    void bootstrap(BootstrapContext context);

    /**
     * Release resources held by the entry. Called during process shutdown.
     *
     * @param context Bounds of the shutdown phase.
     */
    void interrupt(BootstrapContext context);

}
