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

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * Bounds for a single retrieval.
 *
 * @param deadline       Optional point in time after which no more requests are issued.
 *                       Derived from the overall bootstrap deadline.
 * @param dialTimeout    Timeout for establishing connections.
 * @param requestTimeout Timeout for each individual request.
 * @since 1.0.0
 */
public record RetrieveContext(@Nullable Instant deadline, Duration dialTimeout, Duration requestTimeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    public RetrieveContext {
        requireNonNull(dialTimeout, "dialTimeout must not be null");
        requireNonNull(requestTimeout, "requestTimeout must not be null");
        if (dialTimeout.isNegative() || dialTimeout.isZero()) {
            throw new IllegalArgumentException("dialTimeout must be positive, but is " + dialTimeout);
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive, but is " + requestTimeout);
        }
    }

    public static RetrieveContext withDefaults() {
        return new RetrieveContext(null, DEFAULT_TIMEOUT, DEFAULT_TIMEOUT);
    }

    public static RetrieveContext of(RetrievalConfig config, @Nullable Instant deadline) {
        requireNonNull(config, "config must not be null");
        return new RetrieveContext(deadline, config.getDialTimeout(), config.getRequestTimeout());
    }

    public RetrieveContext withDeadline(@Nullable Instant deadline) {
        return new RetrieveContext(deadline, dialTimeout, requestTimeout);
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /**
     * @return The timeout for the next request: the request timeout, capped by the time
     * left until the deadline. {@link Duration#ZERO} when the deadline has passed.
     */
    public Duration effectiveRequestTimeout() {
        return capped(requestTimeout);
    }

    /**
     * @return The connect timeout, capped by the time left until the deadline.
     * {@link Duration#ZERO} when the deadline has passed.
     */
    public Duration effectiveDialTimeout() {
        return capped(dialTimeout);
    }

    private Duration capped(Duration timeout) {
        if (deadline == null) {
            return timeout;
        }

        final Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return Duration.ZERO;
        }

        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }

}
