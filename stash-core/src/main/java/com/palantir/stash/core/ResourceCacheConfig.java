/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.stash.core;

import com.github.benmanes.caffeine.cache.Ticker;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.stash.BackingStore;
import com.palantir.stash.StashImmutablesStyle;
import java.time.Duration;
import java.util.List;
import org.immutables.value.Value;

/** Configuration of a {@link ResourceCache}. */
@Value.Immutable
@StashImmutablesStyle
public interface ResourceCacheConfig {

    /**
     * Stores to find resource files in. When several stores provide the same file, the one with the greater time
     * stamp wins, and on equal time stamps the store listed first wins.
     */
    List<BackingStore> stores();

    /** Source of last-access times used to pick eviction candidates. */
    @Value.Default
    default Ticker ticker() {
        return Ticker.systemTicker();
    }

    /** How long {@link ResourceCache#unloadUnused} waits for each candidate's lock before skipping it. */
    @Value.Default
    default Duration unloadLockTimeout() {
        return Duration.ofMillis(100);
    }

    /**
     * How long a hot reload waits for outstanding guards of a changed resource to be closed. Resources which stay
     * borrowed for longer are retried on the next {@link ResourceCache#refresh()}.
     */
    @Value.Default
    default Duration reloadLockTimeout() {
        return Duration.ofSeconds(1);
    }

    @Value.Check
    default void check() {
        Preconditions.checkArgument(!stores().isEmpty(), "At least one backing store is required");
        Preconditions.checkArgument(
                !unloadLockTimeout().isNegative(),
                "unloadLockTimeout must not be negative",
                SafeArg.of("unloadLockTimeout", unloadLockTimeout()));
        Preconditions.checkArgument(
                !reloadLockTimeout().isNegative(),
                "reloadLockTimeout must not be negative",
                SafeArg.of("reloadLockTimeout", reloadLockTimeout()));
    }

    static Builder builder() {
        return new Builder();
    }

    final class Builder extends ImmutableResourceCacheConfig.Builder {}
}
