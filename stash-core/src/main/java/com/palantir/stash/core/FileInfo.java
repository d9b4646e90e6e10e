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

import com.palantir.stash.BackingStore;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.StashImmutablesStyle;
import java.time.Instant;
import org.immutables.value.Value;

/** The freshest known version of a file: its time stamp and the store providing it. */
@Value.Immutable(builder = false)
@StashImmutablesStyle
interface FileInfo {

    @Value.Parameter
    ResourceKey key();

    @Value.Parameter
    Instant timeStamp();

    @Value.Parameter
    BackingStore store();

    static FileInfo of(ResourceKey key, Instant timeStamp, BackingStore store) {
        return ImmutableFileInfo.of(key, timeStamp, store);
    }
}
