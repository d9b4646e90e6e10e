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

package com.palantir.stash;

import java.time.Instant;
import org.immutables.value.Value;

/** A single file available in a {@link BackingStore}, as reported by {@link BackingStore#availableFiles()}. */
@Value.Immutable(builder = false)
@StashImmutablesStyle
public interface FileRecord {

    @Value.Parameter
    ResourceKey key();

    @Value.Parameter
    Instant timeStamp();

    static FileRecord of(ResourceKey key, Instant timeStamp) {
        return ImmutableFileRecord.of(key, timeStamp);
    }

    static FileRecord of(String name, Instant timeStamp) {
        return of(ResourceKey.of(name), timeStamp);
    }
}
