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

/** Notification that a loaded resource was re-loaded because its file, or one of its dependencies, changed. */
@Value.Immutable(builder = false)
@StashImmutablesStyle
public interface FileChangedEvent {

    @Value.Parameter
    ResourceHandle<?> resource();

    /** The {@link Resource#typeId()} of the re-loaded resource. */
    @Value.Parameter
    String resourceType();

    /** Time stamp of the file the resource was re-loaded from. */
    @Value.Parameter
    Instant timeStamp();

    static FileChangedEvent of(ResourceHandle<?> resource, String resourceType, Instant timeStamp) {
        return ImmutableFileChangedEvent.of(resource, resourceType, timeStamp);
    }
}
