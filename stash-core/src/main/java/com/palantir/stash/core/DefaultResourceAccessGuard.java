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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.stash.Resource;
import com.palantir.stash.ResourceAccessGuard;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceType;
import java.time.Instant;
import javax.annotation.concurrent.NotThreadSafe;

/** Keeps the resource of an entry loaded, and its lock read-locked, until closed. */
@NotThreadSafe
final class DefaultResourceAccessGuard<T extends Resource> implements ResourceAccessGuard<T> {

    private final ResourceEntry<T> entry;
    private final T resource;
    private final Instant fileTimeStamp;
    private boolean closed = false;

    DefaultResourceAccessGuard(ResourceEntry<T> entry, ResourceType<T> requestedType) {
        this.entry = entry;
        this.resource = entry.acquire();
        this.fileTimeStamp = entry.timeStamp();
        String typeTag = entry.typeTag().orElse(null);
        if (!requestedType.resourceClass().isInstance(resource) || !resource.typeId().equals(typeTag)) {
            entry.release();
            throw new SafeIllegalStateException(
                    "Resource accessed as the wrong type of resource",
                    entry.key().safeArg(),
                    requestedType.safeArg(),
                    SafeArg.of("typeTag", typeTag));
        }
    }

    @Override
    public T get() {
        Preconditions.checkState(!closed, "Resource guard is already closed", entry.key().safeArg());
        return resource;
    }

    @Override
    public ResourceKey key() {
        return entry.key();
    }

    @Override
    public Instant fileTimeStamp() {
        return fileTimeStamp;
    }

    @Override
    public void close() {
        if (!closed) {
            entry.release();
            closed = true;
        }
    }

    @Override
    public String toString() {
        return "DefaultResourceAccessGuard{key=" + entry.key() + ", closed=" + closed + '}';
    }
}
