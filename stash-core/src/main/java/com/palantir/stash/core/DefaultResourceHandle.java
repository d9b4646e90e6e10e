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

import com.palantir.stash.Resource;
import com.palantir.stash.ResourceAccessGuard;
import com.palantir.stash.ResourceHandle;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceType;
import javax.annotation.concurrent.Immutable;

@Immutable
final class DefaultResourceHandle<T extends Resource> implements ResourceHandle<T> {

    private final ResourceEntry<T> entry;

    DefaultResourceHandle(ResourceEntry<T> entry) {
        this.entry = entry;
    }

    @Override
    public ResourceKey key() {
        return entry.key();
    }

    @Override
    public ResourceType<T> type() {
        return entry.type();
    }

    @Override
    public ResourceAccessGuard<T> access() {
        return new DefaultResourceAccessGuard<>(entry, entry.type());
    }

    ResourceEntry<T> entry() {
        return entry;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof DefaultResourceHandle && entry == ((DefaultResourceHandle<?>) other).entry;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(entry);
    }

    @Override
    public String toString() {
        return "ResourceHandle{key=" + entry.key() + ", type=" + entry.type() + '}';
    }
}
