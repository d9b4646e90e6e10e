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

import com.google.common.collect.ImmutableList;
import com.palantir.stash.Resource;
import com.palantir.stash.ResourceAccessGuard;
import com.palantir.stash.ResourceHandle;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceLoadingInput;
import com.palantir.stash.ResourceType;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;

/** Passed to a single {@link Resource#load} call. Records the dependencies the resource loads. */
@NotThreadSafe
final class DefaultResourceLoadingInput implements ResourceLoadingInput {

    private final ResourceKey key;
    private final ByteBuffer data;
    private final ResourceCache cache;
    private final List<Dependency> dependencies = new ArrayList<>();

    DefaultResourceLoadingInput(ResourceKey key, ByteBuffer data, ResourceCache cache) {
        this.key = key;
        this.data = data;
        this.cache = cache;
    }

    @Override
    public ResourceKey key() {
        return key;
    }

    @Override
    public ByteBuffer data() {
        return data.duplicate();
    }

    @Override
    public byte[] bytes() {
        byte[] bytes = new byte[data.remaining()];
        data.duplicate().get(bytes);
        return bytes;
    }

    @Override
    public String dataAsText() {
        return StandardCharsets.UTF_8.decode(data.duplicate()).toString();
    }

    @Override
    public <D extends Resource> ResourceHandle<D> loadDependency(ResourceKey dependency, ResourceType<D> type) {
        ResourceHandle<D> handle = cache.resourceHandle(dependency, type, false);
        try (ResourceAccessGuard<D> guard = handle.access()) {
            record(guard);
        }
        return handle;
    }

    @Override
    @SuppressWarnings("MustBeClosedChecker")
    public <D extends Resource> ResourceAccessGuard<D> accessDependency(ResourceKey dependency, ResourceType<D> type) {
        ResourceAccessGuard<D> guard = cache.access(dependency, type);
        record(guard);
        return guard;
    }

    // The time stamp of the loaded version, which lags the index while the dependency's own reload is pending.
    private void record(ResourceAccessGuard<?> guard) {
        dependencies.add(Dependency.of(guard.key(), guard.fileTimeStamp()));
    }

    ImmutableList<Dependency> dependencies() {
        return ImmutableList.copyOf(dependencies);
    }
}
