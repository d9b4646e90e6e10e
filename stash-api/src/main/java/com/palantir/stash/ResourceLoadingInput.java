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

import com.google.errorprone.annotations.MustBeClosed;
import java.nio.ByteBuffer;

/**
 * Everything a {@link Resource} needs while loading: the raw file data, its own key, and access to other
 * resources in the same cache.
 *
 * <p>Only valid for the duration of the {@link Resource#load(ResourceLoadingInput)} call it was passed to.
 */
public interface ResourceLoadingInput {

    /** Key of the resource being loaded. */
    ResourceKey key();

    /** Read-only view of the file contents. */
    ByteBuffer data();

    /** Copy of the file contents. */
    byte[] bytes();

    /** File contents decoded as UTF-8. */
    String dataAsText();

    /**
     * Loads another resource and marks the resource being loaded as dependent on it, so that changes to the
     * dependency's file trigger a re-load of this resource.
     *
     * @throws ResourceNotFoundException if no file exists for {@code dependency}
     */
    <T extends Resource> ResourceHandle<T> loadDependency(ResourceKey dependency, ResourceType<T> type);

    /**
     * Like {@link #loadDependency(ResourceKey, ResourceType)}, but returns a guard for immediate use during
     * loading.
     */
    @MustBeClosed
    <T extends Resource> ResourceAccessGuard<T> accessDependency(ResourceKey dependency, ResourceType<T> type);
}
