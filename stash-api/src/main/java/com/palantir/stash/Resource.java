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

/**
 * A typed, in-memory resource which a {@code ResourceCache} constructs from a {@link ResourceKey} and then
 * initialises from the bytes of the backing file.
 *
 * <p>Resources are created through the factory of their {@link ResourceType}. Most implementations should extend
 * {@link BaseResource} rather than implementing this interface directly.
 */
public interface Resource {

    /** Key of the file this resource is loaded from. */
    ResourceKey key();

    /**
     * Initialises this resource from file data. May load other resources via
     * {@link ResourceLoadingInput#loadDependency}, which also records them as dependencies of this resource.
     */
    LoadResult load(ResourceLoadingInput input);

    /** Whether the cache should re-load this resource when its file, or a dependency's file, changes. */
    boolean shouldReloadOnFileChange();

    /**
     * Identifier of the concrete type of this resource. Reload callbacks are registered against this value. By
     * convention this is the simple name of the class.
     */
    String typeId();

    /** Releases data held by this resource when it is evicted from the cache. */
    default void unload() {}
}
