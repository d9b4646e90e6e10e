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

/**
 * Storable reference to a resource within a cache. Handles hold no lock and do not keep the resource loaded, so
 * they may be kept indefinitely. Obtain a {@link ResourceAccessGuard} via {@link #access()} only when the
 * resource is actually used.
 */
public interface ResourceHandle<T extends Resource> {

    ResourceKey key();

    ResourceType<T> type();

    /** Borrows the resource, loading it first if needed. */
    @MustBeClosed
    ResourceAccessGuard<T> access();
}
