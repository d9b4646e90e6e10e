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

/**
 * Scoped borrow of a loaded resource. While at least one guard for a resource is open, the resource will be
 * neither evicted nor replaced by a hot reload.
 *
 * <p>Guards must be closed by the thread which opened them, preferably with try-with-resources:
 *
 * <pre>
 * try (ResourceAccessGuard&lt;TextResource&gt; text = handle.access()) {
 *     render(text.get().text());
 * }
 * </pre>
 *
 * Do not store guards in fields; store the {@link ResourceHandle} instead.
 */
public interface ResourceAccessGuard<T extends Resource> extends AutoCloseable {

    /** Returns the resource. Only valid until this guard is closed. */
    T get();

    ResourceKey key();

    /** Time stamp of the file the resource was loaded from. */
    Instant fileTimeStamp();

    @Override
    void close();
}
