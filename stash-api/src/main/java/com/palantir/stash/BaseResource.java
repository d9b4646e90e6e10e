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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;

/** Convenience base class for {@link Resource} implementations. */
public abstract class BaseResource implements Resource {
    private static final SafeLogger log = SafeLoggerFactory.get(BaseResource.class);

    private final ResourceKey key;

    protected BaseResource(ResourceKey key) {
        this.key = Preconditions.checkNotNull(key, "key");
    }

    @Override
    public final ResourceKey key() {
        return key;
    }

    /**
     * Runs {@link #loadResource(ResourceLoadingInput)}, reporting a missing dependency as a data error of this
     * resource.
     */
    @Override
    public final LoadResult load(ResourceLoadingInput input) {
        log.debug("Loading resource {}", key.safeArg());
        try {
            return loadResource(input);
        } catch (ResourceNotFoundException e) {
            log.debug(
                    "Dependency {} of resource {} not found",
                    SafeArg.of("dependencyKey", e.key().name()),
                    key.safeArg());
            return LoadResult.dataError("Dependency not found.");
        }
    }

    @Override
    public String typeId() {
        return getClass().getSimpleName();
    }

    protected abstract LoadResult loadResource(ResourceLoadingInput input);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{key=" + key + '}';
    }
}
