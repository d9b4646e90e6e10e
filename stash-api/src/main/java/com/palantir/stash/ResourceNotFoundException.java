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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.SafeArg;
import java.util.List;

/** Thrown when a requested resource key is absent from the file index of the cache. */
public final class ResourceNotFoundException extends ResourceException {

    private final ResourceKey key;

    public ResourceNotFoundException(ResourceKey key, List<String> searchedStores) {
        super(
                "A requested resource file could not be found",
                ImmutableList.of(key.safeArg(), SafeArg.of("searchedStores", searchedStores)),
                null);
        this.key = key;
    }

    public ResourceKey key() {
        return key;
    }
}
