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
import com.palantir.logsafe.UnsafeArg;

/**
 * Thrown when a resource's {@link Resource#load(ResourceLoadingInput)} rejected its data. The resource is left
 * unloaded.
 */
public final class ResourceDataException extends ResourceException {

    private final ResourceKey key;
    private final String reason;

    public ResourceDataException(ResourceKey key, String reason) {
        super(
                "A requested resource file could not be loaded due to invalid data",
                ImmutableList.of(key.safeArg(), UnsafeArg.of("reason", reason)),
                null);
        this.key = key;
        this.reason = reason;
    }

    public ResourceKey key() {
        return key;
    }

    public String reason() {
        return reason;
    }
}
