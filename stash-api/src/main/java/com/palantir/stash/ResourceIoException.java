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
import java.io.IOException;

/** Thrown when a {@link BackingStore} failed to list or read files. The cache never substitutes stale data. */
public final class ResourceIoException extends ResourceException {

    public ResourceIoException(ResourceKey key, String storeName, IOException cause) {
        super(
                "Failed to read resource file from backing store",
                ImmutableList.of(key.safeArg(), SafeArg.of("store", storeName)),
                cause);
    }

    public ResourceIoException(String storeName, IOException cause) {
        super("Failed to list files of backing store", ImmutableList.of(SafeArg.of("store", storeName)), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
