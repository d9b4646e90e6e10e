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


package com.palantir.stash.resources;

import com.palantir.logsafe.Preconditions;
import com.palantir.stash.BaseResource;
import com.palantir.stash.LoadResult;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceLoadingInput;
import com.palantir.stash.ResourceType;
import java.nio.ByteBuffer;
import javax.annotation.Nullable;

/** Resource holding the unparsed bytes of its file. */
public class RawResource extends BaseResource {

    public static final ResourceType<RawResource> TYPE = ResourceType.of(RawResource.class, RawResource::new);

    @Nullable
    private byte[] bytes;

    public RawResource(ResourceKey key) {
        super(key);
    }

    @Override
    protected LoadResult loadResource(ResourceLoadingInput input) {
        this.bytes = input.bytes();
        return LoadResult.success();
    }

    @Override
    public boolean shouldReloadOnFileChange() {
        return true;
    }

    /** Read-only view of the file contents. */
    public ByteBuffer data() {
        return ByteBuffer.wrap(loadedBytes()).asReadOnlyBuffer();
    }

    public int size() {
        return loadedBytes().length;
    }

    @Override
    public void unload() {
        bytes = null;
    }

    final byte[] loadedBytes() {
        return Preconditions.checkNotNull(bytes, "Resource is not loaded", key().safeArg());
    }
}
