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

import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceType;
import java.nio.charset.StandardCharsets;

/** Resource holding the contents of a UTF-8 text file. */
public final class TextResource extends RawResource {

    public static final ResourceType<TextResource> TYPE = ResourceType.of(TextResource.class, TextResource::new);

    public TextResource(ResourceKey key) {
        super(key);
    }

    public String text() {
        return new String(loadedBytes(), StandardCharsets.UTF_8);
    }
}
