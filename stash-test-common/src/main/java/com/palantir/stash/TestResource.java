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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Text resource driven by its file content. Lines of the form {@code dep:<key>} load another test resource as a
 * dependency, lines of the form {@code copy:<key>} append the text of another test resource, a first line of
 * {@code error:<reason>} makes loading fail with a data error, a first line of {@code crash:<reason>} makes it throw,
 * and every other line becomes part of {@link #text()}.
 */
public final class TestResource extends BaseResource {

    private static final String DEPENDENCY_PREFIX = "dep:";
    private static final String COPY_PREFIX = "copy:";
    private static final String ERROR_PREFIX = "error:";
    private static final String CRASH_PREFIX = "crash:";

    private final TestResourceFactory factory;
    private final boolean reloadOnFileChange;

    @Nullable
    private String text;

    private ImmutableList<ResourceHandle<TestResource>> dependencies = ImmutableList.of();

    TestResource(ResourceKey key, TestResourceFactory factory, boolean reloadOnFileChange) {
        super(key);
        this.factory = factory;
        this.reloadOnFileChange = reloadOnFileChange;
    }

    @Override
    protected LoadResult loadResource(ResourceLoadingInput input) {
        factory.recordLoad(key());
        String content = input.dataAsText();
        if (content.startsWith(ERROR_PREFIX)) {
            return LoadResult.dataError(content.substring(ERROR_PREFIX.length()).trim());
        }
        if (content.startsWith(CRASH_PREFIX)) {
            throw new SafeIllegalArgumentException(
                    "Malformed test resource", UnsafeArg.of("reason", content.substring(CRASH_PREFIX.length())));
        }
        List<String> lines = new ArrayList<>();
        ImmutableList.Builder<ResourceHandle<TestResource>> deps = ImmutableList.builder();
        for (String line : Splitter.on('\n').omitEmptyStrings().split(content)) {
            if (line.startsWith(DEPENDENCY_PREFIX)) {
                ResourceKey dependency = ResourceKey.of(line.substring(DEPENDENCY_PREFIX.length()).trim());
                deps.add(input.loadDependency(dependency, factory.type()));
            } else if (line.startsWith(COPY_PREFIX)) {
                ResourceKey source = ResourceKey.of(line.substring(COPY_PREFIX.length()).trim());
                try (ResourceAccessGuard<TestResource> guard = input.accessDependency(source, factory.type())) {
                    lines.add("copied " + guard.get().text());
                }
            } else {
                lines.add(line);
            }
        }
        this.text = String.join("\n", lines);
        this.dependencies = deps.build();
        return LoadResult.success();
    }

    @Override
    public boolean shouldReloadOnFileChange() {
        return reloadOnFileChange;
    }

    @Override
    public void unload() {
        factory.recordUnload(key());
    }

    public String text() {
        return Preconditions.checkNotNull(text, "Resource is not loaded");
    }

    public ImmutableList<ResourceHandle<TestResource>> dependencies() {
        return dependencies;
    }
}
