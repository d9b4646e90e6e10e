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

import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.Multiset;
import java.util.function.Consumer;
import javax.annotation.concurrent.ThreadSafe;

/** Creates {@link TestResource test resources} and records what happens to them. */
@ThreadSafe
public final class TestResourceFactory {

    private final ResourceType<TestResource> type = ResourceType.of(TestResource.class, this::create);

    private final Multiset<ResourceKey> created = ConcurrentHashMultiset.create();
    private final Multiset<ResourceKey> loaded = ConcurrentHashMultiset.create();
    private final Multiset<ResourceKey> unloaded = ConcurrentHashMultiset.create();

    private volatile boolean reloadOnFileChange = true;
    private volatile Consumer<ResourceKey> loadHook = ignored -> {};

    public ResourceType<TestResource> type() {
        return type;
    }

    /** Number of instances constructed for the key, including ones whose load failed. */
    public int created(String key) {
        return created.count(ResourceKey.of(key));
    }

    public int loaded(String key) {
        return loaded.count(ResourceKey.of(key));
    }

    public int totalLoaded() {
        return loaded.size();
    }

    public int unloaded(String key) {
        return unloaded.count(ResourceKey.of(key));
    }

    /** Whether resources created from now on ask to be re-loaded on file changes. */
    public void reloadOnFileChange(boolean value) {
        this.reloadOnFileChange = value;
    }

    /** Runs {@code hook} at the start of every load, on the loading thread. */
    public void onLoad(Consumer<ResourceKey> hook) {
        this.loadHook = hook;
    }

    void recordLoad(ResourceKey key) {
        loadHook.accept(key);
        loaded.add(key);
    }

    void recordUnload(ResourceKey key) {
        unloaded.add(key);
    }

    private TestResource create(ResourceKey key) {
        created.add(key);
        return new TestResource(key, this, reloadOnFileChange);
    }
}
