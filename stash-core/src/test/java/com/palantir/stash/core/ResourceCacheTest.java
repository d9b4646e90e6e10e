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


package com.palantir.stash.core;

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.stash.BaseResource;
import com.palantir.stash.CapacityExhaustedException;
import com.palantir.stash.InMemoryBackingStore;
import com.palantir.stash.LoadResult;
import com.palantir.stash.ResourceAccessGuard;
import com.palantir.stash.ResourceDataException;
import com.palantir.stash.ResourceHandle;
import com.palantir.stash.ResourceIoException;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceLoadingInput;
import com.palantir.stash.ResourceNotFoundException;
import com.palantir.stash.ResourceType;
import com.palantir.stash.TestResource;
import com.palantir.stash.TestResourceFactory;
import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class ResourceCacheTest {

    private static final ResourceKey A = ResourceKey.of("a.mesh");
    private static final ResourceKey B = ResourceKey.of("b.mesh");
    private static final ResourceKey C = ResourceKey.of("c.mesh");

    private final AtomicLong time = new AtomicLong();
    private final TestResourceFactory factory = new TestResourceFactory();
    private final InMemoryBackingStore store = new InMemoryBackingStore("data");
    private ResourceCache cache;

    @BeforeEach
    void before() {
        store.put("a.mesh", "mesh a", 100).put("b.mesh", "mesh b", 100).put("c.mesh", "mesh c", 100);
        cache = ResourceCache.create(ResourceCacheConfig.builder()
                .addStores(store)
                .ticker(time::get)
                .build());
    }

    @Test
    void testLoadsOnFirstAccessWhenNotLoadedImmediately() {
        ResourceHandle<TestResource> handle = cache.resourceHandle(A, factory.type(), false);
        assertThat(factory.loaded("a.mesh")).isZero();
        assertThat(cache.isCached(A)).isFalse();

        try (ResourceAccessGuard<TestResource> guard = handle.access()) {
            assertThat(guard.get().text()).isEqualTo("mesh a");
            assertThat(guard.key()).isEqualTo(A);
            assertThat(guard.fileTimeStamp()).isEqualTo(Instant.ofEpochSecond(100));
        }
        assertThat(factory.loaded("a.mesh")).isEqualTo(1);
        assertThat(cache.isCached(A)).isTrue();
    }

    @Test
    void testLoadsImmediatelyByDefault() {
        ResourceHandle<TestResource> handle = cache.resourceHandle(A, factory.type());
        assertThat(factory.loaded("a.mesh")).isEqualTo(1);
        assertThat(cache.isCached(A)).isTrue();
        assertThat(handle.key()).isEqualTo(A);
        assertThat(handle.type()).isEqualTo(factory.type());
    }

    @Test
    void testRepeatedAccessLoadsOnce() {
        assertThat(text(A)).isEqualTo("mesh a");
        assertThat(text(A)).isEqualTo("mesh a");
        assertThat(cache.resourceHandle(A, factory.type())).isEqualTo(cache.resourceHandle(A, factory.type()));

        assertThat(factory.created("a.mesh")).isEqualTo(1);
        assertThat(factory.loaded("a.mesh")).isEqualTo(1);
        assertThat(store.loadCount()).isEqualTo(1);
        assertThat(cache.numEntries()).isEqualTo(1);
    }

    @Test
    void testMissingFileIsNotFound() {
        ResourceKey missing = ResourceKey.of("missing.mesh");
        assertThatLoggableExceptionThrownBy(() -> cache.resourceHandle(missing, factory.type()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasLogMessage("A requested resource file could not be found");
        assertThatThrownBy(() -> cache.fileTimeStamp(missing)).isInstanceOf(ResourceNotFoundException.class);

        assertThat(cache.fileExists(missing)).isFalse();
        assertThat(cache.isCached(missing)).isFalse();
        assertThat(cache.numEntries()).isZero();
    }

    @Test
    void testFileQueriesUseIndex() {
        assertThat(cache.fileExists(A)).isTrue();
        assertThat(cache.fileTimeStamp(A)).isEqualTo(Instant.ofEpochSecond(100));

        store.put("d.mesh", "mesh d", 100);
        assertThat(cache.fileExists(ResourceKey.of("d.mesh"))).isFalse();
        cache.refresh();
        assertThat(cache.fileExists(ResourceKey.of("d.mesh"))).isTrue();
    }

    @Test
    void testRequestingAsDifferentTypeFails() {
        cache.resourceHandle(A, factory.type());

        assertThatLoggableExceptionThrownBy(() -> cache.resourceHandle(A, OtherResource.TYPE))
                .isInstanceOf(SafeIllegalStateException.class)
                .hasLogMessage("Resource requested as a different type than it was first requested as");
    }

    @Test
    void testDataErrorLeavesResourceUnloaded() {
        store.put("a.mesh", "error: truncated vertex data", 100);
        cache.refresh();

        assertThatThrownBy(() -> text(A))
                .isInstanceOfSatisfying(
                        ResourceDataException.class,
                        e -> assertThat(e.reason()).isEqualTo("truncated vertex data"));
        assertThat(cache.isCached(A)).isFalse();

        store.put("a.mesh", "fixed", 200);
        assertThat(cache.refresh()).isZero();
        assertThat(text(A)).isEqualTo("fixed");
    }

    @Test
    void testMissingDependencyIsDataError() {
        store.put("a.mesh", "dep:textures/missing.png", 100);
        cache.refresh();

        assertThatThrownBy(() -> text(A))
                .isInstanceOfSatisfying(
                        ResourceDataException.class,
                        e -> assertThat(e.reason()).isEqualTo("Dependency not found."));
    }

    @Test
    void testCircularDependencyFails() {
        store.put("a.mesh", "dep:b.mesh", 100).put("b.mesh", "dep:a.mesh", 100);
        cache.refresh();

        assertThatLoggableExceptionThrownBy(() -> text(A))
                .isInstanceOf(SafeIllegalStateException.class)
                .hasLogMessage("Circular resource dependency");
        assertThat(cache.isCached(A)).isFalse();
        assertThat(cache.isCached(B)).isFalse();
    }

    @Test
    void testUnloadsLeastRecentlyUsed() {
        time.set(10);
        cache.resourceHandle(A, factory.type());
        time.set(20);
        cache.resourceHandle(B, factory.type());
        time.set(30);
        cache.resourceHandle(C, factory.type());

        assertThat(cache.unloadUnused()).isTrue();
        assertThat(cache.isCached(A)).isFalse();
        assertThat(cache.isCached(B)).isTrue();
        assertThat(cache.isCached(C)).isTrue();
        assertThat(factory.unloaded("a.mesh")).isEqualTo(1);

        time.set(40);
        text(B);
        assertThat(cache.unloadUnused()).isTrue();
        assertThat(cache.isCached(B)).isTrue();
        assertThat(cache.isCached(C)).isFalse();
    }

    @Test
    void testUnloadBreaksTiesByKey() {
        cache.resourceHandle(C, factory.type());
        cache.resourceHandle(B, factory.type());

        // Both were accessed at time zero, b.mesh sorts before c.mesh.
        assertThat(cache.unloadUnused()).isTrue();
        assertThat(cache.isCached(B)).isFalse();
        assertThat(cache.isCached(C)).isTrue();
    }

    @Test
    void testBorrowedResourcesAreNotUnloaded() {
        time.set(10);
        ResourceHandle<TestResource> handle = cache.resourceHandle(A, factory.type());
        time.set(20);
        cache.resourceHandle(B, factory.type());

        try (ResourceAccessGuard<TestResource> guard = handle.access()) {
            assertThat(cache.unloadUnused(true)).isTrue();
            assertThat(cache.isCached(A)).isTrue();
            assertThat(cache.isCached(B)).isFalse();
            assertThat(guard.get().text()).isEqualTo("mesh a");
            assertThat(cache.unloadUnused()).isFalse();
        }
        assertThat(cache.unloadUnused()).isTrue();
        assertThat(cache.isCached(A)).isFalse();
    }

    @Test
    void testUnloadAll() {
        cache.resourceHandle(A, factory.type());
        cache.resourceHandle(B, factory.type());

        assertThat(cache.unloadUnused(true)).isTrue();
        assertThat(cache.isCached(A)).isFalse();
        assertThat(cache.isCached(B)).isFalse();
        assertThat(cache.unloadUnused(true)).isFalse();
    }

    @Test
    void testHandlesSurviveUnload() {
        ResourceHandle<TestResource> handle = cache.resourceHandle(A, factory.type());
        cache.unloadUnused(true);

        try (ResourceAccessGuard<TestResource> guard = handle.access()) {
            assertThat(guard.get().text()).isEqualTo("mesh a");
        }
        assertThat(factory.loaded("a.mesh")).isEqualTo(2);
        assertThat(factory.created("a.mesh")).isEqualTo(2);
        assertThat(cache.numEntries()).isEqualTo(1);
    }

    @Test
    void testClosedGuardRejectsUse() {
        ResourceAccessGuard<TestResource> guard = cache.access(A, factory.type());
        guard.close();
        guard.close();

        assertThatLoggableExceptionThrownBy(guard::get)
                .isInstanceOf(SafeIllegalStateException.class)
                .hasLogMessage("Resource guard is already closed");
        assertThat(cache.unloadUnused()).isTrue();
    }

    @Test
    void testRetryOnExhaustionUnloadsUntilSuccess() {
        cache.resourceHandle(A, factory.type());
        cache.resourceHandle(B, factory.type());
        AtomicInteger attempts = new AtomicInteger();

        String result = cache.retryOnExhaustion(() -> {
            attempts.incrementAndGet();
            if (cache.isCached(A) || cache.isCached(B)) {
                throw new CapacityExhaustedException("Vertex buffer pool is full");
            }
            return "allocated";
        });

        assertThat(result).isEqualTo("allocated");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void testRetryOnExhaustionGivesUpWhenNothingToUnload() {
        cache.resourceHandle(A, factory.type());
        AtomicInteger attempts = new AtomicInteger();

        assertThatLoggableExceptionThrownBy(() -> cache.retryOnExhaustion(() -> {
                    attempts.incrementAndGet();
                    throw new CapacityExhaustedException("Vertex buffer pool is full");
                }))
                .isInstanceOf(CapacityExhaustedException.class)
                .hasLogMessage("Vertex buffer pool is full");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void testFailedRefreshKeepsIndex() {
        store.failWith(new IOException("disk gone"));

        assertThatThrownBy(cache::refresh)
                .isInstanceOf(ResourceIoException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(cache.fileExists(A)).isTrue();

        store.failWith(null);
        assertThat(text(A)).isEqualTo("mesh a");
    }

    @Test
    void testReadFailureSurfaces() {
        store.failWith(new IOException("disk gone"));

        assertThatThrownBy(() -> text(A)).isInstanceOf(ResourceIoException.class);
        assertThat(cache.isCached(A)).isFalse();
    }

    @Test
    void testCloseClosesStores() {
        InMemoryBackingStore failing = new InMemoryBackingStore("failing").put("a.mesh", "mesh a", 50);
        ResourceCache twoStores = ResourceCache.of(store, failing);
        failing.failWith(new IOException("already closed"));

        twoStores.close();
        assertThat(store.closeCount()).isEqualTo(1);
        assertThat(failing.closeCount()).isEqualTo(1);
        assertThat(twoStores.backingStores()).containsExactly(store, failing);
    }

    private String text(ResourceKey key) {
        try (ResourceAccessGuard<TestResource> guard = cache.access(key, factory.type())) {
            return guard.get().text();
        }
    }

    static final class OtherResource extends BaseResource {
        static final ResourceType<OtherResource> TYPE = ResourceType.of(OtherResource.class, OtherResource::new);

        OtherResource(ResourceKey key) {
            super(key);
        }

        @Override
        protected LoadResult loadResource(ResourceLoadingInput input) {
            return LoadResult.success();
        }

        @Override
        public boolean shouldReloadOnFileChange() {
            return false;
        }
    }
}
