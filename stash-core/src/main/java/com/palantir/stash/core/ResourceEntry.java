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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.exceptions.SafeRuntimeException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.stash.BackingStore;
import com.palantir.stash.LoadResult;
import com.palantir.stash.Resource;
import com.palantir.stash.ResourceDataException;
import com.palantir.stash.ResourceIoException;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceType;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Storage node for the resource of a single key. Entries are created the first time a key is requested and are
 * retained for the lifetime of the cache, so handles never dangle; only the resource they hold is loaded, evicted
 * and replaced.
 *
 * <p>Guards hold the read side of {@link #lock} for as long as they are open. Loading, evicting and swapping in a
 * re-loaded resource take the write side, which therefore waits until the resource is no longer borrowed.
 */
@ThreadSafe
final class ResourceEntry<T extends Resource> {
    private static final SafeLogger log = SafeLoggerFactory.get(ResourceEntry.class);

    private static final Duration LOAD_RETRY_INTERVAL = Duration.ofMillis(10);

    private final ResourceKey key;
    private final ResourceType<T> type;
    private final ResourceCache cache;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger borrowCount = new AtomicInteger();

    @Nullable
    @GuardedBy("lock")
    private T resource;

    @GuardedBy("lock")
    private ImmutableList<Dependency> dependencies = ImmutableList.of();

    // Written with the write lock held, readable without it.
    private volatile boolean loaded;
    private volatile Instant timeStamp;
    private volatile long lastAccess;

    @Nullable
    private volatile String typeTag;

    ResourceEntry(ResourceKey key, ResourceType<T> type, Instant timeStamp, ResourceCache cache) {
        this.key = key;
        this.type = type;
        this.timeStamp = timeStamp;
        this.cache = cache;
    }

    ResourceKey key() {
        return key;
    }

    ResourceType<T> type() {
        return type;
    }

    boolean isLoaded() {
        return loaded;
    }

    int borrowCount() {
        return borrowCount.get();
    }

    long lastAccess() {
        return lastAccess;
    }

    /** Time stamp of the file the current, or most recent, resource was loaded from. */
    Instant timeStamp() {
        return timeStamp;
    }

    /** The {@link Resource#typeId()} of the loaded resource, empty until the first successful load. */
    Optional<String> typeTag() {
        return Optional.ofNullable(typeTag);
    }

    ImmutableList<ResourceKey> dependencyKeys() {
        lock.readLock().lock();
        try {
            return dependencies.stream().map(Dependency::key).collect(ImmutableList.toImmutableList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Borrows the resource, loading it first if necessary. On success the calling thread holds the read lock until
     * it calls {@link #release()}.
     */
    T acquire() {
        lockLoaded();
        borrowCount.incrementAndGet();
        lastAccess = cache.ticker().read();
        return resourceUnchecked();
    }

    /**
     * Returns a borrow taken by {@link #acquire()}. Must be called on the acquiring thread; otherwise this throws
     * and the borrow stays in place, so it can still be released on the right thread.
     */
    void release() {
        if (borrowCount.decrementAndGet() < 0) {
            borrowCount.incrementAndGet();
            throw new SafeIllegalStateException("Resource released more often than acquired", key.safeArg());
        }
        try {
            lock.readLock().unlock();
        } catch (IllegalMonitorStateException e) {
            borrowCount.incrementAndGet();
            throw new SafeIllegalStateException(
                    "Resource must be released by the thread which acquired it", e, key.safeArg());
        }
    }

    /** Whether the resource is loaded and not currently borrowed, i.e. whether it may be evicted. */
    boolean isUnloadable() {
        return loaded && borrowCount.get() == 0;
    }

    /** Evicts the resource unless it is borrowed, or its lock cannot be acquired within {@code timeout}. */
    boolean tryUnload(Duration timeout) {
        if (!isUnloadable() || lock.getReadHoldCount() > 0) {
            return false;
        }
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        if (writeLock.isHeldByCurrentThread() || !tryLock(writeLock, timeout)) {
            return false;
        }
        try {
            if (!isUnloadable()) {
                return false;
            }
            unloadResource();
            log.debug("Unloaded unused resource {}", key.safeArg());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Whether the loaded resource is outdated relative to {@code index}: its own file, or the file of one of its
     * dependencies, has a greater time stamp than when it was loaded. Resources which opted out of reloading are
     * never stale.
     */
    boolean isStale(FileIndex index) {
        lock.readLock().lock();
        try {
            if (!loaded || !resourceUnchecked().shouldReloadOnFileChange()) {
                return false;
            }
            FileInfo file = index.find(key);
            if (file == null) {
                return false;
            }
            if (file.timeStamp().isAfter(timeStamp)) {
                log.info(
                        "Detected that resource {} has changed",
                        key.safeArg(),
                        SafeArg.of("oldTimeStamp", timeStamp),
                        SafeArg.of("newTimeStamp", file.timeStamp()));
                return true;
            }
            for (Dependency dependency : dependencies) {
                FileInfo dependencyFile = index.find(dependency.key());
                if (dependencyFile != null && dependencyFile.timeStamp().isAfter(dependency.timeStamp())) {
                    log.info(
                            "Detected that dependency {} of resource {} has changed",
                            SafeArg.of("dependencyKey", dependency.key().name()),
                            key.safeArg(),
                            SafeArg.of("oldTimeStamp", dependency.timeStamp()),
                            SafeArg.of("newTimeStamp", dependencyFile.timeStamp()));
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Loads a fresh copy of the resource from {@code file} and swaps it in place of the current one. Existing
     * guards keep reading the previous resource while the new one loads. The swap itself waits up to
     * {@code lockTimeout} for those guards to close.
     *
     * <p>On failure the previous resource stays in place.
     *
     * @return whether the new resource was swapped in
     */
    boolean reload(FileInfo file, Duration lockTimeout) {
        if (lock.getReadHoldCount() > 0) {
            log.warn("Not reloading resource {} as it is borrowed by the reloading thread", key.safeArg());
            return false;
        }
        log.info("Resource {} was modified, re-loading", key.safeArg());
        LoadedResource<T> fresh;
        try {
            fresh = loadFrom(file);
        } catch (RuntimeException e) {
            log.error("Resource {} was modified but re-loading failed, keeping previous version", key.safeArg(), e);
            return false;
        }

        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        if (!tryLock(writeLock, lockTimeout)) {
            log.warn(
                    "Timed out waiting for resource {} to be released, it will be re-loaded on the next refresh",
                    key.safeArg(),
                    SafeArg.of("lockTimeout", lockTimeout));
            fresh.resource().unload();
            return false;
        }
        try {
            if (!loaded) {
                // Evicted while the new version was loading.
                fresh.resource().unload();
                return false;
            }
            unloadResource();
            install(fresh);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /** Returns with the read lock held and the resource loaded, or throws with no lock held. */
    private void lockLoaded() {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        if (loaded) {
            return;
        }
        readLock.unlock();

        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        if (writeLock.isHeldByCurrentThread()) {
            throw new SafeIllegalStateException("Circular resource dependency", key.safeArg());
        }
        while (!tryLock(writeLock, LOAD_RETRY_INTERVAL)) {
            // Another thread loaded the resource in the meantime and is borrowing it.
            if (loaded && readLock.tryLock()) {
                if (loaded) {
                    return;
                }
                readLock.unlock();
            }
        }
        try {
            if (!loaded) {
                Preconditions.checkState(borrowCount.get() == 0, "Loading a borrowed resource", key.safeArg());
                install(loadFrom(cache.fileInfo(key)));
            }
            readLock.lock();
        } finally {
            writeLock.unlock();
        }
    }

    private LoadedResource<T> loadFrom(FileInfo file) {
        BackingStore store = file.store();
        // Read before the data, so a concurrent write is picked up by the next refresh.
        Instant loadedTimeStamp = fileTimeStamp(store);
        ByteBuffer data = readFile(store);

        T instance = type.create(key);
        DefaultResourceLoadingInput input = new DefaultResourceLoadingInput(key, data, cache);
        LoadResult result = instance.load(input);
        if (!result.isSuccess()) {
            String reason = result.errorReason().orElse("unknown");
            log.error(
                    "Loading resource {} failed: data error",
                    key.safeArg(),
                    type.safeArg(),
                    UnsafeArg.of("reason", reason));
            throw new ResourceDataException(key, reason);
        }
        log.debug("Loaded resource {}", key.safeArg(), SafeArg.of("store", store.name()));
        return new LoadedResource<>(instance, loadedTimeStamp, input.dependencies());
    }

    private ByteBuffer readFile(BackingStore store) {
        try {
            long size = store.fileSize(key);
            Preconditions.checkState(
                    size <= Integer.MAX_VALUE,
                    "Resource file is too large",
                    key.safeArg(),
                    SafeArg.of("size", size));
            ByteBuffer buffer = ByteBuffer.allocate((int) size);
            store.loadFile(key, buffer);
            buffer.flip();
            return buffer.asReadOnlyBuffer();
        } catch (IOException e) {
            throw new ResourceIoException(key, store.name(), e);
        }
    }

    private Instant fileTimeStamp(BackingStore store) {
        try {
            return store.fileTimeStamp(key);
        } catch (IOException e) {
            throw new ResourceIoException(key, store.name(), e);
        }
    }

    @GuardedBy("lock")
    private void install(LoadedResource<T> fresh) {
        resource = fresh.resource();
        dependencies = fresh.dependencies();
        timeStamp = fresh.timeStamp();
        typeTag = fresh.resource().typeId();
        lastAccess = cache.ticker().read();
        loaded = true;
    }

    @GuardedBy("lock")
    private void unloadResource() {
        T current = resourceUnchecked();
        loaded = false;
        resource = null;
        dependencies = ImmutableList.of();
        current.unload();
    }

    private T resourceUnchecked() {
        T current = resource;
        if (current == null) {
            throw new SafeRuntimeException("Resource is not loaded", key.safeArg());
        }
        return current;
    }

    private static boolean tryLock(Lock lock, Duration timeout) {
        try {
            return lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SafeRuntimeException("Interrupted while waiting for resource lock", e);
        }
    }

    @Override
    public String toString() {
        return "ResourceEntry{key=" + key + ", type=" + type + ", loaded=" + loaded + ", borrowCount="
                + borrowCount.get() + '}';
    }

    private static final class LoadedResource<T extends Resource> {
        private final T resource;
        private final Instant timeStamp;
        private final ImmutableList<Dependency> dependencies;

        LoadedResource(T resource, Instant timeStamp, ImmutableList<Dependency> dependencies) {
            this.resource = resource;
            this.timeStamp = timeStamp;
            this.dependencies = dependencies;
        }

        T resource() {
            return resource;
        }

        Instant timeStamp() {
            return timeStamp;
        }

        ImmutableList<Dependency> dependencies() {
            return dependencies;
        }
    }
}
