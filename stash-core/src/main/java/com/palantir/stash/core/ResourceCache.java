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

import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.MustBeClosed;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.stash.BackingStore;
import com.palantir.stash.CapacityExhaustedException;
import com.palantir.stash.FileChangedEvent;
import com.palantir.stash.Resource;
import com.palantir.stash.ResourceAccessGuard;
import com.palantir.stash.ResourceHandle;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceNotFoundException;
import com.palantir.stash.ResourceReloadCallback;
import com.palantir.stash.ResourceType;
import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * In-memory cache of resources loaded from a set of {@link BackingStore backing stores}, e.g. directories and
 * zip archives.
 *
 * <p>When a resource is requested the cache checks whether it is already loaded. If not, it reads the file from
 * whichever store has the most recent version of it and loads it using the resource type's
 * {@link Resource#load} implementation. Resources stay loaded until evicted by {@link #unloadUnused}, which only
 * ever evicts resources that are not borrowed by an open {@link ResourceAccessGuard}.
 *
 * <p>The cache keeps an index of the files available in its stores, so it knows where to load from without
 * touching the file system. The index is only updated by {@link #refresh()}, which should be called when the
 * contents of the stores may have changed, e.g. when the application window regains focus. Refreshing also
 * hot-reloads any loaded resources whose files have changed.
 *
 * <p>Usage example:
 *
 * <pre>
 * ResourceCache cache = ResourceCache.of(new DirectoryBackingStore(Paths.get("data")));
 * try (ResourceAccessGuard&lt;TextResource&gt; text = cache.access(ResourceKey.of("hello.txt"), TextResource.TYPE)) {
 *     System.out.println(text.get().text());
 * }
 * </pre>
 */
@ThreadSafe
public final class ResourceCache implements Closeable {
    private static final SafeLogger log = SafeLoggerFactory.get(ResourceCache.class);

    private final ResourceCacheConfig config;

    // Guards reads of the index against replacement by refresh(). Never held while a resource loads.
    private final ReadWriteLock indexLock = new ReentrantReadWriteLock();

    @GuardedBy("indexLock")
    private FileIndex index = FileIndex.empty();

    // Only guards creation of entries. Held separately from indexLock and never held while a resource loads,
    // as loading a resource may request its dependencies from this cache, which would then deadlock.
    private final Object entryCreationLock = new Object();

    private final ConcurrentMap<ResourceKey, ResourceEntry<?>> entries = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, ResourceReloadCallback> reloadCallbacks = new ConcurrentHashMap<>();

    private final Object refreshLock = new Object();

    private ResourceCache(ResourceCacheConfig config) {
        this.config = config;
    }

    /** Creates a cache over the stores of the given configuration, and builds its initial file index. */
    public static ResourceCache create(ResourceCacheConfig config) {
        ResourceCache cache = new ResourceCache(config);
        cache.refresh();
        return cache;
    }

    /** Creates a cache with default configuration over the given stores. */
    public static ResourceCache of(BackingStore... stores) {
        return create(ResourceCacheConfig.builder().stores(Arrays.asList(stores)).build());
    }

    public List<BackingStore> backingStores() {
        return config.stores();
    }

    /**
     * Rebuilds the file index from the current contents of the backing stores, then re-loads every loaded
     * resource whose file, or a dependency's file, has changed since it was loaded. Resources are re-loaded in
     * place: existing handles stay valid and observe the new version. If re-loading fails, the previous version is
     * kept, and resources depending on it are left for the next refresh. After each successful re-load the reload
     * callback registered for the resource's type, if any, is invoked.
     *
     * @return the number of resources which were re-loaded
     */
    @CanIgnoreReturnValue
    public int refresh() {
        synchronized (refreshLock) {
            FileIndex newIndex = FileIndex.build(config.stores());
            indexLock.writeLock().lock();
            try {
                index = newIndex;
            } finally {
                indexLock.writeLock().unlock();
            }
            log.debug("Rebuilt file index", SafeArg.of("numFiles", newIndex.size()));

            List<ResourceEntry<?>> stale = entries.values().stream()
                    .filter(entry -> entry.isStale(newIndex))
                    .collect(ImmutableList.toImmutableList());
            int reloaded = 0;
            Set<ResourceKey> failed = new HashSet<>();
            for (ResourceEntry<?> entry : ReloadOrder.dependenciesFirst(stale)) {
                if (entry.dependencyKeys().stream().anyMatch(failed::contains)) {
                    log.info("Not re-loading resource {} as a dependency failed to re-load", entry.key().safeArg());
                    failed.add(entry.key());
                    continue;
                }
                FileInfo file = Preconditions.checkNotNull(newIndex.find(entry.key()), "file of stale resource");
                if (entry.reload(file, config.reloadLockTimeout())) {
                    reloaded++;
                    notifyReloaded(entry);
                } else {
                    failed.add(entry.key());
                }
            }
            return reloaded;
        }
    }

    /**
     * Returns a handle to the resource with the given key, loading the resource first.
     *
     * @throws ResourceNotFoundException if no backing store contains the file
     */
    public <T extends Resource> ResourceHandle<T> resourceHandle(ResourceKey key, ResourceType<T> type) {
        return resourceHandle(key, type, true);
    }

    /**
     * Returns a handle to the resource with the given key.
     *
     * @param loadImmediately whether to load the resource before returning, rather than on first access
     * @throws ResourceNotFoundException if no backing store contains the file
     */
    public <T extends Resource> ResourceHandle<T> resourceHandle(
            ResourceKey key, ResourceType<T> type, boolean loadImmediately) {
        ResourceEntry<T> entry;
        indexLock.readLock().lock();
        try {
            FileInfo file = index.find(key);
            if (file == null) {
                throw resourceNotFound(key);
            }
            entry = getOrCreateEntry(file, type);
        } finally {
            indexLock.readLock().unlock();
        }

        DefaultResourceHandle<T> handle = new DefaultResourceHandle<>(entry);
        if (loadImmediately) {
            try (ResourceAccessGuard<T> guard = handle.access()) {
                log.debug("Loaded resource eagerly", guard.key().safeArg());
            }
        }
        return handle;
    }

    /**
     * Borrows the resource with the given key, loading it if necessary. The resource stays loaded until the
     * returned guard is closed.
     *
     * @throws ResourceNotFoundException if no backing store contains the file
     * @throws com.palantir.stash.ResourceDataException if the resource rejected the file's data
     */
    @MustBeClosed
    public <T extends Resource> ResourceAccessGuard<T> access(ResourceKey key, ResourceType<T> type) {
        return resourceHandle(key, type, false).access();
    }

    /** Whether the file exists in the index, as of the most recent {@link #refresh()}. */
    public boolean fileExists(ResourceKey key) {
        indexLock.readLock().lock();
        try {
            return index.find(key) != null;
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /**
     * Returns the time stamp of the freshest version of the file, as of the most recent {@link #refresh()}.
     *
     * @throws ResourceNotFoundException if the file is not in the index
     */
    public Instant fileTimeStamp(ResourceKey key) {
        return fileInfo(key).timeStamp();
    }

    /** Whether the resource with the given key is currently loaded in this cache. */
    public boolean isCached(ResourceKey key) {
        indexLock.readLock().lock();
        try {
            if (index.find(key) == null) {
                return false;
            }
        } finally {
            indexLock.readLock().unlock();
        }
        ResourceEntry<?> entry = entries.get(key);
        return entry != null && entry.isLoaded();
    }

    /** Unloads the least recently used resource which is not currently borrowed. */
    @CanIgnoreReturnValue
    public boolean unloadUnused() {
        return unloadUnused(false);
    }

    /**
     * Unloads the least recently used resource which is not currently borrowed, or every such resource if
     * {@code unloadAll} is set. Resources last accessed at the same time are unloaded in key order.
     *
     * @return whether any resource was unloaded
     */
    @CanIgnoreReturnValue
    public boolean unloadUnused(boolean unloadAll) {
        List<ResourceEntry<?>> candidates = entries.values().stream()
                .filter(ResourceEntry::isUnloadable)
                .sorted(Comparator.<ResourceEntry<?>>comparingLong(ResourceEntry::lastAccess)
                        .thenComparing(ResourceEntry::key))
                .collect(ImmutableList.toImmutableList());

        if (unloadAll) {
            int unloaded = 0;
            for (ResourceEntry<?> entry : candidates) {
                if (entry.tryUnload(config.unloadLockTimeout())) {
                    unloaded++;
                }
            }
            log.debug("Unloaded all unused resources", SafeArg.of("numUnloaded", unloaded));
            return unloaded > 0;
        }

        for (ResourceEntry<?> entry : candidates) {
            if (entry.tryUnload(config.unloadLockTimeout())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs {@code operation}, evicting unused resources and retrying whenever it fails with
     * {@link CapacityExhaustedException}. Once nothing more can be evicted, the failure propagates.
     */
    public <T> T retryOnExhaustion(Supplier<T> operation) {
        while (true) {
            try {
                return operation.get();
            } catch (CapacityExhaustedException e) {
                if (!unloadUnused()) {
                    throw e;
                }
                log.debug("Capacity exhausted, unloaded an unused resource and retrying", e);
            }
        }
    }

    /**
     * Registers the callback invoked after a resource with the given {@link Resource#typeId()} has been
     * hot-reloaded, replacing any previously registered callback for that type.
     */
    public void setResourceReloadCallback(String typeId, ResourceReloadCallback callback) {
        Preconditions.checkNotNull(callback, "callback");
        reloadCallbacks.put(Preconditions.checkNotNull(typeId, "typeId"), callback);
    }

    public void removeResourceReloadCallback(String typeId) {
        reloadCallbacks.remove(typeId);
    }

    /** Closes all backing stores. Handles and guards of this cache must not be used afterwards. */
    @Override
    public void close() {
        for (BackingStore store : config.stores()) {
            try {
                log.debug("Closing backing store {}", SafeArg.of("store", store.name()));
                store.close();
            } catch (IOException | RuntimeException e) {
                log.warn(
                        "Failed to close backing store, resources may be leaked",
                        SafeArg.of("store", store.name()),
                        e);
            }
        }
    }

    /**
     * Returns the index record of the file.
     *
     * @throws ResourceNotFoundException if the file is not in the index
     */
    FileInfo fileInfo(ResourceKey key) {
        indexLock.readLock().lock();
        try {
            FileInfo file = index.find(key);
            if (file == null) {
                throw resourceNotFound(key);
            }
            return file;
        } finally {
            indexLock.readLock().unlock();
        }
    }

    Ticker ticker() {
        return config.ticker();
    }

    @VisibleForTesting
    FileIndex index() {
        indexLock.readLock().lock();
        try {
            return index;
        } finally {
            indexLock.readLock().unlock();
        }
    }

    @VisibleForTesting
    int numEntries() {
        return entries.size();
    }

    @VisibleForTesting
    @Nullable
    ResourceEntry<?> entry(ResourceKey key) {
        return entries.get(key);
    }

    // Entries are permanent, so the lock is only needed the first time a key is requested.
    @SuppressWarnings("unchecked")
    private <T extends Resource> ResourceEntry<T> getOrCreateEntry(FileInfo file, ResourceType<T> type) {
        ResourceEntry<?> entry = entries.get(file.key());
        if (entry == null) {
            synchronized (entryCreationLock) {
                // Check again, another thread may have created the entry while this one waited for the lock.
                entry = entries.get(file.key());
                if (entry == null) {
                    entry = new ResourceEntry<>(file.key(), type, file.timeStamp(), this);
                    entries.put(file.key(), entry);
                }
            }
        }
        if (!entry.type().equals(type)) {
            throw new SafeIllegalStateException(
                    "Resource requested as a different type than it was first requested as",
                    file.key().safeArg(),
                    SafeArg.of("requestedType", type.resourceClass().getSimpleName()),
                    SafeArg.of("existingType", entry.type().resourceClass().getSimpleName()));
        }
        return (ResourceEntry<T>) entry;
    }

    private <T extends Resource> void notifyReloaded(ResourceEntry<T> entry) {
        String typeTag = entry.typeTag().orElseThrow();
        ResourceReloadCallback callback = reloadCallbacks.get(typeTag);
        if (callback == null) {
            return;
        }
        FileChangedEvent event = FileChangedEvent.of(new DefaultResourceHandle<>(entry), typeTag, entry.timeStamp());
        try {
            callback.onResourceReloaded(event);
        } catch (RuntimeException e) {
            log.error(
                    "Resource reload callback failed for resource {}",
                    entry.key().safeArg(),
                    SafeArg.of("resourceType", typeTag),
                    e);
        }
    }

    private ResourceNotFoundException resourceNotFound(ResourceKey key) {
        List<String> searched =
                config.stores().stream().map(BackingStore::name).collect(ImmutableList.toImmutableList());
        log.debug("Resource not found", key.safeArg(), SafeArg.of("searchedStores", searched));
        return new ResourceNotFoundException(key, searched);
    }

    @Override
    public String toString() {
        return "ResourceCache{stores=" + config.stores() + ", numEntries=" + entries.size() + '}';
    }
}
