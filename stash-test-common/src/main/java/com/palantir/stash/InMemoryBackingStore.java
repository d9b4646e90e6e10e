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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Backing store whose files live in memory, so tests can change them between refreshes. Counts reads and listings.
 */
@ThreadSafe
public final class InMemoryBackingStore implements BackingStore {

    private final String name;
    private final Map<ResourceKey, StoredFile> files = new ConcurrentHashMap<>();
    private final AtomicInteger listCount = new AtomicInteger();
    private final AtomicInteger loadCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();

    @Nullable
    private volatile IOException failure;

    @Nullable
    private volatile Consumer<ResourceKey> afterLoad;

    public InMemoryBackingStore(String name) {
        this.name = name;
    }

    @CanIgnoreReturnValue
    public InMemoryBackingStore put(String key, String content, Instant timeStamp) {
        return put(key, content.getBytes(StandardCharsets.UTF_8), timeStamp);
    }

    @CanIgnoreReturnValue
    public InMemoryBackingStore put(String key, byte[] content, Instant timeStamp) {
        files.put(ResourceKey.of(key), new StoredFile(content.clone(), timeStamp));
        return this;
    }

    /** Puts a file whose time stamp is the given number of seconds after the epoch. */
    @CanIgnoreReturnValue
    public InMemoryBackingStore put(String key, String content, long epochSecond) {
        return put(key, content, Instant.ofEpochSecond(epochSecond));
    }

    @CanIgnoreReturnValue
    public InMemoryBackingStore remove(String key) {
        files.remove(ResourceKey.of(key));
        return this;
    }

    /** Makes every subsequent call of this store fail with {@code value}, or succeed again if {@code null}. */
    public void failWith(@Nullable IOException value) {
        this.failure = value;
    }

    /** Runs {@code hook} after each file has been copied out of this store, or nothing if {@code null}. */
    public void afterLoad(@Nullable Consumer<ResourceKey> hook) {
        this.afterLoad = hook;
    }

    public int listCount() {
        return listCount.get();
    }

    public int loadCount() {
        return loadCount.get();
    }

    public int closeCount() {
        return closeCount.get();
    }

    @Override
    public List<FileRecord> availableFiles() throws IOException {
        checkFailure();
        listCount.incrementAndGet();
        return files.entrySet().stream()
                .map(entry -> FileRecord.of(entry.getKey(), entry.getValue().timeStamp))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public boolean fileExists(ResourceKey key) throws IOException {
        checkFailure();
        return files.containsKey(key);
    }

    @Override
    public long fileSize(ResourceKey key) throws IOException {
        return file(key).content.length;
    }

    @Override
    public Instant fileTimeStamp(ResourceKey key) throws IOException {
        return file(key).timeStamp;
    }

    @Override
    public void loadFile(ResourceKey key, ByteBuffer target) throws IOException {
        StoredFile file = file(key);
        if (target.remaining() < file.content.length) {
            throw new IOException("Buffer too small for " + key);
        }
        loadCount.incrementAndGet();
        target.put(file.content);
        Consumer<ResourceKey> hook = afterLoad;
        if (hook != null) {
            hook.accept(key);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() throws IOException {
        closeCount.incrementAndGet();
        checkFailure();
    }

    private StoredFile file(ResourceKey key) throws IOException {
        checkFailure();
        StoredFile file = files.get(key);
        if (file == null) {
            throw new IOException("No such file: " + key);
        }
        return file;
    }

    private void checkFailure() throws IOException {
        IOException current = failure;
        if (current != null) {
            throw current;
        }
    }

    @Override
    public String toString() {
        return "InMemoryBackingStore{name=" + name + ", numFiles=" + files.size() + '}';
    }

    private static final class StoredFile {
        private final byte[] content;
        private final Instant timeStamp;

        StoredFile(byte[] content, Instant timeStamp) {
            this.content = content;
            this.timeStamp = timeStamp;
        }
    }
}
