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


package com.palantir.stash.stores;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.stash.BackingStore;
import com.palantir.stash.FileRecord;
import com.palantir.stash.ResourceKey;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Serves the files of a zip archive. Keys are the entry names of the archive; directory entries are skipped.
 *
 * <p>The archive is opened on first use and kept open until {@link #close()}. A closed store re-opens the archive
 * when it is used again, which picks up a replaced archive file.
 */
@ThreadSafe
public final class ZipBackingStore implements BackingStore {
    private static final SafeLogger log = SafeLoggerFactory.get(ZipBackingStore.class);

    private final Path archive;

    @Nullable
    @GuardedBy("this")
    private ZipFile zipFile;

    public ZipBackingStore(Path archive) {
        this.archive = Preconditions.checkNotNull(archive, "archive").toAbsolutePath().normalize();
    }

    public Path archive() {
        return archive;
    }

    @Override
    public synchronized List<FileRecord> availableFiles() throws IOException {
        return openArchive().stream()
                .filter(entry -> !entry.isDirectory())
                .map(entry -> FileRecord.of(entry.getName(), lastModified(entry)))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public synchronized boolean fileExists(ResourceKey key) throws IOException {
        ZipEntry entry = openArchive().getEntry(key.name());
        return entry != null && !entry.isDirectory();
    }

    @Override
    public synchronized long fileSize(ResourceKey key) throws IOException {
        long size = existingEntry(key).getSize();
        if (size < 0) {
            throw new IOException("Size of " + key + " is not recorded in archive " + archive);
        }
        return size;
    }

    @Override
    public synchronized Instant fileTimeStamp(ResourceKey key) throws IOException {
        return lastModified(existingEntry(key));
    }

    @Override
    public synchronized void loadFile(ResourceKey key, ByteBuffer target) throws IOException {
        ZipEntry entry = existingEntry(key);
        log.debug("Loading file {} from archive {}", key.safeArg(), SafeArg.of("archive", name()));
        byte[] bytes;
        try (InputStream in = openArchive().getInputStream(entry)) {
            bytes = ByteStreams.toByteArray(in);
        }
        if (target.remaining() < bytes.length) {
            throw new IOException("Buffer of " + target.remaining() + " bytes is too small for file " + key + " of "
                    + bytes.length + " bytes");
        }
        target.put(bytes);
    }

    @Override
    public String name() {
        return archive.toString();
    }

    @Override
    public synchronized void close() throws IOException {
        ZipFile current = zipFile;
        zipFile = null;
        if (current != null) {
            log.debug("Closing archive {}", SafeArg.of("archive", name()));
            current.close();
        }
    }

    @GuardedBy("this")
    private ZipFile openArchive() throws IOException {
        ZipFile current = zipFile;
        if (current == null) {
            log.debug("Opening archive {}", SafeArg.of("archive", name()));
            current = new ZipFile(archive.toFile());
            zipFile = current;
        }
        return current;
    }

    @GuardedBy("this")
    private ZipEntry existingEntry(ResourceKey key) throws IOException {
        ZipEntry entry = openArchive().getEntry(key.name());
        if (entry == null || entry.isDirectory()) {
            throw new NoSuchFileException(key.name(), archive.toString(), "No such entry in archive");
        }
        return entry;
    }

    private static Instant lastModified(ZipEntry entry) {
        FileTime time = entry.getLastModifiedTime();
        return time == null ? Instant.EPOCH : time.toInstant();
    }

    @Override
    public String toString() {
        return "ZipBackingStore{archive=" + archive + '}';
    }
}
