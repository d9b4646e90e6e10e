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
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.stash.BackingStore;
import com.palantir.stash.FileRecord;
import com.palantir.stash.ResourceKey;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Serves the files below a directory. Keys are paths relative to the directory, using {@code /} as separator on
 * every platform. Symbolic links are followed.
 */
@ThreadSafe
public final class DirectoryBackingStore implements BackingStore {
    private static final SafeLogger log = SafeLoggerFactory.get(DirectoryBackingStore.class);

    private final Path root;

    public DirectoryBackingStore(Path root) {
        this.root = Preconditions.checkNotNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public List<FileRecord> availableFiles() throws IOException {
        try (Stream<Path> paths = Files.walk(root, FileVisitOption.FOLLOW_LINKS)) {
            ImmutableList.Builder<FileRecord> files = ImmutableList.builder();
            for (Path path : (Iterable<Path>) paths::iterator) {
                if (Files.isRegularFile(path)) {
                    files.add(FileRecord.of(keyOf(path), lastModified(path)));
                }
            }
            return files.build();
        }
    }

    @Override
    public boolean fileExists(ResourceKey key) throws IOException {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public long fileSize(ResourceKey key) throws IOException {
        return Files.size(existingFile(key));
    }

    @Override
    public Instant fileTimeStamp(ResourceKey key) throws IOException {
        return lastModified(existingFile(key));
    }

    @Override
    public void loadFile(ResourceKey key, ByteBuffer target) throws IOException {
        Path path = existingFile(key);
        log.debug("Loading file {} from directory {}", key.safeArg(), SafeArg.of("directory", name()));
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (target.remaining() < size) {
                throw new IOException("Buffer of " + target.remaining() + " bytes is too small for file " + key
                        + " of " + size + " bytes");
            }
            int read;
            do {
                read = channel.read(target);
            } while (read >= 0 && target.hasRemaining());
        }
    }

    @Override
    public String name() {
        return root.toString();
    }

    private String keyOf(Path path) {
        StringBuilder key = new StringBuilder();
        for (Path element : root.relativize(path)) {
            if (key.length() > 0) {
                key.append('/');
            }
            key.append(element);
        }
        return key.toString();
    }

    private Path existingFile(ResourceKey key) throws IOException {
        Path path = resolve(key);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        return path;
    }

    private Path resolve(ResourceKey key) throws IOException {
        Path path = root.resolve(key.name()).normalize();
        if (!path.startsWith(root)) {
            throw new IOException("Resource key points outside of the store directory: " + key);
        }
        return path;
    }

    private static Instant lastModified(Path path) throws IOException {
        return Files.getLastModifiedTime(path).toInstant();
    }

    @Override
    public String toString() {
        return "DirectoryBackingStore{root=" + root + '}';
    }
}
