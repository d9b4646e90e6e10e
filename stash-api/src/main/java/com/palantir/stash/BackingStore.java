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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.List;

/**
 * A source of raw resource bytes, e.g. a directory tree or a zip archive.
 *
 * <p>Implementations must be safe for use from multiple threads, since resources are loaded on whichever thread
 * first accesses them.
 */
public interface BackingStore extends Closeable {

    /** Lists every file currently available in this store. */
    List<FileRecord> availableFiles() throws IOException;

    boolean fileExists(ResourceKey key) throws IOException;

    /** Returns the size of the file in bytes. */
    long fileSize(ResourceKey key) throws IOException;

    /** Returns the last-modified time of the file. */
    Instant fileTimeStamp(ResourceKey key) throws IOException;

    /**
     * Reads the whole file into {@code target}, starting at its current position. Fails if the file does not exist
     * or if {@code target} has fewer than {@link #fileSize(ResourceKey)} bytes remaining.
     */
    void loadFile(ResourceKey key, ByteBuffer target) throws IOException;

    /** Human-readable label for this store, e.g. the directory path. Intended for diagnostics only. */
    String name();

    @Override
    default void close() throws IOException {}
}
