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
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.stash.BackingStore;
import com.palantir.stash.FileRecord;
import com.palantir.stash.ResourceIoException;
import com.palantir.stash.ResourceKey;
import java.io.IOException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Merged view of the files available across all backing stores of a cache. For each key it records the store
 * with the greatest time stamp.
 *
 * <p>Files are kept sorted by {@link ResourceKey} order (hash first), so lookups are binary searches.
 */
@Immutable
final class FileIndex {
    private static final SafeLogger log = SafeLoggerFactory.get(FileIndex.class);

    private static final FileIndex EMPTY = new FileIndex(ImmutableList.of());

    private final ImmutableList<FileInfo> files;

    private FileIndex(ImmutableList<FileInfo> files) {
        this.files = files;
    }

    static FileIndex empty() {
        return EMPTY;
    }

    /** Lists every store and merges the results. Stores earlier in the list win time stamp ties. */
    static FileIndex build(List<BackingStore> stores) {
        Map<ResourceKey, FileInfo> merged = new HashMap<>();
        for (BackingStore store : stores) {
            log.debug("Refreshing file list for store {}", SafeArg.of("store", store.name()));
            for (FileRecord record : availableFiles(store)) {
                merged.merge(record.key(), FileInfo.of(record.key(), record.timeStamp(), store), FileIndex::fresher);
            }
        }
        return new FileIndex(merged.values().stream()
                .sorted(Comparator.comparing(FileInfo::key))
                .collect(ImmutableList.toImmutableList()));
    }

    @Nullable
    FileInfo find(ResourceKey key) {
        int low = 0;
        int high = files.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            FileInfo file = files.get(mid);
            int cmp = file.key().compareTo(key);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return file;
            }
        }
        return null;
    }

    ImmutableList<FileInfo> files() {
        return files;
    }

    int size() {
        return files.size();
    }

    private static FileInfo fresher(FileInfo existing, FileInfo candidate) {
        return candidate.timeStamp().isAfter(existing.timeStamp()) ? candidate : existing;
    }

    private static List<FileRecord> availableFiles(BackingStore store) {
        try {
            return store.availableFiles();
        } catch (IOException e) {
            throw new ResourceIoException(store.name(), e);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof FileIndex && files.equals(((FileIndex) other).files);
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return "FileIndex{files=" + files + '}';
    }
}
