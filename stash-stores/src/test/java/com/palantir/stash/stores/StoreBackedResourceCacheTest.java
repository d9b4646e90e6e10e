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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.palantir.stash.ResourceAccessGuard;
import com.palantir.stash.ResourceKey;
import com.palantir.stash.ResourceNotFoundException;
import com.palantir.stash.core.ResourceCache;
import com.palantir.stash.resources.RawResource;
import com.palantir.stash.resources.TextResource;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class StoreBackedResourceCacheTest {

    private static final ResourceKey MESH = ResourceKey.of("a.mesh");

    @TempDir
    Path dir;

    @Test
    void testAccessFromDirectory() throws IOException {
        write(dir.resolve("a.mesh"), "mesh data", Instant.ofEpochSecond(100));

        try (ResourceCache cache = ResourceCache.of(new DirectoryBackingStore(dir))) {
            assertThat(cache.fileTimeStamp(MESH)).isEqualTo(Instant.ofEpochSecond(100));
            try (ResourceAccessGuard<TextResource> first = cache.access(MESH, TextResource.TYPE);
                    ResourceAccessGuard<TextResource> second = cache.access(MESH, TextResource.TYPE)) {
                assertThat(first.get().text()).isEqualTo("mesh data");
                assertThat(second.get()).isSameAs(first.get());
            }
            assertThatThrownBy(() -> cache.access(ResourceKey.of("missing.mesh"), TextResource.TYPE))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    void testHotReloadFromDirectory() throws IOException {
        Path file = dir.resolve("shaders/basic.vert");
        write(file, "v1", Instant.ofEpochSecond(100));

        try (ResourceCache cache = ResourceCache.of(new DirectoryBackingStore(dir))) {
            ResourceKey key = ResourceKey.of("shaders/basic.vert");
            cache.resourceHandle(key, TextResource.TYPE);

            write(file, "version 2", Instant.ofEpochSecond(200));
            assertThat(cache.refresh()).isEqualTo(1);
            try (ResourceAccessGuard<TextResource> guard = cache.access(key, TextResource.TYPE)) {
                assertThat(guard.get().text()).isEqualTo("version 2");
            }
        }
    }

    @Test
    void testDirectoryOverridesOlderArchive() throws IOException {
        Path archive = dir.resolve("base.zip");
        try (OutputStream out = Files.newOutputStream(archive);
                ZipOutputStream zip = new ZipOutputStream(out)) {
            ZipEntry entry = new ZipEntry("a.mesh");
            entry.setLastModifiedTime(FileTime.from(Instant.ofEpochSecond(100)));
            zip.putNextEntry(entry);
            zip.write(new byte[] {1, 2, 3});
            zip.closeEntry();
        }
        Path overrides = Files.createDirectories(dir.resolve("overrides"));
        ZipBackingStore zipStore = new ZipBackingStore(archive);

        try (ResourceCache cache = ResourceCache.of(zipStore, new DirectoryBackingStore(overrides))) {
            try (ResourceAccessGuard<RawResource> guard = cache.access(MESH, RawResource.TYPE)) {
                assertThat(guard.get().size()).isEqualTo(3);
            }

            write(overrides.resolve("a.mesh"), "new", Instant.ofEpochSecond(200));
            assertThat(cache.refresh()).isEqualTo(1);
            try (ResourceAccessGuard<RawResource> guard = cache.access(MESH, RawResource.TYPE)) {
                assertThat(guard.get().data()).isEqualTo(StandardCharsets.UTF_8.encode("new"));
            }
        }
    }

    private static void write(Path path, String content, Instant timeStamp) throws IOException {
        Files.createDirectories(path.getParent());
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(path, FileTime.from(timeStamp));
    }
}
