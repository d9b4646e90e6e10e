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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.palantir.stash.BackingStore;
import com.palantir.stash.FileRecord;
import com.palantir.stash.ResourceIoException;
import com.palantir.stash.ResourceKey;
import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
final class FileIndexTest {

    private static final Instant T1 = Instant.ofEpochSecond(1);
    private static final Instant T2 = Instant.ofEpochSecond(2);

    @Mock
    private BackingStore first;

    @Mock
    private BackingStore second;

    @BeforeEach
    void before() {
        lenient().when(first.name()).thenReturn("first");
    }

    @Test
    void testEmpty() {
        assertThat(FileIndex.empty().size()).isZero();
        assertThat(FileIndex.empty().find(ResourceKey.of("a"))).isNull();
    }

    @Test
    void testMergesStoresByFreshestTimeStamp() throws IOException {
        when(second.name()).thenReturn("second");
        when(first.availableFiles()).thenReturn(ImmutableList.of(
                FileRecord.of("shared", T1), FileRecord.of("tie", T1), FileRecord.of("only-first", T2)));
        when(second.availableFiles()).thenReturn(ImmutableList.of(
                FileRecord.of("shared", T2), FileRecord.of("tie", T1), FileRecord.of("only-second", T1)));

        FileIndex index = FileIndex.build(ImmutableList.of(first, second));

        assertThat(index.size()).isEqualTo(4);
        assertThat(index.find(ResourceKey.of("shared"))).isEqualTo(FileInfo.of(ResourceKey.of("shared"), T2, second));
        assertThat(index.find(ResourceKey.of("tie"))).isEqualTo(FileInfo.of(ResourceKey.of("tie"), T1, first));
        assertThat(index.find(ResourceKey.of("only-first")).store()).isSameAs(first);
        assertThat(index.find(ResourceKey.of("only-second")).store()).isSameAs(second);
        assertThat(index.find(ResourceKey.of("absent"))).isNull();
    }

    @Test
    void testSortedByKey() throws IOException {
        ImmutableList.Builder<FileRecord> records = ImmutableList.builder();
        for (int i = 0; i < 100; i++) {
            records.add(FileRecord.of("file-" + i, T1));
        }
        when(first.availableFiles()).thenReturn(records.build());

        FileIndex index = FileIndex.build(ImmutableList.of(first));

        assertThat(index.files()).extracting(FileInfo::key).isSorted();
        for (int i = 0; i < 100; i++) {
            assertThat(index.find(ResourceKey.of("file-" + i))).isNotNull();
        }
    }

    @Test
    void testRebuildingUnchangedStoresGivesEqualIndex() throws IOException {
        when(first.availableFiles()).thenReturn(ImmutableList.of(FileRecord.of("a", T1), FileRecord.of("b", T2)));

        assertThat(FileIndex.build(ImmutableList.of(first))).isEqualTo(FileIndex.build(ImmutableList.of(first)));
    }

    @Test
    void testListingFailure() throws IOException {
        IOException failure = new IOException("permission denied");
        when(first.availableFiles()).thenThrow(failure);

        assertThatThrownBy(() -> FileIndex.build(ImmutableList.of(first)))
                .isInstanceOf(ResourceIoException.class)
                .hasCause(failure);
    }
}
