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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.exceptions.SafeIllegalStateException;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

final class ResourceTypeTest {

    private static final ResourceKey KEY = ResourceKey.of("a.txt");

    @Test
    void testCreatesUnloadedInstances() {
        ResourceType<Plain> type = ResourceType.of(Plain.class, Plain::new);
        Plain first = type.create(KEY);
        Plain second = type.create(KEY);

        assertThat(first).isNotSameAs(second);
        assertThat(first.key()).isEqualTo(KEY);
        assertThat(type.resourceClass()).isEqualTo(Plain.class);
    }

    @Test
    void testEqualityIsByClass() {
        assertThat(ResourceType.of(Plain.class, Plain::new))
                .isEqualTo(ResourceType.of(Plain.class, key -> new Plain(key)))
                .hasToString("ResourceType{Plain}");
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testRejectsFactoryOfWrongClass() {
        ResourceType<Plain> type = ResourceType.of(Plain.class, (Function) (Function<ResourceKey, Other>) Other::new);

        assertThatLoggableExceptionThrownBy(() -> type.create(KEY))
                .isInstanceOf(SafeIllegalStateException.class)
                .hasLogMessage("Resource factory produced an instance of the wrong class");
    }

    @Test
    void testExceptionsCarrySafeArgs() {
        ResourceNotFoundException notFound = new ResourceNotFoundException(KEY, ImmutableList.of("data"));
        assertThat(notFound.getLogMessage()).isEqualTo("A requested resource file could not be found");
        assertThat(notFound.getArgs()).extracting(Arg::getName).containsExactly("resourceKey", "searchedStores");
        assertThat(notFound.getArgs()).allMatch(Arg::isSafeForLogging);
        assertThat(notFound.key()).isEqualTo(KEY);

        ResourceDataException dataError = new ResourceDataException(KEY, "truncated");
        assertThat(dataError.reason()).isEqualTo("truncated");
        assertThat(dataError.getMessage()).contains("invalid data");
    }

    static final class Plain extends BaseResource {
        Plain(ResourceKey key) {
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

    static final class Other extends BaseResource {
        Other(ResourceKey key) {
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
