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
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.SuccessorsFunction;
import com.google.common.graph.Traverser;
import com.palantir.stash.ResourceKey;
import java.util.Collection;
import java.util.Comparator;
import java.util.function.Function;

/**
 * Orders entries which are due for a hot reload so that dependencies are re-loaded before the resources which
 * depend on them. Otherwise a dependent would pick up the outdated version of its dependency.
 */
final class ReloadOrder {

    static ImmutableList<ResourceEntry<?>> dependenciesFirst(Collection<ResourceEntry<?>> stale) {
        ImmutableMap<ResourceKey, ResourceEntry<?>> byKey = stale.stream()
                .sorted(Comparator.comparing(ResourceEntry::key))
                .collect(ImmutableMap.toImmutableMap(ResourceEntry::key, Function.identity()));

        // Only edges between stale entries matter, the other dependencies are not re-loaded.
        SuccessorsFunction<ResourceKey> staleDependencies = key -> byKey.get(key).dependencyKeys().stream()
                .filter(byKey::containsKey)
                .collect(ImmutableList.toImmutableList());

        return ImmutableList.copyOf(Traverser.forGraph(staleDependencies).depthFirstPostOrder(byKey.keySet()))
                .stream()
                .map(byKey::get)
                .collect(ImmutableList.toImmutableList());
    }

    private ReloadOrder() {}
}
