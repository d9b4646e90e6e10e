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

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.util.function.Function;

/**
 * Describes a kind of {@link Resource}: its class, and how to construct an unloaded instance for a key.
 *
 * <p>Usage example: <pre>ResourceType.of(TextResource.class, TextResource::new)</pre>.
 *
 * <p>Two descriptors are equal when they describe the same class. A key may only ever be requested as one type.
 */
public final class ResourceType<T extends Resource> {

    private final Class<T> resourceClass;
    private final Function<ResourceKey, T> factory;

    private ResourceType(Class<T> resourceClass, Function<ResourceKey, T> factory) {
        this.resourceClass = resourceClass;
        this.factory = factory;
    }

    public static <T extends Resource> ResourceType<T> of(Class<T> resourceClass, Function<ResourceKey, T> factory) {
        return new ResourceType<>(
                Preconditions.checkNotNull(resourceClass, "resourceClass"),
                Preconditions.checkNotNull(factory, "factory"));
    }

    public Class<T> resourceClass() {
        return resourceClass;
    }

    /** Constructs a new, not yet loaded, resource for the given key. */
    public T create(ResourceKey key) {
        T resource = factory.apply(key);
        Preconditions.checkState(
                resourceClass.isInstance(resource),
                "Resource factory produced an instance of the wrong class",
                SafeArg.of("expected", resourceClass.getName()),
                SafeArg.of("actual", resource == null ? "null" : resource.getClass().getName()));
        return resource;
    }

    public SafeArg<String> safeArg() {
        return SafeArg.of("resourceType", resourceClass.getSimpleName());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return resourceClass.equals(((ResourceType<?>) other).resourceClass);
    }

    @Override
    public int hashCode() {
        return resourceClass.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceType{" + resourceClass.getSimpleName() + '}';
    }
}
