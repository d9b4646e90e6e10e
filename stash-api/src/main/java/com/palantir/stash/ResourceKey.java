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

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import com.google.errorprone.annotations.Immutable;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.nio.charset.StandardCharsets;

/**
 * Path-like identifier of a resource, e.g. {@code meshes/box.mesh}.
 *
 * <p>Keys carry a 32-bit FNV-1a hash of their name. Hash collisions are handled: two keys are only equal when
 * their names are equal, and ordering falls back to the name when hashes match. Keys are interned, so
 * {@code ResourceKey.of("a") == ResourceKey.of("a")} normally holds, but callers must still use
 * {@link #equals(Object)}.
 */
@Immutable
public final class ResourceKey implements Comparable<ResourceKey> {

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private static final Interner<ResourceKey> interner = Interners.newWeakInterner();

    private final String name;
    private final int hash;

    private ResourceKey(String name) {
        this.name = name;
        this.hash = fnv1a(name);
    }

    public static ResourceKey of(String name) {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkArgument(!name.isEmpty(), "Resource keys must not be empty");
        return interner.intern(new ResourceKey(name));
    }

    /** Hashes the UTF-8 encoding of the given string using 32-bit FNV-1a. */
    public static int fnv1a(String value) {
        int result = FNV_OFFSET_BASIS;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            result ^= b & 0xFF;
            result *= FNV_PRIME;
        }
        return result;
    }

    public String name() {
        return name;
    }

    /** Returns the FNV-1a hash of {@link #name()}. */
    public int hash() {
        return hash;
    }

    public SafeArg<String> safeArg() {
        return SafeArg.of("resourceKey", name);
    }

    @Override
    public int compareTo(ResourceKey other) {
        int byHash = Integer.compareUnsigned(hash, other.hash);
        return byHash != 0 ? byHash : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        ResourceKey that = (ResourceKey) other;
        return hash == that.hash && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return name;
    }
}
