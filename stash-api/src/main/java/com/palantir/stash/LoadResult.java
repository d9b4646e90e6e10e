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
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/** Outcome of {@link Resource#load(ResourceLoadingInput)}. */
public final class LoadResult {

    private static final LoadResult SUCCESS = new LoadResult(null);

    @Nullable
    private final String errorReason;

    private LoadResult(@Nullable String errorReason) {
        this.errorReason = errorReason;
    }

    public static LoadResult success() {
        return SUCCESS;
    }

    /** The file data was malformed or failed validation. */
    public static LoadResult dataError(String reason) {
        return new LoadResult(Preconditions.checkNotNull(reason, "reason"));
    }

    public boolean isSuccess() {
        return errorReason == null;
    }

    public Optional<String> errorReason() {
        return Optional.ofNullable(errorReason);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return Objects.equals(errorReason, ((LoadResult) other).errorReason);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(errorReason);
    }

    @Override
    public String toString() {
        return isSuccess() ? "LoadResult{success}" : "LoadResult{dataError=" + errorReason + '}';
    }
}
