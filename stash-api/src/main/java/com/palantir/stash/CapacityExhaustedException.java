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

import com.google.errorprone.annotations.CompileTimeConstant;
import com.palantir.logsafe.Arg;
import java.util.Arrays;

/**
 * Thrown by allocators of resource-derived data (e.g. a GPU buffer pool) when they have run out of space. Callers
 * typically recover by evicting unused resources and retrying, see {@code ResourceCache#retryOnExhaustion}.
 */
public final class CapacityExhaustedException extends ResourceException {

    public CapacityExhaustedException(@CompileTimeConstant String message, Arg<?>... args) {
        super(message, Arrays.asList(args), null);
    }
}
