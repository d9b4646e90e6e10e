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

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.SafeLoggable;
import com.palantir.logsafe.exceptions.SafeExceptions;
import java.util.List;
import javax.annotation.Nullable;

/** Base type of failures surfaced by the resource cache to its callers. */
public abstract class ResourceException extends RuntimeException implements SafeLoggable {

    private final String logMessage;
    private final List<Arg<?>> args;

    ResourceException(String message, List<Arg<?>> args, @Nullable Throwable cause) {
        super(SafeExceptions.renderMessage(message, args.toArray(new Arg<?>[0])), cause);
        this.logMessage = message;
        this.args = ImmutableList.copyOf(args);
    }

    @Override
    public final String getLogMessage() {
        return logMessage;
    }

    @Override
    public final List<Arg<?>> getArgs() {
        return args;
    }
}
