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

/**
 * Hook invoked after a resource of the type it was registered for has been hot-reloaded. Typically used to
 * rebuild data derived from the resource, such as GPU buffers.
 *
 * <p>Exceptions thrown by callbacks are logged and otherwise ignored.
 */
@FunctionalInterface
public interface ResourceReloadCallback {

    void onResourceReloaded(FileChangedEvent event);
}
