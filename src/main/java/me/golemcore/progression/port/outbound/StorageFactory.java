package me.golemcore.progression.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.nio.file.Path;

/**
 * Opens storage rooted at an arbitrary workspace directory. Used to run an
 * engine in isolation, e.g. for deterministic replay.
 */
public interface StorageFactory {

    /**
     * Open (and initialize) storage rooted at {@code basePath}.
     */
    StoragePort open(Path basePath);
}
