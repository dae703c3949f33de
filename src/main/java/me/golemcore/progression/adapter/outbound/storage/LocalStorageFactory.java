package me.golemcore.progression.adapter.outbound.storage;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import me.golemcore.progression.port.outbound.StorageFactory;
import me.golemcore.progression.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Creates {@link LocalStorageAdapter} instances rooted at a given directory.
 */
@Component
@Slf4j
public class LocalStorageFactory implements StorageFactory {

    @Override
    public StoragePort open(Path basePath) {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getStorage().getLocal().setBasePath(basePath.toAbsolutePath().toString());
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties);
        adapter.init();
        log.debug("[Storage] Opened isolated storage at {}", basePath);
        return adapter;
    }
}
