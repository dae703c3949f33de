package me.golemcore.progression.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the progression engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code progression.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link EventsProperties} - canonical event log location</li>
 * <li>{@link EngineProperties} - ingestion batch sizing</li>
 * <li>{@link ReplayProperties} - replay harness batch sizing</li>
 * <li>{@link MapProperties} - place seed location</li>
 * <li>{@link AdapterContractProperties} - untrusted-lane payload contract</li>
 * <li>{@link LensProperties} - world lens feature flag and slice</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "progression")
@Data
public class ProgressionProperties {

    private StorageProperties storage = new StorageProperties();
    private EventsProperties events = new EventsProperties();
    private EngineProperties engine = new EngineProperties();
    private ReplayProperties replay = new ReplayProperties();
    private MapProperties map = new MapProperties();
    private AdapterContractProperties adapterContract = new AdapterContractProperties();
    private LensProperties lens = new LensProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/progression";
    }

    @Data
    public static class EventsProperties {
        private String directory = "events";
        private String file = "gameplay_events.ndjson";
    }

    @Data
    public static class EngineProperties {
        private int maxEventsPerTick = 128;
        private int readChunkBytes = 65536;
    }

    @Data
    public static class ReplayProperties {
        private int maxEventsPerTick = 1024;
    }

    @Data
    public static class MapProperties {
        private String seedLocation = "classpath:spatial/locations-seed.default.json";
    }

    @Data
    public static class AdapterContractProperties {
        private String location = "classpath:contracts/adapter-event-contract.json";
    }

    @Data
    public static class LensProperties {
        private String version = "1.3.22";
        private FeatureFlagProperties featureFlag = new FeatureFlagProperties();
        private SliceProperties slice = new SliceProperties();
        private Map<String, String> contracts = new LinkedHashMap<>(Map.of(
                "locid", "v1.3.18",
                "seed-depth", "v1.3.19",
                "world-adapter", "v1.3.21"));
    }

    @Data
    public static class FeatureFlagProperties {
        private String envVar = "UDOS_3D_WORLD_LENS_ENABLED";
        private boolean defaultEnabled = false;
    }

    @Data
    public static class SliceProperties {
        private String id = "earth_subterra_slice";
        private String title = "Earth Subterra Slice";
        private String entryPlaceId = "subterra-relay";
        private List<String> allowedPlaceIds = new ArrayList<>(
                List.of("andes-pass", "lunar-gateway", "subterra-relay"));
        private String anchorPrefix = "EARTH:";
    }
}
