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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.domain.service.AdapterEventContract;
import me.golemcore.progression.domain.service.PlaceGraphLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/**
 * Spring configuration for shared infrastructure beans: the clock, the JSON
 * mapper used for every persisted document, the read-only place graph loaded
 * once from the configured seed, and the adapter event contract.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ProgressionProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public PlaceGraph placeGraph(PlaceGraphLoader placeGraphLoader) {
        return placeGraphLoader.load(properties.getMap().getSeedLocation());
    }

    @Bean
    public AdapterEventContract adapterEventContract(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return AdapterEventContract.load(objectMapper,
                resourceLoader.getResource(properties.getAdapterContract().getLocation()));
    }

    @PostConstruct
    public void init() {
        log.info("Progression engine starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Event log: {}/{}", properties.getEvents().getDirectory(), properties.getEvents().getFile());
        log.info("Max events per tick: {}", properties.getEngine().getMaxEventsPerTick());
    }
}
