package me.golemcore.progression;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the progression engine.
 *
 * <p>
 * The engine ingests an append-only log of canonical gameplay events and
 * reduces it into per-user progression state (stats, gates, achievements,
 * unlock tokens). A small IF/THEN rule engine runs after every ingestion
 * batch, a static place-graph runtime produces map events, and a replay
 * harness proves that the log alone determines the resulting state.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → CommandRouter
 * Domain Layer       → ProgressionService, StateReducer, RuleEngine, MapRuntimeService
 * Infrastructure     → LocalStorageAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code progression.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ProgressionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProgressionApplication.class, args);
    }

}
