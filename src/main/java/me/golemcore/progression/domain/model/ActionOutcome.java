package me.golemcore.progression.domain.model;

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

/**
 * What a single rule action did.
 *
 * @param kind
 *            action variant
 * @param target
 *            action target id
 * @param applied
 *            whether state changed
 * @param detail
 *            short machine-readable status, e.g. {@code granted},
 *            {@code already_granted}, {@code blocked:xp>=100}
 */
public record ActionOutcome(RuleAction.Kind kind, String target, boolean applied, String detail) {
}
