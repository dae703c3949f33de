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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured result of an engine operation that may fail on bad input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationResult {

    private boolean ok;
    private String error;
    private ErrorKind errorKind;
    private Object data;

    public static OperationResult success(Object data) {
        return OperationResult.builder()
                .ok(true)
                .data(data)
                .build();
    }

    public static OperationResult failure(ErrorKind kind, String error) {
        return OperationResult.builder()
                .ok(false)
                .error(error)
                .errorKind(kind)
                .build();
    }
}
