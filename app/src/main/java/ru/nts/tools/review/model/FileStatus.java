/*
 * Copyright 2025 Aristo
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
package ru.nts.tools.review.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Working-tree status of a changed file. Declaration order is the display order.
 */
public enum FileStatus {
    MODIFIED("modified"),
    ADDED("added"),
    UNTRACKED("untracked"),
    DELETED("deleted");

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
