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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Priority of a review comment. Serialized in lower case.
 */
public enum Priority {
    LOW("low", "LOW PRIORITY", "🟢"),
    MEDIUM("medium", "MEDIUM PRIORITY", "🟡"),
    HIGH("high", "HIGH PRIORITY", "⚠️"),
    CRITICAL("critical", "CRITICAL", "🚨");

    /**
     * Order of priority groups in the exported report.
     */
    public static final List<Priority> REPORT_ORDER = List.of(CRITICAL, HIGH, MEDIUM, LOW);

    private final String value;
    private final String heading;
    private final String marker;

    Priority(String value, String heading, String marker) {
        this.value = value;
        this.heading = heading;
        this.marker = marker;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Section heading in the report ("HIGH PRIORITY").
     */
    public String getHeading() {
        return heading;
    }

    public String getMarker() {
        return marker;
    }

    /**
     * Label prefix of an item in the report ("HIGH" in HIGH-2).
     */
    public String getLabel() {
        return name();
    }

    @JsonCreator
    public static Priority fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Priority priority : values()) {
                if (priority.value.equals(normalized)) {
                    return priority;
                }
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(Priority::getValue).collect(Collectors.joining(", "));
    }
}
