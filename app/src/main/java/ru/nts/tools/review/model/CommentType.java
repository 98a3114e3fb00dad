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
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Kind of a review comment. Serialized in lower case.
 */
public enum CommentType {
    ISSUE("issue", "🐛"),
    SUGGESTION("suggestion", "💡"),
    QUESTION("question", "❓"),
    PRAISE("praise", "👍");

    private final String value;
    private final String marker;

    CommentType(String value, String marker) {
        this.value = value;
        this.marker = marker;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Emoji shown in front of the type in the markdown report.
     */
    public String getMarker() {
        return marker;
    }

    /**
     * Display name with a capital first letter ("Issue").
     */
    public String getDisplayName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    @JsonCreator
    public static CommentType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (CommentType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown comment type: " + value);
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(CommentType::getValue).collect(Collectors.joining(", "));
    }
}
