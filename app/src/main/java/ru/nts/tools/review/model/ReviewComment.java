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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A typed, prioritized comment anchored to a line of the modified text.
 *
 * @param id        Opaque id, unique within a session.
 * @param file      Workspace-relative path of the commented file.
 * @param line      1-based anchor in the modified text at creation time.
 * @param endLine   Optional end of a multi-line range ({@code >= line}).
 * @param comment   Comment text, never blank.
 * @param type      Comment kind.
 * @param priority  Priority group used by the report.
 * @param timestamp ISO-8601 time of the last change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewComment(
        String id,
        String file,
        int line,
        Integer endLine,
        String comment,
        CommentType type,
        Priority priority,
        String timestamp) {

    /**
     * Returns a copy with new content, type, priority and timestamp; id, file and anchor are kept.
     */
    public ReviewComment withContent(String newComment, CommentType newType, Priority newPriority, String newTimestamp) {
        return new ReviewComment(id, file, line, endLine, newComment, newType, newPriority, newTimestamp);
    }

    /**
     * True when the comment covers more than one line.
     */
    @JsonIgnore
    public boolean isRange() {
        return endLine != null && endLine != line;
    }
}
