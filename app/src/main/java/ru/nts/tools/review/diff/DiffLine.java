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
package ru.nts.tools.review.diff;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One classified line with anchors in one or both versions of the text.
 * Transient: regenerated on every file view and never persisted.
 *
 * @param type          Classification.
 * @param content       Line text without the line separator.
 * @param oldLineNumber 1-based position in the original text, null for added lines.
 * @param newLineNumber 1-based position in the modified text, null for removed lines.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffLine(DiffLineType type, String content, Integer oldLineNumber, Integer newLineNumber) {

    public static DiffLine unchanged(String content, int oldLineNumber, int newLineNumber) {
        return new DiffLine(DiffLineType.UNCHANGED, content, oldLineNumber, newLineNumber);
    }

    public static DiffLine added(String content, int newLineNumber) {
        return new DiffLine(DiffLineType.ADDED, content, null, newLineNumber);
    }

    public static DiffLine removed(String content, int oldLineNumber) {
        return new DiffLine(DiffLineType.REMOVED, content, oldLineNumber, null);
    }
}
