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
package ru.nts.tools.review.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import ru.nts.tools.review.model.ReviewComment;

import java.util.List;

/**
 * Lossless JSON side-artifact of a review session.
 *
 * @param branch      Sanitized branch name.
 * @param comments    Comments in insertion order.
 * @param lastUpdated ISO-8601 time of the write.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewDocument(String branch, List<ReviewComment> comments, String lastUpdated) {

    public ReviewDocument {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
