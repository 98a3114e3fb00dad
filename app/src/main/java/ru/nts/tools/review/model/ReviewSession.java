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

import java.util.List;

/**
 * Snapshot of the comment set bound to one branch.
 *
 * @param branch     Sanitized branch name the artifacts are named after.
 * @param baseBranch Branch the review compares against.
 * @param timestamp  ISO-8601 time the session was opened.
 * @param status     Descriptive status.
 * @param comments   Comments in insertion order.
 */
public record ReviewSession(
        String branch,
        String baseBranch,
        String timestamp,
        SessionStatus status,
        List<ReviewComment> comments) {

    public ReviewSession {
        comments = List.copyOf(comments);
    }
}
