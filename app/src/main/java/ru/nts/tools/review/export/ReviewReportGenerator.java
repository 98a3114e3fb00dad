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

import ru.nts.tools.review.model.Priority;
import ru.nts.tools.review.model.ReviewComment;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the review as a priority-grouped markdown report for a human or an automated fixing agent.
 *
 * Groups follow {@link Priority#REPORT_ORDER}; inside a group the insertion order is kept.
 * Empty groups are omitted. Every item gets a stable label {@code <PRIORITY>-<n>}.
 */
public class ReviewReportGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String AGENT_INSTRUCTIONS = """

            ## 🤖 AI AGENT INSTRUCTIONS

            ### Task Overview
            Please review and fix all issues listed above, prioritizing CRITICAL and HIGH priority items first.

            ### For Each Issue:
            1. **Locate the file and line number specified**
            2. **Read the surrounding context to understand the problem**
            3. **Implement the suggested fix or your own solution**
            4. **Test that your changes don't break existing functionality**

            ### Priority Order:
            1. Fix all CRITICAL issues first
            2. Then HIGH priority issues
            3. Then MEDIUM priority issues
            4. Finally LOW priority issues

            ---
            *Generated by NTS Review*
            """;

    private final Clock clock;

    public ReviewReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public ReviewReportGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the report for the given comments.
     *
     * @param comments Comments in insertion order.
     * @param branch   Branch shown in the header.
     *
     * @return Markdown text.
     */
    public String generateReport(List<ReviewComment> comments, String branch) {
        Map<Priority, List<ReviewComment>> groups = groupByPriority(comments);

        StringBuilder md = new StringBuilder();
        md.append("# Code Review\n\n");
        md.append("**Branch**: `").append(branch).append("`  \n");
        md.append("**Date**: ").append(LocalDateTime.now(clock).format(DATE_FORMAT)).append("  \n");
        md.append("**Total Comments**: ").append(comments.size()).append("  \n\n");

        md.append("## Summary\n");
        md.append("- **Critical**: ").append(groups.get(Priority.CRITICAL).size()).append('\n');
        md.append("- **High Priority**: ").append(groups.get(Priority.HIGH).size()).append('\n');
        md.append("- **Medium Priority**: ").append(groups.get(Priority.MEDIUM).size()).append('\n');
        md.append("- **Low Priority**: ").append(groups.get(Priority.LOW).size()).append("\n\n");

        for (Priority priority : Priority.REPORT_ORDER) {
            List<ReviewComment> group = groups.get(priority);
            if (group.isEmpty()) {
                continue;
            }
            md.append("## ").append(priority.getMarker()).append(' ')
                    .append(priority.getHeading()).append(" ISSUES\n\n");
            for (int i = 0; i < group.size(); i++) {
                appendComment(md, group.get(i), priority.getLabel() + "-" + (i + 1));
            }
        }

        md.append(AGENT_INSTRUCTIONS);
        return md.toString();
    }

    /**
     * Splits comments into priority groups, preserving insertion order inside each group.
     */
    static Map<Priority, List<ReviewComment>> groupByPriority(List<ReviewComment> comments) {
        Map<Priority, List<ReviewComment>> groups = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            groups.put(priority, new ArrayList<>());
        }
        for (ReviewComment comment : comments) {
            Priority priority = comment.priority() != null ? comment.priority() : Priority.MEDIUM;
            groups.get(priority).add(comment);
        }
        return groups;
    }

    private void appendComment(StringBuilder md, ReviewComment comment, String label) {
        String marker = comment.type() != null ? comment.type().getMarker() + " " : "";
        String typeName = comment.type() != null ? comment.type().getDisplayName() : "Comment";

        md.append("### ").append(label).append(": ").append(marker).append(typeName).append("\n\n");
        md.append("**File**: `").append(comment.file()).append("`  \n");
        md.append("**Line**: ").append(comment.line());
        if (comment.isRange()) {
            md.append('-').append(comment.endLine());
        }
        md.append("  \n\n");
        md.append("**Comment**: ").append(comment.comment()).append("\n\n");
        md.append("---\n\n");
    }
}
