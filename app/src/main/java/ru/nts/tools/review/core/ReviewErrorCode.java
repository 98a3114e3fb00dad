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
package ru.nts.tools.review.core;

import java.util.Map;

/**
 * Structured error codes for the review core.
 * Each error has a human-readable message, a solution hint and a category
 * that tells the caller whether the failure blocks the operation or degrades it.
 *
 * <p>Example rendering:
 * <pre>
 * [ERROR: INVALID_BRANCH_NAME]
 * Message: Invalid branch name
 * Solution: Branch 'feature/../x' cannot be used as a file name. Falling back to the default session.
 * Context: branch=feature/../x, reason=contains '..' or '//'
 * </pre>
 */
public enum ReviewErrorCode {

    // ============ Validation ============

    INVALID_PATH(Category.VALIDATION, "Invalid path",
            "Path '%path%' must stay inside the workspace. Use a workspace-relative path."),

    INVALID_BRANCH_NAME(Category.VALIDATION, "Invalid branch name",
            "Branch '%branch%' cannot be used as a file name. Falling back to the default session."),

    INVALID_COMMENT(Category.VALIDATION, "Invalid comment",
            "Comment needs a non-empty text, line >= 1 and endLine >= line."),

    PARAM_MISSING(Category.VALIDATION, "Required parameter missing",
            "Provide '%param%' in the message."),

    PARAM_INVALID(Category.VALIDATION, "Invalid parameter value",
            "Check '%param%'. Allowed values: %allowed%."),

    INVALID_MESSAGE(Category.VALIDATION, "Malformed message",
            "Send one JSON object per line with a 'command' field."),

    UNKNOWN_COMMAND(Category.VALIDATION, "Unknown command",
            "Supported commands: listFiles, openFile, addComment, editComment, deleteComment, clearComments, exportReview."),

    // ============ File system ============

    FILE_NOT_FOUND(Category.FILE_SYSTEM, "File not found",
            "Check that '%path%' exists in the working tree."),

    NOT_A_FILE(Category.FILE_SYSTEM, "Path is not a file",
            "'%path%' is a directory. Open a regular file."),

    FILE_READ_FAILED(Category.FILE_SYSTEM, "File read failed",
            "Check that '%path%' is a readable text file."),

    FILE_TOO_LARGE(Category.FILE_SYSTEM, "File too large",
            "'%path%' exceeds the %limit% byte limit for text review."),

    FILE_WRITE_FAILED(Category.FILE_SYSTEM, "File write failed",
            "Check permissions of '%path%' and free disk space."),

    // ============ Source control ============

    SCM_UNAVAILABLE(Category.SOURCE_CONTROL, "Source control unavailable",
            "No Git repository found in the workspace. Review continues on the fallback branch."),

    SCM_OPERATION_FAILED(Category.SOURCE_CONTROL, "Git operation failed",
            "Operation '%operation%' failed. Ensure git is installed and the workspace is a repository."),

    // ============ Review ============

    COMMENT_NOT_FOUND(Category.REVIEW, "Comment not found",
            "Comment '%commentId%' does not exist in the current session."),

    NO_FILE_OPEN(Category.REVIEW, "No file open",
            "Open a changed file with 'openFile' before adding comments."),

    PERSISTENCE_FAILED(Category.REVIEW, "Review could not be saved",
            "Comments are kept in memory. Check '%path%' and retry with exportReview."),

    INTERNAL_ERROR(Category.REVIEW, "Internal error",
            "Unexpected error. Check logs for details.");

    /**
     * Error taxonomy.
     */
    public enum Category {VALIDATION, FILE_SYSTEM, SOURCE_CONTROL, REVIEW}

    private final Category category;
    private final String message;
    private final String solution;

    ReviewErrorCode(Category category, String message, String solution) {
        this.category = category;
        this.message = message;
        this.solution = solution;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, branch, commentId...)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
