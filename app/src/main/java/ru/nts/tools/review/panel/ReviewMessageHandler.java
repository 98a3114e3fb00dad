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
package ru.nts.tools.review.panel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.review.content.FileContent;
import ru.nts.tools.review.content.FileContentService;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.diff.DiffEngine;
import ru.nts.tools.review.diff.DiffLine;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.ChangedFile;
import ru.nts.tools.review.model.CommentType;
import ru.nts.tools.review.model.FileStatus;
import ru.nts.tools.review.model.Priority;
import ru.nts.tools.review.model.ReviewComment;
import ru.nts.tools.review.scm.SourceControl;
import ru.nts.tools.review.session.MutationResult;
import ru.nts.tools.review.session.ReviewSessionManager;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Обработчик сообщений панели ревью.
 *
 * Каждое входящее сообщение - JSON-объект с полем {@code command}; на каждое
 * возвращается ровно один ответ. Любой сбой превращается в ответ {@code error},
 * обработчик никогда не пробрасывает исключения наружу.
 *
 * <pre>
 * listFiles                                   -> changedFiles {files}
 * openFile {path, status?}                    -> fileOpened {file, lines, comments, summary}
 * addComment {line, endLine?, comment, type, priority, file?} -> commentAdded {comment}
 * editComment {commentId, comment, type, priority}            -> commentUpdated {comment}
 * deleteComment {commentId}                   -> commentDeleted {commentId}
 * clearComments                               -> commentsCleared {count}
 * exportReview                                -> reviewExported {path, count}
 * </pre>
 */
public class ReviewMessageHandler {

    private final ReviewSessionManager session;
    private final SourceControl sourceControl;
    private final WorkspaceFileSystem fileSystem;
    private final FileContentService contentService;
    private final ObjectMapper mapper;

    // файл, открытый последним openFile; к нему привязываются новые комментарии
    private String currentFile;

    public ReviewMessageHandler(ReviewSessionManager session,
                                SourceControl sourceControl,
                                WorkspaceFileSystem fileSystem,
                                FileContentService contentService,
                                ObjectMapper mapper) {
        this.session = session;
        this.sourceControl = sourceControl;
        this.fileSystem = fileSystem;
        this.contentService = contentService;
        this.mapper = mapper;
    }

    /**
     * Обрабатывает одно входящее сообщение.
     *
     * @return исходящее сообщение (ответ или {@code error}).
     */
    public synchronized ObjectNode handle(JsonNode message) {
        String command = message == null ? "" : message.path("command").asText("");
        try {
            ReviewLog.debug("Received command: " + command);
            return switch (command) {
                case "listFiles" -> listFiles();
                case "openFile" -> openFile(message);
                case "addComment" -> addComment(message);
                case "editComment" -> editComment(message);
                case "deleteComment" -> deleteComment(message);
                case "clearComments" -> clearComments();
                case "exportReview" -> exportReview();
                case "" -> throw new ReviewException(ReviewErrorCode.INVALID_MESSAGE);
                default -> throw new ReviewException(ReviewErrorCode.UNKNOWN_COMMAND, "command", command);
            };
        } catch (ReviewException e) {
            ReviewLog.warn("Command '" + command + "' failed: " + e.getMessage());
            return errorMessage(e);
        } catch (RuntimeException e) {
            ReviewLog.error("Command '" + command + "' failed unexpectedly", e);
            return errorMessage(new ReviewException(ReviewErrorCode.INTERNAL_ERROR, Map.of("command", command), e));
        }
    }

    /**
     * Исходящее сообщение об ошибке.
     */
    public ObjectNode errorMessage(ReviewException error) {
        ObjectNode reply = reply("error");
        reply.put("code", error.getCode().name());
        reply.put("category", error.getCategory().name().toLowerCase(Locale.ROOT));
        reply.put("recoverable", error.isRecoverable());
        reply.put("message", error.toUserMessage());
        return reply;
    }

    /**
     * Файл, к которому привязываются новые комментарии; null, если ничего не открыто.
     */
    public synchronized String getCurrentFile() {
        return currentFile;
    }

    private ObjectNode listFiles() {
        List<ChangedFile> files = fileSystem.filterValidFiles(sourceControl.getChangedFiles());
        files.sort(ChangedFile.DISPLAY_ORDER);
        ObjectNode reply = reply("changedFiles");
        reply.set("files", mapper.valueToTree(files));
        return reply;
    }

    private ObjectNode openFile(JsonNode message) {
        String path = fileSystem.toRelative(requireText(message, "path"));
        ChangedFile file = new ChangedFile(path, resolveStatus(message, path), false);

        FileContent content = contentService.loadFileContent(file);
        List<DiffLine> lines = DiffEngine.computeDiff(content.diff().original(), content.diff().modified());
        currentFile = path;

        ObjectNode reply = reply("fileOpened");
        reply.put("file", path);
        reply.set("lines", mapper.valueToTree(lines));
        reply.set("comments", mapper.valueToTree(session.getCommentsForFile(path)));
        reply.set("summary", mapper.valueToTree(DiffEngine.summarize(lines)));
        return reply;
    }

    private ObjectNode addComment(JsonNode message) {
        String file = message.hasNonNull("file")
                ? fileSystem.toRelative(message.get("file").asText())
                : currentFile;
        if (file == null) {
            throw new ReviewException(ReviewErrorCode.NO_FILE_OPEN);
        }
        int line = requireInt(message, "line");
        Integer endLine = message.hasNonNull("endLine") ? requireInt(message, "endLine") : null;
        MutationResult<ReviewComment> result = session.addComment(file, line, endLine,
                requireText(message, "comment"), commentType(message), priority(message));

        ObjectNode reply = reply("commentAdded");
        reply.set("comment", mapper.valueToTree(result.value()));
        return reply;
    }

    private ObjectNode editComment(JsonNode message) {
        MutationResult<ReviewComment> result = session.editComment(requireText(message, "commentId"),
                requireText(message, "comment"), commentType(message), priority(message));

        ObjectNode reply = reply("commentUpdated");
        reply.set("comment", mapper.valueToTree(result.value()));
        return reply;
    }

    private ObjectNode deleteComment(JsonNode message) {
        String commentId = requireText(message, "commentId");
        if (!session.deleteComment(commentId).value()) {
            throw new ReviewException(ReviewErrorCode.COMMENT_NOT_FOUND, "commentId", commentId);
        }
        ObjectNode reply = reply("commentDeleted");
        reply.put("commentId", commentId);
        return reply;
    }

    private ObjectNode clearComments() {
        int removed = session.clearComments().value();
        ObjectNode reply = reply("commentsCleared");
        reply.put("count", removed);
        return reply;
    }

    private ObjectNode exportReview() {
        String path;
        try {
            path = session.exportReview().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ReviewException re) {
                throw re;
            }
            throw e;
        }
        ObjectNode reply = reply("reviewExported");
        reply.put("path", path);
        reply.put("count", session.getCommentCount());
        return reply;
    }

    // Статус берется из сообщения, иначе из Git; файл вне списка изменений сравнивается с HEAD
    private FileStatus resolveStatus(JsonNode message, String path) {
        if (message.hasNonNull("status")) {
            String value = message.get("status").asText();
            for (FileStatus status : FileStatus.values()) {
                if (status.getValue().equalsIgnoreCase(value)) {
                    return status;
                }
            }
            throw new ReviewException(ReviewErrorCode.PARAM_INVALID, Map.of("param", "status",
                    "allowed", Arrays.stream(FileStatus.values()).map(FileStatus::getValue).collect(Collectors.joining(", "))));
        }
        return sourceControl.getChangedFiles().stream()
                .filter(f -> f.path().equals(path))
                .map(ChangedFile::status)
                .findFirst()
                .orElse(FileStatus.MODIFIED);
    }

    private CommentType commentType(JsonNode message) {
        String value = requireText(message, "type");
        try {
            return CommentType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ReviewException(ReviewErrorCode.PARAM_INVALID,
                    Map.of("param", "type", "allowed", CommentType.allowedValues()));
        }
    }

    private Priority priority(JsonNode message) {
        String value = requireText(message, "priority");
        try {
            return Priority.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ReviewException(ReviewErrorCode.PARAM_INVALID,
                    Map.of("param", "priority", "allowed", Priority.allowedValues()));
        }
    }

    private static String requireText(JsonNode message, String param) {
        JsonNode node = message.get(param);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            throw new ReviewException(ReviewErrorCode.PARAM_MISSING, "param", param);
        }
        return node.asText();
    }

    private static int requireInt(JsonNode message, String param) {
        JsonNode node = message.get(param);
        if (node == null || node.isNull()) {
            throw new ReviewException(ReviewErrorCode.PARAM_MISSING, "param", param);
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw invalidInt(param);
            }
        }
        throw invalidInt(param);
    }

    private static ReviewException invalidInt(String param) {
        return new ReviewException(ReviewErrorCode.PARAM_INVALID, Map.of("param", param, "allowed", "integer >= 1"));
    }

    private ObjectNode reply(String command) {
        ObjectNode reply = mapper.createObjectNode();
        reply.put("command", command);
        return reply;
    }
}
