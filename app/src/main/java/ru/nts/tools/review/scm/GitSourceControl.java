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
package ru.nts.tools.review.scm;

import ru.nts.tools.review.core.EncodingUtils;
import ru.nts.tools.review.core.PathSanitizer;
import ru.nts.tools.review.core.ProcessExecutor;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.model.ChangedFile;
import ru.nts.tools.review.model.FileStatus;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Реализация {@link SourceControl} поверх CLI git.
 * Каждая операция - отдельный процесс с таймаутом, вывод разбирается в машиночитаемых форматах.
 */
public class GitSourceControl implements SourceControl {

    private static final int SHORT_HASH_LENGTH = 7;

    private final Path workingDir;
    private final long timeoutSeconds;

    public GitSourceControl(Path workingDir, Duration timeout) {
        this.workingDir = workingDir;
        this.timeoutSeconds = Math.max(1, timeout.toSeconds());
    }

    @Override
    public boolean isReady() {
        try {
            ProcessExecutor.ExecutionResult result = git("rev-parse", "--is-inside-work-tree");
            return result.isSuccess() && result.output().trim().equals("true");
        } catch (ReviewException e) {
            ReviewLog.debug("Git is not ready: " + e.getMessage());
            return false;
        }
    }

    @Override
    public String getCurrentBranch() {
        // symbolic-ref работает и в репозитории без коммитов
        ProcessExecutor.ExecutionResult symbolic = git("symbolic-ref", "--short", "-q", "HEAD");
        if (symbolic.isSuccess() && !symbolic.output().isBlank()) {
            return symbolic.output().trim();
        }
        String commit = require(git("rev-parse", "HEAD"), "rev-parse HEAD").output().trim();
        return detachedName(commit);
    }

    @Override
    public String getFileContent(String path, String ref) {
        String gitPath = path.replace('\\', '/');
        ProcessExecutor.ExecutionResult result = git("show", ref + ":" + gitPath);
        if (result.isSuccess() && result.truncated()) {
            throw new ReviewException(ReviewErrorCode.FILE_TOO_LARGE,
                    Map.of("path", gitPath, "limit", PathSanitizer.MAX_TEXT_FILE_SIZE));
        }
        byte[] content = require(result, "show " + ref + ":" + gitPath).outputBytes();
        try {
            return EncodingUtils.decode(content, gitPath).content();
        } catch (IOException e) {
            throw new ReviewException(ReviewErrorCode.FILE_READ_FAILED, Map.of("path", gitPath), e);
        }
    }

    @Override
    public List<ChangedFile> getChangedFiles() {
        // без quotePath не-ASCII имена приходят восьмеричными escape-последовательностями
        String output = require(git("-c", "core.quotePath=false", "status", "--porcelain", "--untracked-files=all"),
                "status").output();
        return parsePorcelain(output);
    }

    @Override
    public List<String> getBranchList() {
        String output = require(git("for-each-ref", "--format=%(refname:short)", "refs/heads"), "for-each-ref").output();
        List<String> branches = new ArrayList<>();
        for (String line : output.split("\n")) {
            if (!line.isBlank()) {
                branches.add(line.trim());
            }
        }
        return branches;
    }

    /**
     * Имя псевдо-ветки для detached HEAD.
     */
    static String detachedName(String commit) {
        String shortHash = commit.length() > SHORT_HASH_LENGTH ? commit.substring(0, SHORT_HASH_LENGTH) : commit;
        return "detached-" + shortHash;
    }

    /**
     * Разбирает вывод {@code git status --porcelain}.
     * Формат строки: {@code XY path} или {@code XY old -> new} для переименований.
     * X - статус в индексе, Y - в рабочем дереве. Повтор пути сворачивается в одну запись.
     */
    static List<ChangedFile> parsePorcelain(String output) {
        Map<String, ChangedFile> files = new LinkedHashMap<>();
        for (String line : output.split("\n")) {
            if (line.length() < 4) {
                continue;
            }
            char x = line.charAt(0);
            char y = line.charAt(1);
            String path = line.substring(3);
            int arrow = path.indexOf(" -> ");
            if (arrow >= 0) {
                path = path.substring(arrow + 4);
            }
            path = unquote(path.trim());
            files.put(path, new ChangedFile(path, translateStatus(x, y), x != ' ' && x != '?'));
        }
        return new ArrayList<>(files.values());
    }

    private static FileStatus translateStatus(char x, char y) {
        if (x == '?' && y == '?') {
            return FileStatus.UNTRACKED;
        }
        if (x == 'D' || y == 'D') {
            return FileStatus.DELETED;
        }
        if (x == 'A') {
            return FileStatus.ADDED;
        }
        return FileStatus.MODIFIED;
    }

    /**
     * Снимает C-кавычки git: {@code "a\\tb"}, {@code "\\320\\244.txt"}.
     * Восьмеричные escape-последовательности - это байты UTF-8 имени.
     */
    static String unquote(String path) {
        if (path.length() < 2 || !path.startsWith("\"") || !path.endsWith("\"")) {
            return path;
        }
        String body = path.substring(1, path.length() - 1);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                int codePoint = body.codePointAt(i);
                bytes.writeBytes(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
                i += Character.charCount(codePoint);
                continue;
            }
            char next = body.charAt(i + 1);
            if (isOctal(next) && i + 3 < body.length() && isOctal(body.charAt(i + 2)) && isOctal(body.charAt(i + 3))) {
                bytes.write(Integer.parseInt(body.substring(i + 1, i + 4), 8));
                i += 4;
                continue;
            }
            int escaped = switch (next) {
                case 'a' -> 0x07;
                case 'b' -> '\b';
                case 't' -> '\t';
                case 'n' -> '\n';
                case 'v' -> 0x0B;
                case 'f' -> '\f';
                case 'r' -> '\r';
                default -> next;
            };
            bytes.write(escaped);
            i += 2;
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }

    private ProcessExecutor.ExecutionResult require(ProcessExecutor.ExecutionResult result, String operation) {
        if (!result.isSuccess()) {
            String reason = result.timedOut() ? "timed out" : result.error().trim();
            throw new ReviewException(ReviewErrorCode.SCM_OPERATION_FAILED,
                    Map.of("operation", operation + ": " + reason));
        }
        if (result.truncated()) {
            throw new ReviewException(ReviewErrorCode.SCM_OPERATION_FAILED,
                    Map.of("operation", operation + ": output exceeds " + ProcessExecutor.MAX_OUTPUT_BYTES + " bytes"));
        }
        return result;
    }

    private ProcessExecutor.ExecutionResult git(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        try {
            return ProcessExecutor.execute(workingDir, command, timeoutSeconds);
        } catch (IOException e) {
            throw new ReviewException(ReviewErrorCode.SCM_UNAVAILABLE, Map.of("reason", String.valueOf(e.getMessage())), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewException(ReviewErrorCode.SCM_UNAVAILABLE, Map.of("reason", "interrupted"), e);
        }
    }
}
