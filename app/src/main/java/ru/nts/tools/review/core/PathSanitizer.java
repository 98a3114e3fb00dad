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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Утилита для проверки и нормализации путей и имен веток.
 *
 * Гарантирует два инварианта:
 * 1. Невалидный путь никогда не открывается: итоговый абсолютный путь лежит строго внутри корня.
 * 2. Невалидное имя ветки никогда не становится частью имени файла.
 */
public final class PathSanitizer {

    /**
     * Максимально допустимый размер файла для текстовой обработки (10 MB).
     */
    public static final long MAX_TEXT_FILE_SIZE = 10 * 1024 * 1024;

    /**
     * Максимальная длина имени ветки.
     */
    public static final int MAX_BRANCH_LENGTH = 255;

    /**
     * Управляющие символы, пробел и спецсимволы Git: ~ ^ : ? * [ \
     */
    private static final Pattern FORBIDDEN_BRANCH_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f ~^:?*\\[\\\\]");

    /**
     * Служебные директории, недоступные для чтения через ревью.
     */
    private static final Set<String> PROTECTED_NAMES = Set.of(".git");

    private PathSanitizer() {
    }

    /**
     * Выполняет санитарную проверку и нормализацию пути относительно корня.
     *
     * @param root          Корень рабочей директории.
     * @param requestedPath Путь (относительный или абсолютный, может содержать '..').
     *
     * @return Абсолютный нормализованный путь внутри корня.
     *
     * @throws SecurityException Если путь ведет за пределы корня или содержит NUL.
     */
    public static Path sanitize(Path root, String requestedPath) {
        if (requestedPath == null || requestedPath.isBlank()) {
            throw new SecurityException("Access denied: empty path");
        }
        if (requestedPath.indexOf('\0') >= 0) {
            throw new SecurityException("Access denied: null bytes in path are not allowed");
        }

        Path normalizedRoot = root.toAbsolutePath().normalize();
        // Нормализация разделителей для Windows
        String normalizedRequest = requestedPath.replace('\\', '/');
        Path target;
        try {
            Path requested = Paths.get(normalizedRequest);
            target = requested.isAbsolute()
                    ? requested.toAbsolutePath().normalize()
                    : normalizedRoot.resolve(normalizedRequest).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new SecurityException("Access denied: malformed path: " + requestedPath);
        }

        if (!target.startsWith(normalizedRoot)) {
            throw new SecurityException("Access denied: path is outside of working directory: " + requestedPath);
        }
        return target;
    }

    /**
     * Проверяет имя ветки на пригодность в качестве компонента имени файла.
     *
     * @param branchName Имя ветки из системы контроля версий.
     *
     * @return То же имя ветки, если оно валидно.
     *
     * @throws ReviewException с кодом {@link ReviewErrorCode#INVALID_BRANCH_NAME}.
     */
    public static String validateBranchName(String branchName) {
        if (branchName == null || branchName.isEmpty()) {
            throw invalidBranch(String.valueOf(branchName), "empty");
        }
        if (FORBIDDEN_BRANCH_CHARS.matcher(branchName).find()) {
            throw invalidBranch(branchName, "contains forbidden characters");
        }
        if (branchName.startsWith(".") || branchName.startsWith("-")) {
            throw invalidBranch(branchName, "cannot start with . or -");
        }
        if (branchName.endsWith(".") || branchName.endsWith(".lock")) {
            throw invalidBranch(branchName, "invalid ending");
        }
        if (branchName.contains("..") || branchName.contains("//")) {
            throw invalidBranch(branchName, "contains '..' or '//'");
        }
        if (branchName.length() > MAX_BRANCH_LENGTH) {
            throw invalidBranch(branchName, "too long (max " + MAX_BRANCH_LENGTH + " characters)");
        }
        return branchName;
    }

    private static ReviewException invalidBranch(String branch, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("branch", branch);
        ctx.put("reason", reason);
        return new ReviewException(ReviewErrorCode.INVALID_BRANCH_NAME, ctx);
    }

    /**
     * Проверяет файл на соответствие лимиту размера.
     *
     * @throws SecurityException Если размер превышает {@link #MAX_TEXT_FILE_SIZE}.
     */
    public static void checkFileSize(Path path) throws IOException {
        if (Files.exists(path) && Files.isRegularFile(path)) {
            long size = Files.size(path);
            if (size > MAX_TEXT_FILE_SIZE) {
                throw new SecurityException(String.format("File is too large (%d bytes). Limit is %d bytes.", size, MAX_TEXT_FILE_SIZE));
            }
        }
    }

    /**
     * Определяет, является ли путь частью служебной инфраструктуры (.git).
     */
    public static boolean isProtected(Path path) {
        for (Path part : path) {
            if (PROTECTED_NAMES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
