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
package ru.nts.tools.review.fs;

import ru.nts.tools.review.core.EncodingUtils;
import ru.nts.tools.review.core.FileUtils;
import ru.nts.tools.review.core.PathSanitizer;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.core.ReviewFileException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.model.ChangedFile;
import ru.nts.tools.review.model.FileStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Доступ к файлам рабочей директории.
 *
 * Все пути принимаются относительно корня и проходят через {@link PathSanitizer}:
 * путь за пределами корня никогда не открывается. Запись всегда в UTF-8 через Safe Swap.
 */
public class WorkspaceFileSystem {

    private final Path root;
    private final String reviewsDir;

    public WorkspaceFileSystem(ReviewConfig config) {
        this.root = config.workspaceRoot();
        this.reviewsDir = resolveReviewsDir(config.reviewsDir());
    }

    /**
     * Проверяет путь и возвращает его абсолютную форму внутри корня.
     *
     * @throws ReviewException с кодом {@link ReviewErrorCode#INVALID_PATH}.
     */
    public Path resolve(String relativePath) {
        try {
            return PathSanitizer.sanitize(root, relativePath);
        } catch (SecurityException e) {
            throw new ReviewException(ReviewErrorCode.INVALID_PATH, Map.of("path", String.valueOf(relativePath)), e);
        }
    }

    /**
     * Каноническая форма пути относительно корня с разделителем '/'.
     * {@code ./src/A.java}, {@code src\A.java} и {@code src/A.java} дают одну и ту же строку.
     */
    public String toRelative(String path) {
        return root.toAbsolutePath().normalize().relativize(resolve(path)).toString().replace('\\', '/');
    }

    public boolean exists(String relativePath) {
        return Files.exists(resolve(relativePath));
    }

    public boolean isFile(String relativePath) {
        return Files.isRegularFile(resolve(relativePath));
    }

    /**
     * Читает текст файла.
     *
     * @throws ReviewFileException если файла нет или чтение не удалось.
     */
    public String read(String relativePath) {
        Path path = resolve(relativePath);
        if (!Files.exists(path)) {
            throw ReviewFileException.notFound(relativePath);
        }
        if (!Files.isRegularFile(path)) {
            throw ReviewFileException.notAFile(relativePath);
        }
        try {
            PathSanitizer.checkFileSize(path);
            return EncodingUtils.readTextFile(path).content();
        } catch (SecurityException e) {
            throw ReviewFileException.tooLarge(relativePath, e);
        } catch (IOException e) {
            throw ReviewFileException.readFailed(path, e);
        }
    }

    /**
     * Записывает текст в UTF-8, создавая родительские директории.
     */
    public void write(String relativePath, String content) {
        Path path = resolve(relativePath);
        try {
            FileUtils.safeWrite(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ReviewFileException.writeFailed(path, e);
        }
    }

    public void ensureDirectory(String relativePath) {
        Path path = resolve(relativePath);
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw ReviewFileException.writeFailed(path, e);
        }
    }

    /**
     * Путь к директории артефактов ревью относительно корня.
     */
    public String getReviewsDirectory() {
        return reviewsDir;
    }

    public void ensureReviewsDirectory() {
        ensureDirectory(reviewsDir);
    }

    /**
     * Путь к артефакту внутри директории ревью.
     */
    public String reviewArtifact(String fileName) {
        return reviewsDir + "/" + fileName;
    }

    /**
     * Отбрасывает файлы самого ревью, невалидные пути и директории.
     * Удаленные файлы сохраняются: проверить их существование невозможно.
     */
    public List<ChangedFile> filterValidFiles(List<ChangedFile> files) {
        List<ChangedFile> valid = new ArrayList<>();
        for (ChangedFile file : files) {
            String normalized = file.path().replace('\\', '/');
            if (normalized.equals(reviewsDir) || normalized.startsWith(reviewsDir + "/")) {
                ReviewLog.debug("Filtering out review artifact: " + file.path());
                continue;
            }
            Path fullPath;
            try {
                fullPath = resolve(file.path());
            } catch (ReviewException e) {
                ReviewLog.warn("Invalid file path detected: " + file.path());
                continue;
            }
            if (PathSanitizer.isProtected(root.relativize(fullPath))) {
                continue;
            }
            if (file.status() != FileStatus.DELETED && Files.exists(fullPath) && !Files.isRegularFile(fullPath)) {
                ReviewLog.debug("Filtering out directory: " + file.path());
                continue;
            }
            valid.add(file);
        }
        return valid;
    }

    private String resolveReviewsDir(String configured) {
        String candidate = configured.replace('\\', '/');
        while (candidate.endsWith("/")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        try {
            Path path = PathSanitizer.sanitize(root, candidate);
            if (path.equals(root)) {
                throw new SecurityException("Reviews directory cannot be the workspace root");
            }
            return root.relativize(path).toString().replace('\\', '/');
        } catch (SecurityException e) {
            ReviewLog.warn("Invalid reviews directory '" + configured + "', using " + ReviewConfig.DEFAULT_REVIEWS_DIR);
            return ReviewConfig.DEFAULT_REVIEWS_DIR;
        }
    }
}
