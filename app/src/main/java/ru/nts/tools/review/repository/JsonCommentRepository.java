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
package ru.nts.tools.review.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.export.ReviewDocument;
import ru.nts.tools.review.export.ReviewJsonCodec;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.ReviewComment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Репозиторий комментариев с JSON-артефактом в директории ревью.
 *
 * Источник истины - список в памяти. Запись на диск выполняется только по явному
 * {@link #saveToFile(String)} и всегда сериализует всю коллекцию целиком.
 * Методы синхронизированы: фоновое сохранение читает снимок, пока поток
 * сообщений продолжает мутации.
 */
public class JsonCommentRepository implements CommentRepository {

    private final WorkspaceFileSystem fileSystem;
    private final ReviewJsonCodec codec;
    private final List<ReviewComment> comments = new ArrayList<>();

    public JsonCommentRepository(WorkspaceFileSystem fileSystem, ReviewJsonCodec codec) {
        this.fileSystem = fileSystem;
        this.codec = codec;
    }

    /**
     * Имя JSON-артефакта для ветки.
     */
    public static String jsonFileName(String branch) {
        return "review-" + branch + ".json";
    }

    @Override
    public synchronized List<ReviewComment> findAll() {
        return new ArrayList<>(comments);
    }

    @Override
    public synchronized List<ReviewComment> findByFile(String file) {
        List<ReviewComment> result = new ArrayList<>();
        for (ReviewComment comment : comments) {
            if (comment.file().equals(file)) {
                result.add(comment);
            }
        }
        return result;
    }

    @Override
    public synchronized Optional<ReviewComment> findById(String id) {
        return comments.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    @Override
    public synchronized void save(ReviewComment comment) {
        Objects.requireNonNull(comment, "comment");
        int index = indexOf(comment.id());
        if (index >= 0) {
            comments.set(index, comment);
        } else {
            comments.add(comment);
        }
    }

    /**
     * Заменяет комментарий только если он уже есть.
     *
     * @return true, если замена произошла.
     */
    public synchronized boolean update(ReviewComment comment) {
        int index = indexOf(comment.id());
        if (index < 0) {
            return false;
        }
        comments.set(index, comment);
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        comments.remove(index);
        return true;
    }

    @Override
    public synchronized void clear() {
        comments.clear();
    }

    @Override
    public synchronized int count() {
        return comments.size();
    }

    /**
     * Заменяет содержимое кэша комментариями из JSON-артефакта ветки.
     *
     * @return false, если артефакта нет (кэш при этом очищается).
     * @throws ReviewException если файл есть, но не читается или поврежден.
     */
    public boolean loadFromFile(String branch) {
        String path = fileSystem.reviewArtifact(jsonFileName(branch));
        if (!fileSystem.exists(path)) {
            synchronized (this) {
                comments.clear();
            }
            ReviewLog.debug("No saved review for branch " + branch);
            return false;
        }
        String json = fileSystem.read(path);
        ReviewDocument document;
        try {
            document = codec.read(json);
        } catch (JsonProcessingException e) {
            throw new ReviewException(ReviewErrorCode.PERSISTENCE_FAILED, Map.of("path", path), e);
        }
        synchronized (this) {
            comments.clear();
            for (ReviewComment comment : document.comments()) {
                if (comment != null && comment.id() != null) {
                    save(comment);
                }
            }
            ReviewLog.info("Loaded " + comments.size() + " comments from " + path);
        }
        return true;
    }

    /**
     * Записывает всю коллекцию в JSON-артефакт ветки.
     *
     * @return путь артефакта относительно корня.
     */
    public String saveToFile(String branch) {
        String path = fileSystem.reviewArtifact(jsonFileName(branch));
        List<ReviewComment> snapshot = findAll();
        String json;
        try {
            json = codec.write(branch, snapshot, Instant.now().toString());
        } catch (JsonProcessingException e) {
            throw new ReviewException(ReviewErrorCode.PERSISTENCE_FAILED, Map.of("path", path), e);
        }
        fileSystem.ensureReviewsDirectory();
        fileSystem.write(path, json);
        ReviewLog.debug("Saved " + snapshot.size() + " comments to " + path);
        return path;
    }

    private int indexOf(String id) {
        for (int i = 0; i < comments.size(); i++) {
            if (comments.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
