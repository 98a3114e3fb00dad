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

import ru.nts.tools.review.model.ReviewComment;

import java.util.List;
import java.util.Optional;

/**
 * Хранилище комментариев одной сессии ревью.
 * Порядок вставки сохраняется во всех выборках.
 */
public interface CommentRepository {

    List<ReviewComment> findAll();

    List<ReviewComment> findByFile(String file);

    Optional<ReviewComment> findById(String id);

    /**
     * Upsert: заменяет запись с тем же id на месте, иначе добавляет в конец.
     */
    void save(ReviewComment comment);

    /**
     * @return true, если запись существовала и была удалена.
     */
    boolean delete(String id);

    /**
     * Очищает коллекцию. Повторный вызов ничего не меняет.
     */
    void clear();

    default int count() {
        return findAll().size();
    }
}
