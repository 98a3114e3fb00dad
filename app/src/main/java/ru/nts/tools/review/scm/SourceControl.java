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

import ru.nts.tools.review.model.ChangedFile;

import java.util.List;

/**
 * Источник сведений о системе контроля версий.
 *
 * Ядро ревью никогда не запускает команды VCS напрямую: ветка, содержимое файла
 * на ревизии и список изменений приходят только через этот интерфейс.
 * Сбои сообщаются через {@link ru.nts.tools.review.core.ReviewException}
 * с кодом {@code SCM_UNAVAILABLE} или {@code SCM_OPERATION_FAILED}.
 */
public interface SourceControl {

    String HEAD = "HEAD";

    /**
     * Готов ли репозиторий отвечать на запросы. Не бросает исключений.
     */
    boolean isReady();

    /**
     * Имя текущей ветки. Для detached HEAD - {@code detached-<7 символов коммита>}.
     */
    String getCurrentBranch();

    /**
     * Содержимое файла на указанной ревизии.
     *
     * @param path Путь относительно корня репозитория.
     * @param ref  Ревизия, например {@code HEAD}.
     */
    String getFileContent(String path, String ref);

    default String getFileContent(String path) {
        return getFileContent(path, HEAD);
    }

    /**
     * Измененные файлы рабочей копии и индекса.
     */
    List<ChangedFile> getChangedFiles();

    /**
     * Локальные ветки репозитория.
     */
    List<String> getBranchList();
}
