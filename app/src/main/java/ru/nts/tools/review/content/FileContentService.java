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
package ru.nts.tools.review.content;

import ru.nts.tools.review.core.ReviewFileException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.ChangedFile;
import ru.nts.tools.review.scm.SourceControl;

/**
 * Собирает исходную и измененную версии файла по его статусу в Git.
 */
public class FileContentService {

    private final WorkspaceFileSystem fileSystem;
    private final SourceControl sourceControl;

    public FileContentService(WorkspaceFileSystem fileSystem, SourceControl sourceControl) {
        this.fileSystem = fileSystem;
        this.sourceControl = sourceControl;
    }

    /**
     * Загружает содержимое измененного файла.
     * <ul>
     *   <li>added, untracked: ("", рабочая копия)</li>
     *   <li>modified: (HEAD, рабочая копия)</li>
     *   <li>deleted: (HEAD, "")</li>
     * </ul>
     *
     * @throws ReviewFileException если файла нет в рабочей копии или это директория.
     */
    public FileContent loadFileContent(ChangedFile file) {
        ReviewLog.debug("Loading content for " + file.path() + " (" + file.status().getValue() + ")");
        switch (file.status()) {
            case ADDED, UNTRACKED -> {
                String modified = readWorkingCopy(file.path());
                return new FileContent(modified, new FileContent.DiffContent("", modified));
            }
            case DELETED -> {
                String original = sourceControl.getFileContent(file.path(), SourceControl.HEAD);
                return new FileContent("", new FileContent.DiffContent(original, ""));
            }
            default -> {
                String modified = readWorkingCopy(file.path());
                String original = sourceControl.getFileContent(file.path(), SourceControl.HEAD);
                return new FileContent(modified, new FileContent.DiffContent(original, modified));
            }
        }
    }

    private String readWorkingCopy(String path) {
        if (!fileSystem.exists(path)) {
            throw ReviewFileException.notFound(path);
        }
        if (!fileSystem.isFile(path)) {
            throw ReviewFileException.notAFile(path);
        }
        return fileSystem.read(path);
    }
}
