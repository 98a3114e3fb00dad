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
package ru.nts.tools.review.model;

import java.util.Comparator;

/**
 * A path reported as changed by source control.
 *
 * @param path   Workspace-relative path with '/' separators.
 * @param status Working-tree status.
 * @param staged Whether the change is in the index.
 */
public record ChangedFile(String path, FileStatus status, boolean staged) {

    /**
     * Sorts by status (modified, added, untracked, deleted), then by path.
     */
    public static final Comparator<ChangedFile> DISPLAY_ORDER =
            Comparator.comparing(ChangedFile::status).thenComparing(ChangedFile::path);
}
