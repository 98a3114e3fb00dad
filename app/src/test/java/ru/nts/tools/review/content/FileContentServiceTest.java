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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.ChangedFile;
import ru.nts.tools.review.model.FileStatus;
import ru.nts.tools.review.scm.FakeSourceControl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileContentServiceTest {

    @TempDir
    Path root;

    private FakeSourceControl git;
    private FileContentService service;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/App.java"), "class App {\n  int x;\n}");
        git = new FakeSourceControl().head("src/App.java", "class App {\n}");
        service = new FileContentService(new WorkspaceFileSystem(ReviewConfig.forWorkspace(root)), git);
    }

    @Test
    void testModifiedComparesHeadWithWorkingCopy() {
        FileContent content = service.loadFileContent(new ChangedFile("src/App.java", FileStatus.MODIFIED, false));

        assertEquals("class App {\n  int x;\n}", content.content());
        assertEquals(new FileContent.DiffContent("class App {\n}", "class App {\n  int x;\n}"), content.diff());
    }

    @Test
    void testAddedAndUntrackedHaveEmptyOriginal() {
        for (FileStatus status : new FileStatus[]{FileStatus.ADDED, FileStatus.UNTRACKED}) {
            FileContent content = service.loadFileContent(new ChangedFile("src/App.java", status, false));
            assertEquals("", content.diff().original());
            assertEquals("class App {\n  int x;\n}", content.diff().modified());
        }
    }

    @Test
    void testDeletedHasEmptyModified() {
        git.head("src/Gone.java", "class Gone {}");

        FileContent content = service.loadFileContent(new ChangedFile("src/Gone.java", FileStatus.DELETED, true));

        assertEquals("", content.content());
        assertEquals(new FileContent.DiffContent("class Gone {}", ""), content.diff());
    }

    @Test
    void testMissingWorkingCopyIsFileSystemError() {
        ReviewException e = assertThrows(ReviewException.class,
                () -> service.loadFileContent(new ChangedFile("src/Missing.java", FileStatus.ADDED, false)));

        assertEquals(ReviewErrorCode.FILE_NOT_FOUND, e.getCode());
    }

    @Test
    void testDirectoryIsRejected() {
        ReviewException e = assertThrows(ReviewException.class,
                () -> service.loadFileContent(new ChangedFile("src", FileStatus.UNTRACKED, false)));

        assertEquals(ReviewErrorCode.NOT_A_FILE, e.getCode());
    }

    @Test
    void testSourceControlFailurePropagates() {
        git.failing(true);

        ReviewException e = assertThrows(ReviewException.class,
                () -> service.loadFileContent(new ChangedFile("src/App.java", FileStatus.MODIFIED, false)));

        assertEquals(ReviewErrorCode.Category.SOURCE_CONTROL, e.getCode().getCategory());
    }
}
