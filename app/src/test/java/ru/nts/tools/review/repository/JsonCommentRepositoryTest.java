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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.export.ReviewJsonCodec;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.CommentType;
import ru.nts.tools.review.model.Priority;
import ru.nts.tools.review.model.ReviewComment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CRUD и сохранение репозитория комментариев.
 */
class JsonCommentRepositoryTest {

    @TempDir
    Path root;

    private WorkspaceFileSystem fs;
    private JsonCommentRepository repository;

    @BeforeEach
    void setUp() {
        fs = new WorkspaceFileSystem(ReviewConfig.forWorkspace(root));
        repository = new JsonCommentRepository(fs, new ReviewJsonCodec());
    }

    private static ReviewComment comment(String id, String file, int line) {
        return new ReviewComment(id, file, line, null, "text " + id, CommentType.ISSUE, Priority.MEDIUM,
                "2025-01-01T10:00:00Z");
    }

    @Test
    void testSaveThenFindById() {
        ReviewComment c = comment("c1", "src/A.java", 3);
        repository.save(c);

        assertEquals(Optional.of(c), repository.findById("c1"));
        assertEquals(Optional.empty(), repository.findById("missing"));
    }

    @Test
    void testSaveWithSameIdReplacesInPlace() {
        repository.save(comment("c1", "A.java", 1));
        repository.save(comment("c2", "A.java", 2));
        repository.save(comment("c3", "B.java", 3));

        ReviewComment replaced = comment("c2", "A.java", 2)
                .withContent("changed", CommentType.QUESTION, Priority.HIGH, "2025-01-02T00:00:00Z");
        repository.save(replaced);

        List<ReviewComment> all = repository.findAll();
        assertEquals(3, all.size());
        assertEquals(List.of("c1", "c2", "c3"), all.stream().map(ReviewComment::id).toList());
        assertEquals("changed", all.get(1).comment());
    }

    @Test
    void testFindByFilePreservesOrder() {
        repository.save(comment("c1", "A.java", 9));
        repository.save(comment("c2", "B.java", 1));
        repository.save(comment("c3", "A.java", 2));

        assertEquals(List.of("c1", "c3"), repository.findByFile("A.java").stream().map(ReviewComment::id).toList());
        assertTrue(repository.findByFile("C.java").isEmpty());
    }

    @Test
    void testDeleteAbsentIdLeavesCollection() {
        repository.save(comment("c1", "A.java", 1));

        assertFalse(repository.delete("nope"));
        assertEquals(1, repository.count());
        assertTrue(repository.delete("c1"));
        assertFalse(repository.delete("c1"));
        assertEquals(0, repository.count());
    }

    @Test
    void testClearIsIdempotent() {
        repository.save(comment("c1", "A.java", 1));

        repository.clear();
        repository.clear();

        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void testUpdateOnlyReplacesExisting() {
        assertFalse(repository.update(comment("c1", "A.java", 1)));
        assertEquals(0, repository.count());

        repository.save(comment("c1", "A.java", 1));
        assertTrue(repository.update(comment("c1", "A.java", 1).withContent("new", CommentType.PRAISE, Priority.LOW, "t")));
        assertEquals("new", repository.findById("c1").orElseThrow().comment());
    }

    @Test
    void testReturnedListsAreCopies() {
        repository.save(comment("c1", "A.java", 1));

        List<ReviewComment> all = repository.findAll();
        all.clear();

        assertEquals(1, repository.count());
    }

    @Test
    void testSaveAndLoadRoundTrip() {
        repository.save(comment("c1", "A.java", 1));
        repository.save(new ReviewComment("c2", "B.java", 4, 7, "range", CommentType.SUGGESTION, Priority.CRITICAL, "t2"));

        String path = repository.saveToFile("feature/login");
        assertEquals(".nts/reviews/review-feature/login.json", path);
        assertTrue(Files.isRegularFile(root.resolve(path)));

        JsonCommentRepository reloaded = new JsonCommentRepository(fs, new ReviewJsonCodec());
        assertTrue(reloaded.loadFromFile("feature/login"));
        assertEquals(repository.findAll(), reloaded.findAll());
    }

    @Test
    void testLoadMissingFileClearsCache() {
        repository.save(comment("c1", "A.java", 1));

        assertFalse(repository.loadFromFile("main"));
        assertEquals(0, repository.count());
    }

    @Test
    void testLoadCorruptedFileFails() throws IOException {
        Path file = root.resolve(".nts/reviews/review-main.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{ not json");

        ReviewException e = assertThrows(ReviewException.class, () -> repository.loadFromFile("main"));
        assertEquals(ReviewErrorCode.PERSISTENCE_FAILED, e.getCode());
    }
}
