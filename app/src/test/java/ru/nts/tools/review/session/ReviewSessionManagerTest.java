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
package ru.nts.tools.review.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.review.core.ErrorReporter;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.export.ReviewJsonCodec;
import ru.nts.tools.review.export.ReviewReportGenerator;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.CommentType;
import ru.nts.tools.review.model.Priority;
import ru.nts.tools.review.model.ReviewComment;
import ru.nts.tools.review.model.ReviewSession;
import ru.nts.tools.review.model.SessionStatus;
import ru.nts.tools.review.repository.JsonCommentRepository;
import ru.nts.tools.review.scm.FakeSourceControl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Жизненный цикл сессии ревью, автосохранение и деградация при сбоях.
 */
class ReviewSessionManagerTest {

    @TempDir
    Path root;

    private final FakeSourceControl git = new FakeSourceControl();
    private final List<ReviewException> reported = new CopyOnWriteArrayList<>();
    private ReviewSessionManager manager;

    @BeforeEach
    void setUp() {
        manager = newManager();
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private ReviewSessionManager newManager() {
        ReviewConfig config = new ReviewConfig(root, ReviewConfig.DEFAULT_REVIEWS_DIR,
                Duration.ofMillis(300), Duration.ofMillis(20));
        WorkspaceFileSystem fs = new WorkspaceFileSystem(config);
        ErrorReporter errors = new ErrorReporter();
        errors.subscribe(reported::add);
        return new ReviewSessionManager(config, git, fs, new JsonCommentRepository(fs, new ReviewJsonCodec()),
                new ReviewReportGenerator(), errors);
    }

    private void start() throws Exception {
        manager.initialize().get(5, TimeUnit.SECONDS);
    }

    private Path artifact(String name) {
        return root.resolve(".nts/reviews").resolve(name);
    }

    private ReviewComment add(String file, int line, String text, Priority priority) {
        MutationResult<ReviewComment> result = manager.addComment(file, line, null, text, CommentType.ISSUE, priority);
        result.saved().join();
        return result.value();
    }

    @Test
    void testInitializeWritesEmptyArtifactsForBranch() throws Exception {
        git.branch("feature/login");
        assertEquals(SessionState.UNINITIALIZED, manager.getState());

        start();

        assertEquals(SessionState.READY, manager.getState());
        assertEquals("feature/login", manager.getBranch());
        assertEquals(".nts/reviews/review-feature/login.md", manager.getCurrentReviewFile());
        assertTrue(Files.isRegularFile(artifact("review-feature/login.md")));
        assertTrue(Files.isRegularFile(artifact("review-feature/login.json")));
        assertTrue(reported.isEmpty());
    }

    @Test
    void testInitializeIsIdempotent() {
        assertSame(manager.initialize(), manager.initialize());
    }

    @Test
    void testNotReadySourceControlFallsBackToMainAfterTimeout() throws Exception {
        git.ready(false).branch("feature/never");

        start();

        assertEquals(ReviewConfig.FALLBACK_BRANCH, manager.getBranch());
        assertTrue(git.getReadyChecks() > 1, "readiness must be polled");
        assertEquals(ReviewErrorCode.SCM_UNAVAILABLE, reported.get(0).getCode());
        assertTrue(Files.isRegularFile(artifact("review-main.md")));
    }

    @Test
    void testInvalidBranchNameFallsBackToMain() throws Exception {
        git.branch("feature/../escape");

        start();

        assertEquals("main", manager.getBranch());
        assertEquals(ReviewErrorCode.INVALID_BRANCH_NAME, reported.get(0).getCode());
        assertFalse(Files.exists(root.resolve(".nts/escape.md")));
    }

    @Test
    void testSourceControlFailureFallsBackToMain() throws Exception {
        git.failing(true);

        start();

        assertEquals("main", manager.getBranch());
        assertEquals(SessionState.READY, manager.getState());
        assertFalse(reported.isEmpty());
    }

    @Test
    void testDetachedHeadNameIsUsable() throws Exception {
        git.branch("detached-a1b2c3d");

        start();

        assertEquals("detached-a1b2c3d", manager.getBranch());
    }

    @Test
    void testAddEditDeleteUpdateArtifacts() throws Exception {
        start();

        ReviewComment first = add("src/A.java", 10, "Null check missing", Priority.CRITICAL);
        ReviewComment second = add("src/B.java", 3, "Rename variable", Priority.LOW);
        assertEquals(2, manager.getCommentCount());
        assertEquals(List.of(first), manager.getCommentsForFile("src/A.java"));

        String report = Files.readString(artifact("review-main.md"));
        assertTrue(report.contains("### CRITICAL-1: 🐛 Issue"));
        assertTrue(report.contains("Null check missing"));

        MutationResult<ReviewComment> edited = manager.editComment(second.id(), "Rename to count",
                CommentType.SUGGESTION, Priority.HIGH);
        edited.saved().join();
        assertEquals(second.id(), edited.value().id());
        assertEquals(3, edited.value().line());
        assertEquals("Rename to count", manager.getComments().get(1).comment());
        assertTrue(Files.readString(artifact("review-main.md")).contains("### HIGH-1: 💡 Suggestion"));

        MutationResult<Boolean> deleted = manager.deleteComment(first.id());
        deleted.saved().join();
        assertTrue(deleted.value());
        assertFalse(Files.readString(artifact("review-main.md")).contains("Null check missing"));
        assertFalse(Files.readString(artifact("review-main.json")).contains(first.id()));
    }

    @Test
    void testRangeCommentIsStored() throws Exception {
        start();

        ReviewComment comment = manager.addComment("src/A.java", 4, 9, "Whole block", CommentType.QUESTION,
                Priority.MEDIUM).value();

        assertEquals(9, comment.endLine());
        assertTrue(comment.isRange());
    }

    @Test
    void testClearCommentsEmptiesSession() throws Exception {
        start();
        add("A.java", 1, "one", Priority.LOW);
        add("A.java", 2, "two", Priority.LOW);

        MutationResult<Integer> cleared = manager.clearComments();
        cleared.saved().join();

        assertEquals(2, cleared.value());
        assertEquals(0, manager.getCommentCount());
        assertTrue(Files.readString(artifact("review-main.md")).contains("**Total Comments**: 0"));
    }

    @Test
    void testSessionIsReloadedByNextManager() throws Exception {
        start();
        ReviewComment saved = add("src/A.java", 7, "Persist me", Priority.HIGH);
        manager.close();

        manager = newManager();
        start();

        assertEquals(List.of(saved), manager.getComments());
    }

    @Test
    void testInvalidCommentsAreRejectedWithoutChangingCache() throws Exception {
        start();

        assertEquals(ReviewErrorCode.INVALID_COMMENT, assertThrows(ReviewException.class,
                () -> manager.addComment("A.java", 1, null, "  ", CommentType.ISSUE, Priority.LOW)).getCode());
        assertEquals(ReviewErrorCode.INVALID_COMMENT, assertThrows(ReviewException.class,
                () -> manager.addComment("A.java", 0, null, "text", CommentType.ISSUE, Priority.LOW)).getCode());
        assertEquals(ReviewErrorCode.INVALID_COMMENT, assertThrows(ReviewException.class,
                () -> manager.addComment("A.java", 5, 4, "text", CommentType.ISSUE, Priority.LOW)).getCode());
        assertEquals(ReviewErrorCode.INVALID_COMMENT, assertThrows(ReviewException.class,
                () -> manager.addComment("A.java", 1, null, "text", null, Priority.LOW)).getCode());
        assertEquals(ReviewErrorCode.INVALID_PATH, assertThrows(ReviewException.class,
                () -> manager.addComment("../A.java", 1, null, "text", CommentType.ISSUE, Priority.LOW)).getCode());

        assertEquals(0, manager.getCommentCount());
    }

    @Test
    void testEditUnknownCommentFails() throws Exception {
        start();

        ReviewException e = assertThrows(ReviewException.class,
                () -> manager.editComment("nope", "text", CommentType.ISSUE, Priority.LOW));
        assertEquals(ReviewErrorCode.COMMENT_NOT_FOUND, e.getCode());
    }

    @Test
    void testDeleteUnknownCommentIsNoOp() throws Exception {
        start();
        add("A.java", 1, "one", Priority.LOW);

        MutationResult<Boolean> result = manager.deleteComment("nope");

        assertFalse(result.value());
        assertTrue(result.saved().isDone());
        assertEquals(1, manager.getCommentCount());
    }

    @Test
    void testPersistenceFailureIsReportedAndCacheKept() throws Exception {
        // файл на месте директории ревью делает запись невозможной
        Files.createDirectories(root.resolve(".nts"));
        Files.writeString(root.resolve(".nts/reviews"), "not a directory");
        start();
        reported.clear();

        MutationResult<ReviewComment> result = manager.addComment("A.java", 1, null, "kept", CommentType.ISSUE,
                Priority.HIGH);

        CompletionException e = assertThrows(CompletionException.class, () -> result.saved().join());
        assertInstanceOf(ReviewException.class, e.getCause());
        assertEquals(1, manager.getCommentCount());
        assertEquals(ReviewErrorCode.PERSISTENCE_FAILED, reported.get(0).getCode());
    }

    @Test
    void testMutationsBeforeReadyAreKeptAndSavedAfterInit() throws Exception {
        MutationResult<ReviewComment> early = manager.addComment("A.java", 2, null, "early bird", CommentType.PRAISE,
                Priority.LOW);
        assertNull(manager.getCurrentReviewFile());

        start();
        early.saved().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(early.value()), manager.getComments());
        assertTrue(Files.readString(artifact("review-main.json")).contains("early bird"));
    }

    @Test
    void testExportReviewReturnsReportPath() throws Exception {
        start();
        add("A.java", 1, "one", Priority.LOW);

        String path = manager.exportReview().get(5, TimeUnit.SECONDS);

        assertEquals(".nts/reviews/review-main.md", path);
        assertTrue(Files.readString(root.resolve(path)).contains("**Total Comments**: 1"));
    }

    @Test
    void testFlushWaitsForAllScheduledSaves() throws Exception {
        start();
        for (int i = 1; i <= 20; i++) {
            manager.addComment("A.java", i, null, "comment " + i, CommentType.ISSUE, Priority.MEDIUM);
        }

        manager.flush().get(5, TimeUnit.SECONDS);

        String json = Files.readString(artifact("review-main.json"));
        assertTrue(json.contains("comment 20"));
    }

    @Test
    void testGeneratedIdsAreUnique() throws Exception {
        start();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(manager.addComment("A.java", 1, null, "c" + i, CommentType.ISSUE, Priority.LOW).value().id());
        }

        assertEquals(200, ids.size());
    }

    @Test
    void testSessionSnapshot() throws Exception {
        git.branch("feature/x").branches("master", "feature/x");
        start();
        add("A.java", 1, "one", Priority.LOW);

        ReviewSession session = manager.getSession();

        assertEquals("feature/x", session.branch());
        assertEquals("master", session.baseBranch());
        assertEquals(SessionStatus.IN_PROGRESS, session.status());
        assertNotNull(session.timestamp());
        assertEquals(1, session.comments().size());
    }

    @Test
    void testCorruptedArtifactStartsEmptySession() throws Exception {
        Files.createDirectories(artifact("x").getParent());
        Files.writeString(artifact("review-main.json"), "{ broken");

        start();

        assertEquals(0, manager.getCommentCount());
        assertEquals(ReviewErrorCode.PERSISTENCE_FAILED, reported.get(0).getCode());
    }
}
