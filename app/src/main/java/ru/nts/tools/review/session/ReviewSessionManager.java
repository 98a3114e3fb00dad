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

import ru.nts.tools.review.core.ErrorReporter;
import ru.nts.tools.review.core.PathSanitizer;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.export.ReviewReportGenerator;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.model.CommentType;
import ru.nts.tools.review.model.Priority;
import ru.nts.tools.review.model.ReviewComment;
import ru.nts.tools.review.model.ReviewSession;
import ru.nts.tools.review.model.SessionStatus;
import ru.nts.tools.review.repository.JsonCommentRepository;
import ru.nts.tools.review.scm.SourceControl;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Сессия ревью текущей ветки.
 *
 * Связывает репозиторий комментариев с артефактами {@code review-<branch>.md} и
 * {@code review-<branch>.json}. Мутации применяются к кэшу синхронно в порядке вызова,
 * после каждой оба артефакта целиком перегенерируются на единственном фоновом потоке.
 * Ошибки записи уходят в {@link ErrorReporter}, кэш не откатывается.
 *
 * <pre>
 * UNINITIALIZED -> LOADING -> READY
 * </pre>
 *
 * Мутации до READY принимаются, их автосохранение ждет окончания инициализации.
 */
public class ReviewSessionManager implements AutoCloseable {

    private static final String REPORT_PREFIX = "review-";

    private final ReviewConfig config;
    private final SourceControl sourceControl;
    private final WorkspaceFileSystem fileSystem;
    private final JsonCommentRepository repository;
    private final ReviewReportGenerator reportGenerator;
    private final ErrorReporter errors;
    private final CommentIdGenerator idGenerator;
    private final Clock clock;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "review-autosave");
        thread.setDaemon(true);
        return thread;
    });

    private final CompletableFuture<Void> ready = new CompletableFuture<>();

    private volatile SessionState state = SessionState.UNINITIALIZED;
    private volatile String branch;
    private volatile String baseBranch = ReviewConfig.FALLBACK_BRANCH;
    private volatile String startedAt;

    // цепочка всех запланированных сохранений, для flush()
    private CompletableFuture<Void> pendingSaves = CompletableFuture.completedFuture(null);

    public ReviewSessionManager(ReviewConfig config,
                                SourceControl sourceControl,
                                WorkspaceFileSystem fileSystem,
                                JsonCommentRepository repository,
                                ReviewReportGenerator reportGenerator,
                                ErrorReporter errors) {
        this(config, sourceControl, fileSystem, repository, reportGenerator, errors,
                new CommentIdGenerator(), Clock.systemUTC());
    }

    public ReviewSessionManager(ReviewConfig config,
                                SourceControl sourceControl,
                                WorkspaceFileSystem fileSystem,
                                JsonCommentRepository repository,
                                ReviewReportGenerator reportGenerator,
                                ErrorReporter errors,
                                CommentIdGenerator idGenerator,
                                Clock clock) {
        this.config = config;
        this.sourceControl = sourceControl;
        this.fileSystem = fileSystem;
        this.repository = repository;
        this.reportGenerator = reportGenerator;
        this.errors = errors;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Запускает определение ветки и загрузку сессии в фоне.
     * Повторный вызов возвращает тот же future. Future никогда не завершается с ошибкой:
     * любой сбой сообщается в канал ошибок, сессия продолжает работу на безопасном значении.
     */
    public synchronized CompletableFuture<Void> initialize() {
        if (state != SessionState.UNINITIALIZED) {
            return ready;
        }
        state = SessionState.LOADING;
        startedAt = Instant.now(clock).toString();
        worker.execute(() -> {
            try {
                branch = resolveBranch();
                baseBranch = resolveBaseBranch();
                loadSession();
            } catch (RuntimeException e) {
                errors.report(ReviewErrorCode.INTERNAL_ERROR, "operation", "initialize", e);
                if (branch == null) {
                    branch = ReviewConfig.FALLBACK_BRANCH;
                }
            } finally {
                state = SessionState.READY;
                ReviewLog.info("Review session ready: branch=" + branch + ", comments=" + repository.count());
                ready.complete(null);
            }
        });
        return ready;
    }

    // ============ Mutations ============

    /**
     * Добавляет комментарий к строке (или диапазону строк) файла.
     *
     * @throws ReviewException INVALID_COMMENT или INVALID_PATH; кэш при этом не меняется.
     */
    public MutationResult<ReviewComment> addComment(String file, int line, Integer endLine,
                                                    String text, CommentType type, Priority priority) {
        if (file == null || file.isBlank()) {
            throw new ReviewException(ReviewErrorCode.INVALID_COMMENT, Map.of("reason", "file is required"));
        }
        fileSystem.resolve(file);
        validateContent(text, type, priority);
        if (line < 1 || (endLine != null && endLine < line)) {
            throw new ReviewException(ReviewErrorCode.INVALID_COMMENT,
                    Map.of("line", line, "endLine", String.valueOf(endLine)));
        }
        ReviewComment comment = new ReviewComment(nextUniqueId(), file, line, endLine, text, type, priority,
                Instant.now(clock).toString());
        repository.save(comment);
        ReviewLog.debug("Comment added: " + comment.id() + " at " + file + ":" + line);
        return new MutationResult<>(comment, scheduleSave());
    }

    /**
     * Заменяет текст, тип и приоритет комментария. Id, файл и якорь сохраняются.
     *
     * @throws ReviewException COMMENT_NOT_FOUND для неизвестного id.
     */
    public MutationResult<ReviewComment> editComment(String id, String text, CommentType type, Priority priority) {
        validateContent(text, type, priority);
        ReviewComment existing = repository.findById(id)
                .orElseThrow(() -> new ReviewException(ReviewErrorCode.COMMENT_NOT_FOUND, "commentId", String.valueOf(id)));
        ReviewComment updated = existing.withContent(text, type, priority, Instant.now(clock).toString());
        if (!repository.update(updated)) {
            throw new ReviewException(ReviewErrorCode.COMMENT_NOT_FOUND, "commentId", id);
        }
        ReviewLog.debug("Comment updated: " + id);
        return new MutationResult<>(updated, scheduleSave());
    }

    /**
     * Удаляет комментарий. Для неизвестного id возвращает false и ничего не сохраняет.
     */
    public MutationResult<Boolean> deleteComment(String id) {
        if (!repository.delete(id)) {
            return MutationResult.unchanged(false);
        }
        ReviewLog.debug("Comment deleted: " + id);
        return new MutationResult<>(true, scheduleSave());
    }

    /**
     * Удаляет все комментарии сессии.
     *
     * @return количество удаленных комментариев.
     */
    public MutationResult<Integer> clearComments() {
        int removed = repository.count();
        repository.clear();
        ReviewLog.info("Cleared " + removed + " comments");
        return new MutationResult<>(removed, scheduleSave());
    }

    /**
     * Принудительно перегенерирует артефакты.
     *
     * @return future с путем markdown-отчета.
     */
    public CompletableFuture<String> exportReview() {
        return scheduleSave().thenApply(v -> getCurrentReviewFile());
    }

    /**
     * Завершается после всех сохранений, запланированных к моменту вызова.
     * Ошибки отдельных сохранений не пробрасываются.
     */
    public synchronized CompletableFuture<Void> flush() {
        return pendingSaves;
    }

    // ============ Reads ============

    public List<ReviewComment> getComments() {
        return repository.findAll();
    }

    public List<ReviewComment> getCommentsForFile(String file) {
        return repository.findByFile(file);
    }

    public int getCommentCount() {
        return repository.count();
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Ветка сессии; null до завершения инициализации.
     */
    public String getBranch() {
        return branch;
    }

    /**
     * Путь markdown-отчета относительно корня; null до завершения инициализации.
     */
    public String getCurrentReviewFile() {
        String current = branch;
        return current == null ? null : fileSystem.reviewArtifact(REPORT_PREFIX + current + ".md");
    }

    public ReviewSession getSession() {
        return new ReviewSession(branch, baseBranch, startedAt, SessionStatus.IN_PROGRESS, repository.findAll());
    }

    /**
     * Дожидается запланированных сохранений и останавливает фоновый поток.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(config.scmTimeout().toMillis() + 5000, TimeUnit.MILLISECONDS)) {
                ReviewLog.warn("Auto-save worker did not finish in time");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ============ Internals ============

    /**
     * Ждет готовности VCS с ограниченным опросом. При таймауте, сбое или невалидном
     * имени возвращает резервную ветку.
     */
    private String resolveBranch() {
        long deadline = System.nanoTime() + config.scmTimeout().toNanos();
        while (!sourceControl.isReady()) {
            if (System.nanoTime() >= deadline) {
                errors.report(new ReviewException(ReviewErrorCode.SCM_UNAVAILABLE));
                return ReviewConfig.FALLBACK_BRANCH;
            }
            try {
                Thread.sleep(config.scmPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ReviewConfig.FALLBACK_BRANCH;
            }
        }

        String rawBranch;
        try {
            rawBranch = sourceControl.getCurrentBranch();
        } catch (ReviewException e) {
            errors.report(e);
            return ReviewConfig.FALLBACK_BRANCH;
        }

        try {
            return PathSanitizer.validateBranchName(rawBranch);
        } catch (ReviewException e) {
            errors.report(e);
            return ReviewConfig.FALLBACK_BRANCH;
        }
    }

    private String resolveBaseBranch() {
        try {
            List<String> branches = sourceControl.getBranchList();
            if (!branches.contains(ReviewConfig.FALLBACK_BRANCH) && branches.contains("master")) {
                return "master";
            }
        } catch (ReviewException e) {
            ReviewLog.debug("Branch list unavailable: " + e.getMessage());
        }
        return ReviewConfig.FALLBACK_BRANCH;
    }

    /**
     * Загружает сохраненную сессию ветки. Комментарии, добавленные до готовности,
     * дописываются поверх загруженных.
     */
    private void loadSession() {
        boolean loaded;
        synchronized (repository) {
            List<ReviewComment> early = repository.findAll();
            try {
                loaded = repository.loadFromFile(branch);
            } catch (ReviewException e) {
                errors.report(e);
                repository.clear();
                loaded = false;
            }
            for (ReviewComment comment : early) {
                repository.save(comment);
            }
        }
        if (!loaded) {
            try {
                writeArtifacts();
            } catch (ReviewException e) {
                errors.report(e);
            }
        }
    }

    private synchronized CompletableFuture<Void> scheduleSave() {
        CompletableFuture<Void> save = ready.thenRunAsync(() -> {
            try {
                writeArtifacts();
            } catch (ReviewException e) {
                errors.report(e);
                throw new CompletionException(e);
            }
        }, worker);
        pendingSaves = CompletableFuture.allOf(pendingSaves, save.exceptionally(t -> null));
        return save;
    }

    /**
     * Перегенерирует оба артефакта из всей текущей коллекции.
     */
    private void writeArtifacts() {
        String reportPath = getCurrentReviewFile();
        try {
            repository.saveToFile(branch);
            String report = reportGenerator.generateReport(repository.findAll(), branch);
            fileSystem.write(reportPath, report);
        } catch (ReviewException e) {
            if (e.getCode() == ReviewErrorCode.PERSISTENCE_FAILED) {
                throw e;
            }
            throw new ReviewException(ReviewErrorCode.PERSISTENCE_FAILED, Map.of("path", reportPath), e);
        } catch (RuntimeException e) {
            throw new ReviewException(ReviewErrorCode.PERSISTENCE_FAILED, Map.of("path", reportPath), e);
        }
    }

    private void validateContent(String text, CommentType type, Priority priority) {
        if (text == null || text.isBlank()) {
            throw new ReviewException(ReviewErrorCode.INVALID_COMMENT, Map.of("reason", "comment text is empty"));
        }
        if (type == null || priority == null) {
            throw new ReviewException(ReviewErrorCode.INVALID_COMMENT, Map.of("reason", "type and priority are required"));
        }
    }

    private String nextUniqueId() {
        String id = idGenerator.nextId();
        while (repository.findById(id).isPresent()) {
            id = idGenerator.nextId();
        }
        return id;
    }
}
