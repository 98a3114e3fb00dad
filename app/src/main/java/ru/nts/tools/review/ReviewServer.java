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
package ru.nts.tools.review;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.review.content.FileContentService;
import ru.nts.tools.review.core.ErrorReporter;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.core.ReviewErrorCode;
import ru.nts.tools.review.core.ReviewException;
import ru.nts.tools.review.core.ReviewLog;
import ru.nts.tools.review.export.ReviewJsonCodec;
import ru.nts.tools.review.export.ReviewReportGenerator;
import ru.nts.tools.review.fs.WorkspaceFileSystem;
import ru.nts.tools.review.panel.ReviewMessageHandler;
import ru.nts.tools.review.repository.JsonCommentRepository;
import ru.nts.tools.review.scm.GitSourceControl;
import ru.nts.tools.review.scm.SourceControl;
import ru.nts.tools.review.session.ReviewSessionManager;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Процесс ревью: читает сообщения панели из stdin построчно и пишет ответы в stdout.
 *
 * Одна строка - один JSON-объект. Сообщения обрабатываются строго последовательно,
 * поэтому мутации кэша применяются в порядке поступления. stdout зарезервирован
 * под протокол: диагностика идет в stderr через {@link ReviewLog}.
 * Ошибки фонового автосохранения доставляются отдельными сообщениями {@code error}.
 */
public class ReviewServer implements AutoCloseable {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ErrorReporter errors = new ErrorReporter();
    private final ReviewSessionManager session;
    private final ReviewMessageHandler handler;

    public ReviewServer(ReviewConfig config, SourceControl sourceControl) {
        WorkspaceFileSystem fileSystem = new WorkspaceFileSystem(config);
        JsonCommentRepository repository = new JsonCommentRepository(fileSystem, new ReviewJsonCodec(mapper));
        this.session = new ReviewSessionManager(config, sourceControl, fileSystem, repository,
                new ReviewReportGenerator(), errors);
        this.handler = new ReviewMessageHandler(session, sourceControl, fileSystem,
                new FileContentService(fileSystem, sourceControl), mapper);
    }

    /**
     * Точка входа. Конфигурация берется из окружения (PROJECT_ROOT, REVIEWS_DIR, REVIEW_GIT_TIMEOUT_MS,
     * REVIEW_DEBUG, REVIEW_LOG_FILE).
     */
    public static void main(String[] args) {
        // Принудительно UTF-8: на Windows потоки по умолчанию в системной кодировке
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));

        ReviewConfig config = ReviewConfig.fromEnvironment();
        ReviewLog.info("Review server starting in " + config.workspaceRoot());

        try (ReviewServer server = new ReviewServer(config, new GitSourceControl(config.workspaceRoot(), config.scmTimeout()));
             Reader in = new InputStreamReader(System.in, StandardCharsets.UTF_8)) {
            server.serve(in, out);
        } catch (IOException e) {
            ReviewLog.error("Error in server loop", e);
        }
    }

    /**
     * Запускает сессию и обрабатывает сообщения до конца входного потока.
     * Перед возвратом дожидается всех запланированных сохранений.
     */
    public void serve(Reader input, PrintStream out) throws IOException {
        Runnable unsubscribe = errors.subscribe(error -> send(out, handler.errorMessage(error)));
        session.initialize();
        try {
            BufferedReader reader = new BufferedReader(input);
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                send(out, process(line));
            }
            session.flush().join();
        } finally {
            unsubscribe.run();
        }
    }

    /**
     * Обрабатывает одну строку протокола.
     */
    ObjectNode process(String line) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            ReviewLog.warn("Malformed message: " + e.getOriginalMessage());
            return handler.errorMessage(new ReviewException(ReviewErrorCode.INVALID_MESSAGE, Map.of(), e));
        }
        if (message == null || !message.isObject()) {
            return handler.errorMessage(new ReviewException(ReviewErrorCode.INVALID_MESSAGE));
        }
        return handler.handle(message);
    }

    public ReviewSessionManager getSession() {
        return session;
    }

    private void send(PrintStream out, ObjectNode message) {
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            ReviewLog.error("Failed to serialize outgoing message", e);
            return;
        }
        synchronized (out) {
            out.println(json);
            out.flush();
        }
    }

    @Override
    public void close() {
        session.close();
    }
}
