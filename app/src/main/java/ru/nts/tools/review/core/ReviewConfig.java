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
package ru.nts.tools.review.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Конфигурация процесса ревью.
 *
 * В рабочем режиме читается из переменных окружения (как PROJECT_ROOT у MCP-сервера),
 * в тестах создается напрямую через конструктор.
 *
 * @param workspaceRoot  Абсолютный корень рабочей директории.
 * @param reviewsDir     Путь к директории артефактов ревью относительно корня.
 * @param scmTimeout     Максимальное ожидание готовности системы контроля версий.
 * @param scmPollInterval Интервал опроса готовности системы контроля версий.
 */
public record ReviewConfig(Path workspaceRoot, String reviewsDir, Duration scmTimeout, Duration scmPollInterval) {

    public static final String DEFAULT_REVIEWS_DIR = ".nts/reviews";
    public static final String FALLBACK_BRANCH = "main";
    public static final Duration DEFAULT_SCM_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SCM_POLL_INTERVAL = Duration.ofMillis(100);

    public ReviewConfig {
        workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        if (reviewsDir == null || reviewsDir.isBlank()) {
            reviewsDir = DEFAULT_REVIEWS_DIR;
        }
        if (scmTimeout == null || scmTimeout.isNegative()) {
            scmTimeout = DEFAULT_SCM_TIMEOUT;
        }
        if (scmPollInterval == null || scmPollInterval.isZero() || scmPollInterval.isNegative()) {
            scmPollInterval = DEFAULT_SCM_POLL_INTERVAL;
        }
    }

    /**
     * Конфигурация со значениями по умолчанию для указанного корня.
     */
    public static ReviewConfig forWorkspace(Path workspaceRoot) {
        return new ReviewConfig(workspaceRoot, DEFAULT_REVIEWS_DIR, DEFAULT_SCM_TIMEOUT, DEFAULT_SCM_POLL_INTERVAL);
    }

    /**
     * Собирает конфигурацию из окружения процесса.
     * PROJECT_ROOT, REVIEWS_DIR, REVIEW_GIT_TIMEOUT_MS, REVIEW_DEBUG.
     */
    public static ReviewConfig fromEnvironment() {
        String projectRoot = System.getenv("PROJECT_ROOT");
        Path root = projectRoot != null && !projectRoot.isBlank()
                ? Paths.get(projectRoot)
                : Paths.get(".");

        Duration timeout = DEFAULT_SCM_TIMEOUT;
        String timeoutMs = System.getenv("REVIEW_GIT_TIMEOUT_MS");
        if (timeoutMs != null && !timeoutMs.isBlank()) {
            try {
                timeout = Duration.ofMillis(Long.parseLong(timeoutMs.trim()));
            } catch (NumberFormatException e) {
                ReviewLog.warn("Ignoring invalid REVIEW_GIT_TIMEOUT_MS: " + timeoutMs);
            }
        }

        if ("true".equalsIgnoreCase(System.getenv("REVIEW_DEBUG"))) {
            ReviewLog.setDebug(true);
        }

        return new ReviewConfig(root, System.getenv("REVIEWS_DIR"), timeout, DEFAULT_SCM_POLL_INTERVAL);
    }
}
