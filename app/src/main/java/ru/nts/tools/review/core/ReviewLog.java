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

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Диагностический лог процесса.
 *
 * stdout зарезервирован под протокол сообщений, поэтому весь вывод идет в stderr
 * и (опционально) в файл, заданный переменной REVIEW_LOG_FILE.
 * Отладочные сообщения подавляются, пока не установлено REVIEW_DEBUG=true.
 */
public final class ReviewLog {

    public enum Level {DEBUG, INFO, WARN, ERROR}

    private static volatile boolean debug = "true".equalsIgnoreCase(System.getenv("REVIEW_DEBUG"));
    private static PrintWriter logWriter = null;

    static {
        String logFile = System.getenv("REVIEW_LOG_FILE");
        if (logFile != null && !logFile.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(logFile, true), true);
            } catch (IOException e) {
                System.err.println("Log file unavailable, falling back to stderr: " + e.getMessage());
            }
        }
    }

    private ReviewLog() {
    }

    /**
     * Включает или выключает отладочный вывод (используется конфигурацией и тестами).
     */
    public static void setDebug(boolean enabled) {
        debug = enabled;
    }

    public static void debug(String message) {
        if (debug) {
            write(Level.DEBUG, message, null);
        }
    }

    public static void info(String message) {
        write(Level.INFO, message, null);
    }

    public static void warn(String message) {
        write(Level.WARN, message, null);
    }

    public static void error(String message, Throwable cause) {
        write(Level.ERROR, message, cause);
    }

    private static synchronized void write(Level level, String message, Throwable cause) {
        String line = "[" + LocalDateTime.now() + "] [" + level + "] [nts-review] " + message
                + (cause != null ? ": " + cause.getMessage() : "");
        if (logWriter != null) {
            logWriter.println(line);
            if (cause != null && debug) {
                cause.printStackTrace(logWriter);
            }
        }
        if (level != Level.DEBUG || debug) {
            System.err.println(line);
            if (cause != null && debug) {
                cause.printStackTrace();
            }
        }
    }
}
