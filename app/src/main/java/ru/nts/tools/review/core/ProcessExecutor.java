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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Утилита для безопасного выполнения внешних команд (git).
 *
 * 1. Изоляция: команда выполняется строго в рабочей директории проекта.
 * 2. Безопасность: прямой запуск через ProcessBuilder без shell, цепочки через ';' или '|' невозможны.
 * 3. Стабильность: жесткий лимит времени, по истечении которого процесс принудительно завершается.
 */
public final class ProcessExecutor {

    /**
     * Максимальный объем вывода, сохраняемый в памяти (совпадает с лимитом размера текстового файла).
     */
    public static final int MAX_OUTPUT_BYTES = 10 * 1024 * 1024;

    private ProcessExecutor() {
    }

    /**
     * Выполняет внешнюю команду с заданным таймаутом.
     *
     * @param workingDir     Рабочая директория процесса.
     * @param command        Список аргументов команды. Первый элемент - исполняемый файл.
     * @param timeoutSeconds Максимальное время ожидания в секундах.
     *
     * @return Объект {@link ExecutionResult} с кодом выхода и выводом.
     *
     * @throws IOException          Если процесс не удалось запустить.
     * @throws InterruptedException Если поток был прерван во время ожидания.
     */
    public static ExecutionResult execute(Path workingDir, List<String> command, long timeoutSeconds)
            throws IOException, InterruptedException {
        return execute(workingDir, command, timeoutSeconds, MAX_OUTPUT_BYTES);
    }

    static ExecutionResult execute(Path workingDir, List<String> command, long timeoutSeconds, int maxOutputBytes)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDir.toFile());

        Process process = pb.start();
        process.getOutputStream().close();

        // stdout и stderr читаются раздельно: stdout git show - это содержимое файла
        StreamCollector stdout = new StreamCollector(process.getInputStream(), maxOutputBytes);
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), maxOutputBytes);
        Thread outThread = startDaemon(stdout, "process-stdout");
        Thread errThread = startDaemon(stderr, "process-stderr");

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                outThread.join(TimeUnit.SECONDS.toMillis(1));
                errThread.join(TimeUnit.SECONDS.toMillis(1));
                return new ExecutionResult(-1, stdout.bytes(), "[TIMEOUT_REACHED] " + String.join(" ", command),
                        true, stdout.isTruncated());
            }
            outThread.join();
            errThread.join();
            return new ExecutionResult(process.exitValue(), stdout.bytes(), stderr.text(), false, stdout.isTruncated());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static Thread startDaemon(Runnable task, String name) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Контейнер для результата выполнения внешней команды.
     *
     * @param exitCode    Код выхода процесса (0 - успех, -1 - таймаут).
     * @param outputBytes Стандартный вывод без декодирования (git show отдает файл в его кодировке).
     * @param error       Поток ошибок.
     * @param timedOut    true, если процесс был прерван по таймауту.
     * @param truncated   true, если stdout превысил лимит и был обрезан.
     */
    public record ExecutionResult(int exitCode, byte[] outputBytes, String error, boolean timedOut, boolean truncated) {

        public boolean isSuccess() {
            return exitCode == 0 && !timedOut;
        }

        /**
         * Стандартный вывод в UTF-8 (служебные команды git).
         */
        public String output() {
            return new String(outputBytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Фоновое чтение потока процесса с ограничением объема.
     */
    private static final class StreamCollector implements Runnable {
        private final InputStream in;
        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private boolean truncated;

        StreamCollector(InputStream in, int limit) {
            this.in = in;
            this.limit = limit;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (in) {
                int len;
                while ((len = in.read(chunk)) != -1) {
                    synchronized (buffer) {
                        // поток дочитывается до конца, иначе процесс заблокируется на записи
                        int accepted = Math.min(len, limit - buffer.size());
                        if (accepted < len) {
                            truncated = true;
                        }
                        if (accepted > 0) {
                            buffer.write(chunk, 0, accepted);
                        }
                    }
                }
            } catch (IOException e) {
                // Поток закрывается при destroyForcibly - накопленный вывод остается валидным
                ReviewLog.debug("Process stream closed: " + e.getMessage());
            }
        }

        String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }

        byte[] bytes() {
            synchronized (buffer) {
                return buffer.toByteArray();
            }
        }

        boolean isTruncated() {
            synchronized (buffer) {
                return truncated;
            }
        }
    }
}
