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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Канал ошибок для хоста.
 *
 * Любой сбой, который ядро переживает без прерывания операции (запись артефактов,
 * недоступный Git, невалидная ветка), логируется и доставляется всем подписчикам.
 * Исключение в подписчике не влияет на остальных.
 */
public class ErrorReporter {

    /**
     * Подписчик канала ошибок.
     */
    @FunctionalInterface
    public interface Listener {
        void onError(ReviewException error);
    }

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Регистрирует подписчика. Возвращает действие для отписки.
     */
    public Runnable subscribe(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Сообщает о структурированной ошибке.
     */
    public void report(ReviewException error) {
        if (error.isRecoverable()) {
            ReviewLog.warn(error.toLogMessage());
        } else {
            ReviewLog.error(error.toLogMessage(), error.getCause());
        }
        for (Listener listener : listeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                ReviewLog.error("Error listener failed", e);
            }
        }
    }

    /**
     * Оборачивает произвольный сбой в ошибку с указанным кодом и сообщает о ней.
     */
    public ReviewException report(ReviewErrorCode code, String key, Object value, Throwable cause) {
        ReviewException error = cause instanceof ReviewException re
                ? re
                : new ReviewException(code, Map.of(key, value), cause);
        report(error);
        return error;
    }
}
