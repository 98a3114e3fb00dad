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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ошибка ядра ревью: код {@link ReviewErrorCode} и контекст (путь, ветка, id комментария).
 * Сообщение форматируется один раз при создании: оно же уходит в ответ панели и в канал ошибок.
 */
public class ReviewException extends RuntimeException {

    private final ReviewErrorCode code;
    private final Map<String, Object> context;

    public ReviewException(ReviewErrorCode code) {
        this(code, Map.of(), null);
    }

    public ReviewException(ReviewErrorCode code, String key, Object value) {
        this(code, Map.of(key, value), null);
    }

    public ReviewException(ReviewErrorCode code, Map<String, Object> context) {
        this(code, context, null);
    }

    public ReviewException(ReviewErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.format(context), cause);
        this.code = code;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ReviewErrorCode getCode() {
        return code;
    }

    public ReviewErrorCode.Category getCategory() {
        return code.getCategory();
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Сессия переживает сбой: комментарии остаются в памяти, ветка заменяется запасной.
     * Так ведут себя недоступный Git, невалидная ветка и несохраненные артефакты.
     */
    public boolean isRecoverable() {
        return code.getCategory() == ReviewErrorCode.Category.SOURCE_CONTROL
                || code == ReviewErrorCode.INVALID_BRANCH_NAME
                || code == ReviewErrorCode.PERSISTENCE_FAILED;
    }

    public String toUserMessage() {
        return getMessage();
    }

    /**
     * Однострочная форма для лога: {@code [CODE] message | key=value | cause=...}.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder("[").append(code.name()).append("] ").append(code.getMessage());
        context.forEach((key, value) -> sb.append(" | ").append(key).append('=').append(value));
        if (getCause() != null) {
            sb.append(" | cause=").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
