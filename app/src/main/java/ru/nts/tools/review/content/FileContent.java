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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Текст файла для просмотра и пара версий для диффа.
 *
 * @param content Текущее содержимое рабочей копии (пусто для удаленного файла).
 * @param diff    Исходная и измененная версии.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileContent(String content, DiffContent diff) {

    /**
     * @param original Версия из HEAD или пустая строка для нового файла.
     * @param modified Версия рабочей копии или пустая строка для удаленного файла.
     */
    public record DiffContent(String original, String modified) {
    }
}
