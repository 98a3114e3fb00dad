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

import java.util.concurrent.CompletableFuture;

/**
 * Результат мутации: значение доступно сразу, запись на диск завершится позже.
 *
 * @param value Результат операции над кэшем.
 * @param saved Фоновое автосохранение. Завершается с ошибкой, если артефакты не записались;
 *              сама мутация в кэше при этом остается.
 */
public record MutationResult<T>(T value, CompletableFuture<Void> saved) {

    /**
     * Мутация, не потребовавшая сохранения.
     */
    public static <T> MutationResult<T> unchanged(T value) {
        return new MutationResult<>(value, CompletableFuture.completedFuture(null));
    }
}
