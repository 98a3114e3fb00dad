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
package ru.nts.tools.review.diff;

import ru.nts.tools.review.core.ReviewLog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Построчное сравнение исходной и измененной версии текста.
 *
 * Это эвристика за один проход, а не минимальный скрипт правок (LCS):
 * строки с повторяющимся содержимым могут сопоставиться не с тем вхождением,
 * перемещенные блоки отображаются как пары удаление+добавление.
 * Результат используется только для подсветки и привязки комментариев к строкам.
 */
public final class DiffEngine {

    /**
     * Запас итераций сверх суммы длин обоих текстов.
     */
    private static final int ITERATION_MARGIN = 100;

    private DiffEngine() {
    }

    /**
     * Классифицирует строки двух текстов как unchanged/added/removed.
     *
     * @param original Исходный текст (например, HEAD).
     * @param modified Измененный текст (рабочая копия).
     *
     * @return Последовательность строк в порядке отображения.
     */
    public static List<DiffLine> computeDiff(String original, String modified) {
        String oldText = original == null ? "" : original;
        String newText = modified == null ? "" : modified;

        if (oldText.isEmpty() && newText.isEmpty()) {
            return List.of();
        }

        if (oldText.isEmpty()) {
            String[] lines = splitLines(newText);
            List<DiffLine> result = new ArrayList<>(lines.length);
            for (int i = 0; i < lines.length; i++) {
                result.add(DiffLine.added(lines[i], i + 1));
            }
            return result;
        }

        if (newText.isEmpty()) {
            String[] lines = splitLines(oldText);
            List<DiffLine> result = new ArrayList<>(lines.length);
            for (int i = 0; i < lines.length; i++) {
                result.add(DiffLine.removed(lines[i], i + 1));
            }
            return result;
        }

        String[] originalLines = splitLines(oldText);
        String[] modifiedLines = splitLines(newText);
        Set<String> originalSet = new HashSet<>(Arrays.asList(originalLines));
        Set<String> modifiedSet = new HashSet<>(Arrays.asList(modifiedLines));

        List<DiffLine> diff = new ArrayList<>(Math.max(originalLines.length, modifiedLines.length));
        int oldIndex = 0;
        int newIndex = 0;
        int iterations = 0;
        int maxIterations = originalLines.length + modifiedLines.length + ITERATION_MARGIN;

        while (oldIndex < originalLines.length || newIndex < modifiedLines.length) {
            if (++iterations > maxIterations) {
                ReviewLog.warn("Diff computation exceeded " + maxIterations + " iterations, returning partial result");
                break;
            }

            String oldLine = oldIndex < originalLines.length ? originalLines[oldIndex] : null;
            String newLine = newIndex < modifiedLines.length ? modifiedLines[newIndex] : null;

            if (oldLine != null && oldLine.equals(newLine)) {
                diff.add(DiffLine.unchanged(oldLine, oldIndex + 1, newIndex + 1));
                oldIndex++;
                newIndex++;
            } else if (oldLine != null && !modifiedSet.contains(oldLine)) {
                diff.add(DiffLine.removed(oldLine, oldIndex + 1));
                oldIndex++;
            } else if (newLine != null && !originalSet.contains(newLine)) {
                diff.add(DiffLine.added(newLine, newIndex + 1));
                newIndex++;
            } else {
                // Обе строки встречаются в другом тексте, но не на курсоре: пара замены
                if (oldLine != null) {
                    diff.add(DiffLine.removed(oldLine, oldIndex + 1));
                    oldIndex++;
                }
                if (newLine != null) {
                    diff.add(DiffLine.added(newLine, newIndex + 1));
                    newIndex++;
                }
            }
        }

        ReviewLog.debug("Diff computed: " + originalLines.length + " -> " + modifiedLines.length
                + " lines, " + diff.size() + " diff lines");
        return diff;
    }

    /**
     * Подсчитывает количество строк каждого типа.
     */
    public static DiffSummary summarize(List<DiffLine> lines) {
        int added = 0;
        int removed = 0;
        int unchanged = 0;
        for (DiffLine line : lines) {
            switch (line.type()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new DiffSummary(added, removed, unchanged);
    }

    /**
     * Разбивает текст по '\n', сохраняя завершающие пустые сегменты.
     */
    static String[] splitLines(String text) {
        return text.split("\n", -1);
    }
}
