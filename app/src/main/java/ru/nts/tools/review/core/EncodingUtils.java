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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Утилиты для безопасного чтения текстовых файлов рабочей копии.
 *
 * Основная кодировка UTF-8 (артефакты ревью всегда пишутся в UTF-8).
 * Если содержимое не является валидным UTF-8, кодировка определяется
 * через UniversalDetector (juniversalchardet), чтобы diff не показывал мусор.
 */
public final class EncodingUtils {

    private static final int BINARY_CHECK_LIMIT = 8192;

    private EncodingUtils() {
    }

    /**
     * Результат чтения текстового файла.
     *
     * @param content Содержимое файла в виде строки.
     * @param charset Кодировка, использованная для декодирования байтов.
     */
    public record TextFileContent(String content, Charset charset) {
    }

    /**
     * Считывает полный текст файла за один проход.
     *
     * @param path Путь к целевому файлу.
     * @return Объект {@link TextFileContent} с текстом файла.
     * @throws IOException Если файл недоступен или является бинарным.
     */
    public static TextFileContent readTextFile(Path path) throws IOException {
        return decode(FileUtils.safeReadAllBytes(path), String.valueOf(path.getFileName()));
    }

    /**
     * Декодирует содержимое файла, полученное не с диска (например, версия из HEAD).
     * Кодировка определяется так же, как для рабочей копии, чтобы обе стороны diff совпадали.
     *
     * @param allBytes Байты файла.
     * @param name     Имя файла для сообщения об ошибке.
     * @throws IOException Если содержимое является бинарным.
     */
    public static TextFileContent decode(byte[] allBytes, String name) throws IOException {
        Charset charset = detect(allBytes);
        allBytes = stripUtf8Bom(allBytes, charset);

        int checkLimit = Math.min(allBytes.length, BINARY_CHECK_LIMIT);
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            for (int i = 0; i < checkLimit; i++) {
                if (allBytes[i] == 0) {
                    throw new IOException("Binary file detected (contains NUL bytes): " + name);
                }
            }
        }

        return new TextFileContent(new String(allBytes, charset), charset);
    }

    /**
     * Определяет кодировку массива байтов. UTF-8 по умолчанию.
     */
    static Charset detect(byte[] bytes) {
        if (isValidUtf8(bytes)) {
            return StandardCharsets.UTF_8;
        }

        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String encoding = detector.getDetectedCharset();

        if (encoding != null) {
            try {
                return Charset.forName(encoding);
            } catch (IllegalArgumentException e) {
                ReviewLog.debug("Unsupported detected charset " + encoding + ", using windows-1251");
            }
        }
        // Кириллица без метки - наиболее частый случай невалидного UTF-8
        return Charset.forName("windows-1251");
    }

    private static byte[] stripUtf8Bom(byte[] allBytes, Charset charset) {
        if (charset.equals(StandardCharsets.UTF_8) && allBytes.length >= 3
                && (allBytes[0] & 0xFF) == 0xEF && (allBytes[1] & 0xFF) == 0xBB && (allBytes[2] & 0xFF) == 0xBF) {
            byte[] withoutBom = new byte[allBytes.length - 3];
            System.arraycopy(allBytes, 3, withoutBom, 0, withoutBom.length);
            return withoutBom;
        }
        return allBytes;
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    private static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
