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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Чтение рабочей копии в разных кодировках.
 */
class EncodingUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testUtf8IsReadAsIs() throws IOException {
        Path file = tempDir.resolve("utf8.txt");
        Files.writeString(file, "Привет, ревью!\nline 2", StandardCharsets.UTF_8);

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);

        assertEquals(StandardCharsets.UTF_8, content.charset());
        assertEquals("Привет, ревью!\nline 2", content.content());
    }

    @Test
    void testUtf8BomIsStripped() throws IOException {
        Path file = tempDir.resolve("bom.txt");
        byte[] text = "class A {}".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[text.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(text, 0, withBom, 3, text.length);
        Files.write(file, withBom);

        assertEquals("class A {}", EncodingUtils.readTextFile(file).content());
    }

    @Test
    void testCyrillicWindows1251IsDecoded() throws IOException {
        Path file = tempDir.resolve("cp1251.txt");
        String text = "Прекрасный солнечный день в Москве. Комментарий к строке кода.";
        Files.write(file, text.getBytes(Charset.forName("windows-1251")));

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);

        assertEquals(text, content.content());
    }

    @Test
    void testBinaryFileIsRejected() throws IOException {
        Path file = tempDir.resolve("image.bin");
        Files.write(file, new byte[]{'P', 'N', 'G', 0, 1, 2});

        assertThrows(IOException.class, () -> EncodingUtils.readTextFile(file));
    }

    @Test
    void testEmptyFileIsUtf8() throws IOException {
        Path file = tempDir.resolve("empty.txt");
        Files.write(file, new byte[0]);

        assertEquals("", EncodingUtils.readTextFile(file).content());
    }
}
