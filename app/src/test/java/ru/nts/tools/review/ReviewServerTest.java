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
package ru.nts.tools.review;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.review.core.ReviewConfig;
import ru.nts.tools.review.model.ChangedFile;
import ru.nts.tools.review.model.FileStatus;
import ru.nts.tools.review.scm.FakeSourceControl;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозной прогон протокола через stdin/stdout.
 */
class ReviewServerTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();

    private List<JsonNode> run(ReviewServer server, String... lines) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        server.serve(new StringReader(String.join("\n", lines) + "\n"), out);

        List<JsonNode> replies = new ArrayList<>();
        for (String line : buffer.toString(StandardCharsets.UTF_8).split("\n")) {
            if (!line.isBlank()) {
                replies.add(mapper.readTree(line));
            }
        }
        return replies;
    }

    @Test
    void testSessionFlowWritesArtifacts() throws Exception {
        Files.writeString(root.resolve("Main.java"), "class Main {\n  void run() {}\n}");
        FakeSourceControl git = new FakeSourceControl()
                .branch("feature/review")
                .changed(new ChangedFile("Main.java", FileStatus.ADDED, true));

        List<JsonNode> replies;
        try (ReviewServer server = new ReviewServer(ReviewConfig.forWorkspace(root), git)) {
            replies = run(server,
                    "{\"command\":\"listFiles\"}",
                    "{\"command\":\"openFile\",\"path\":\"Main.java\"}",
                    "{\"command\":\"addComment\",\"line\":2,\"comment\":\"Method body is empty\",\"type\":\"issue\",\"priority\":\"critical\"}");
        }

        assertEquals(3, replies.size());
        assertEquals("changedFiles", replies.get(0).get("command").asText());
        assertEquals("fileOpened", replies.get(1).get("command").asText());
        assertEquals(3, replies.get(1).get("summary").get("added").asInt());
        assertEquals("commentAdded", replies.get(2).get("command").asText());

        String report = Files.readString(root.resolve(".nts/reviews/review-feature/review.md"));
        assertTrue(report.contains("**Branch**: `feature/review`"));
        assertTrue(report.contains("### CRITICAL-1: 🐛 Issue"));
        assertTrue(report.contains("**Line**: 2  "));
        JsonNode json = mapper.readTree(root.resolve(".nts/reviews/review-feature/review.json").toFile());
        assertEquals("feature/review", json.get("branch").asText());
        assertEquals(1, json.get("comments").size());
    }

    @Test
    void testMalformedLinesDoNotStopTheLoop() throws Exception {
        List<JsonNode> replies;
        try (ReviewServer server = new ReviewServer(ReviewConfig.forWorkspace(root), new FakeSourceControl())) {
            replies = run(server, "not json", "[1,2]", "", "{\"command\":\"exportReview\"}");
        }

        assertEquals(3, replies.size());
        assertEquals("INVALID_MESSAGE", replies.get(0).get("code").asText());
        assertEquals("INVALID_MESSAGE", replies.get(1).get("code").asText());
        assertEquals("reviewExported", replies.get(2).get("command").asText());
    }

    @Test
    void testBackgroundSaveFailureIsSentAsError() throws Exception {
        Files.createDirectories(root.resolve(".nts"));
        Files.writeString(root.resolve(".nts/reviews"), "blocks the reviews directory");
        Files.writeString(root.resolve("A.java"), "class A {}");

        List<JsonNode> replies;
        try (ReviewServer server = new ReviewServer(ReviewConfig.forWorkspace(root), new FakeSourceControl())) {
            replies = run(server,
                    "{\"command\":\"addComment\",\"file\":\"A.java\",\"line\":1,\"comment\":\"x\",\"type\":\"issue\",\"priority\":\"low\"}");
            assertEquals(1, server.getSession().getCommentCount());
        }

        assertTrue(replies.stream().anyMatch(r -> "commentAdded".equals(r.get("command").asText())));
        assertTrue(replies.stream().anyMatch(r -> "PERSISTENCE_FAILED".equals(r.path("code").asText())));
    }
}
