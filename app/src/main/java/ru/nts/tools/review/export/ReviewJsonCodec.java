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
package ru.nts.tools.review.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import ru.nts.tools.review.model.ReviewComment;

import java.util.List;

/**
 * Serializes review sessions to and from the JSON artifact
 * {@code {branch, comments, lastUpdated}}.
 */
public class ReviewJsonCodec {

    private final ObjectMapper mapper;

    public ReviewJsonCodec() {
        this(new ObjectMapper());
    }

    public ReviewJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Renders the artifact text, pretty-printed with two-space indentation.
     */
    public String write(String branch, List<ReviewComment> comments, String lastUpdated) throws JsonProcessingException {
        return mapper.writeValueAsString(new ReviewDocument(branch, comments, lastUpdated));
    }

    /**
     * Parses an artifact previously produced by {@link #write}.
     * A missing {@code comments} field yields an empty list.
     */
    public ReviewDocument read(String json) throws JsonProcessingException {
        ReviewDocument document = mapper.readValue(json, ReviewDocument.class);
        if (document == null) {
            return new ReviewDocument(null, List.of(), null);
        }
        return document;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
