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

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Непрозрачные id комментариев: время в base36 плюс случайный суффикс.
 */
public class CommentIdGenerator {

    private static final int SUFFIX_LENGTH = 9;
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final Clock clock;

    public CommentIdGenerator() {
        this(Clock.systemUTC());
    }

    public CommentIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        StringBuilder id = new StringBuilder(Long.toString(clock.millis(), 36));
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
