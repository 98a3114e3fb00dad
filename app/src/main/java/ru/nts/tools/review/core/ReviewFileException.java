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

import java.nio.file.Path;
import java.util.Map;

/**
 * Exception for file-system failures (not found, not a file, read/write errors).
 */
public class ReviewFileException extends ReviewException {

    public ReviewFileException(ReviewErrorCode code, String path) {
        super(code, Map.of("path", path));
    }

    public ReviewFileException(ReviewErrorCode code, Path path, Throwable cause) {
        super(code, Map.of("path", path.toString()), cause);
    }

    private ReviewFileException(ReviewErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code, context, cause);
    }

    public static ReviewFileException notFound(String path) {
        return new ReviewFileException(ReviewErrorCode.FILE_NOT_FOUND, path);
    }

    public static ReviewFileException notAFile(String path) {
        return new ReviewFileException(ReviewErrorCode.NOT_A_FILE, path);
    }

    public static ReviewFileException tooLarge(String path, Throwable cause) {
        return new ReviewFileException(ReviewErrorCode.FILE_TOO_LARGE,
                Map.of("path", path, "limit", PathSanitizer.MAX_TEXT_FILE_SIZE), cause);
    }

    public static ReviewFileException readFailed(Path path, Throwable cause) {
        return new ReviewFileException(ReviewErrorCode.FILE_READ_FAILED, path, cause);
    }

    public static ReviewFileException writeFailed(Path path, Throwable cause) {
        return new ReviewFileException(ReviewErrorCode.FILE_WRITE_FAILED, path, cause);
    }
}
