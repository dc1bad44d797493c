/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.zenbot.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Port for file storage inside the local workspace, organized by directory.
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} if the file does
     * not exist.
     *
     * @param directory
     *            subdirectory (e.g., "reminders")
     * @param path
     *            relative path within directory
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Atomically write text content to file with optional backup.
     *
     * <p>
     * Writes to a temp file first, then renames over the target so readers
     * never observe a partial file.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
