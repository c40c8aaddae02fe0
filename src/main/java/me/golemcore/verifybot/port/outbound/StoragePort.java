package me.golemcore.verifybot.port.outbound;

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

/**
 * Port for the shared state files in the workspace directory. The same files
 * are read and appended to by the web admin surface, so every write replaces
 * the whole file atomically.
 */
public interface StoragePort {

    /**
     * Read text content of a file.
     *
     * @return file content, or {@code null} if the file does not exist
     */
    String readText(String fileName);

    /**
     * Atomically replace file content.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     * Failed attempts are retried up to {@code bot.storage.write-attempts}
     * times.
     *
     * @throws me.golemcore.verifybot.domain.model.StorageException
     *             if every attempt failed
     */
    void writeTextAtomic(String fileName, String content);
}
