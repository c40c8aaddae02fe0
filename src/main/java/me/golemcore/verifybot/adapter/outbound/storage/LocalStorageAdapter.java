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

package me.golemcore.verifybot.adapter.outbound.storage;

import me.golemcore.verifybot.domain.model.StorageException;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import me.golemcore.verifybot.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Holds the files shared with the web admin surface in a single directory:
 * <ul>
 * <li>groups_list.inc - group registry
 * <li>restricted_users.inc - restriction ledger
 * <li>telegram_offset.inc - update cursor
 * </ul>
 *
 * <p>
 * Base path configured via {@code bot.storage.base-path}, defaults to
 * {@code ${user.home}/.verifybot}.
 *
 * @see me.golemcore.verifybot.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final BotProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory {}", basePath, e);
        }
    }

    @Override
    public String readText(String fileName) {
        Path filePath = resolvePath(fileName);
        if (!Files.exists(filePath)) {
            return null;
        }
        try {
            return Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read file: " + fileName, e);
        }
    }

    @Override
    public void writeTextAtomic(String fileName, String content) {
        BotProperties.StorageProperties storage = properties.getStorage();
        int attempts = Math.max(1, storage.getWriteAttempts());
        IOException lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                writeOnce(resolvePath(fileName), content);
                log.debug("[Storage] Atomic write completed: {}", fileName);
                return;
            } catch (IOException e) {
                lastError = e;
                log.warn("[Storage] Write of {} failed (attempt {}/{}): {}",
                        fileName, attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    sleepForRetry(storage.getWriteRetryDelayMillis());
                }
            }
        }
        throw new StorageException("Atomic write failed: " + fileName, lastError);
    }

    private void writeOnce(Path targetPath, String content) throws IOException {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // 1. Write to temp file with fsync
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            // 2. Verify written content is readable
            if (Files.size(tempPath) != bytes.length) {
                throw new IOException("Verification failed: size mismatch");
            }

            // 3. Atomic rename
            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw e;
        }
    }

    void sleepForRetry(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    Path getBasePath() {
        return basePath;
    }

    private Path resolvePath(String fileName) {
        Path resolved = basePath.resolve(fileName).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + fileName);
        }
        return resolved;
    }
}
