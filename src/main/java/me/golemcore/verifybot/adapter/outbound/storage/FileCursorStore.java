package me.golemcore.verifybot.adapter.outbound.storage;

import me.golemcore.verifybot.domain.model.StorageException;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import me.golemcore.verifybot.port.outbound.CursorPort;
import me.golemcore.verifybot.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Update cursor stored as a single integer text value.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileCursorStore implements CursorPort {

    // getUpdates takes a 32-bit offset of cursor + 1
    static final long MAX_CURSOR = Integer.MAX_VALUE - 1L;

    private final StoragePort storage;
    private final BotProperties properties;

    @Override
    public long load() {
        String content;
        try {
            content = storage.readText(fileName());
        } catch (StorageException e) {
            log.warn("[Storage] Cursor unreadable, starting from 0: {}", e.getMessage());
            return 0;
        }
        if (content == null || content.isBlank()) {
            return 0;
        }
        try {
            long value = Long.parseLong(content.trim());
            if (value > MAX_CURSOR) {
                log.warn("[Storage] Cursor value {} out of range, starting from 0", value);
                return 0;
            }
            return Math.max(value, 0);
        } catch (NumberFormatException e) {
            log.warn("[Storage] Corrupt cursor value '{}', starting from 0", content.trim());
            return 0;
        }
    }

    @Override
    public void store(long updateId) {
        storage.writeTextAtomic(fileName(), Long.toString(updateId));
    }

    private String fileName() {
        return properties.getStorage().getOffsetFile();
    }
}
