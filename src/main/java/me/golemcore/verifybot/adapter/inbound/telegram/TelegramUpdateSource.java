
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

package me.golemcore.verifybot.adapter.inbound.telegram;

import me.golemcore.verifybot.domain.model.ModerationEvent;
import me.golemcore.verifybot.domain.model.UpdateBatch;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import me.golemcore.verifybot.port.inbound.UpdateSourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Telegram update source using {@code getUpdates} long polling.
 *
 * <p>
 * Requests {@code offset = cursor + 1}, so the last processed update is never
 * redelivered, with the configured wait bound and update kind filter. On a
 * transport failure or an API error the source logs, pauses for
 * {@code bot.telegram.retry-delay-seconds} and returns an empty batch. An empty
 * successful poll is normal and returns immediately.
 *
 * @see TelegramUpdateMapper
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramUpdateSource implements UpdateSourcePort {

    private final TelegramClient telegramClient;
    private final TelegramUpdateMapper updateMapper;
    private final BotProperties properties;

    @Override
    public UpdateBatch fetch(long cursor) {
        BotProperties.TelegramProperties telegram = properties.getTelegram();
        GetUpdates request = GetUpdates.builder()
                .offset(Math.toIntExact(cursor + 1))
                .timeout(telegram.getPollTimeoutSeconds())
                .allowedUpdates(telegram.getAllowedUpdates())
                .build();

        List<Update> updates;
        try {
            updates = telegramClient.execute(request);
        } catch (TelegramApiRequestException e) {
            log.error("[Telegram] getUpdates returned an error: {} {}", e.getErrorCode(), e.getApiResponse());
            sleepForRetry(telegram.getRetryDelaySeconds());
            return UpdateBatch.empty();
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to fetch updates: {}", e.getMessage());
            sleepForRetry(telegram.getRetryDelaySeconds());
            return UpdateBatch.empty();
        }

        if (updates == null || updates.isEmpty()) {
            log.trace("[Telegram] No updates after {}", cursor);
            return UpdateBatch.empty();
        }
        return toBatch(updates);
    }

    private UpdateBatch toBatch(List<Update> updates) {
        List<Update> ordered = new ArrayList<>(updates);
        ordered.removeIf(update -> update == null || update.getUpdateId() == null);
        ordered.sort(Comparator.comparing(Update::getUpdateId));
        if (ordered.isEmpty()) {
            return UpdateBatch.empty();
        }

        List<ModerationEvent> events = new ArrayList<>(ordered.size());
        for (Update update : ordered) {
            updateMapper.map(update).ifPresent(events::add);
        }
        long lastUpdateId = ordered.get(ordered.size() - 1).getUpdateId();
        log.debug("[Telegram] Fetched {} updates ({} handled), last id {}",
                ordered.size(), events.size(), lastUpdateId);
        return new UpdateBatch(events, lastUpdateId);
    }

    void sleepForRetry(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
