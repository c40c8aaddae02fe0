package me.golemcore.verifybot.adapter.inbound.telegram;

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

import me.golemcore.verifybot.domain.model.BotMembershipChanged;
import me.golemcore.verifybot.domain.model.ChatKind;
import me.golemcore.verifybot.domain.model.MemberStatus;
import me.golemcore.verifybot.domain.model.MessagePosted;
import me.golemcore.verifybot.domain.model.ModerationEvent;
import me.golemcore.verifybot.domain.model.TelegramUser;
import me.golemcore.verifybot.domain.model.UserMembershipChanged;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMemberUpdated;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.Optional;

/**
 * Converts raw Bot API updates into {@link ModerationEvent} values.
 *
 * <p>
 * Updates that carry none of the handled payloads, or lack a field a handler
 * needs, map to {@link Optional#empty()} and are skipped. Mapping never throws.
 */
@Component
@Slf4j
public class TelegramUpdateMapper {

    public Optional<ModerationEvent> map(Update update) {
        if (update == null || update.getUpdateId() == null) {
            log.trace("[Telegram] Skipping update without id");
            return Optional.empty();
        }
        long updateId = update.getUpdateId();
        try {
            if (update.getMyChatMember() != null) {
                return mapBotMembership(updateId, update.getMyChatMember());
            }
            if (update.getChatMember() != null) {
                return mapUserMembership(updateId, update.getChatMember());
            }
            if (update.getMessage() != null) {
                return mapMessage(updateId, update.getMessage());
            }
        } catch (RuntimeException e) {
            log.debug("[Telegram] Skipping malformed update {}: {}", updateId, e.getMessage());
            return Optional.empty();
        }
        log.trace("[Telegram] Update {} carries no handled payload", updateId);
        return Optional.empty();
    }

    private Optional<ModerationEvent> mapBotMembership(long updateId, ChatMemberUpdated changed) {
        Chat chat = changed.getChat();
        MemberStatus newStatus = statusOf(changed.getNewChatMember());
        if (chat == null || chat.getId() == null || newStatus == null) {
            log.trace("[Telegram] Update {}: bot membership change without chat or status", updateId);
            return Optional.empty();
        }
        return Optional.of(new BotMembershipChanged(
                updateId, chat.getId(), ChatKind.fromApiValue(chat.getType()), newStatus));
    }

    private Optional<ModerationEvent> mapUserMembership(long updateId, ChatMemberUpdated changed) {
        Chat chat = changed.getChat();
        ChatMember newMember = changed.getNewChatMember();
        MemberStatus newStatus = statusOf(newMember);
        if (chat == null || chat.getId() == null || newStatus == null
                || newMember.getUser() == null || newMember.getUser().getId() == null) {
            log.trace("[Telegram] Update {}: member change without chat, status or user", updateId);
            return Optional.empty();
        }
        return Optional.of(new UserMembershipChanged(
                updateId,
                chat.getId(),
                ChatKind.fromApiValue(chat.getType()),
                toTelegramUser(newMember.getUser()),
                statusOf(changed.getOldChatMember()),
                newStatus));
    }

    private Optional<ModerationEvent> mapMessage(long updateId, Message message) {
        if (message.getChatId() == null || message.getMessageId() == null
                || message.getFrom() == null || message.getFrom().getId() == null) {
            log.trace("[Telegram] Update {}: message without chat, id or author", updateId);
            return Optional.empty();
        }
        return Optional.of(new MessagePosted(
                updateId, message.getChatId(), message.getMessageId(), message.getFrom().getId()));
    }

    static TelegramUser toTelegramUser(User user) {
        return new TelegramUser(user.getId(), user.getUserName(), Boolean.TRUE.equals(user.getIsBot()));
    }

    private static MemberStatus statusOf(ChatMember member) {
        return member != null ? MemberStatus.fromApiValue(member.getStatus()) : null;
    }
}
