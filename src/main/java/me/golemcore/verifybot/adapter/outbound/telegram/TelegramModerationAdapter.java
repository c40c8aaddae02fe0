package me.golemcore.verifybot.adapter.outbound.telegram;

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

import me.golemcore.verifybot.domain.model.MemberPermissions;
import me.golemcore.verifybot.domain.model.MemberStatus;
import me.golemcore.verifybot.domain.model.TelegramUser;
import me.golemcore.verifybot.port.outbound.ChatModerationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatAdministrators;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.groupadministration.RestrictChatMember;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.ChatPermissions;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moderation actions over the Telegram Bot API.
 *
 * <p>
 * Each operation is exactly one request. {@link TelegramApiException} never
 * escapes: failures become {@code false}, {@link Optional#empty()} or an empty
 * list and are logged at debug, leaving the caller to log the outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramModerationAdapter implements ChatModerationPort {

    private final TelegramClient telegramClient;

    @Override
    public Optional<MemberStatus> getChatMemberStatus(long groupId, long userId) {
        GetChatMember request = GetChatMember.builder()
                .chatId(Long.toString(groupId))
                .userId(userId)
                .build();
        try {
            ChatMember member = telegramClient.execute(request);
            if (member == null || member.getStatus() == null) {
                return Optional.empty();
            }
            return Optional.of(MemberStatus.fromApiValue(member.getStatus()));
        } catch (TelegramApiException e) {
            log.debug("[Telegram] getChatMember {} in {} failed: {}", userId, groupId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean restrictChatMember(long groupId, long userId, MemberPermissions permissions) {
        RestrictChatMember request = RestrictChatMember.builder()
                .chatId(Long.toString(groupId))
                .userId(userId)
                .permissions(toChatPermissions(permissions))
                .useIndependentChatPermissions(true)
                .build();
        try {
            return Boolean.TRUE.equals(telegramClient.execute(request));
        } catch (TelegramApiException e) {
            log.debug("[Telegram] restrictChatMember {} in {} failed: {}", userId, groupId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean deleteMessage(long groupId, int messageId) {
        DeleteMessage request = DeleteMessage.builder()
                .chatId(Long.toString(groupId))
                .messageId(messageId)
                .build();
        try {
            return Boolean.TRUE.equals(telegramClient.execute(request));
        } catch (TelegramApiException e) {
            log.debug("[Telegram] deleteMessage {} in {} failed: {}", messageId, groupId, e.getMessage());
            return false;
        }
    }

    @Override
    public List<TelegramUser> getChatAdministrators(long groupId) {
        GetChatAdministrators request = GetChatAdministrators.builder()
                .chatId(Long.toString(groupId))
                .build();
        try {
            List<ChatMember> administrators = telegramClient.execute(request);
            if (administrators == null) {
                return List.of();
            }
            List<TelegramUser> result = new ArrayList<>(administrators.size());
            for (ChatMember administrator : administrators) {
                if (administrator.getUser() != null && administrator.getUser().getId() != null) {
                    result.add(new TelegramUser(
                            administrator.getUser().getId(),
                            administrator.getUser().getUserName(),
                            Boolean.TRUE.equals(administrator.getUser().getIsBot())));
                }
            }
            return result;
        } catch (TelegramApiException e) {
            log.debug("[Telegram] getChatAdministrators {} failed: {}", groupId, e.getMessage());
            return List.of();
        }
    }

    static ChatPermissions toChatPermissions(MemberPermissions permissions) {
        return ChatPermissions.builder()
                .canSendMessages(permissions.isCanSendMessages())
                .canSendAudios(permissions.isCanSendAudios())
                .canSendDocuments(permissions.isCanSendDocuments())
                .canSendPhotos(permissions.isCanSendPhotos())
                .canSendVideos(permissions.isCanSendVideos())
                .canSendVideoNotes(permissions.isCanSendVideoNotes())
                .canSendVoiceNotes(permissions.isCanSendVoiceNotes())
                .canSendPolls(permissions.isCanSendPolls())
                .canSendOtherMessages(permissions.isCanSendOtherMessages())
                .canAddWebPagePreviews(permissions.isCanAddWebPagePreviews())
                .canChangeInfo(permissions.isCanChangeInfo())
                .canInviteUsers(permissions.isCanInviteUsers())
                .canPinMessages(permissions.isCanPinMessages())
                .canManageTopics(permissions.isCanManageTopics())
                .build();
    }
}
