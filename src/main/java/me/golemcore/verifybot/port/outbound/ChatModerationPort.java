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

import me.golemcore.verifybot.domain.model.MemberPermissions;
import me.golemcore.verifybot.domain.model.MemberStatus;
import me.golemcore.verifybot.domain.model.TelegramUser;

import java.util.List;
import java.util.Optional;

/**
 * Outbound moderation actions on the chat platform.
 *
 * <p>
 * Every call is a single request with no internal retry. Failures are reported
 * through the return value, never thrown; the caller decides whether they
 * matter.
 */
public interface ChatModerationPort {

    /**
     * Current status of a member, fetched from the platform.
     *
     * @return the status, or empty if the request failed
     */
    Optional<MemberStatus> getChatMemberStatus(long groupId, long userId);

    /**
     * @return {@code true} if the platform confirmed the restriction
     */
    boolean restrictChatMember(long groupId, long userId, MemberPermissions permissions);

    /**
     * @return {@code true} if the platform confirmed the deletion
     */
    boolean deleteMessage(long groupId, int messageId);

    /**
     * @return administrators of the group, empty if the request failed
     */
    List<TelegramUser> getChatAdministrators(long groupId);
}
