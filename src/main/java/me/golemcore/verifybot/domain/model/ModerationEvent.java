package me.golemcore.verifybot.domain.model;

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
 * A platform update reduced to one of the shapes the moderation loop acts on.
 *
 * <p>
 * The kind is decided once, when the raw update is mapped, so each handler
 * receives a narrowly typed payload instead of probing optional fields.
 */
public sealed interface ModerationEvent permits BotMembershipChanged, UserMembershipChanged, MessagePosted {

    /**
     * Sequence number of the update in the stream ({@code update_id}).
     */
    long updateId();

    long groupId();
}
