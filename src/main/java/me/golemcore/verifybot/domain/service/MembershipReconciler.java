package me.golemcore.verifybot.domain.service;

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
import me.golemcore.verifybot.domain.model.MemberPermissions;
import me.golemcore.verifybot.domain.model.MemberStatus;
import me.golemcore.verifybot.domain.model.MessagePosted;
import me.golemcore.verifybot.domain.model.ModerationEvent;
import me.golemcore.verifybot.domain.model.ReconciliationState;
import me.golemcore.verifybot.domain.model.TelegramUser;
import me.golemcore.verifybot.domain.model.UserMembershipChanged;
import me.golemcore.verifybot.domain.model.VerifiedIdentity;
import me.golemcore.verifybot.port.outbound.ChatModerationPort;
import me.golemcore.verifybot.port.outbound.GroupRegistryPort;
import me.golemcore.verifybot.port.outbound.RestrictionLedgerPort;
import me.golemcore.verifybot.port.outbound.VerificationOraclePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decides, for each moderation event, which registry/ledger mutations and
 * platform actions to apply.
 *
 * <p>
 * Handlers by event kind:
 * <ul>
 * <li>{@link BotMembershipChanged} - register the group when the bot becomes
 * member or administrator, drop it when the bot is kicked or leaves</li>
 * <li>{@link MessagePosted} - delete the message when the group opted in and
 * the author is in the restriction ledger</li>
 * <li>{@link UserMembershipChanged} - first, a {@code restricted} status
 * confirms a pending restriction and clears the ledger entry; then, a new join
 * of an unverified user who is still a member gets restricted</li>
 * </ul>
 *
 * <p>
 * Every handler is safe to re-run for a redelivered event. Actuator failures
 * are logged and never retried. An unreachable verification store propagates
 * as {@link me.golemcore.verifybot.domain.model.OracleUnavailableException}
 * because the reconciler refuses to guess a user's verification state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipReconciler {

    private final GroupRegistryPort groupRegistry;
    private final RestrictionLedgerPort restrictionLedger;
    private final ChatModerationPort moderation;
    private final VerificationOraclePort verificationOracle;

    public void reconcile(ModerationEvent event, ReconciliationState state) {
        if (event instanceof BotMembershipChanged botChange) {
            handleBotMembership(botChange, state);
        } else if (event instanceof MessagePosted message) {
            handleMessage(message, state);
        } else if (event instanceof UserMembershipChanged memberChange) {
            handleRestrictionConfirmed(memberChange, state);
            handleJoin(memberChange, state);
        }
    }

    private void handleBotMembership(BotMembershipChanged event, ReconciliationState state) {
        long groupId = event.groupId();
        if (event.chatKind() == ChatKind.PRIVATE) {
            log.trace("[Moderation] Update {}: ignoring bot status in private chat {}", event.updateId(), groupId);
            return;
        }

        MemberStatus status = event.newStatus();
        if (status == MemberStatus.MEMBER || status == MemberStatus.ADMINISTRATOR) {
            if (groupRegistry.putIfAbsent(groupId, false)) {
                log.info("[Moderation] Added group {} to groups list", groupId);
            } else {
                log.trace("[Moderation] Group {} already registered", groupId);
            }
            state.registerGroup(groupId);
        } else if (status.isGone()) {
            if (groupRegistry.remove(groupId)) {
                log.info("[Moderation] Removed group {} from groups list", groupId);
            } else {
                log.trace("[Moderation] Group {} was not registered", groupId);
            }
            state.removeGroup(groupId);
        } else {
            log.trace("[Moderation] Update {}: bot status {} in {} needs no change",
                    event.updateId(), status, groupId);
        }
    }

    private void handleMessage(MessagePosted event, ReconciliationState state) {
        long groupId = event.groupId();
        long authorId = event.authorId();
        if (!state.isDeleteEnabled(groupId)) {
            log.trace("[Moderation] Update {}: message deletion disabled for {}", event.updateId(), groupId);
            return;
        }
        if (!state.isRestricted(authorId)) {
            log.trace("[Moderation] Update {}: author {} not in restriction ledger", event.updateId(), authorId);
            return;
        }

        if (moderation.deleteMessage(groupId, event.messageId())) {
            log.info("[Moderation] Deleted message {} from restricted user {} in chat {}",
                    event.messageId(), authorId, groupId);
        } else {
            log.warn("[Moderation] Failed to delete message {} from restricted user {} in chat {}",
                    event.messageId(), authorId, groupId);
        }
    }

    private void handleRestrictionConfirmed(UserMembershipChanged event, ReconciliationState state) {
        if (event.newStatus() != MemberStatus.RESTRICTED) {
            return;
        }
        long userId = event.subject().id();
        if (!state.isRestricted(userId)) {
            log.trace("[Moderation] Update {}: restricted user {} not in ledger", event.updateId(), userId);
            return;
        }
        restrictionLedger.remove(userId);
        state.clearRestricted(userId);
        log.info("[Moderation] Removed user {} from restricted users list", userId);
    }

    private void handleJoin(UserMembershipChanged event, ReconciliationState state) {
        TelegramUser user = event.subject();
        long groupId = event.groupId();

        if (event.chatKind() == ChatKind.PRIVATE) {
            log.trace("[Moderation] Update {}: ignoring private chat {}", event.updateId(), groupId);
            return;
        }
        if (user.bot()) {
            log.trace("[Moderation] Update {}: ignoring bot account {}", event.updateId(), user.displayName());
            return;
        }
        if (event.newStatus() != MemberStatus.MEMBER) {
            log.trace("[Moderation] Update {}: {} has status {}, not a member",
                    event.updateId(), user.displayName(), event.newStatus());
            return;
        }
        if (!event.isJoin()) {
            log.trace("[Moderation] Update {}: {} changed {} -> member, not a join",
                    event.updateId(), user.displayName(), event.oldStatus());
            return;
        }

        Optional<VerifiedIdentity> identity = verificationOracle.findVerifiedIdentity(user.id());
        if (identity.isPresent()) {
            log.info("[Moderation] User {} already verified as {}", user.displayName(), identity.get().wikiUserId());
            return;
        }

        Optional<MemberStatus> currentStatus = moderation.getChatMemberStatus(groupId, user.id());
        if (currentStatus.isEmpty()) {
            log.warn("[Moderation] Could not fetch current status of {} in chat {}, leaving untouched",
                    user.displayName(), groupId);
            return;
        }
        if (currentStatus.get() != MemberStatus.MEMBER) {
            log.debug("[Moderation] {} is now {} in chat {}, skipping restriction",
                    user.displayName(), currentStatus.get(), groupId);
            return;
        }

        if (!moderation.restrictChatMember(groupId, user.id(), MemberPermissions.denyAll())) {
            log.error("[Moderation] Failed to restrict {} in chat {}", user.displayName(), groupId);
            return;
        }
        log.info("[Moderation] Restricted {} in chat {}", user.displayName(), groupId);
        restrictionLedger.add(user.id());
        state.markRestricted(user.id());
    }
}
