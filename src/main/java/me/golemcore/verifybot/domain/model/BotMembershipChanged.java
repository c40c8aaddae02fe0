package me.golemcore.verifybot.domain.model;

/**
 * The bot's own membership in a chat changed ({@code my_chat_member}).
 */
public record BotMembershipChanged(long updateId, long groupId, ChatKind chatKind, MemberStatus newStatus)
        implements ModerationEvent {
}
