package me.golemcore.verifybot.domain.model;

/**
 * Membership of another user changed ({@code chat_member}).
 *
 * @param oldStatus
 *            previous status, {@code null} when the platform omitted it
 */
public record UserMembershipChanged(long updateId, long groupId, ChatKind chatKind, TelegramUser subject,
        MemberStatus oldStatus, MemberStatus newStatus) implements ModerationEvent {

    /**
     * A new arrival: the user becomes a plain member coming from outside the
     * group. Promotions, demotions and lifted restrictions do not count.
     */
    public boolean isJoin() {
        return newStatus == MemberStatus.MEMBER
                && (oldStatus == null || oldStatus == MemberStatus.LEFT || oldStatus == MemberStatus.KICKED);
    }
}
