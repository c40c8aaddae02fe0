package me.golemcore.verifybot.domain.model;

public record MessagePosted(long updateId, long groupId, int messageId, long authorId) implements ModerationEvent {
}
