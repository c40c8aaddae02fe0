package me.golemcore.verifybot.domain.model;

/**
 * A verification record whose wiki side is linked.
 *
 * @param wikiUsername
 *            may be {@code null} for records written before usernames were
 *            stored
 */
public record VerifiedIdentity(long telegramUserId, long wikiUserId, String wikiUsername) {
}
