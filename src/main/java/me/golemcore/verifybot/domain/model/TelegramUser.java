package me.golemcore.verifybot.domain.model;

/**
 * Minimal view of a platform account.
 *
 * @param username
 *            public handle without '@', may be {@code null}
 */
public record TelegramUser(long id, String username, boolean bot) {

    /**
     * Label for log lines: {@code name (id)} or just the id.
     */
    public String displayName() {
        if (username == null || username.isBlank()) {
            return String.valueOf(id);
        }
        return username + " (" + id + ")";
    }
}
