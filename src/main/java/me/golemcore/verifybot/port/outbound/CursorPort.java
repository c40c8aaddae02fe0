package me.golemcore.verifybot.port.outbound;

/**
 * Durable position in the update stream.
 */
public interface CursorPort {

    /**
     * @return highest fully processed update id, 0 if absent or unreadable
     */
    long load();

    void store(long updateId);
}
