package me.golemcore.verifybot.port.outbound;

import java.util.Set;

/**
 * Users the bot restricted and has not yet seen confirmed. A hint only: the
 * platform status is authoritative.
 */
public interface RestrictionLedgerPort {

    Set<Long> load();

    /**
     * @return {@code true} if the id was not present
     */
    boolean add(long userId);

    /**
     * @return {@code true} if the id was present
     */
    boolean remove(long userId);
}
