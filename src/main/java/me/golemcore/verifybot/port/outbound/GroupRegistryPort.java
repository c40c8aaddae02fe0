package me.golemcore.verifybot.port.outbound;

import me.golemcore.verifybot.domain.model.GroupConfig;

import java.util.Map;

/**
 * Groups the bot moderates, with their settings. Mutations re-read the backing
 * store first so concurrent external edits are kept.
 */
public interface GroupRegistryPort {

    /**
     * @return group id to config, in file order
     */
    Map<Long, GroupConfig> load();

    void upsert(long groupId, boolean deleteMessagesFromRestricted);

    /**
     * Register a group unless it is already present; an existing flag is kept.
     *
     * @return {@code true} if the group was added
     */
    boolean putIfAbsent(long groupId, boolean deleteMessagesFromRestricted);

    /**
     * @return {@code true} if the group was present
     */
    boolean remove(long groupId);
}
