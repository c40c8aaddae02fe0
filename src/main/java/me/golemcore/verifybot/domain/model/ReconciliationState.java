package me.golemcore.verifybot.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory view of the group registry and restriction ledger for one loop
 * iteration. Loaded fresh every iteration and kept in step with the writes the
 * reconciler makes, so later events in a batch see earlier decisions.
 */
public class ReconciliationState {

    private final Map<Long, GroupConfig> groups;
    private final Set<Long> restrictedUsers;

    public ReconciliationState(Map<Long, GroupConfig> groups, Set<Long> restrictedUsers) {
        this.groups = new LinkedHashMap<>(groups);
        this.restrictedUsers = new LinkedHashSet<>(restrictedUsers);
    }

    public boolean isDeleteEnabled(long groupId) {
        GroupConfig config = groups.get(groupId);
        return config != null && config.isDeleteMessagesFromRestricted();
    }

    public boolean isRestricted(long userId) {
        return restrictedUsers.contains(userId);
    }

    public void registerGroup(long groupId) {
        groups.putIfAbsent(groupId, new GroupConfig(groupId, false));
    }

    public void removeGroup(long groupId) {
        groups.remove(groupId);
    }

    public void markRestricted(long userId) {
        restrictedUsers.add(userId);
    }

    public void clearRestricted(long userId) {
        restrictedUsers.remove(userId);
    }

    public Map<Long, GroupConfig> getGroups() {
        return Collections.unmodifiableMap(groups);
    }

    public Set<Long> getRestrictedUsers() {
        return Collections.unmodifiableSet(restrictedUsers);
    }
}
