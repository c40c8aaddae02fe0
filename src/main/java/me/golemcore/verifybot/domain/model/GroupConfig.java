package me.golemcore.verifybot.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-group moderation settings, keyed by group id in the registry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GroupConfig {
    private long groupId;
    private boolean deleteMessagesFromRestricted;
}
