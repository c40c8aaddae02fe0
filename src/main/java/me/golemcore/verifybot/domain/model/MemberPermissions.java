package me.golemcore.verifybot.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Permission set applied to a restricted member.
 */
@Value
@Builder
public class MemberPermissions {

    boolean canSendMessages;
    boolean canSendAudios;
    boolean canSendDocuments;
    boolean canSendPhotos;
    boolean canSendVideos;
    boolean canSendVideoNotes;
    boolean canSendVoiceNotes;
    boolean canSendPolls;
    boolean canSendOtherMessages;
    boolean canAddWebPagePreviews;
    boolean canChangeInfo;
    boolean canInviteUsers;
    boolean canPinMessages;
    boolean canManageTopics;

    private static final MemberPermissions DENY_ALL = MemberPermissions.builder().build();

    /**
     * Nothing allowed: no messages, media, polls, invites, pins, topics or info
     * changes.
     */
    public static MemberPermissions denyAll() {
        return DENY_ALL;
    }
}
