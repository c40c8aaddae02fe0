package me.golemcore.verifybot.domain.model;

import java.util.Locale;

/**
 * Chat member status as reported by the Bot API.
 */
public enum MemberStatus {

    CREATOR("creator"),
    ADMINISTRATOR("administrator"),
    MEMBER("member"),
    RESTRICTED("restricted"),
    LEFT("left"),
    KICKED("kicked"),
    UNKNOWN("unknown");

    private final String apiValue;

    MemberStatus(String apiValue) {
        this.apiValue = apiValue;
    }

    public String getApiValue() {
        return apiValue;
    }

    public boolean isGone() {
        return this == LEFT || this == KICKED;
    }

    /**
     * @return the matching status, {@link #UNKNOWN} for unrecognized values,
     *         {@code null} for {@code null}
     */
    public static MemberStatus fromApiValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MemberStatus status : values()) {
            if (status.apiValue.equals(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return apiValue;
    }
}
