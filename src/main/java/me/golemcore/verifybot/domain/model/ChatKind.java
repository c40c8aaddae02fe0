package me.golemcore.verifybot.domain.model;

import java.util.Locale;

public enum ChatKind {

    PRIVATE("private"),
    GROUP("group"),
    SUPERGROUP("supergroup"),
    CHANNEL("channel"),
    UNKNOWN("unknown");

    private final String apiValue;

    ChatKind(String apiValue) {
        this.apiValue = apiValue;
    }

    public static ChatKind fromApiValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ChatKind kind : values()) {
            if (kind.apiValue.equals(normalized)) {
                return kind;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return apiValue;
    }
}
