package me.golemcore.verifybot.domain.model;

import java.util.List;

/**
 * One long-poll result.
 *
 * @param events
 *            mapped events in increasing update id order
 * @param lastUpdateId
 *            highest raw update id received, including updates that mapped to
 *            no event; {@link #NONE} when nothing was received
 */
public record UpdateBatch(List<ModerationEvent> events, long lastUpdateId) {

    public static final long NONE = -1L;

    public UpdateBatch {
        events = List.copyOf(events);
    }

    public static UpdateBatch empty() {
        return new UpdateBatch(List.of(), NONE);
    }

    public boolean isEmpty() {
        return lastUpdateId == NONE;
    }
}
