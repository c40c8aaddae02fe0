package me.golemcore.verifybot.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemberStatusTest {

    @Test
    void shouldParseApiValues() {
        assertEquals(MemberStatus.ADMINISTRATOR, MemberStatus.fromApiValue("administrator"));
        assertEquals(MemberStatus.KICKED, MemberStatus.fromApiValue(" Kicked "));
        assertEquals(MemberStatus.UNKNOWN, MemberStatus.fromApiValue("owner"));
        assertNull(MemberStatus.fromApiValue(null));
    }

    @Test
    void shouldClassifyDeparture() {
        assertTrue(MemberStatus.LEFT.isGone());
        assertTrue(MemberStatus.KICKED.isGone());
        assertFalse(MemberStatus.MEMBER.isGone());
        assertFalse(MemberStatus.RESTRICTED.isGone());
    }

    @ParameterizedTest
    @CsvSource({
            ",member,true",
            "left,member,true",
            "kicked,member,true",
            "restricted,member,false",
            "administrator,member,false",
            "member,administrator,false",
            "left,restricted,false"
    })
    void shouldRecognizeGenuineJoins(String oldStatus, String newStatus, boolean join) {
        UserMembershipChanged event = new UserMembershipChanged(1L, -100L, ChatKind.SUPERGROUP,
                new TelegramUser(42L, null, false),
                MemberStatus.fromApiValue(oldStatus), MemberStatus.fromApiValue(newStatus));

        assertEquals(join, event.isJoin());
    }

    @Test
    void shouldLabelUsersForLogs() {
        assertEquals("42", new TelegramUser(42L, null, false).displayName());
        assertEquals("alice (42)", new TelegramUser(42L, "alice", false).displayName());
    }
}
