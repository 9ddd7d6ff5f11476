package com.example.hotbox.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VoiceRoomTest {

    @Test
    void put_sameConnection_replacesSeat() {
        VoiceRoom room = new VoiceRoom("general");
        VoiceParticipant first = new VoiceParticipant("bob", "Bob", "c1");
        first.setMuted(true);

        assertNull(room.put(first));
        VoiceParticipant replaced = room.put(new VoiceParticipant("bob", "Bob", "c1"));

        assertSame(first, replaced);
        assertEquals(1, room.size());
        assertFalse(room.get("c1").isMuted());
    }

    @Test
    void roster_keepsJoinOrder_andHidesConnectionIds() {
        VoiceRoom room = new VoiceRoom("general");
        room.put(new VoiceParticipant("bob", "Bob", "c1"));
        room.put(new VoiceParticipant("carol", "Carol", "c2"));

        List<VoiceParticipantView> roster = room.roster();
        assertEquals(List.of(
                new VoiceParticipantView("bob", "Bob", false, false),
                new VoiceParticipantView("carol", "Carol", false, false)), roster);
        assertEquals(List.of("c1", "c2"), room.connectionIds());
    }

    @Test
    void findByUserId_returnsFirstSeat() {
        VoiceRoom room = new VoiceRoom("general");
        room.put(new VoiceParticipant("bob", "Bob", "c1"));
        room.put(new VoiceParticipant("bob", "Bob", "c2"));

        assertEquals("c1", room.findByUserId("bob").orElseThrow().getConnectionId());
        assertTrue(room.findByUserId("nobody").isEmpty());
    }

    @Test
    void remove_lastSeat_leavesRoomEmpty() {
        VoiceRoom room = new VoiceRoom("general");
        room.put(new VoiceParticipant("bob", "Bob", "c1"));

        assertNotNull(room.remove("c1"));
        assertNull(room.remove("c1"));
        assertTrue(room.isEmpty());
    }

    @Test
    void blankDisplayName_becomesUnknown() {
        assertEquals("Unknown", new VoiceParticipant("bob", " ", "c1").getDisplayName());
    }
}
