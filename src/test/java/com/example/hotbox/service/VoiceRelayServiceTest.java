package com.example.hotbox.service;

import com.example.hotbox.config.VoiceProperties;
import com.example.hotbox.model.IceServer;
import com.example.hotbox.model.SignalKind;
import com.example.hotbox.model.SignalMessage;
import com.example.hotbox.model.VoiceParticipantView;
import com.example.hotbox.model.VoiceRoomEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class VoiceRelayServiceTest {

    private VoiceRelayService relay;
    private List<VoiceRoomEvent> roomEvents;
    private List<SignalMessage> signals;

    @BeforeEach
    void setUp() {
        relay = new VoiceRelayService(new VoiceProperties(List.of("stun:stun.l.google.com:19302"), null, null, null),
                Runnable::run);
        roomEvents = Collections.synchronizedList(new ArrayList<>());
        signals = new ArrayList<>();
        relay.addListener(new VoiceEventListener() {
            @Override
            public void onRoomEvent(VoiceRoomEvent event) {
                roomEvents.add(event);
            }

            @Override
            public void onSignal(SignalMessage signal) {
                signals.add(signal);
            }
        });
    }

    @Nested
    @DisplayName("join / leave")
    class Roster {

        @Test
        @DisplayName("Bob joins from two handles; closing both removes the room")
        void bob_twoHandles() {
            relay.join("general", "bob", "c1", "Bob");
            List<VoiceParticipantView> roster = relay.join("general", "bob", "c2", "Bob");

            assertEquals(2, roster.size());
            assertTrue(roster.stream().allMatch(v -> v.userId().equals("bob")));

            relay.onDisconnect("c1");
            assertTrue(relay.roomExists("general"));
            assertEquals(1, relay.getRoomRoster("general").size());

            relay.onDisconnect("c2");
            assertFalse(relay.roomExists("general"));
            assertTrue(relay.getRoomRoster("general").isEmpty());
            assertEquals(0, relay.roomCount());
        }

        @Test
        void rejoin_sameConnection_keepsOneSeat() {
            relay.join("general", "bob", "c1", "Bob");
            relay.toggleMute("general", "c1", true);

            List<VoiceParticipantView> roster = relay.join("general", "bob", "c1", "Bob");

            assertEquals(List.of(new VoiceParticipantView("bob", "Bob", false, false)), roster);
        }

        @Test
        void join_returnsRosterIncludingCaller_andEventListsMembers() {
            relay.join("general", "alice", "a1", "Alice");
            List<VoiceParticipantView> roster = relay.join("general", "bob", "b1", "Bob");

            assertEquals(List.of("alice", "bob"), roster.stream().map(VoiceParticipantView::userId).toList());

            VoiceRoomEvent joined = roomEvents.get(1);
            assertEquals(VoiceRoomEvent.Type.JOINED, joined.type());
            assertEquals("b1", joined.originConnectionId());
            assertEquals(List.of("a1", "b1"), joined.memberConnectionIds());
            assertEquals(new VoiceParticipantView("bob", "Bob", false, false), joined.participant());
        }

        @Test
        void join_blankArguments_isIgnored() {
            assertTrue(relay.join(" ", "bob", "c1", "Bob").isEmpty());
            assertTrue(relay.join("general", null, "c1", "Bob").isEmpty());
            assertEquals(0, relay.roomCount());
            assertTrue(roomEvents.isEmpty());
        }

        @Test
        void leave_lastSeat_deletesRoom_andNotifiesNobodyElse() {
            relay.join("general", "bob", "c1", "Bob");

            assertTrue(relay.leave("general", "c1"));
            assertFalse(relay.roomExists("general"));

            VoiceRoomEvent left = roomEvents.get(roomEvents.size() - 1);
            assertEquals(VoiceRoomEvent.Type.LEFT, left.type());
            assertTrue(left.memberConnectionIds().isEmpty());
        }

        @Test
        void leave_unknownRoomOrSeat_returnsFalse() {
            relay.join("general", "bob", "c1", "Bob");

            assertFalse(relay.leave("nope", "c1"));
            assertFalse(relay.leave("general", "c9"));
            assertEquals(1, roomEvents.size());
        }

        @Test
        void onDisconnect_emitsOneLeavePerAffectedRoom() {
            relay.join("general", "bob", "c1", "Bob");
            relay.join("random", "bob", "c1", "Bob");
            relay.join("random", "carol", "c2", "Carol");
            roomEvents.clear();

            Set<String> affected = relay.onDisconnect("c1");

            assertEquals(Set.of("general", "random"), affected);
            assertEquals(2, roomEvents.size());
            assertTrue(roomEvents.stream().allMatch(e -> e.type() == VoiceRoomEvent.Type.LEFT));
            assertFalse(relay.roomExists("general"));
            assertEquals(List.of("carol"),
                    relay.getRoomRoster("random").stream().map(VoiceParticipantView::userId).toList());
        }

        @Test
        void onDisconnect_unknownConnection_changesNothing() {
            relay.join("general", "bob", "c1", "Bob");
            roomEvents.clear();

            assertTrue(relay.onDisconnect("zzz").isEmpty());
            assertTrue(roomEvents.isEmpty());
        }
    }

    @Nested
    @DisplayName("mute / deafen")
    class Toggles {

        @Test
        void toggleMute_emitsOnRealChangeOnly() {
            relay.join("general", "bob", "c1", "Bob");
            relay.join("general", "carol", "c2", "Carol");
            roomEvents.clear();

            assertTrue(relay.toggleMute("general", "c1", true));
            assertTrue(relay.toggleMute("general", "c1", true));

            assertEquals(1, roomEvents.size());
            VoiceRoomEvent e = roomEvents.get(0);
            assertEquals(VoiceRoomEvent.Type.MUTE_CHANGED, e.type());
            assertTrue(e.participant().muted());
            assertEquals("c1", e.originConnectionId());
            assertTrue(relay.getRoomRoster("general").get(0).muted());
        }

        @Test
        void toggleDeafen_updatesFlag() {
            relay.join("general", "bob", "c1", "Bob");
            roomEvents.clear();

            assertTrue(relay.toggleDeafen("general", "c1", true));
            assertTrue(relay.getRoomRoster("general").get(0).deafened());
            assertEquals(VoiceRoomEvent.Type.DEAFEN_CHANGED, roomEvents.get(0).type());

            relay.toggleDeafen("general", "c1", false);
            assertFalse(relay.getRoomRoster("general").get(0).deafened());
        }

        @Test
        void toggle_unknownSeat_returnsFalse() {
            relay.join("general", "bob", "c1", "Bob");
            roomEvents.clear();

            assertFalse(relay.toggleMute("general", "c9", true));
            assertFalse(relay.toggleDeafen("nope", "c1", true));
            assertTrue(roomEvents.isEmpty());
        }
    }

    @Nested
    @DisplayName("signaling")
    class Signaling {

        @Test
        void relay_routesToTargetConnection_verbatim() {
            relay.join("general", "alice", "a1", "Alice");
            relay.join("general", "bob", "b1", "Bob");

            assertTrue(relay.relaySignal(SignalKind.OFFER, "alice", "bob", "{\"sdp\":\"v=0\"}"));

            assertEquals(List.of(new SignalMessage(SignalKind.OFFER, "alice", "bob", "b1", "{\"sdp\":\"v=0\"}")), signals);
        }

        @Test
        void relay_findsTargetAcrossRooms() {
            relay.join("general", "alice", "a1", "Alice");
            relay.join("music", "bob", "b1", "Bob");

            assertTrue(relay.relaySignal(SignalKind.ICE_CANDIDATE, "alice", "bob", "cand"));
            assertEquals("b1", signals.get(0).targetConnectionId());
        }

        @Test
        void relay_unknownTarget_isDroppedWithoutError() {
            relay.join("general", "alice", "a1", "Alice");

            assertDoesNotThrow(() -> assertFalse(relay.relaySignal(SignalKind.ANSWER, "alice", "ghost", "x")));
            assertFalse(relay.relaySignal(null, "alice", "alice", "x"));
            assertFalse(relay.relaySignal(SignalKind.OFFER, "alice", null, "x"));
            assertTrue(signals.isEmpty());
        }

        @Test
        void relay_afterTargetLeft_isDropped() {
            relay.join("general", "bob", "b1", "Bob");
            relay.leave("general", "b1");

            assertFalse(relay.relaySignal(SignalKind.OFFER, "alice", "bob", "x"));
            assertTrue(signals.isEmpty());
        }
    }

    @Nested
    @DisplayName("ICE servers")
    class Ice {

        @Test
        void stunOnly_byDefault() {
            List<IceServer> servers = relay.getIceServers();

            assertEquals(1, servers.size());
            assertEquals(List.of("stun:stun.l.google.com:19302"), servers.get(0).urls());
            assertNull(servers.get(0).username());
        }

        @Test
        void turnAdded_whenConfigured() {
            VoiceRelayService withTurn = new VoiceRelayService(
                    new VoiceProperties(List.of("stun:stun.example.org:3478"), "turn:turn.example.org:3478", "u", "p"),
                    Runnable::run);

            List<IceServer> servers = withTurn.getIceServers();

            assertEquals(2, servers.size());
            assertEquals(new IceServer(List.of("turn:turn.example.org:3478"), "u", "p"), servers.get(1));
        }

        @Test
        void blankTurnUrl_isSkipped() {
            VoiceRelayService blank = new VoiceRelayService(
                    new VoiceProperties(List.of(), " ", null, null), Runnable::run);

            assertTrue(blank.getIceServers().isEmpty());
        }
    }

    @Test
    void failingListener_doesNotBreakRelay() {
        relay.addListener(new VoiceEventListener() {
            @Override
            public void onRoomEvent(VoiceRoomEvent event) {
                throw new IllegalStateException("boom");
            }
        });

        assertDoesNotThrow(() -> relay.join("general", "bob", "c1", "Bob"));
        assertEquals(1, roomEvents.size());
    }

    @Test
    @DisplayName("concurrent joins and leaves never leave an empty room behind")
    void concurrentJoinLeave_noEmptyRoomSurvives() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                final String conn = "c" + i;
                final String room = "room-" + (i % 4);
                futures.add(pool.submit(() -> {
                    start.await();
                    relay.join(room, "user-" + conn, conn, null);
                    relay.leave(room, conn);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);

            assertEquals(0, relay.roomCount());
        } finally {
            pool.shutdownNow();
        }
    }
}
