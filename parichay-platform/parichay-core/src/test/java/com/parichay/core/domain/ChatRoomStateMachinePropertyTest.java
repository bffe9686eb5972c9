package com.parichay.core.domain;

import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the room status machine.
 */
class ChatRoomStateMachinePropertyTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final UUID alice = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private final UUID bob = UUID.fromString("22222222-2222-2222-2222-222222222222");

    private ChatRoom newRoom() {
        return ChatRoom.open(alice, bob, ContextType.MARRIAGE, UUID.randomUUID(), NOW);
    }

    @Test
    void newRoomIsActiveWithZeroCounters() {
        ChatRoom room = newRoom();

        assertThat(room.getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(room.getMessageCount()).isZero();
        assertThat(room.unreadCountFor(alice)).isZero();
        assertThat(room.unreadCountFor(bob)).isZero();
        assertThat(room.getUniquenessKey()).startsWith(CanonicalPair.of(alice, bob).key());
    }

    @Test
    void selfChatIsRejected() {
        assertThatThrownBy(() -> ChatRoom.open(alice, alice, ContextType.JOB, null, NOW))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void dismissalRestoresThePriorStatus() {
        ChatRoom room = newRoom();
        room.transitionTo(RoomStatus.MUTED, alice, null, NOW);
        room.transitionTo(RoomStatus.REPORTED, bob, "abuse", NOW);

        assertThat(room.getPreReportStatus()).isEqualTo(RoomStatus.MUTED);

        room.restoreFromReport(NOW);

        assertThat(room.getStatus()).isEqualTo(RoomStatus.MUTED);
        assertThat(room.getMutedBy()).isEqualTo(alice);
        assertThat(room.getReportedBy()).isNull();
    }

    @Test
    void requestingTheRememberedStatusKeepsTheRoomUnderReview() {
        ChatRoom room = newRoom();
        room.markReported(alice, "spam", NOW);

        assertThat(room.transitionTo(RoomStatus.ACTIVE, bob, null, NOW)).isFalse();
        assertThat(room.getStatus()).isEqualTo(RoomStatus.REPORTED);
        assertThat(room.getReportedBy()).isEqualTo(alice);
    }

    @Test
    void blockWhileReportedUpdatesRememberedStatus() {
        ChatRoom room = newRoom();
        room.markReported(alice, "spam", NOW);

        room.applyBlock(alice, "spam", NOW);

        assertThat(room.getStatus()).isEqualTo(RoomStatus.REPORTED);
        assertThat(room.underlyingStatus()).isEqualTo(RoomStatus.BLOCKED);

        room.restoreFromReport(NOW);
        assertThat(room.getStatus()).isEqualTo(RoomStatus.BLOCKED);
        assertThat(room.getBlockedBy()).isEqualTo(alice);
    }

    @Test
    void timedMuteEndsOnlyAfterItsLimit() {
        ChatRoom room = newRoom();
        room.transitionTo(RoomStatus.MUTED, alice, null, NOW);
        room.limitMute(NOW.plusSeconds(600));

        assertThat(room.liftExpiredMute(NOW.plusSeconds(599))).isFalse();
        assertThat(room.liftExpiredMute(NOW.plusSeconds(600))).isTrue();
        assertThat(room.getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(room.getMutedUntil()).isNull();
    }

    @Test
    void onlyMutedRoomsTakeAMuteLimit() {
        ChatRoom room = newRoom();

        assertThatThrownBy(() -> room.limitMute(NOW.plusSeconds(60)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void blockedRoomCannotBeMuted() {
        ChatRoom room = newRoom();
        room.transitionTo(RoomStatus.BLOCKED, alice, null, NOW);

        assertThatThrownBy(() -> room.transitionTo(RoomStatus.MUTED, alice, null, NOW))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("blocked");
    }

    @Test
    void leavingMutedClearsMuteFields() {
        ChatRoom room = newRoom();
        room.transitionTo(RoomStatus.MUTED, bob, null, NOW);
        room.transitionTo(RoomStatus.BLOCKED, bob, "rude", NOW);

        assertThat(room.getMutedBy()).isNull();
        assertThat(room.getMutedAt()).isNull();
        assertThat(room.getBlockedBy()).isEqualTo(bob);
        assertThat(room.getBlockReason()).isEqualTo("rude");
    }

    @Test
    void releaseBlockKeepsRoomBlockedWhileOtherSideStillBlocks() {
        ChatRoom room = newRoom();
        room.applyBlock(alice, null, NOW);

        boolean released = room.releaseBlock(alice, bob, NOW);

        assertThat(released).isFalse();
        assertThat(room.getStatus()).isEqualTo(RoomStatus.BLOCKED);
        assertThat(room.getBlockedBy()).isEqualTo(bob);
    }

    @Test
    void closingTwiceIsANoOp() {
        ChatRoom room = newRoom();

        assertThat(room.transitionTo(RoomStatus.CLOSED, PlatformActors.SYSTEM, "expired", NOW)).isTrue();
        assertThat(room.transitionTo(RoomStatus.CLOSED, PlatformActors.SYSTEM, "again", NOW)).isFalse();
        assertThat(room.getCloseReason()).isEqualTo("expired");
    }

    @Test
    void messageCountersTrackTheOtherParticipant() {
        ChatRoom room = newRoom();
        UUID messageId = UUID.randomUUID();

        room.recordMessage(bob, messageId, NOW);
        room.recordMessage(bob, UUID.randomUUID(), NOW.plusSeconds(1));

        assertThat(room.getMessageCount()).isEqualTo(2);
        assertThat(room.unreadCountFor(alice)).isEqualTo(2);
        assertThat(room.unreadCountFor(bob)).isZero();

        room.markRead(alice, NOW.plusSeconds(2));
        assertThat(room.unreadCountFor(alice)).isZero();
    }

    @Test
    void outsiderCannotTouchCounters() {
        ChatRoom room = newRoom();

        assertThatThrownBy(() -> room.recordMessage(UUID.randomUUID(), UUID.randomUUID(), NOW))
                .isInstanceOf(ForbiddenException.class);
    }

    @Property(tries = 300)
    void closedIsTerminal(@ForAll("requests") List<RoomStatus> requests) {
        ChatRoom room = newRoom();
        room.transitionTo(RoomStatus.CLOSED, PlatformActors.SYSTEM, "admin", NOW);

        for (RoomStatus target : requests) {
            try {
                room.transitionTo(target, alice, null, NOW);
            } catch (ConflictException expected) {
                assertThat(expected.getCode()).isEqualTo("INVALID_TRANSITION");
            }
            assertThat(room.getStatus()).isEqualTo(RoomStatus.CLOSED);
        }
    }

    @Property(tries = 500)
    void onlyTheCurrentStatusFieldSetIsPopulated(@ForAll("requests") List<RoomStatus> requests) {
        ChatRoom room = newRoom();

        for (RoomStatus target : requests) {
            try {
                room.transitionTo(target, alice, "reason", NOW);
            } catch (ConflictException ignored) {
                // rejected transitions leave the room untouched
            }
            RoomStatus underlying = room.underlyingStatus();
            assertThat(room.getMutedBy() != null).isEqualTo(underlying == RoomStatus.MUTED);
            assertThat(room.getBlockedBy() != null).isEqualTo(underlying == RoomStatus.BLOCKED);
            assertThat(room.getReportedBy() != null).isEqualTo(room.getStatus() == RoomStatus.REPORTED);
            assertThat(room.getPreReportStatus() != null).isEqualTo(room.getStatus() == RoomStatus.REPORTED);
            if (room.getStatus() == RoomStatus.CLOSED) {
                assertThat(room.getClosedAt()).isNotNull();
            }
        }
    }

    @Property(tries = 300)
    void reportedRoomNeverRemembersReportedOrClosed(@ForAll("requests") List<RoomStatus> requests) {
        ChatRoom room = newRoom();

        for (RoomStatus target : requests) {
            try {
                room.transitionTo(target, bob, null, NOW);
            } catch (ConflictException ignored) {
                // rejected
            }
            if (room.getStatus() == RoomStatus.REPORTED) {
                assertThat(room.getPreReportStatus())
                        .isIn(RoomStatus.ACTIVE, RoomStatus.MUTED, RoomStatus.BLOCKED);
            }
        }
    }

    @Property(tries = 300)
    void participantRequestsNeverEndReview(@ForAll("requests") List<RoomStatus> requests) {
        ChatRoom room = newRoom();
        room.markReported(alice, "spam", NOW);

        for (RoomStatus target : requests) {
            try {
                room.transitionTo(target, bob, null, NOW);
            } catch (ConflictException ignored) {
                // rejected
            }
            assertThat(room.getStatus()).isIn(RoomStatus.REPORTED, RoomStatus.CLOSED);
        }
    }

    @Provide
    Arbitrary<List<RoomStatus>> requests() {
        return Arbitraries.of(RoomStatus.class).list().ofMinSize(1).ofMaxSize(12);
    }
}
