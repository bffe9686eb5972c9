package com.parichay.api.block;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.api.support.DatabaseCleaner;
import com.parichay.api.support.MutableClock;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import com.parichay.core.domain.UserBlock;
import com.parichay.core.domain.UserBlock.BlockType;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = ParichayApiApplication.class)
@Import(ChatTestConfig.class)
@ActiveProfiles("test")
class BlockServiceTest {

    @Autowired
    private BlockService blockService;

    @Autowired
    private ChatRoomService roomService;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner cleaner;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        cleaner.reset();
    }

    @Test
    void blockIsDirectional() {
        blockService.block(alice, bob, "spam");

        assertThat(blockService.isBlocked(alice, bob)).isTrue();
        assertThat(blockService.isBlocked(bob, alice)).isFalse();
        assertThat(blockService.canMessage(alice, bob)).isFalse();
        assertThat(blockService.canMessage(bob, alice)).isTrue();
        assertThat(blockService.blockedEitherWay(bob, alice)).isTrue();
    }

    @Test
    void secondActiveBlockIsRejected() {
        blockService.block(alice, bob, "spam");

        assertThatThrownBy(() -> blockService.block(alice, bob, "again"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("ALREADY_BLOCKED");
    }

    @Test
    void selfBlockIsRejected() {
        assertThatThrownBy(() -> blockService.block(alice, alice, "me"))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("SELF_BLOCK");
    }

    @Test
    void blockingMovesSharedRoomsToBlockedUntilLifted() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.MARRIAGE, UUID.randomUUID());

        UserBlock block = blockService.block(alice, bob, "rude");
        assertThat(roomService.getRoom(room.getId()).getStatus()).isEqualTo(RoomStatus.BLOCKED);
        assertThat(roomService.getRoom(room.getId()).getBlockedBy()).isEqualTo(alice);

        assertThatThrownBy(() -> blockService.unblock(block.getId(), bob))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_BLOCKER");

        blockService.unblock(block.getId(), alice);

        assertThat(roomService.getRoom(room.getId()).getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(blockService.isBlocked(alice, bob)).isFalse();
        assertThat(blockService.listBlocks(alice)).isEmpty();
    }

    @Test
    void roomStaysBlockedWhileTheReverseBlockHolds() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.GENERAL, null);
        UserBlock fromAlice = blockService.block(alice, bob, "rude");
        blockService.block(bob, alice, "rude too");

        blockService.unblock(fromAlice.getId(), alice);

        ChatRoom reloaded = roomService.getRoom(room.getId());
        assertThat(reloaded.getStatus()).isEqualTo(RoomStatus.BLOCKED);
        assertThat(reloaded.getBlockedBy()).isEqualTo(bob);
    }

    @Test
    void temporaryBlockExpiresThroughTheSweep() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.JOB, UUID.randomUUID());
        blockService.block(alice, bob, "cool off", false, clock.instant().plus(Duration.ofHours(1)));

        assertThat(blockService.sweepExpired(clock.instant())).isZero();

        clock.advance(Duration.ofHours(2));

        assertThat(blockService.sweepExpired(clock.instant())).isEqualTo(1);
        assertThat(roomService.getRoom(room.getId()).getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(blockService.sweepExpired(clock.instant())).isZero();
    }

    @Test
    void expiredBlockIsNotInForceBeforeTheSweep() {
        blockService.block(alice, bob, "cool off", false, clock.instant().plus(Duration.ofMinutes(30)));
        clock.advance(Duration.ofHours(1));

        assertThat(blockService.isBlocked(alice, bob)).isFalse();
        assertThatCode(() -> blockService.block(alice, bob, "again")).doesNotThrowAnyException();
    }

    @Test
    void temporaryBlockNeedsFutureExpiry() {
        assertThatThrownBy(() -> blockService.block(alice, bob, "x", false, null))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("INVALID_EXPIRY");
    }

    @Test
    void strongerBanIsKept() {
        UserBlock permanent = blockService.platformBan(alice, bob, BlockType.ADMIN, null, "fraud");
        UserBlock shorter = blockService.platformBan(alice, bob, BlockType.ADMIN, 60, "again");

        assertThat(shorter.getId()).isEqualTo(permanent.getId());
        assertThat(blockService.isBanned(bob)).isTrue();
        assertThat(blockService.canMessage(bob, alice)).isFalse();
    }

    @Test
    void liftingBansReportsWhetherOneExisted() {
        assertThat(blockService.liftPlatformBans(bob, alice)).isFalse();

        blockService.platformBan(alice, bob, BlockType.ADMIN, 60, "spam");

        assertThat(blockService.liftPlatformBans(bob, alice)).isTrue();
        assertThat(blockService.isBanned(bob)).isFalse();
    }

    @Test
    void platformBanDoesNotTouchRooms() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.GENERAL, null);

        blockService.platformBan(UUID.randomUUID(), bob, BlockType.ADMIN, null, "fraud");

        assertThat(roomService.getRoom(room.getId()).getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(blockService.listPlatformBans()).hasSize(1);
    }
}
