package com.parichay.api.context;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.context.ChatInitiationService.InitiationResult;
import com.parichay.api.message.MessageService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.api.support.DatabaseCleaner;
import com.parichay.api.support.MutableClock;
import com.parichay.api.support.StubContextDirectory;
import com.parichay.core.domain.ChatContextLink;
import com.parichay.core.domain.ChatMessage.MessageType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.DependencyUnavailableException;
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
class ContextLinkServiceTest {

    @Autowired
    private ContextLinkService linkService;

    @Autowired
    private ChatInitiationService initiationService;

    @Autowired
    private ChatRoomService roomService;

    @Autowired
    private MessageService messageService;

    @Autowired
    private StubContextDirectory contextDirectory;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner cleaner;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID profile = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        cleaner.reset();
    }

    // ==================== Links ====================

    @Test
    void roomHasAtMostOneActiveLink() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.MARRIAGE, profile);
        linkService.linkContext(room.getId(), ContextType.MARRIAGE, profile, "marriage_interest", false, null);

        assertThatThrownBy(() -> linkService.linkContext(room.getId(), ContextType.MARRIAGE, profile,
                "marriage_interest", false, null))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("LINK_EXISTS");
    }

    @Test
    void approvalGatesMessaging() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.JOB, profile);
        ChatContextLink link = linkService.linkContext(room.getId(), ContextType.JOB, profile,
                "job_shortlist", true, null);

        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "hello", null))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("AWAITING_APPROVAL");

        linkService.approve(link.getId(), bob);

        assertThat(linkService.isAwaitingApproval(room.getId())).isFalse();
        assertThatCode(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "hello", null))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> linkService.approve(link.getId(), bob))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("ALREADY_APPROVED");
    }

    @Test
    void unknownContextIsRejected() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.BUSINESS, profile);
        contextDirectory.markMissing(profile);

        assertThatThrownBy(() -> linkService.linkContext(room.getId(), ContextType.BUSINESS, profile,
                "business_inquiry", false, null))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("CONTEXT_NOT_FOUND");
    }

    @Test
    void directoryOutageIsReportedAsUnavailable() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.BUSINESS, profile);
        contextDirectory.setUnavailable(true);

        assertThatThrownBy(() -> linkService.linkContext(room.getId(), ContextType.BUSINESS, profile,
                "business_inquiry", false, null))
                .isInstanceOf(DependencyUnavailableException.class);
    }

    // ==================== Expiry & revocation ====================

    @Test
    void expiredLinkClosesItsRoomOnce() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.MARRIAGE, profile);
        linkService.linkContext(room.getId(), ContextType.MARRIAGE, profile, "marriage_interest", false,
                clock.instant().plus(Duration.ofDays(1)));

        assertThat(linkService.sweepExpired(clock.instant())).isEmpty();

        clock.advance(Duration.ofDays(2));

        assertThat(linkService.sweepExpired(clock.instant())).containsExactly(room.getId());
        assertThat(roomService.getRoom(room.getId()).getStatus()).isEqualTo(RoomStatus.CLOSED);
        assertThat(linkService.activeLink(room.getId())).isEmpty();
        assertThat(linkService.sweepExpired(clock.instant())).isEmpty();
    }

    @Test
    void relinkAfterExpiryClosesTheRoom() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.MARRIAGE, profile);
        linkService.linkContext(room.getId(), ContextType.MARRIAGE, profile, "marriage_interest", false,
                clock.instant().plus(Duration.ofHours(1)));

        clock.advance(Duration.ofHours(2));

        assertThatThrownBy(() -> linkService.linkContext(room.getId(), ContextType.MARRIAGE, profile,
                "marriage_interest", false, null))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("ROOM_CLOSED");
        ChatRoom closed = roomService.getRoom(room.getId());
        assertThat(closed.getStatus()).isEqualTo(RoomStatus.CLOSED);
        assertThat(closed.getCloseReason()).isEqualTo(ContextLinkService.EXPIRED_REASON);
        assertThat(linkService.activeLink(room.getId())).isEmpty();
        assertThat(linkService.linkHistory(room.getId())).hasSize(1);
        assertThat(linkService.sweepExpired(clock.instant())).isEmpty();
    }

    @Test
    void revokingAContextClosesEveryLinkedRoom() {
        UUID carol = UUID.randomUUID();
        ChatRoom first = roomService.createRoom(alice, bob, ContextType.JOB, profile);
        ChatRoom second = roomService.createRoom(carol, bob, ContextType.JOB, profile);
        linkService.linkContext(first.getId(), ContextType.JOB, profile, "job_shortlist", false, null);
        linkService.linkContext(second.getId(), ContextType.JOB, profile, "job_shortlist", false, null);

        assertThat(linkService.revokeContext(ContextType.JOB, profile, "position filled"))
                .containsExactlyInAnyOrder(first.getId(), second.getId());
        assertThat(roomService.getRoom(first.getId()).getCloseReason()).isEqualTo("position filled");
        assertThat(linkService.linkHistory(second.getId()))
                .singleElement()
                .satisfies(link -> assertThat(link.isActive()).isFalse());
    }

    // ==================== Initiation ====================

    @Test
    void initiationIsIdempotent() {
        InitiationResult first = initiationService.initiateChat(alice, bob, ContextType.MARRIAGE, profile, "Namaste");
        InitiationResult again = initiationService.initiateChat(alice, bob, ContextType.MARRIAGE, profile, null);

        assertThat(first.created()).isTrue();
        assertThat(first.contextLinkId()).isNotNull();
        assertThat(first.messageId()).isNotNull();
        assertThat(again.created()).isFalse();
        assertThat(again.roomId()).isEqualTo(first.roomId());
        assertThat(again.contextLinkId()).isEqualTo(first.contextLinkId());
        assertThat(again.messageId()).isNull();
        assertThat(roomService.getRoom(first.roomId()).getMessageCount()).isEqualTo(1);
    }

    @Test
    void initiationChecksTheContext() {
        contextDirectory.markInactive(profile);

        assertThatThrownBy(() -> initiationService.initiateChat(alice, bob, ContextType.MARRIAGE, profile, "hi"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("CONTEXT_INACTIVE");
        assertThat(roomService.findRoom(alice, bob, ContextType.MARRIAGE, profile)).isEmpty();
    }

    @Test
    void initiatedFromFollowsTheContextType() {
        assertThat(ChatInitiationService.initiatedFrom(ContextType.JOB)).isEqualTo("job_shortlist");
        assertThat(ChatInitiationService.initiatedFrom(ContextType.GENERAL)).isEqualTo("direct");
    }
}
