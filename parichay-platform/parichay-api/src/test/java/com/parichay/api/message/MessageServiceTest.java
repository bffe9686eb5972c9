package com.parichay.api.message;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.block.BlockService;
import com.parichay.api.message.MessageService.MessageView;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.api.support.DatabaseCleaner;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatMessage.MessageType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import com.parichay.core.domain.PlatformActors;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = ParichayApiApplication.class)
@Import(ChatTestConfig.class)
@ActiveProfiles("test")
class MessageServiceTest {

    @Autowired
    private MessageService messageService;

    @Autowired
    private ChatRoomService roomService;

    @Autowired
    private BlockService blockService;

    @Autowired
    private DatabaseCleaner cleaner;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    private ChatRoom room;

    @BeforeEach
    void setUp() {
        cleaner.reset();
        room = roomService.createRoom(alice, bob, ContextType.MARRIAGE, UUID.randomUUID());
    }

    // ==================== Sending ====================

    @Test
    void sentMessageUpdatesRoomCounters() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "Namaste", null);

        ChatRoom reloaded = roomService.getRoom(room.getId());
        assertThat(reloaded.getMessageCount()).isEqualTo(1);
        assertThat(reloaded.getLastMessageId()).isEqualTo(message.getId());
        assertThat(roomService.unreadCountFor(room.getId(), bob)).isEqualTo(1);
        assertThat(roomService.unreadCountFor(room.getId(), alice)).isZero();
    }

    @Test
    void readingTheTimelineClearsUnread() {
        messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "first", null);
        messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "second", null);

        List<MessageView> timeline = messageService.timeline(room.getId(), bob, 0, 50);

        assertThat(timeline).hasSize(2);
        assertThat(roomService.unreadCountFor(room.getId(), bob)).isZero();
    }

    @Test
    void concurrentSendsKeepCountersExact() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<ChatMessage>> results = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String body = "message " + i;
            results.add(pool.submit(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, body, null)));
        }
        for (Future<ChatMessage> result : results) {
            result.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        ChatRoom reloaded = roomService.getRoom(room.getId());
        assertThat(reloaded.getMessageCount()).isEqualTo(20);
        assertThat(reloaded.unreadCountFor(bob)).isEqualTo(20);
    }

    @Test
    void contactDetailsAreFlaggedButDelivered() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT,
                "call me on 9876543210", null);

        assertThat(message.isFlagged()).isTrue();
        assertThat(message.getSafetyFlags().isContainsPhone()).isTrue();
        assertThat(messageService.timeline(room.getId(), bob, 0, 10)).hasSize(1);
        assertThat(messageService.flaggedMessages(0, 10).getContent())
                .extracting(ChatMessage::getId)
                .containsExactly(message.getId());
    }

    @Test
    void blankContentIsRejected() {
        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "  ", null))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("EMPTY_CONTENT");
    }

    @Test
    void outsiderCannotSend() {
        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), UUID.randomUUID(), MessageType.TEXT, "hi", null))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_PARTICIPANT");
    }

    @Test
    void blockStopsBothDirections() {
        blockService.block(alice, bob, "spam");

        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), bob, MessageType.TEXT, "hello?", null))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("MESSAGING_BLOCKED");
        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "bye", null))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("MESSAGING_BLOCKED");
    }

    @Test
    void closedRoomRejectsMessages() {
        roomService.closeRoom(room.getId(), PlatformActors.SYSTEM, "context expired");

        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "still there?", null))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("ROOM_CLOSED");
    }

    @Test
    void mutedRoomStillDelivers() {
        roomService.transitionStatus(room.getId(), bob, RoomStatus.MUTED, null);

        assertThatCode(() -> messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "ping", null))
                .doesNotThrowAnyException();
    }

    @Test
    void replyMustStayInTheRoom() {
        ChatRoom other = roomService.createRoom(alice, UUID.randomUUID(), ContextType.GENERAL, null);
        ChatMessage elsewhere = messageService.sendMessage(other.getId(), alice, MessageType.TEXT, "elsewhere", null);

        assertThatThrownBy(() -> messageService.sendMessage(room.getId(), bob, MessageType.TEXT, "re", elsewhere.getId()))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("INVALID_REPLY");

        ChatMessage original = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "question", null);
        ChatMessage reply = messageService.sendMessage(room.getId(), bob, MessageType.TEXT, "answer", original.getId());
        assertThat(reply.getReplyToId()).isEqualTo(original.getId());
    }

    // ==================== Sender actions ====================

    @Test
    void retractedMessageKeepsContentForModerators() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "oops", null);

        messageService.retractMessage(message.getId(), alice);

        MessageView view = messageService.timeline(room.getId(), bob, 0, 10).get(0);
        assertThat(view.retracted()).isTrue();
        assertThat(view.content()).isNull();
        assertThat(messageService.moderationView(message.getId()).getContent()).isEqualTo("oops");
    }

    @Test
    void onlyTheSenderMayRetractOrEdit() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "mine", null);

        assertThatThrownBy(() -> messageService.retractMessage(message.getId(), bob))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_SENDER");
        assertThatThrownBy(() -> messageService.editMessage(message.getId(), bob, "theirs"))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_SENDER");
    }

    @Test
    void editRescansAndRetractedMessagesCannotBeEdited() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "hello", null);

        ChatMessage edited = messageService.editMessage(message.getId(), alice, "mail me at someone@example.com");
        assertThat(edited.isFlagged()).isTrue();
        assertThat(edited.getEditedAt()).isNotNull();

        messageService.retractMessage(message.getId(), alice);
        assertThatThrownBy(() -> messageService.editMessage(message.getId(), alice, "again"))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("MESSAGE_NOT_EDITABLE");
    }

    @Test
    void senderDeleteHidesOnlyForTheSender() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "gone", null);

        messageService.deleteMessage(message.getId(), alice, false);

        assertThat(messageService.timeline(room.getId(), alice, 0, 10)).isEmpty();
        assertThat(messageService.timeline(room.getId(), bob, 0, 10))
                .singleElement()
                .satisfies(view -> assertThat(view.retracted()).isTrue());
    }

    @Test
    void moderatorRemovalAndRestore() {
        ChatMessage message = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "bad", null);
        UUID moderator = UUID.randomUUID();

        messageService.moderatorRemove(message.getId(), moderator);
        assertThat(messageService.timeline(room.getId(), bob, 0, 10)).isEmpty();

        messageService.restoreMessage(message.getId());
        assertThat(messageService.timeline(room.getId(), bob, 0, 10)).hasSize(1);
    }
}
