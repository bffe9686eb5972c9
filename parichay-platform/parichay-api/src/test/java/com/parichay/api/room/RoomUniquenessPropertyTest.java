package com.parichay.api.room;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ContextType;
import net.jqwik.api.*;
import net.jqwik.spring.JqwikSpringSupport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for room identity: one live room per pair and context,
 * whichever participant asks.
 */
@JqwikSpringSupport
@SpringBootTest(classes = ParichayApiApplication.class)
@Import(ChatTestConfig.class)
@ActiveProfiles("test")
class RoomUniquenessPropertyTest {

    @Autowired
    private ChatRoomService roomService;

    @Property(tries = 20)
    void participantOrderNeverCreatesASecondRoom(
            @ForAll ContextType contextType,
            @ForAll boolean withContextId,
            @ForAll boolean swapped) {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID contextId = withContextId ? UUID.randomUUID() : null;

        ChatRoom first = roomService.getOrCreateRoom(a, b, contextType, contextId);
        ChatRoom second = swapped
                ? roomService.getOrCreateRoom(b, a, contextType, contextId)
                : roomService.getOrCreateRoom(a, b, contextType, contextId);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.participants().low().toString()).isLessThan(first.participants().high().toString());
    }
}
