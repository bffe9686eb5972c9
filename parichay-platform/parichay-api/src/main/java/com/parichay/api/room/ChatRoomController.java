package com.parichay.api.room;

import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for a user's chat rooms.
 */
@RestController
@RequestMapping("/api/v1/chat/rooms")
public class ChatRoomController {

    private final ChatRoomService roomService;

    public ChatRoomController(ChatRoomService roomService) {
        this.roomService = roomService;
    }

    /**
     * Open a room with another user.
     * POST /api/v1/chat/rooms
     */
    @PostMapping
    public ResponseEntity<ChatRoom> createRoom(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody CreateRoomRequest request) {
        ChatRoom room = roomService.createRoom(userId, request.otherUserId(), request.contextType(), request.contextId());
        return ResponseEntity.status(HttpStatus.CREATED).body(room);
    }

    /**
     * Inbox, most recent conversation first.
     * GET /api/v1/chat/rooms
     */
    @GetMapping
    public ResponseEntity<List<ChatRoom>> inbox(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(roomService.inbox(userId, page, size));
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<ChatRoom> getRoom(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(roomService.getRoomForParticipant(roomId, userId));
    }

    @GetMapping("/{roomId}/unread")
    public ResponseEntity<Map<String, Object>> unread(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(Map.of("roomId", roomId, "unread", roomService.unreadCountFor(roomId, userId)));
    }

    /**
     * Participant status change: mute, unmute, block, unblock.
     * POST /api/v1/chat/rooms/{roomId}/status
     */
    @PostMapping("/{roomId}/status")
    public ResponseEntity<ChatRoom> changeStatus(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(roomService.transitionStatus(roomId, userId, request.status(), request.reason()));
    }

    @PostMapping("/{roomId}/read")
    public ResponseEntity<Void> markRead(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId) {
        roomService.markRead(roomId, userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{roomId}")
    public ResponseEntity<Void> deleteRoom(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId) {
        roomService.softDeleteRoom(roomId, userId);
        return ResponseEntity.noContent().build();
    }

    public record CreateRoomRequest(UUID otherUserId, ContextType contextType, UUID contextId) {}

    public record StatusChangeRequest(RoomStatus status, String reason) {}
}
