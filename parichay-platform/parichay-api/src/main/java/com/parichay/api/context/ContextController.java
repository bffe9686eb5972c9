package com.parichay.api.context;

import com.parichay.api.context.ChatInitiationService.InitiationResult;
import com.parichay.api.room.ChatRoomService;
import com.parichay.core.domain.ChatContextLink;
import com.parichay.core.domain.ContextType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for context-bound conversations.
 */
@RestController
@RequestMapping("/api/v1/chat/context")
public class ContextController {

    private final ChatInitiationService initiationService;
    private final ContextLinkService contextLinkService;
    private final ChatRoomService roomService;

    public ContextController(
            ChatInitiationService initiationService,
            ContextLinkService contextLinkService,
            ChatRoomService roomService) {
        this.initiationService = initiationService;
        this.contextLinkService = contextLinkService;
        this.roomService = roomService;
    }

    /**
     * Start (or continue) a conversation from a context page.
     * POST /api/v1/chat/context/initiate
     */
    @PostMapping("/initiate")
    public ResponseEntity<InitiationResult> initiate(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody InitiateChatRequest request) {
        InitiationResult result = initiationService.initiateChat(userId, request.otherUserId(),
                request.contextType(), request.contextId(), request.initialMessage());
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    @PostMapping("/links/{linkId}/approve")
    public ResponseEntity<ChatContextLink> approve(
            @PathVariable UUID linkId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(contextLinkService.approve(linkId, userId));
    }

    @GetMapping("/rooms/{roomId}/links")
    public ResponseEntity<List<ChatContextLink>> linkHistory(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId) {
        roomService.getRoomForParticipant(roomId, userId);
        return ResponseEntity.ok(contextLinkService.linkHistory(roomId));
    }

    public record InitiateChatRequest(UUID otherUserId, ContextType contextType, UUID contextId, String initialMessage) {}
}
