package com.parichay.api.message;

import com.parichay.api.message.MessageService.MessageView;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatMessage.MessageType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for sending and managing messages.
 */
@RestController
@RequestMapping("/api/v1/chat")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    /**
     * Send a message.
     * POST /api/v1/chat/rooms/{roomId}/messages
     */
    @PostMapping("/rooms/{roomId}/messages")
    public ResponseEntity<MessageView> send(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody SendMessageRequest request) {
        MessageType type = request.messageType() == null ? MessageType.TEXT : request.messageType();
        ChatMessage message = messageService.sendMessage(roomId, userId, type, request.content(), request.replyToId());
        return ResponseEntity.status(HttpStatus.CREATED).body(MessageView.of(message));
    }

    /**
     * Timeline page, newest first. Marks the other participant's messages read.
     * GET /api/v1/chat/rooms/{roomId}/messages
     */
    @GetMapping("/rooms/{roomId}/messages")
    public ResponseEntity<List<MessageView>> timeline(
            @PathVariable UUID roomId,
            @RequestHeader("X-User-ID") UUID userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(messageService.timeline(roomId, userId, page, size));
    }

    @PutMapping("/messages/{messageId}")
    public ResponseEntity<MessageView> edit(
            @PathVariable UUID messageId,
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody EditMessageRequest request) {
        return ResponseEntity.ok(MessageView.of(messageService.editMessage(messageId, userId, request.content())));
    }

    @PostMapping("/messages/{messageId}/retract")
    public ResponseEntity<MessageView> retract(
            @PathVariable UUID messageId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(MessageView.of(messageService.retractMessage(messageId, userId)));
    }

    @PostMapping("/messages/{messageId}/hide")
    public ResponseEntity<MessageView> hide(
            @PathVariable UUID messageId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(MessageView.of(messageService.hideMessage(messageId, userId)));
    }

    @DeleteMapping("/messages/{messageId}")
    public ResponseEntity<Void> delete(
            @PathVariable UUID messageId,
            @RequestHeader("X-User-ID") UUID userId) {
        messageService.deleteMessage(messageId, userId, false);
        return ResponseEntity.noContent().build();
    }

    public record SendMessageRequest(MessageType messageType, String content, UUID replyToId) {}

    public record EditMessageRequest(String content) {}
}
