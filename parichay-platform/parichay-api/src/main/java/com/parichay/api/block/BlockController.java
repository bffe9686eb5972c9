package com.parichay.api.block;

import com.parichay.core.domain.UserBlock;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for user-to-user blocks.
 */
@RestController
@RequestMapping("/api/v1/chat/blocks")
public class BlockController {

    private final BlockService blockService;

    public BlockController(BlockService blockService) {
        this.blockService = blockService;
    }

    @PostMapping
    public ResponseEntity<UserBlock> block(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody BlockRequest request) {
        boolean permanent = request.permanent() != null ? request.permanent() : request.expiresAt() == null;
        UserBlock block = blockService.block(userId, request.blockedUserId(), request.reason(),
                permanent, request.expiresAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(block);
    }

    @GetMapping
    public ResponseEntity<List<UserBlock>> list(@RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(blockService.listBlocks(userId));
    }

    @DeleteMapping("/{blockId}")
    public ResponseEntity<UserBlock> unblock(
            @PathVariable UUID blockId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(blockService.unblock(blockId, userId));
    }

    /**
     * Whether the caller may currently message the other user.
     * GET /api/v1/chat/blocks/check/{otherUserId}
     */
    @GetMapping("/check/{otherUserId}")
    public ResponseEntity<Map<String, Object>> check(
            @PathVariable UUID otherUserId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(Map.of(
                "canMessage", blockService.canMessage(userId, otherUserId),
                "blocked", blockService.isBlocked(userId, otherUserId)));
    }

    public record BlockRequest(UUID blockedUserId, String reason, Boolean permanent, Instant expiresAt) {}
}
