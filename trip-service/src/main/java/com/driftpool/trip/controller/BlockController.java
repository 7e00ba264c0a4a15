package com.driftpool.trip.controller;

import com.driftpool.shared.context.ActorContext;
import com.driftpool.shared.dto.ApiResponse;
import com.driftpool.trip.blocking.BlockingService;
import com.driftpool.trip.entity.UserBlock;
import com.driftpool.trip.model.BlockUserRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.driftpool.shared.context.ActorContext.HEADER_TENANT_ID;
import static com.driftpool.shared.context.ActorContext.HEADER_USER_ID;
import static com.driftpool.shared.context.ActorContext.HEADER_USER_ROLE;

@RestController
@RequestMapping("/api/v1/blocks")
@RequiredArgsConstructor
public class BlockController {

    private final BlockingService blockingService;

    @PostMapping
    public ResponseEntity<ApiResponse<UserBlock>> block(
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody BlockUserRequest request) {

        ActorContext actor = ActorContext.fromHeaders(userId, role, tenantId);
        UserBlock block = blockingService.block(actor.userId(), request.getBlockedUserId(),
                request.getReasonType(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(block));
    }

    @DeleteMapping("/{blockedUserId}")
    public ResponseEntity<ApiResponse<Boolean>> unblock(
            @PathVariable("blockedUserId") String blockedUserId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        ActorContext actor = ActorContext.fromHeaders(userId, role, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(blockingService.unblock(actor.userId(), blockedUserId)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<UserBlock>>> myBlocks(
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        ActorContext actor = ActorContext.fromHeaders(userId, role, tenantId);
        return ResponseEntity.ok(ApiResponse.ok(blockingService.blocksBy(actor.userId())));
    }
}
