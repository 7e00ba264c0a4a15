package com.driftpool.trip.blocking;

import com.driftpool.shared.enums.BlockReason;
import com.driftpool.trip.entity.UserBlock;
import com.driftpool.trip.exception.TripValidationException;
import com.driftpool.trip.matching.BlockListCache;
import com.driftpool.trip.matching.BlockListService;
import com.driftpool.trip.repository.UserBlockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rider/driver blocking. Blocks are directed records but matching treats them as mutual, so
 * {@link #listBlocked} returns both directions. Records only grow until an explicit unblock.
 */
@Slf4j
@Service
public class BlockingService implements BlockListService {

    private final UserBlockRepository blockRepository;
    private final BlockListCache blockListCache;

    public BlockingService(UserBlockRepository blockRepository, @Lazy BlockListCache blockListCache) {
        this.blockRepository = blockRepository;
        this.blockListCache = blockListCache;
    }

    @Transactional
    public UserBlock block(String blockerId, String blockedId, BlockReason reasonType, String reason) {
        validatePair(blockerId, blockedId);
        if (reasonType == null) {
            throw new TripValidationException("A block reason is required");
        }
        UserBlock block = blockRepository.findByBlockerIdAndBlockedId(blockerId, blockedId)
                .orElseGet(() -> blockRepository.save(UserBlock.builder()
                        .blockerId(blockerId)
                        .blockedId(blockedId)
                        .reasonType(reasonType)
                        .reason(reason)
                        .build()));
        evictBoth(blockerId, blockedId);
        log.info("User {} blocked {} ({})", blockerId, blockedId, block.getReasonType());
        return block;
    }

    @Transactional
    public boolean unblock(String blockerId, String blockedId) {
        validatePair(blockerId, blockedId);
        boolean removed = blockRepository.findByBlockerIdAndBlockedId(blockerId, blockedId)
                .map(block -> {
                    blockRepository.delete(block);
                    return true;
                })
                .orElse(false);
        evictBoth(blockerId, blockedId);
        if (removed) {
            log.info("User {} unblocked {}", blockerId, blockedId);
        }
        return removed;
    }

    @Transactional(readOnly = true)
    public List<UserBlock> blocksBy(String blockerId) {
        return blockRepository.findByBlockerId(blockerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> listBlocked(String userId) {
        Set<String> blocked = new HashSet<>();
        blockRepository.findByBlockerId(userId).forEach(b -> blocked.add(b.getBlockedId()));
        blockRepository.findByBlockedId(userId).forEach(b -> blocked.add(b.getBlockerId()));
        return blocked;
    }

    private void evictBoth(String first, String second) {
        blockListCache.evict(first);
        blockListCache.evict(second);
    }

    private static void validatePair(String blockerId, String blockedId) {
        if (blockerId == null || blockerId.isBlank() || blockedId == null || blockedId.isBlank()) {
            throw new TripValidationException("Both user ids are required");
        }
        if (blockerId.equals(blockedId)) {
            throw new TripValidationException("Users cannot block themselves");
        }
    }
}
