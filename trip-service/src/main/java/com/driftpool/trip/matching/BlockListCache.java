package com.driftpool.trip.matching;

import com.driftpool.trip.config.TripEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-user block list memoized in Redis for a short TTL (60s by default), so the broadcast filter
 * can check every open request against a driver without a database round trip each time.
 *
 * Entries are evicted on block/unblock; the TTL bounds staleness for writes from other instances.
 * If Redis is unreachable the lookup goes straight to {@link BlockListService}.
 */
@Slf4j
@Component
public class BlockListCache {

    private static final String KEY_PREFIX = "blocklist:";
    private static final String SEPARATOR = ",";

    private final StringRedisTemplate redisTemplate;
    private final BlockListService blockListService;
    private final Duration ttl;

    public BlockListCache(StringRedisTemplate redisTemplate,
                          BlockListService blockListService,
                          TripEngineProperties properties) {
        this.redisTemplate = redisTemplate;
        this.blockListService = blockListService;
        this.ttl = properties.getBlockList().getCacheTtl();
    }

    public Set<String> blockedFor(String userId) {
        String key = KEY_PREFIX + userId;
        try {
            String cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                return decode(cached);
            }
            Set<String> blocked = blockListService.listBlocked(userId);
            redisTemplate.opsForValue().set(key, String.join(SEPARATOR, blocked), ttl);
            log.debug("Cached {} block(s) for user {}", blocked.size(), userId);
            return blocked;
        } catch (DataAccessException e) {
            log.warn("Block-list cache unavailable for user {}, reading through: {}", userId, e.getMessage());
            return blockListService.listBlocked(userId);
        }
    }

    /** True if either user has blocked the other. */
    public boolean isBlocked(String driverId, String riderId) {
        return blockedFor(driverId).contains(riderId);
    }

    public void evict(String userId) {
        try {
            redisTemplate.delete(KEY_PREFIX + userId);
        } catch (DataAccessException e) {
            log.warn("Could not evict block-list cache for user {}: {}", userId, e.getMessage());
        }
    }

    private static Set<String> decode(String cached) {
        if (cached.isEmpty()) {
            return new HashSet<>();
        }
        return Arrays.stream(cached.split(SEPARATOR)).collect(Collectors.toSet());
    }
}
