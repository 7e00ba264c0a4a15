package com.driftpool.trip.matching;

import java.util.Set;

/**
 * Source of truth for who a user should never be matched with.
 */
public interface BlockListService {

    /**
     * Users {@code userId} has blocked plus users who have blocked {@code userId}.
     */
    Set<String> listBlocked(String userId);
}
