package com.streamfirst.mindmap.retention.ports;

import com.streamfirst.mindmap.retention.domain.UserId;

/**
 * Port for the billing component that knows which plan a user is on.
 */
public interface PlanTierPort {

    /**
     * Returns the raw tier code (for example {@code "free"} or {@code "pro"}) for the user. The
     * code is parsed by the caller so that an unknown value surfaces as a typed failure.
     */
    String currentTier(UserId userId);
}
