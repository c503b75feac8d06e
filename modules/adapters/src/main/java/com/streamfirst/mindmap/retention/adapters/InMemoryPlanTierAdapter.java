package com.streamfirst.mindmap.retention.adapters;

import com.streamfirst.mindmap.retention.domain.UserId;
import com.streamfirst.mindmap.retention.ports.PlanTierPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PlanTierPort for testing and development. Users without a
 * subscription are on the free tier, matching the billing component's default.
 */
@Slf4j
public class InMemoryPlanTierAdapter implements PlanTierPort {

    public static final String DEFAULT_TIER = "free";

    private final Map<UserId, String> tiers = new ConcurrentHashMap<>();

    @Override
    public String currentTier(UserId userId) {
        String tier = tiers.getOrDefault(userId, DEFAULT_TIER);
        log.debug("User {} is on tier {}", userId, tier);
        return tier;
    }

    /**
     * Records the user's tier code. The code is stored verbatim so callers can simulate bad
     * billing data.
     */
    public void setTier(UserId userId, String tierCode) {
        log.info("Setting tier for user {} to {}", userId, tierCode);
        tiers.put(userId, tierCode);
    }
}
