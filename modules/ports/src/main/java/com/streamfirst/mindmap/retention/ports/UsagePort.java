package com.streamfirst.mindmap.retention.ports;

import com.streamfirst.mindmap.retention.domain.UserId;

import java.util.Optional;

/**
 * Port for the storage collaborator's aggregate usage query.
 */
public interface UsagePort {

    /**
     * Returns the user's aggregate snapshot storage.
     *
     * @param userId the owner
     * @return the usage row, or empty if the user has no snapshots yet
     * @throws UsageQueryException if the query failed or timed out
     */
    Optional<UsageRow> aggregateUsage(UserId userId);

    /**
     * Zero-or-one row returned by the aggregate query.
     *
     * @param totalSizeBytes bytes held across all of the user's snapshots
     * @param quotaBytes ceiling configured for the user's plan
     * @param usagePercentage usage percentage as computed by the store
     */
    record UsageRow(long totalSizeBytes, long quotaBytes, double usagePercentage) {}
}
