package com.streamfirst.mindmap.retention.adapters;

import com.streamfirst.mindmap.retention.domain.DeletionReport;
import com.streamfirst.mindmap.retention.domain.SnapshotId;
import com.streamfirst.mindmap.retention.domain.SnapshotMetadata;
import com.streamfirst.mindmap.retention.domain.UserId;
import com.streamfirst.mindmap.retention.ports.SnapshotDeletionPort;
import com.streamfirst.mindmap.retention.ports.SnapshotInventoryPort;
import com.streamfirst.mindmap.retention.ports.UsagePort;
import com.streamfirst.mindmap.retention.ports.UsageQueryException;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToLongFunction;

/**
 * In-memory snapshot store implementing the inventory, usage and deletion ports for testing and
 * development. Holds metadata only; there are no payload bytes.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemorySnapshotStoreAdapter implements SnapshotInventoryPort, UsagePort, SnapshotDeletionPort {

    // Snapshots by owner, insertion-ordered per owner
    private final Map<UserId, Map<SnapshotId, SnapshotMetadata>> snapshotsByUser = new ConcurrentHashMap<>();

    // Users whose usage query should fail, simulating an outage
    private final Set<UserId> unavailableUsage = ConcurrentHashMap.newKeySet();

    // Snapshots whose deletion should fail
    private final Set<SnapshotId> undeletable = ConcurrentHashMap.newKeySet();

    private final ToLongFunction<UserId> quotaResolver;

    /**
     * @param quotaResolver supplies the quota reported in each user's usage row
     */
    public InMemorySnapshotStoreAdapter(ToLongFunction<UserId> quotaResolver) {
        this.quotaResolver = Objects.requireNonNull(quotaResolver, "Quota resolver cannot be null");
    }

    @Override
    public List<SnapshotMetadata> listSnapshots(UserId userId) {
        Map<SnapshotId, SnapshotMetadata> snapshots = snapshotsByUser.get(userId);
        if (snapshots == null) {
            log.debug("No snapshots stored for user {}", userId);
            return List.of();
        }
        synchronized (snapshots) {
            List<SnapshotMetadata> copy = List.copyOf(snapshots.values());
            log.debug("Listed {} snapshots for user {}", copy.size(), userId);
            return copy;
        }
    }

    @Override
    public Optional<UsageRow> aggregateUsage(UserId userId) {
        if (unavailableUsage.contains(userId)) {
            throw new UsageQueryException(userId, "Usage query timed out for user " + userId);
        }

        List<SnapshotMetadata> snapshots = listSnapshots(userId);
        if (snapshots.isEmpty()) {
            return Optional.empty();
        }

        long total = snapshots.stream().mapToLong(SnapshotMetadata::getSizeBytes).sum();
        long quota = quotaResolver.applyAsLong(userId);
        double percentage = (double) total / quota * 100.0;

        log.debug("User {} uses {} of {} bytes ({}%)", userId, total, quota, percentage);
        return Optional.of(new UsageRow(total, quota, percentage));
    }

    @Override
    public DeletionReport deleteSnapshots(UserId userId, List<SnapshotId> snapshotIds) {
        log.debug("Deleting {} snapshots for user {}", snapshotIds.size(), userId);

        Map<SnapshotId, SnapshotMetadata> snapshots = snapshotsByUser.get(userId);
        List<SnapshotId> deleted = new ArrayList<>();
        List<SnapshotId> failed = new ArrayList<>();

        for (SnapshotId id : snapshotIds) {
            if (undeletable.contains(id)) {
                log.warn("Deletion of snapshot {} for user {} failed", id, userId);
                failed.add(id);
                continue;
            }
            if (snapshots != null) {
                synchronized (snapshots) {
                    snapshots.remove(id);
                }
            }
            // already gone counts as deleted
            deleted.add(id);
        }

        log.debug("Deleted {} snapshots for user {}, {} failed", deleted.size(), userId, failed.size());
        return new DeletionReport(deleted, failed);
    }

    /**
     * Stores a snapshot's metadata. Used for testing setup and by the demo runner.
     */
    public void save(UserId userId, SnapshotMetadata snapshot) {
        Map<SnapshotId, SnapshotMetadata> snapshots =
            snapshotsByUser.computeIfAbsent(userId, k -> Collections.synchronizedMap(new LinkedHashMap<>()));
        synchronized (snapshots) {
            if (snapshots.putIfAbsent(snapshot.getId(), snapshot) != null) {
                throw new IllegalArgumentException("Snapshot already exists: " + snapshot.getId());
            }
        }
        log.debug("Saved snapshot {} for user {} ({} bytes)", snapshot.getId(), userId, snapshot.getSizeBytes());
    }

    /**
     * Makes the usage query for {@code userId} fail until {@link #restoreUsageQuery} is called.
     */
    public void failUsageQuery(UserId userId) {
        unavailableUsage.add(userId);
    }

    public void restoreUsageQuery(UserId userId) {
        unavailableUsage.remove(userId);
    }

    /**
     * Makes deletion of the given snapshot fail until {@link #allowDeletion} is called.
     */
    public void failDeletionOf(SnapshotId snapshotId) {
        undeletable.add(snapshotId);
    }

    public void allowDeletion(SnapshotId snapshotId) {
        undeletable.remove(snapshotId);
    }

    /**
     * Gets the total bytes stored for a user.
     */
    public long getTotalBytes(UserId userId) {
        return listSnapshots(userId).stream().mapToLong(SnapshotMetadata::getSizeBytes).sum();
    }
}
