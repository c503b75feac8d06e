package com.streamfirst.mindmap.retention.ports;

import com.streamfirst.mindmap.retention.domain.SnapshotMetadata;
import com.streamfirst.mindmap.retention.domain.UserId;

import java.util.List;

/**
 * Port for enumerating a user's stored edit-history snapshots.
 *
 * <p>Implementations must return a stable view of the inventory. If the backing store paginates,
 * the adapter assembles every page before returning so that eviction planning never mixes
 * inventory taken before and after a concurrent write.
 */
public interface SnapshotInventoryPort {

    /**
     * Lists metadata for every snapshot owned by the user.
     *
     * @param userId the owner
     * @return all snapshots, empty if the user has none
     * @throws RuntimeException if the store cannot be read
     */
    List<SnapshotMetadata> listSnapshots(UserId userId);
}
