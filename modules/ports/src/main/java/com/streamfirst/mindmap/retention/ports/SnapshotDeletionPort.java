package com.streamfirst.mindmap.retention.ports;

import com.streamfirst.mindmap.retention.domain.DeletionReport;
import com.streamfirst.mindmap.retention.domain.SnapshotId;
import com.streamfirst.mindmap.retention.domain.UserId;

import java.util.List;

/**
 * Port for logically deleting snapshots from the storage collaborator.
 *
 * <p>Deletion is idempotent: ids that no longer exist count as deleted. A batch may partially
 * fail; the report says which ids went and which did not.
 */
public interface SnapshotDeletionPort {

    /**
     * Deletes the given snapshots in order.
     *
     * @param userId the owner
     * @param snapshotIds ids to delete
     * @return per-id outcome
     * @throws RuntimeException if the store is unreachable and nothing could be attempted
     */
    DeletionReport deleteSnapshots(UserId userId, List<SnapshotId> snapshotIds);
}
