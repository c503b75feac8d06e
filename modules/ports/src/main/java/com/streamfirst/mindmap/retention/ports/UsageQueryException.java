package com.streamfirst.mindmap.retention.ports;

import com.streamfirst.mindmap.retention.domain.UserId;

/**
 * Thrown by {@link UsagePort} when the aggregate usage query fails or times out. Callers must not
 * treat this as zero usage.
 */
public class UsageQueryException extends RuntimeException {

    private final UserId userId;

    public UsageQueryException(UserId userId, String message) {
        super(message);
        this.userId = userId;
    }

    public UsageQueryException(UserId userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public UserId getUserId() {
        return userId;
    }
}
