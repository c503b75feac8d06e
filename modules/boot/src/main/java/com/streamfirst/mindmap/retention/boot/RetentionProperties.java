package com.streamfirst.mindmap.retention.boot;

import com.streamfirst.mindmap.retention.application.PolicyCatalog;
import com.streamfirst.mindmap.retention.domain.RetentionPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Retention limits per plan tier, bound from {@code mindmap.retention.*}.
 *
 * <p>Defaults match {@link PolicyCatalog#defaults()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "mindmap.retention")
public class RetentionProperties {

    private TierLimits free = new TierLimits(Duration.ofDays(30), DataSize.ofMegabytes(100));

    private TierLimits pro = new TierLimits(Duration.ofDays(365), DataSize.ofGigabytes(1));

    /**
     * Seed a demo user and run one sweep at startup.
     */
    private boolean demo = false;

    public PolicyCatalog toCatalog() {
        return PolicyCatalog.of(free.toPolicy(), pro.toPolicy());
    }

    @Getter
    @Setter
    public static class TierLimits {

        /**
         * Age past which an ordinary snapshot is stale. Major snapshots get twice this.
         */
        private Duration maxAge;

        /**
         * Aggregate snapshot storage ceiling.
         */
        private DataSize storageQuota;

        public TierLimits() {
        }

        public TierLimits(Duration maxAge, DataSize storageQuota) {
            this.maxAge = maxAge;
            this.storageQuota = storageQuota;
        }

        RetentionPolicy toPolicy() {
            return RetentionPolicy.of(maxAge, storageQuota.toBytes());
        }
    }
}
