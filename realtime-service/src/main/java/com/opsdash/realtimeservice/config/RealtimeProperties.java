package com.opsdash.realtimeservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning knobs for subscriptions and dashboard reconciliation.
 * Overridable through application.yml or environment variables.
 */
@Component
@ConfigurationProperties(prefix = "opsdash.realtime")
@Getter
@Setter
public class RealtimeProperties {

    /**
     * How long a new channel may take to be confirmed live before the subscribe fails.
     */
    private Duration confirmTimeout = Duration.ofMillis(5000);

    /**
     * Quiet window between the first change event and the coalesced reload.
     */
    private Duration reloadDebounce = Duration.ofMillis(250);

    /**
     * Rows fetched per table for a role dashboard snapshot.
     */
    private int snapshotRowLimit = 200;

    /**
     * Notifications included in an inbox view snapshot.
     */
    private int inboxPageSize = 50;

    private int schedulerPoolSize = 2;
}
