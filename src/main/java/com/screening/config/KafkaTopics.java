package com.screening.config;

/**
 * Centralized Kafka topic names.
 */
public final class KafkaTopics {

    // Alert-worthy disposition transitions, outbound
    public static final String SCREENING_ALERT_RAISED = "screening.alert.raised";

    // Upstream watchlist refresher finished writing new snapshots, inbound
    public static final String WATCHLIST_SNAPSHOT_REFRESHED = "watchlist.snapshot.refreshed";

    private KafkaTopics() {
    }
}
