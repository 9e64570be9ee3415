package com.opsdash.realtimeservice.dashboard;

/**
 * Lifecycle of a mounted dashboard view.
 *
 * IDLE -> LOADING -> SUBSCRIBED <-> RELOAD_PENDING -> RELOADING -> SUBSCRIBED -> UNSUBSCRIBING -> IDLE
 */
public enum DashboardState {
    IDLE,
    LOADING,
    SUBSCRIBED,
    RELOAD_PENDING,
    RELOADING,
    UNSUBSCRIBING
}
