package com.opsdash.realtimeservice.dashboard;

public enum DashboardViewKind {
    /** Tables of every topic the user's role sees. */
    ROLE_DASHBOARD,
    /** The user's latest notifications and unread count. */
    NOTIFICATION_INBOX
}
