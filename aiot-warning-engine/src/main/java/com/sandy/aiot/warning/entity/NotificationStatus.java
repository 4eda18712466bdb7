package com.sandy.aiot.warning.entity;

/**
 * Lifecycle of a single escalation entry.
 * SENDING is the claim marker held by a dispatcher between selection and delivery.
 */
public enum NotificationStatus {
    SCHEDULED,
    SENDING,
    SENT,
    FAILED
}
