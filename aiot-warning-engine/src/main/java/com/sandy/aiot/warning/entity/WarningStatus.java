package com.sandy.aiot.warning.entity;

public enum WarningStatus {
    ACTIVE,
    RESOLVED
}
