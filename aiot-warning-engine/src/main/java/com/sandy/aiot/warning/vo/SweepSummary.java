package com.sandy.aiot.warning.vo;

import lombok.Data;

@Data
public class SweepSummary {
    private int deletedWarnings;
    private int deletedNotifications;
    private int expiredClaims;
}
