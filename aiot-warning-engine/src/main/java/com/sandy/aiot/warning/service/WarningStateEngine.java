package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.vo.RuleResult;
import com.sandy.aiot.warning.vo.WarningChange;

import java.util.List;
import java.util.Optional;

public interface WarningStateEngine {

    /**
     * Applies one observation of a device: per warning kind opens, refreshes or resolves the active warning.
     * Failures of one kind are logged and do not affect the other kinds.
     */
    List<WarningChange> observe(String deviceId, String deviceType, String deviceName, List<RuleResult> ruleResults);

    /** Operator acknowledgement; the warning stays ACTIVE. False when the warning is unknown. */
    boolean acknowledge(Long warningId, String acknowledgedBy, String notes);

    /** Operator resolution of an active warning; empty when the warning is unknown or already resolved. */
    Optional<WarningChange> resolveByOperator(Long warningId, String resolvedBy, String notes);
}
