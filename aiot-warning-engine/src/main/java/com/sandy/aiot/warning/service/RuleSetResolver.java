package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.rule.WarningRule;

import java.util.List;

public interface RuleSetResolver {
    /** Active rules of the device in evaluation order; empty when none are configured or warnings are disabled. */
    List<WarningRule> resolve(String deviceId);
}
