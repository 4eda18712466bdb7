package com.sandy.aiot.warning.rule;

public enum LogicalOperator {
    AND,
    OR
}
