package com.sandy.aiot.warning.vo;

import com.sandy.aiot.warning.rule.WarningRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * "Device active" event: decoded field values of one device plus, optionally, the rule set to apply.
 * When {@code rules} is null the rules are looked up from the device warning config store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTelemetry {
    private String deviceId;
    private String deviceType;
    private String deviceName;
    private Map<String, Object> values;
    private List<WarningRule> rules;
    private LocalDateTime timestamp;
}
