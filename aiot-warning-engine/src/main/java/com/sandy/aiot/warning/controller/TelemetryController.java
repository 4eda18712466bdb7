package com.sandy.aiot.warning.controller;

import com.sandy.aiot.warning.rule.WarningRule;
import com.sandy.aiot.warning.service.impl.DeviceTelemetryService;
import com.sandy.aiot.warning.vo.DeviceTelemetry;
import com.sandy.aiot.warning.vo.WarningChange;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Accepts decoded device readings (e.g. forwarded by the MQTT bridge, or simulated) and returns the warning changes.
 */
@RestController
@RequestMapping("/data/api/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final DeviceTelemetryService deviceTelemetryService;

    @PostMapping("/{deviceId}")
    public List<WarningChange> submit(@PathVariable String deviceId, @RequestBody TelemetryReq req) {
        DeviceTelemetry telemetry = DeviceTelemetry.builder()
                .deviceId(deviceId)
                .deviceType(req.getDeviceType())
                .deviceName(req.getDeviceName())
                .values(req.getValues())
                .rules(req.getRules())
                .timestamp(req.getTimestamp() != null ? req.getTimestamp() : LocalDateTime.now())
                .build();
        return deviceTelemetryService.onDeviceActive(telemetry);
    }

    @Data
    public static class TelemetryReq {
        private String deviceType;
        private String deviceName;
        private Map<String, Object> values;
        /** Optional inline rules; otherwise the device's stored warning config applies. */
        private List<WarningRule> rules;
        private LocalDateTime timestamp;
    }
}
