package com.sandy.aiot.warning.vo;

import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Detached, read-only copy of a warning handed to a delivery channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarningSnapshot {
    private Long warningId;
    private String deviceId;
    private String deviceType;
    private String deviceName;
    private String warningKind;
    private WarningSeverity severity;
    private String measuredValue;
    private String thresholdValue;
    private String message;
    private LocalDateTime createdAt;
    private LocalDateTime lastObservedAt;

    public static WarningSnapshot from(Warning w) {
        return WarningSnapshot.builder()
                .warningId(w.getId())
                .deviceId(w.getDeviceId())
                .deviceType(w.getDeviceType())
                .deviceName(w.getDeviceName())
                .warningKind(w.getWarningKind())
                .severity(w.getSeverity())
                .measuredValue(w.getMeasuredValue())
                .thresholdValue(w.getThresholdValue())
                .message(w.getMessage())
                .createdAt(w.getCreatedAt())
                .lastObservedAt(w.getLastObservedAt())
                .build();
    }
}
