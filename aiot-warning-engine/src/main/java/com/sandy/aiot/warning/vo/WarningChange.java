package com.sandy.aiot.warning.vo;

import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * State transition committed by the warning state engine. Published as an application event after commit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarningChange {

    public enum Type { CREATED, REFRESHED, RESOLVED }

    private Type type;
    private Long warningId;
    private String deviceId;
    private String warningKind;
    private WarningSeverity severity;
    private String measuredValue;
    private String message;
    private LocalDateTime occurredAt;

    public static WarningChange of(Type type, Warning w, LocalDateTime at) {
        return WarningChange.builder()
                .type(type)
                .warningId(w.getId())
                .deviceId(w.getDeviceId())
                .warningKind(w.getWarningKind())
                .severity(w.getSeverity())
                .measuredValue(w.getMeasuredValue())
                .message(w.getMessage())
                .occurredAt(at)
                .build();
    }
}
