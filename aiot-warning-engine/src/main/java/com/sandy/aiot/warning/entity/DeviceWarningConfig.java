package com.sandy.aiot.warning.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Per-device warning configuration as stored by the device/connectivity config store.
 * Rules are kept as a JSON array, see {@link com.sandy.aiot.warning.rule.WarningRule}.
 */
@Entity
@Table(name = "device_warning_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceWarningConfig {
    @Id
    @Column(length = 64)
    private String deviceId;

    private boolean enabled;

    @Lob
    @Column(columnDefinition = "CLOB")
    private String rulesJson;

    private LocalDateTime updatedAt;
}
