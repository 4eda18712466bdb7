package com.sandy.aiot.warning.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Device warning for one fingerprint (deviceId + warningKind).
 * <p>
 * At most one ACTIVE row per fingerprint: {@code activeSignature} carries the fingerprint while the warning is
 * ACTIVE and is cleared on resolution, so the unique constraint only covers active rows.
 */
@Entity
@Table(name = "device_warnings",
        uniqueConstraints = @UniqueConstraint(name = "uk_device_warnings_active_signature", columnNames = "active_signature"),
        indexes = {
                @Index(name = "idx_device_warnings_signature", columnList = "signature"),
                @Index(name = "idx_device_warnings_status_resolved", columnList = "status,resolved_at")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "notifications")
public class Warning {
    public static final int MAX_VALUE_LENGTH = 255;
    public static final int MAX_MESSAGE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String deviceId;
    @Column(nullable = false, length = 64)
    private String warningKind;

    /** Display context, set at creation. */
    @Column(length = 64)
    private String deviceType;
    @Column(length = 128)
    private String deviceName;

    /** Set once from the rule that opened the warning. */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WarningSeverity severity;

    /** Latest observation; overwritten on every refresh. */
    @Column(length = MAX_VALUE_LENGTH)
    private String measuredValue;
    @Column(length = MAX_VALUE_LENGTH)
    private String thresholdValue;
    @Column(length = MAX_MESSAGE_LENGTH)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WarningStatus status;

    @Column(nullable = false, length = 140)
    private String signature;
    @Column(name = "active_signature", length = 140)
    private String activeSignature;

    private LocalDateTime createdAt;
    private LocalDateTime lastObservedAt;
    private LocalDateTime resolvedAt;

    /** Operator fields. */
    @Column(length = 64)
    private String acknowledgedBy;
    private LocalDateTime acknowledgedAt;
    @Column(length = 1000)
    private String resolutionNotes;

    @Builder.Default
    @OneToMany(mappedBy = "warning", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("level ASC")
    private List<NotificationEntry> notifications = new ArrayList<>();

    /**
     * Fingerprint key. The device id is length-prefixed, so ids and kinds containing ':' cannot collide
     * ("AA:BB" + "temp" gives "5:AA:BB:temp", "AA" + "BB:temp" gives "2:AA:BB:temp").
     */
    public static String signatureOf(String deviceId, String warningKind) {
        return deviceId.length() + ":" + deviceId + ":" + warningKind;
    }

    /** Cuts observation text to the column width. */
    public static String clip(String text, int max) {
        if (text == null || text.length() <= max) return text;
        return text.substring(0, max - 3) + "...";
    }

    public boolean isActive() {
        return status == WarningStatus.ACTIVE;
    }

    public void addNotification(NotificationEntry entry) {
        if (notifications == null) notifications = new ArrayList<>();
        entry.setWarning(this);
        notifications.add(entry);
    }

    /** Irreversible; no-op when already resolved. */
    public boolean resolve(LocalDateTime at) {
        if (!isActive()) return false;
        status = WarningStatus.RESOLVED;
        resolvedAt = at;
        activeSignature = null;
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Warning warning = (Warning) o;
        return id != null && Objects.equals(id, warning.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
