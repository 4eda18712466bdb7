package com.sandy.aiot.warning.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;

@Entity
@Table(name = "warning_notifications",
        uniqueConstraints = @UniqueConstraint(name = "uk_warning_notifications_level", columnNames = {"warning_id", "escalation_level"}),
        indexes = @Index(name = "idx_warning_notifications_due", columnList = "status,scheduled_for"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "warning")
public class NotificationEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "warning_id", nullable = false)
    private Warning warning;

    /** Escalation ordinal, 1-based. */
    @Column(name = "escalation_level", nullable = false)
    private int level;

    @Column(name = "scheduled_for", nullable = false)
    private LocalDateTime scheduledFor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private NotificationStatus status;

    private LocalDateTime claimedAt;
    private LocalDateTime sentAt;
    /** Set when the entry reaches SENT or FAILED; drives retention. */
    private LocalDateTime finishedAt;
    @Column(length = 255)
    private String failureReason;

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        NotificationEntry that = (NotificationEntry) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
