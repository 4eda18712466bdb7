package com.sandy.aiot.warning.controller;

import com.sandy.aiot.warning.entity.NotificationEntry;
import com.sandy.aiot.warning.entity.NotificationStatus;
import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import com.sandy.aiot.warning.entity.WarningStatus;
import com.sandy.aiot.warning.repository.NotificationEntryRepository;
import com.sandy.aiot.warning.repository.WarningRepository;
import com.sandy.aiot.warning.service.WarningStateEngine;
import com.sandy.aiot.warning.service.impl.NotificationDispatcher;
import com.sandy.aiot.warning.service.impl.RetentionSweeper;
import com.sandy.aiot.warning.vo.ActionResp;
import com.sandy.aiot.warning.vo.DispatchSummary;
import com.sandy.aiot.warning.vo.SweepSummary;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Warning listing, statistics and operator actions (acknowledge / resolve), plus manual dispatch and sweep triggers.
 */
@RestController
@RequestMapping("/data/api/warnings")
@RequiredArgsConstructor
@Slf4j
public class WarningController {

    private final WarningRepository warningRepository;
    private final NotificationEntryRepository notificationEntryRepository;
    private final WarningStateEngine warningStateEngine;
    private final NotificationDispatcher notificationDispatcher;
    private final RetentionSweeper retentionSweeper;

    /** Active warnings unless another status is requested. */
    @GetMapping
    public List<WarningItem> list(@RequestParam(required = false) WarningStatus status) {
        WarningStatus s = status != null ? status : WarningStatus.ACTIVE;
        return warningRepository.findByStatusOrderByLastObservedAtDesc(s).stream().map(this::toItem).collect(Collectors.toList());
    }

    @GetMapping("/recent")
    public List<WarningItem> listRecent() {
        return warningRepository.findTop50ByOrderByCreatedAtDesc().stream().map(this::toItem).collect(Collectors.toList());
    }

    @GetMapping("/device/{deviceId}")
    public List<WarningItem> listByDevice(@PathVariable String deviceId) {
        return warningRepository.findByDeviceIdOrderByCreatedAtDesc(deviceId).stream().map(this::toItem).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<WarningDetail> detail(@PathVariable Long id) {
        Optional<Warning> opt = warningRepository.findById(id);
        if (opt.isEmpty()) return ResponseEntity.notFound().build();
        WarningDetail d = new WarningDetail();
        d.setWarning(toItem(opt.get()));
        d.setNotifications(notificationEntryRepository.findByWarningIdOrderByLevelAsc(id).stream()
                .map(this::toNotificationItem).collect(Collectors.toList()));
        return ResponseEntity.ok(d);
    }

    @GetMapping("/stats")
    public Stats stats() {
        Stats s = new Stats();
        s.setActiveCount(warningRepository.countByStatus(WarningStatus.ACTIVE));
        s.setResolvedCount(warningRepository.countByStatus(WarningStatus.RESOLVED));
        Map<String, Long> severity = new LinkedHashMap<>();
        for (WarningSeverity sev : WarningSeverity.values()) {
            severity.put(sev.name(), warningRepository.countByStatusAndSeverity(WarningStatus.ACTIVE, sev));
        }
        s.setSeverityActive(severity);
        Map<String, Long> notifications = new LinkedHashMap<>();
        for (NotificationStatus ns : NotificationStatus.values()) {
            notifications.put(ns.name(), notificationEntryRepository.countByStatus(ns));
        }
        s.setNotifications(notifications);
        s.setOverdueNotifications(notificationEntryRepository.countByStatusAndScheduledForBefore(NotificationStatus.SCHEDULED, LocalDateTime.now()));
        return s;
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<ActionResp> acknowledge(@PathVariable Long id, @RequestBody(required = false) OperatorReq req) {
        OperatorReq r = req != null ? req : new OperatorReq();
        if (!warningStateEngine.acknowledge(id, r.getOperator(), r.getResolutionNotes())) {
            return ResponseEntity.ok(ActionResp.fail("Warning not found"));
        }
        return ResponseEntity.ok(ActionResp.ok());
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<ActionResp> resolve(@PathVariable Long id, @RequestBody(required = false) OperatorReq req) {
        OperatorReq r = req != null ? req : new OperatorReq();
        if (warningRepository.findStatusById(id).isEmpty()) return ResponseEntity.ok(ActionResp.fail("Warning not found"));
        if (warningStateEngine.resolveByOperator(id, r.getOperator(), r.getResolutionNotes()).isEmpty()) {
            return ResponseEntity.ok(ActionResp.fail("Warning already resolved"));
        }
        return ResponseEntity.ok(ActionResp.ok());
    }

    @PostMapping("/notifications/dispatch")
    public DispatchSummary dispatchNow() {
        return notificationDispatcher.dispatchDue(LocalDateTime.now());
    }

    @PostMapping("/sweep")
    public SweepSummary sweepNow() {
        return retentionSweeper.sweep(LocalDateTime.now());
    }

    private WarningItem toItem(Warning w) {
        WarningItem it = new WarningItem();
        it.setId(w.getId());
        it.setDeviceId(w.getDeviceId());
        it.setDeviceType(w.getDeviceType());
        it.setDeviceName(w.getDeviceName());
        it.setWarningKind(w.getWarningKind());
        it.setSeverity(w.getSeverity());
        it.setStatus(w.getStatus());
        it.setMeasuredValue(w.getMeasuredValue());
        it.setThresholdValue(w.getThresholdValue());
        it.setMessage(w.getMessage());
        it.setCreatedAt(w.getCreatedAt());
        it.setLastObservedAt(w.getLastObservedAt());
        it.setResolvedAt(w.getResolvedAt());
        it.setAcknowledgedBy(w.getAcknowledgedBy());
        it.setAcknowledgedAt(w.getAcknowledgedAt());
        it.setResolutionNotes(w.getResolutionNotes());
        return it;
    }

    private NotificationItem toNotificationItem(NotificationEntry n) {
        NotificationItem it = new NotificationItem();
        it.setId(n.getId());
        it.setLevel(n.getLevel());
        it.setScheduledFor(n.getScheduledFor());
        it.setStatus(n.getStatus());
        it.setSentAt(n.getSentAt());
        it.setFailureReason(n.getFailureReason());
        return it;
    }

    @Data
    public static class WarningItem {
        private Long id;
        private String deviceId;
        private String deviceType;
        private String deviceName;
        private String warningKind;
        private WarningSeverity severity;
        private WarningStatus status;
        private String measuredValue;
        private String thresholdValue;
        private String message;
        private LocalDateTime createdAt;
        private LocalDateTime lastObservedAt;
        private LocalDateTime resolvedAt;
        private String acknowledgedBy;
        private LocalDateTime acknowledgedAt;
        private String resolutionNotes;
    }

    @Data
    public static class NotificationItem {
        private Long id;
        private int level;
        private LocalDateTime scheduledFor;
        private NotificationStatus status;
        private LocalDateTime sentAt;
        private String failureReason;
    }

    @Data
    public static class WarningDetail {
        private WarningItem warning;
        private List<NotificationItem> notifications;
    }

    @Data
    public static class Stats {
        private long activeCount;
        private long resolvedCount;
        private Map<String, Long> severityActive;
        private Map<String, Long> notifications;
        private long overdueNotifications;
    }

    @Data
    public static class OperatorReq {
        private String operator;
        private String resolutionNotes;
    }
}
