package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.entity.NotificationStatus;
import com.sandy.aiot.warning.entity.WarningStatus;
import com.sandy.aiot.warning.repository.NotificationEntryRepository;
import com.sandy.aiot.warning.repository.WarningRepository;
import com.sandy.aiot.warning.vo.SweepSummary;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Housekeeping: purges old resolved warnings (with their notification entries), old finished notification entries
 * and claims left in SENDING by a dispatcher that died mid-flight. Each step is isolated; failures are only logged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionSweeper {

    static final String CLAIM_EXPIRED = "claim expired";
    private static final int DELETE_BATCH = 500;

    private final WarningRepository warningRepository;
    private final NotificationEntryRepository notificationEntryRepository;
    private final TransactionTemplate transactionTemplate;

    @Value("${warning.retention.enabled:true}")
    private boolean enabled;
    @Value("${warning.retention.resolved-days:30}")
    private int resolvedDays;
    @Value("${warning.retention.notification-days:7}")
    private int notificationDays;
    @Value("${warning.dispatch.stale-claim-minutes:10}")
    private int staleClaimMinutes;

    @PostConstruct
    public void init() {
        log.info("Retention sweeper initialized: enabled={} resolvedDays={} notificationDays={} staleClaimMinutes={}",
                enabled, resolvedDays, notificationDays, staleClaimMinutes);
    }

    @Scheduled(cron = "${warning.retention.cron:0 0 3 * * *}")
    public void scheduledSweep() {
        if (!enabled) return;
        sweep(LocalDateTime.now());
    }

    public SweepSummary sweep(LocalDateTime now) {
        SweepSummary summary = new SweepSummary();
        try {
            summary.setDeletedWarnings(purgeResolvedWarnings(now.minusDays(resolvedDays)));
        } catch (Exception e) {
            log.error("Purging resolved warnings failed: {}", e.getMessage(), e);
        }
        try {
            summary.setDeletedNotifications(notificationEntryRepository.deleteFinishedBefore(
                    EnumSet.of(NotificationStatus.SENT, NotificationStatus.FAILED), now.minusDays(notificationDays)));
        } catch (Exception e) {
            log.error("Purging finished notifications failed: {}", e.getMessage(), e);
        }
        try {
            summary.setExpiredClaims(notificationEntryRepository.failStaleClaims(now.minusMinutes(staleClaimMinutes), CLAIM_EXPIRED, now));
        } catch (Exception e) {
            log.error("Expiring stale notification claims failed: {}", e.getMessage(), e);
        }
        log.info("Retention sweep completed deletedWarnings={} deletedNotifications={} expiredClaims={}",
                summary.getDeletedWarnings(), summary.getDeletedNotifications(), summary.getExpiredClaims());
        return summary;
    }

    private int purgeResolvedWarnings(LocalDateTime cutoff) {
        List<Long> ids = warningRepository.findIdsByStatusAndResolvedAtBefore(WarningStatus.RESOLVED, cutoff);
        int deleted = 0;
        for (int from = 0; from < ids.size(); from += DELETE_BATCH) {
            List<Long> batch = ids.subList(from, Math.min(from + DELETE_BATCH, ids.size()));
            Integer n = transactionTemplate.execute(status -> {
                notificationEntryRepository.deleteByWarningIdIn(batch);
                return warningRepository.deleteByIdIn(batch);
            });
            deleted += n == null ? 0 : n;
        }
        return deleted;
    }
}
