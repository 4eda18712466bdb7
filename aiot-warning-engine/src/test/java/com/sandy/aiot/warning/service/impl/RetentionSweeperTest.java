package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.entity.NotificationEntry;
import com.sandy.aiot.warning.entity.NotificationStatus;
import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import com.sandy.aiot.warning.repository.NotificationEntryRepository;
import com.sandy.aiot.warning.repository.WarningRepository;
import com.sandy.aiot.warning.service.WarningStateEngine;
import com.sandy.aiot.warning.vo.RuleResult;
import com.sandy.aiot.warning.vo.SweepSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class RetentionSweeperTest {

    @Autowired RetentionSweeper retentionSweeper;
    @Autowired WarningStateEngine warningStateEngine;
    @Autowired WarningRepository warningRepository;
    @Autowired NotificationEntryRepository notificationEntryRepository;
    @Autowired TransactionTemplate transactionTemplate;

    @BeforeEach
    void setup() {
        notificationEntryRepository.deleteAllInBatch();
        warningRepository.deleteAllInBatch();
    }

    private Warning open(String deviceId) {
        warningStateEngine.observe(deviceId, "pdu", deviceId, List.of(result(deviceId, true)));
        return warningRepository.findByActiveSignature(Warning.signatureOf(deviceId, "voltage_high")).orElseThrow();
    }

    private void resolve(String deviceId) {
        warningStateEngine.observe(deviceId, "pdu", deviceId, List.of(result(deviceId, false)));
    }

    private static RuleResult result(String deviceId, boolean violated) {
        return RuleResult.builder().warningKind("voltage_high").severity(WarningSeverity.MAJOR)
                .measuredValue(violated ? "250" : "230").thresholdValue("240").violated(violated).build();
    }

    private void backdateResolution(Long warningId, LocalDateTime resolvedAt) {
        transactionTemplate.executeWithoutResult(status -> {
            Warning w = warningRepository.findById(warningId).orElseThrow();
            w.setResolvedAt(resolvedAt);
        });
    }

    @Test
    void oldResolvedWarningsArePurgedWithTheirEntries() {
        Warning old = open("OLD");
        resolve("OLD");
        backdateResolution(old.getId(), LocalDateTime.now().minusDays(45));
        Warning recent = open("RECENT");
        resolve("RECENT");

        SweepSummary summary = retentionSweeper.sweep(LocalDateTime.now());

        assertEquals(1, summary.getDeletedWarnings());
        assertFalse(warningRepository.existsById(old.getId()));
        assertTrue(notificationEntryRepository.findByWarningIdOrderByLevelAsc(old.getId()).isEmpty());
        assertTrue(warningRepository.existsById(recent.getId()));
        assertFalse(notificationEntryRepository.findByWarningIdOrderByLevelAsc(recent.getId()).isEmpty());
    }

    @Test
    void activeWarningsAreNeverPurged() {
        Warning w = open("LIVE");
        transactionTemplate.executeWithoutResult(status -> {
            Warning live = warningRepository.findById(w.getId()).orElseThrow();
            live.setCreatedAt(LocalDateTime.now().minusDays(90));
        });

        assertEquals(0, retentionSweeper.sweep(LocalDateTime.now()).getDeletedWarnings());
        assertTrue(warningRepository.existsById(w.getId()));
    }

    @Test
    void oldFinishedEntriesArePurged() {
        Warning w = open("D");
        Long firstEntry = notificationEntryRepository.findByWarningIdOrderByLevelAsc(w.getId()).get(0).getId();
        transactionTemplate.executeWithoutResult(status -> {
            NotificationEntry e = notificationEntryRepository.findById(firstEntry).orElseThrow();
            e.setStatus(NotificationStatus.SENT);
            e.setSentAt(LocalDateTime.now().minusDays(10));
            e.setFinishedAt(LocalDateTime.now().minusDays(10));
        });
        int planned = notificationEntryRepository.findByWarningIdOrderByLevelAsc(w.getId()).size();

        SweepSummary summary = retentionSweeper.sweep(LocalDateTime.now());

        assertEquals(1, summary.getDeletedNotifications());
        assertFalse(notificationEntryRepository.existsById(firstEntry));
        assertEquals(planned - 1, notificationEntryRepository.findByWarningIdOrderByLevelAsc(w.getId()).size());
        assertTrue(warningRepository.existsById(w.getId()));
    }

    @Test
    void staleClaimsAreExpired() {
        Warning w = open("D");
        List<NotificationEntry> entries = notificationEntryRepository.findByWarningIdOrderByLevelAsc(w.getId());
        Long stale = entries.get(0).getId();
        Long fresh = entries.get(1).getId();
        assertEquals(1, notificationEntryRepository.claim(stale, LocalDateTime.now().minusHours(1)));
        assertEquals(1, notificationEntryRepository.claim(fresh, LocalDateTime.now()));

        SweepSummary summary = retentionSweeper.sweep(LocalDateTime.now());

        assertEquals(1, summary.getExpiredClaims());
        NotificationEntry expired = notificationEntryRepository.findById(stale).orElseThrow();
        assertEquals(NotificationStatus.FAILED, expired.getStatus());
        assertEquals(RetentionSweeper.CLAIM_EXPIRED, expired.getFailureReason());
        assertEquals(NotificationStatus.SENDING, notificationEntryRepository.findById(fresh).orElseThrow().getStatus());
    }
}
