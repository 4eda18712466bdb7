package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import com.sandy.aiot.warning.entity.WarningStatus;
import com.sandy.aiot.warning.repository.WarningRepository;
import com.sandy.aiot.warning.service.EscalationScheduler;
import com.sandy.aiot.warning.service.FingerprintLocks;
import com.sandy.aiot.warning.service.WarningStateEngine;
import com.sandy.aiot.warning.vo.RuleResult;
import com.sandy.aiot.warning.vo.WarningChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Anti-spam state machine. Per fingerprint (deviceId + warningKind) there is at most one ACTIVE warning:
 * a violation opens it (with its escalation plan) or refreshes it, the first non-violating observation resolves it.
 * <p>
 * The decision for one fingerprint runs under an in-process stripe lock and in its own transaction. The unique
 * {@code active_signature} column covers writers outside this JVM; losing that race is retried as a refresh.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WarningStateEngineImpl implements WarningStateEngine {

    private final WarningRepository warningRepository;
    private final EscalationScheduler escalationScheduler;
    private final FingerprintLocks fingerprintLocks;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public List<WarningChange> observe(String deviceId, String deviceType, String deviceName, List<RuleResult> ruleResults) {
        if (deviceId == null || ruleResults == null || ruleResults.isEmpty()) return List.of();
        List<WarningChange> changes = new ArrayList<>();
        for (RuleResult verdict : collapseByKind(ruleResults).values()) {
            try {
                apply(deviceId, deviceType, deviceName, verdict).ifPresent(changes::add);
            } catch (Exception e) {
                log.error("Warning state update failed deviceId={} kind={} error={}", deviceId, verdict.getWarningKind(), e.getMessage(), e);
            }
        }
        changes.forEach(this::publish);
        return changes;
    }

    @Override
    public boolean acknowledge(Long warningId, String acknowledgedBy, String notes) {
        Optional<Warning> found = warningRepository.findById(warningId);
        if (found.isEmpty()) return false;
        ReentrantLock lock = fingerprintLocks.lockFor(found.get().getSignature());
        lock.lock();
        try {
            Boolean done = transactionTemplate.execute(status -> {
                Warning w = warningRepository.findById(warningId).orElse(null);
                if (w == null) return false;
                w.setAcknowledgedBy(acknowledgedBy);
                w.setAcknowledgedAt(LocalDateTime.now());
                if (notes != null) w.setResolutionNotes(notes);
                warningRepository.save(w);
                log.info("Warning acknowledged id={} signature={} by={}", w.getId(), w.getSignature(), acknowledgedBy);
                return true;
            });
            return Boolean.TRUE.equals(done);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<WarningChange> resolveByOperator(Long warningId, String resolvedBy, String notes) {
        Optional<Warning> found = warningRepository.findById(warningId);
        if (found.isEmpty()) return Optional.empty();
        String signature = found.get().getSignature();
        ReentrantLock lock = fingerprintLocks.lockFor(signature);
        lock.lock();
        Optional<WarningChange> change;
        try {
            change = transactionTemplate.execute(status -> {
                Warning w = warningRepository.findById(warningId).orElse(null);
                if (w == null) return Optional.<WarningChange>empty();
                LocalDateTime now = LocalDateTime.now();
                if (!w.resolve(now)) return Optional.<WarningChange>empty();
                if (w.getAcknowledgedBy() == null) {
                    w.setAcknowledgedBy(resolvedBy);
                    w.setAcknowledgedAt(now);
                }
                w.setResolutionNotes(notes);
                warningRepository.saveAndFlush(w);
                log.info("Warning resolved by operator id={} signature={} by={}", w.getId(), signature, resolvedBy);
                return Optional.of(WarningChange.of(WarningChange.Type.RESOLVED, w, now));
            });
        } finally {
            lock.unlock();
        }
        if (change == null) return Optional.empty();
        change.ifPresent(this::publish);
        return change;
    }

    /**
     * One verdict per kind, in first-seen order. A kind is violated if any of its results is violated;
     * the first violated result supplies severity, values and message.
     */
    private Map<String, RuleResult> collapseByKind(List<RuleResult> results) {
        Map<String, RuleResult> byKind = new LinkedHashMap<>();
        for (RuleResult r : results) {
            if (r == null || r.getWarningKind() == null || r.getWarningKind().isBlank()) continue;
            RuleResult current = byKind.get(r.getWarningKind());
            if (current == null || (!current.isViolated() && r.isViolated())) {
                byKind.put(r.getWarningKind(), r);
            }
        }
        return byKind;
    }

    private Optional<WarningChange> apply(String deviceId, String deviceType, String deviceName, RuleResult verdict) {
        String signature = Warning.signatureOf(deviceId, verdict.getWarningKind());
        ReentrantLock lock = fingerprintLocks.lockFor(signature);
        lock.lock();
        try {
            Optional<WarningChange> change;
            try {
                change = transactionTemplate.execute(status -> decide(signature, deviceId, deviceType, deviceName, verdict));
            } catch (DataIntegrityViolationException e) {
                // only a committed active row from another writer turns this into a refresh
                if (findActive(deviceId, verdict.getWarningKind()).isEmpty()) throw e;
                log.info("Concurrent warning creation detected signature={}, retrying as refresh", signature);
                change = transactionTemplate.execute(status -> decide(signature, deviceId, deviceType, deviceName, verdict));
            }
            return change == null ? Optional.empty() : change;
        } finally {
            lock.unlock();
        }
    }

    private Optional<Warning> findActive(String deviceId, String warningKind) {
        return warningRepository.findFirstByDeviceIdAndWarningKindAndStatus(deviceId, warningKind, WarningStatus.ACTIVE);
    }

    private Optional<WarningChange> decide(String signature, String deviceId, String deviceType, String deviceName, RuleResult verdict) {
        LocalDateTime now = LocalDateTime.now();
        Optional<Warning> active = findActive(deviceId, verdict.getWarningKind());
        if (verdict.isViolated()) {
            if (active.isPresent()) {
                return Optional.of(refresh(active.get(), verdict, now));
            }
            return Optional.of(create(signature, deviceId, deviceType, deviceName, verdict, now));
        }
        if (active.isEmpty()) return Optional.empty();
        Warning w = active.get();
        w.resolve(now);
        warningRepository.saveAndFlush(w);
        log.info("Warning resolved id={} signature={} lastValue={} activeFor={}min", w.getId(), signature, verdict.getMeasuredValue(),
                Duration.between(w.getCreatedAt(), now).toMinutes());
        return Optional.of(WarningChange.of(WarningChange.Type.RESOLVED, w, now));
    }

    private WarningChange create(String signature, String deviceId, String deviceType, String deviceName, RuleResult verdict, LocalDateTime now) {
        Warning w = Warning.builder()
                .deviceId(deviceId)
                .warningKind(verdict.getWarningKind())
                .deviceType(deviceType)
                .deviceName(deviceName)
                .severity(verdict.getSeverity() != null ? verdict.getSeverity() : WarningSeverity.MODERATE)
                .measuredValue(Warning.clip(verdict.getMeasuredValue(), Warning.MAX_VALUE_LENGTH))
                .thresholdValue(Warning.clip(verdict.getThresholdValue(), Warning.MAX_VALUE_LENGTH))
                .message(Warning.clip(verdict.getMessage(), Warning.MAX_MESSAGE_LENGTH))
                .status(WarningStatus.ACTIVE)
                .signature(signature)
                .activeSignature(signature)
                .createdAt(now)
                .lastObservedAt(now)
                .build();
        escalationScheduler.schedule(w, now);
        warningRepository.saveAndFlush(w);
        log.info("Created warning id={} signature={} severity={} value={} threshold={} notifications={}",
                w.getId(), signature, w.getSeverity(), w.getMeasuredValue(), w.getThresholdValue(), w.getNotifications().size());
        return WarningChange.of(WarningChange.Type.CREATED, w, now);
    }

    private WarningChange refresh(Warning w, RuleResult verdict, LocalDateTime now) {
        w.setMeasuredValue(Warning.clip(verdict.getMeasuredValue(), Warning.MAX_VALUE_LENGTH));
        w.setThresholdValue(Warning.clip(verdict.getThresholdValue(), Warning.MAX_VALUE_LENGTH));
        w.setMessage(Warning.clip(verdict.getMessage(), Warning.MAX_MESSAGE_LENGTH));
        w.setLastObservedAt(now);
        warningRepository.save(w);
        log.debug("Refreshed warning id={} signature={} value={}", w.getId(), w.getSignature(), w.getMeasuredValue());
        return WarningChange.of(WarningChange.Type.REFRESHED, w, now);
    }

    private void publish(WarningChange change) {
        try {
            eventPublisher.publishEvent(change);
        } catch (Exception e) {
            log.warn("Publishing warning change failed warningId={} type={} error={}", change.getWarningId(), change.getType(), e.getMessage());
        }
    }
}
