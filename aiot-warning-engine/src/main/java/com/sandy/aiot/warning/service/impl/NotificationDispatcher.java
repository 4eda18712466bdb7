package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.repository.NotificationEntryRepository;
import com.sandy.aiot.warning.repository.WarningRepository;
import com.sandy.aiot.warning.service.NotificationDeliveryService;
import com.sandy.aiot.warning.vo.DeliveryResult;
import com.sandy.aiot.warning.vo.DispatchSummary;
import com.sandy.aiot.warning.vo.DueNotification;
import com.sandy.aiot.warning.vo.WarningChange;
import com.sandy.aiot.warning.vo.WarningSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic escalation dispatcher. Each pass claims due SCHEDULED entries one by one (conditional update to SENDING),
 * re-reads the owning warning and either voids the entry (warning resolved) or delivers the warning's current state.
 * A failed or timed-out delivery marks only that entry FAILED; there are no retries.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    public static final String VOIDED_BY_RESOLUTION = "voided by resolution";
    private static final int MAX_REASON_LENGTH = 255;

    private final NotificationEntryRepository notificationEntryRepository;
    private final WarningRepository warningRepository;
    private final NotificationDeliveryService deliveryService;
    private final AsyncTaskExecutor deliveryExecutor;
    private final AtomicBoolean ticking = new AtomicBoolean(false);

    @Value("${warning.dispatch.enabled:true}")
    private boolean enabled;
    @Value("${warning.dispatch.delivery-timeout-ms:10000}")
    private long deliveryTimeoutMs;
    @Value("${warning.dispatch.immediate-on-create:true}")
    private boolean immediateOnCreate;

    public NotificationDispatcher(NotificationEntryRepository notificationEntryRepository,
                                  WarningRepository warningRepository,
                                  NotificationDeliveryService deliveryService,
                                  @Qualifier("notificationDeliveryExecutor") AsyncTaskExecutor deliveryExecutor) {
        this.notificationEntryRepository = notificationEntryRepository;
        this.warningRepository = warningRepository;
        this.deliveryService = deliveryService;
        this.deliveryExecutor = deliveryExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Notification dispatcher initialized: enabled={} deliveryTimeoutMs={} immediateOnCreate={} channel={}",
                enabled, deliveryTimeoutMs, immediateOnCreate, deliveryService.getClass().getSimpleName());
    }

    @Scheduled(fixedDelayString = "${warning.dispatch.tick-ms:60000}", initialDelayString = "${warning.dispatch.initial-delay-ms:5000}")
    public void scheduledTick() {
        if (!enabled) return;
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Previous dispatch tick still running, skipping");
            return;
        }
        try {
            dispatchDue(LocalDateTime.now());
        } catch (Exception e) {
            log.error("Scheduled notification dispatch failed: {}", e.getMessage(), e);
        } finally {
            ticking.set(false);
        }
    }

    /** First escalation level usually has no delay; deliver it without waiting for the next tick. */
    @Async
    @EventListener
    public void onWarningChange(WarningChange change) {
        if (!enabled || !immediateOnCreate || change.getType() != WarningChange.Type.CREATED) return;
        try {
            dispatchDue(LocalDateTime.now());
        } catch (Exception e) {
            log.error("Immediate dispatch after creation failed warningId={} error={}", change.getWarningId(), e.getMessage(), e);
        }
    }

    /**
     * Public entry point for the scheduler, tests and manual trigger. Safe to run concurrently with other passes.
     */
    public DispatchSummary dispatchDue(LocalDateTime now) {
        DispatchSummary summary = new DispatchSummary();
        List<DueNotification> due = notificationEntryRepository.findDue(now);
        summary.setDue(due.size());
        for (DueNotification n : due) {
            switch (dispatchOne(n)) {
                case SENT -> summary.setSent(summary.getSent() + 1);
                case FAILED -> summary.setFailed(summary.getFailed() + 1);
                case VOIDED -> summary.setVoided(summary.getVoided() + 1);
                case SKIPPED -> summary.setSkipped(summary.getSkipped() + 1);
            }
        }
        if (!due.isEmpty()) {
            log.info("Dispatch pass completed due={} sent={} failed={} voided={} skipped={}",
                    summary.getDue(), summary.getSent(), summary.getFailed(), summary.getVoided(), summary.getSkipped());
        }
        return summary;
    }

    private Outcome dispatchOne(DueNotification n) {
        if (notificationEntryRepository.claim(n.id(), LocalDateTime.now()) == 0) {
            return Outcome.SKIPPED;
        }
        try {
            // live status, read after the claim
            Optional<Warning> warning = warningRepository.findById(n.warningId());
            if (warning.isEmpty() || !warning.get().isActive()) {
                notificationEntryRepository.markFailed(n.id(), VOIDED_BY_RESOLUTION, LocalDateTime.now());
                log.info("Notification voided id={} warningId={} level={}", n.id(), n.warningId(), n.level());
                return Outcome.VOIDED;
            }
            WarningSnapshot snapshot = WarningSnapshot.from(warning.get());
            DeliveryResult result = deliverWithTimeout(snapshot, n.level());
            if (result.success()) {
                notificationEntryRepository.markSent(n.id(), LocalDateTime.now());
                log.info("Notification sent id={} warningId={} level={} device={} kind={} severity={}",
                        n.id(), n.warningId(), n.level(), snapshot.getDeviceName(), snapshot.getWarningKind(), snapshot.getSeverity());
                return Outcome.SENT;
            }
            notificationEntryRepository.markFailed(n.id(), truncate(result.detail()), LocalDateTime.now());
            log.warn("Notification delivery failed id={} warningId={} level={} reason={}", n.id(), n.warningId(), n.level(), result.detail());
            return Outcome.FAILED;
        } catch (Exception e) {
            log.error("Notification dispatch error id={} warningId={} level={} error={}", n.id(), n.warningId(), n.level(), e.getMessage(), e);
            notificationEntryRepository.markFailed(n.id(), truncate("dispatch error: " + e.getMessage()), LocalDateTime.now());
            return Outcome.FAILED;
        }
    }

    private DeliveryResult deliverWithTimeout(WarningSnapshot snapshot, int level) {
        Future<DeliveryResult> future = deliveryExecutor.submit(() -> deliveryService.deliver(snapshot, level));
        try {
            DeliveryResult result = future.get(deliveryTimeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result : DeliveryResult.fail("delivery returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return DeliveryResult.fail("delivery timed out after " + deliveryTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return DeliveryResult.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DeliveryResult.fail("dispatch interrupted");
        }
    }

    private static String truncate(String reason) {
        if (reason == null) return null;
        return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
    }

    public boolean isEnabled() { return enabled; }

    private enum Outcome { SENT, FAILED, VOIDED, SKIPPED }
}
