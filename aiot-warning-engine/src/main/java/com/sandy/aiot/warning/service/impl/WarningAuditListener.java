package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.vo.WarningChange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Audit trail of the warning change feed. Runs off the ingestion thread.
 */
@Component
@Slf4j
public class WarningAuditListener {

    @Async
    @EventListener
    public void onWarningChange(WarningChange change) {
        if (change.getType() == WarningChange.Type.REFRESHED) {
            log.debug("AUDIT warning {} id={} device={} kind={} value={}", change.getType(), change.getWarningId(),
                    change.getDeviceId(), change.getWarningKind(), change.getMeasuredValue());
            return;
        }
        log.info("AUDIT warning {} id={} device={} kind={} severity={} value={} at={}", change.getType(), change.getWarningId(),
                change.getDeviceId(), change.getWarningKind(), change.getSeverity(), change.getMeasuredValue(), change.getOccurredAt());
    }
}
