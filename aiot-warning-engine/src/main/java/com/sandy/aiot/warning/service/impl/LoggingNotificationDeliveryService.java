package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.service.NotificationDeliveryService;
import com.sandy.aiot.warning.vo.DeliveryResult;
import com.sandy.aiot.warning.vo.WarningSnapshot;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback channel when no mail server is configured: the notification only goes to the log.
 */
@Slf4j
public class LoggingNotificationDeliveryService implements NotificationDeliveryService {

    @Override
    public DeliveryResult deliver(WarningSnapshot w, int level) {
        log.warn("WARNING NOTIFICATION level={} severity={} device={}({}) kind={} value={} threshold={} message={}",
                level, w.getSeverity(), w.getDeviceName(), w.getDeviceId(), w.getWarningKind(),
                w.getMeasuredValue(), w.getThresholdValue(), w.getMessage());
        return DeliveryResult.ok();
    }
}
