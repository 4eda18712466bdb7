package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.vo.DeliveryResult;
import com.sandy.aiot.warning.vo.WarningSnapshot;

/**
 * Outbound channel (mail, SMS, push). Implementations may also signal failure by throwing.
 */
public interface NotificationDeliveryService {
    DeliveryResult deliver(WarningSnapshot warning, int level);
}
