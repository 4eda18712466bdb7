package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.service.NotificationDeliveryService;
import com.sandy.aiot.warning.vo.DeliveryResult;
import com.sandy.aiot.warning.vo.WarningSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Plain-text e-mail channel. Subject carries severity and escalation level so operators can filter.
 */
@Slf4j
public class MailNotificationDeliveryService implements NotificationDeliveryService {

    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JavaMailSender mailSender;
    private final String from;
    private final List<String> recipients;

    public MailNotificationDeliveryService(JavaMailSender mailSender, String from, List<String> recipients) {
        this.mailSender = mailSender;
        this.from = from;
        this.recipients = List.copyOf(recipients);
    }

    @Override
    public DeliveryResult deliver(WarningSnapshot w, int level) {
        if (recipients.isEmpty()) {
            return DeliveryResult.fail("no mail recipients configured");
        }
        SimpleMailMessage mail = new SimpleMailMessage();
        mail.setFrom(from);
        mail.setTo(recipients.toArray(new String[0]));
        mail.setSubject(subject(w, level));
        mail.setText(body(w, level));
        try {
            mailSender.send(mail);
            log.debug("Warning mail sent warningId={} level={} recipients={}", w.getWarningId(), level, recipients.size());
            return DeliveryResult.ok();
        } catch (MailException e) {
            log.warn("Warning mail failed warningId={} level={} error={}", w.getWarningId(), level, e.getMessage());
            return DeliveryResult.fail("mail: " + e.getMessage());
        }
    }

    static String subject(WarningSnapshot w, int level) {
        String device = w.getDeviceName() != null ? w.getDeviceName() : w.getDeviceId();
        return String.format("[%s] %s on %s (escalation level %d)", w.getSeverity(), w.getWarningKind(), device, level);
    }

    static String body(WarningSnapshot w, int level) {
        StringBuilder sb = new StringBuilder();
        sb.append("Device: ").append(w.getDeviceName()).append(" (").append(w.getDeviceId()).append(")\n");
        if (w.getDeviceType() != null) sb.append("Device type: ").append(w.getDeviceType()).append('\n');
        sb.append("Warning: ").append(w.getWarningKind()).append('\n');
        sb.append("Severity: ").append(w.getSeverity()).append('\n');
        sb.append("Current value: ").append(w.getMeasuredValue()).append('\n');
        sb.append("Threshold: ").append(w.getThresholdValue()).append('\n');
        sb.append("Message: ").append(w.getMessage()).append('\n');
        if (w.getCreatedAt() != null) sb.append("Active since: ").append(TS_FMT.format(w.getCreatedAt())).append('\n');
        if (w.getLastObservedAt() != null) sb.append("Last observed: ").append(TS_FMT.format(w.getLastObservedAt())).append('\n');
        sb.append("Escalation level: ").append(level).append('\n');
        return sb.toString();
    }
}
