package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.entity.NotificationEntry;
import com.sandy.aiot.warning.entity.NotificationStatus;
import com.sandy.aiot.warning.entity.Warning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the notification plan of a new warning: one entry per escalation level at a fixed offset from creation.
 * Entries are attached to the warning and persisted with it (cascade), so both land in one transaction.
 */
@Service
@Slf4j
public class EscalationScheduler {

    private final List<Long> delaysMinutes;

    public EscalationScheduler(@Value("${warning.escalation.delays-minutes:0,5,15,30,60}") String delaysMinutes) {
        this.delaysMinutes = parseDelays(delaysMinutes);
        log.info("Escalation plan initialized: levels={} delaysMinutes={}", this.delaysMinutes.size(), this.delaysMinutes);
    }

    public List<NotificationEntry> schedule(Warning warning, LocalDateTime createdAt) {
        List<NotificationEntry> entries = new ArrayList<>(delaysMinutes.size());
        for (int i = 0; i < delaysMinutes.size(); i++) {
            NotificationEntry entry = NotificationEntry.builder()
                    .level(i + 1)
                    .scheduledFor(createdAt.plusMinutes(delaysMinutes.get(i)))
                    .status(NotificationStatus.SCHEDULED)
                    .build();
            warning.addNotification(entry);
            entries.add(entry);
        }
        return entries;
    }

    public int levelCount() {
        return delaysMinutes.size();
    }

    public List<Long> getDelaysMinutes() {
        return delaysMinutes;
    }

    static List<Long> parseDelays(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalStateException("warning.escalation.delays-minutes must not be empty");
        }
        List<Long> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String s = part.trim();
            if (s.isEmpty()) continue;
            long v;
            try {
                v = Long.parseLong(s);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid escalation delay '" + s + "' in '" + raw + "'", e);
            }
            if (out.isEmpty() && v < 0) {
                throw new IllegalStateException("First escalation delay must be >= 0: " + raw);
            }
            if (!out.isEmpty() && v <= out.get(out.size() - 1)) {
                throw new IllegalStateException("Escalation delays must be strictly ascending: " + raw);
            }
            out.add(v);
        }
        if (out.isEmpty()) {
            throw new IllegalStateException("warning.escalation.delays-minutes must not be empty");
        }
        return Collections.unmodifiableList(out);
    }
}
