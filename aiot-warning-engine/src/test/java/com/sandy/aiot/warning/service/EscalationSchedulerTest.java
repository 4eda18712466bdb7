package com.sandy.aiot.warning.service;

import com.sandy.aiot.warning.entity.NotificationEntry;
import com.sandy.aiot.warning.entity.NotificationStatus;
import com.sandy.aiot.warning.entity.Warning;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EscalationSchedulerTest {

    @Test
    void defaultPlanHasFiveAscendingLevels() {
        EscalationScheduler scheduler = new EscalationScheduler("0,5,15,30,60");
        Warning w = new Warning();
        LocalDateTime created = LocalDateTime.of(2025, 1, 1, 8, 0);

        List<NotificationEntry> entries = scheduler.schedule(w, created);

        assertEquals(5, entries.size());
        assertEquals(entries, w.getNotifications());
        int[] expectedOffsets = {0, 5, 15, 30, 60};
        for (int i = 0; i < entries.size(); i++) {
            NotificationEntry e = entries.get(i);
            assertEquals(i + 1, e.getLevel());
            assertEquals(created.plusMinutes(expectedOffsets[i]), e.getScheduledFor());
            assertEquals(NotificationStatus.SCHEDULED, e.getStatus());
            assertSame(w, e.getWarning());
        }
    }

    @Test
    void customPlanToleratesWhitespace() {
        EscalationScheduler scheduler = new EscalationScheduler(" 1, 2 ,10 ");
        assertEquals(List.of(1L, 2L, 10L), scheduler.getDelaysMinutes());
        assertEquals(3, scheduler.levelCount());
    }

    @Test
    void rejectsInvalidPlans() {
        assertThrows(IllegalStateException.class, () -> new EscalationScheduler("0,5,5"));
        assertThrows(IllegalStateException.class, () -> new EscalationScheduler("10,5"));
        assertThrows(IllegalStateException.class, () -> new EscalationScheduler("-1,5"));
        assertThrows(IllegalStateException.class, () -> new EscalationScheduler(""));
        assertThrows(IllegalStateException.class, () -> new EscalationScheduler("0,five"));
    }
}
