package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import com.sandy.aiot.warning.entity.WarningStatus;
import com.sandy.aiot.warning.repository.DeviceWarningConfigRepository;
import com.sandy.aiot.warning.repository.NotificationEntryRepository;
import com.sandy.aiot.warning.repository.WarningRepository;
import com.sandy.aiot.warning.rule.WarningRule;
import com.sandy.aiot.warning.vo.DeviceTelemetry;
import com.sandy.aiot.warning.vo.WarningChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class DeviceTelemetryServiceTest {

    @Autowired DeviceTelemetryService telemetryService;
    @Autowired DeviceWarningConfigService configService;
    @Autowired DeviceWarningConfigRepository configRepository;
    @Autowired WarningRepository warningRepository;
    @Autowired NotificationEntryRepository notificationEntryRepository;

    @BeforeEach
    void setup() {
        notificationEntryRepository.deleteAllInBatch();
        warningRepository.deleteAllInBatch();
        configRepository.deleteAllInBatch();
    }

    private static WarningRule rule(String field, String condition, String kind, String severity) {
        return WarningRule.builder().field(field).condition(condition).warningType(kind).severity(severity).build();
    }

    private List<WarningChange> submit(String deviceId, Map<String, Object> values, List<WarningRule> rules) {
        return telemetryService.onDeviceActive(DeviceTelemetry.builder()
                .deviceId(deviceId).deviceType("iot_environment_status").deviceName("Env-" + deviceId)
                .values(values).rules(rules).build());
    }

    private boolean hasActive(String deviceId, String kind) {
        return warningRepository.findByActiveSignature(Warning.signatureOf(deviceId, kind)).isPresent();
    }

    @Test
    void malformedRuleIsSkippedAndOthersStillApply() {
        List<WarningRule> rules = List.of(
                rule("temperature", "supposed > ", "x", "major"),
                rule("temperature", "> 25", "y", "major"));

        List<WarningChange> changes = assertDoesNotThrow(() -> submit("D", Map.of("temperature", 30), rules));

        assertEquals(1, changes.size());
        assertEquals("y", changes.get(0).getWarningKind());
        assertFalse(hasActive("D", "x"));
        assertTrue(hasActive("D", "y"));
    }

    @Test
    void absentFieldNeitherOpensNorResolves() {
        List<WarningRule> rules = List.of(rule("humidity", "> 70", "humidity_high", "minor"));
        submit("D", Map.of("humidity", 80), rules);

        List<WarningChange> changes = submit("D", Map.of("temperature", 20), rules);

        assertTrue(changes.isEmpty());
        assertTrue(hasActive("D", "humidity_high"), "A missing reading is not a normal reading");
    }

    @Test
    void nonNumericValueIsSkipped() {
        List<WarningRule> rules = List.of(rule("temperature", "> 25", "temperature_high", "major"));
        submit("D", Map.of("temperature", 30), rules);

        List<WarningChange> changes = submit("D", Map.of("temperature", "N/A"), rules);

        assertTrue(changes.isEmpty());
        assertTrue(hasActive("D", "temperature_high"));
    }

    @Test
    void numericStringsAreCompared() {
        List<WarningChange> changes = submit("D", Map.of("temperature", "26.5"),
                List.of(rule("temperature", "> 25", "temperature_high", "major")));
        assertEquals(WarningChange.Type.CREATED, changes.get(0).getType());
    }

    @Test
    void textConditionOpensWarning() {
        List<WarningRule> rules = List.of(rule("state", "== \"error\"", "device_error", "critical"));

        submit("PUMP", Map.of("state", "error"), rules);
        Warning w = warningRepository.findByActiveSignature(Warning.signatureOf("PUMP", "device_error")).orElseThrow();
        assertEquals(WarningSeverity.CRITICAL, w.getSeverity());
        assertEquals("error", w.getMeasuredValue());

        List<WarningChange> changes = submit("PUMP", Map.of("state", "ok"), rules);
        assertEquals(WarningChange.Type.RESOLVED, changes.get(0).getType());
    }

    @Test
    void rulesOfSameKindCollapseToOneWarning() {
        List<WarningRule> rules = List.of(
                rule("temperature", "< 0", "temperature_out_of_range", "major"),
                rule("temperature", "> 40", "temperature_out_of_range", "critical"));

        List<WarningChange> changes = submit("D", Map.of("temperature", 45), rules);

        assertEquals(1, changes.size());
        Warning w = warningRepository.findByActiveSignature(Warning.signatureOf("D", "temperature_out_of_range")).orElseThrow();
        assertEquals(WarningSeverity.CRITICAL, w.getSeverity());
        assertEquals("40", w.getThresholdValue());

        // one rule still violated, so the warning stays active
        assertEquals(WarningChange.Type.REFRESHED, submit("D", Map.of("temperature", 41), rules).get(0).getType());
        assertEquals(WarningChange.Type.RESOLVED, submit("D", Map.of("temperature", 20), rules).get(0).getType());
    }

    @Test
    void independentKindsOnSameDevice() {
        List<WarningRule> rules = List.of(
                rule("temperature", "> 25", "temperature_high", "major"),
                rule("humidity", "> 70", "humidity_high", "minor"));
        submit("D", Map.of("temperature", 30, "humidity", 80), rules);

        List<WarningChange> changes = submit("D", Map.of("temperature", 20, "humidity", 85), rules);

        assertEquals(2, changes.size());
        assertFalse(hasActive("D", "temperature_high"));
        assertTrue(hasActive("D", "humidity_high"));
    }

    @Test
    void storedConfigIsUsedWhenNoInlineRules() {
        configService.save("CFG-1", true, List.of(rule("co2", "> 1000", "co2_high", "moderate")));

        List<WarningChange> changes = submit("CFG-1", Map.of("co2", 1500), null);

        assertEquals(1, changes.size());
        assertTrue(hasActive("CFG-1", "co2_high"));
    }

    @Test
    void disabledConfigEvaluatesNothing() {
        configService.save("CFG-2", false, List.of(rule("co2", "> 1000", "co2_high", "moderate")));

        assertTrue(submit("CFG-2", Map.of("co2", 1500), null).isEmpty());
        assertTrue(warningRepository.findByDeviceIdOrderByCreatedAtDesc("CFG-2").isEmpty());
    }

    @Test
    void messageTemplates() {
        DeviceTelemetry t = DeviceTelemetry.builder().deviceId("D").deviceName("Lab fridge").values(new HashMap<>()).build();

        WarningRule plain = rule("temperature", "> 8", "fridge_warm", "major");
        assertEquals("fridge_warm violated: value=9 threshold=8", DeviceTelemetryService.renderMessage(plain, t, 9, "8"));

        plain.setMessage("Fridge too warm");
        assertEquals("Fridge too warm [value=9, threshold=8]", DeviceTelemetryService.renderMessage(plain, t, 9, "8"));

        plain.setMessage("{device}: {field} at {value} exceeds {threshold}");
        assertEquals("Lab fridge: temperature at 9 exceeds 8", DeviceTelemetryService.renderMessage(plain, t, 9, "8"));
    }

    @Test
    void resolvedStatusPersisted() {
        List<WarningRule> rules = List.of(rule("temperature", "> 25", "temperature_high", "major"));
        submit("D", Map.of("temperature", 30), rules);
        submit("D", Map.of("temperature", 20), rules);

        List<Warning> all = warningRepository.findByDeviceIdOrderByCreatedAtDesc("D");
        assertEquals(1, all.size());
        assertEquals(WarningStatus.RESOLVED, all.get(0).getStatus());
    }
}
