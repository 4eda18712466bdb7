package com.sandy.aiot.warning.service.impl;

import com.sandy.aiot.warning.entity.WarningSeverity;
import com.sandy.aiot.warning.rule.ConditionExpression;
import com.sandy.aiot.warning.rule.RuleConfigurationException;
import com.sandy.aiot.warning.rule.RuleEvaluationException;
import com.sandy.aiot.warning.rule.WarningRule;
import com.sandy.aiot.warning.service.ConditionEvaluator;
import com.sandy.aiot.warning.service.RuleSetResolver;
import com.sandy.aiot.warning.service.WarningStateEngine;
import com.sandy.aiot.warning.vo.DeviceTelemetry;
import com.sandy.aiot.warning.vo.RuleResult;
import com.sandy.aiot.warning.vo.WarningChange;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Entry point for "device active" events: evaluates the device's rules against the decoded field values and
 * hands the verdicts to the warning state engine.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeviceTelemetryService {

    private final RuleSetResolver ruleSetResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final WarningStateEngine warningStateEngine;

    @Value("${warning.enabled:true}")
    private boolean enabled;

    @PostConstruct
    public void init() {
        log.info("Device telemetry warning evaluation initialized: enabled={}", enabled);
    }

    public List<WarningChange> onDeviceActive(DeviceTelemetry telemetry) {
        if (!enabled || telemetry == null || telemetry.getDeviceId() == null) return List.of();
        List<WarningRule> rules = telemetry.getRules() != null ? telemetry.getRules() : ruleSetResolver.resolve(telemetry.getDeviceId());
        if (rules.isEmpty()) return List.of();
        List<RuleResult> results = evaluateRules(telemetry, rules);
        if (results.isEmpty()) return List.of();
        return warningStateEngine.observe(telemetry.getDeviceId(), telemetry.getDeviceType(), telemetry.getDeviceName(), results);
    }

    /**
     * One result per evaluable rule. Misconfigured rules, rules on absent fields and values that cannot be compared
     * are skipped; a skipped rule never resolves a warning.
     */
    List<RuleResult> evaluateRules(DeviceTelemetry telemetry, List<WarningRule> rules) {
        Map<String, Object> values = telemetry.getValues() != null ? telemetry.getValues() : Collections.emptyMap();
        List<RuleResult> results = new ArrayList<>();
        for (WarningRule rule : rules) {
            if (rule == null) continue;
            if (isBlank(rule.getWarningType()) || isBlank(rule.getField())) {
                log.warn("Skipping incomplete warning rule deviceId={} rule={}", telemetry.getDeviceId(), rule);
                continue;
            }
            Object value = values.get(rule.getField());
            if (value == null) {
                log.debug("Field absent, rule not evaluated deviceId={} field={} kind={}", telemetry.getDeviceId(), rule.getField(), rule.getWarningType());
                continue;
            }
            try {
                ConditionExpression condition = conditionEvaluator.parse(rule.getCondition());
                boolean violated = condition.evaluate(value);
                String threshold = !isBlank(rule.getThreshold()) ? rule.getThreshold() : condition.thresholdFor(value);
                results.add(RuleResult.builder()
                        .warningKind(rule.getWarningType())
                        .severity(WarningSeverity.parse(rule.getSeverity()))
                        .measuredValue(String.valueOf(value))
                        .thresholdValue(threshold)
                        .message(renderMessage(rule, telemetry, value, threshold))
                        .violated(violated)
                        .build());
            } catch (RuleConfigurationException e) {
                log.warn("Skipping misconfigured warning rule deviceId={} kind={} condition='{}' error={}",
                        telemetry.getDeviceId(), rule.getWarningType(), rule.getCondition(), e.getMessage());
            } catch (RuleEvaluationException e) {
                log.warn("Skipping warning rule, value not comparable deviceId={} kind={} field={} error={}",
                        telemetry.getDeviceId(), rule.getWarningType(), rule.getField(), e.getMessage());
            }
        }
        return results;
    }

    static String renderMessage(WarningRule rule, DeviceTelemetry telemetry, Object value, String threshold) {
        String v = String.valueOf(value);
        String template = rule.getMessage();
        if (isBlank(template)) {
            return rule.getWarningType() + " violated: value=" + v + " threshold=" + threshold;
        }
        if (!template.contains("{")) {
            return template + " [value=" + v + ", threshold=" + threshold + "]";
        }
        String device = telemetry.getDeviceName() != null ? telemetry.getDeviceName() : telemetry.getDeviceId();
        return template.replace("{value}", v)
                .replace("{threshold}", String.valueOf(threshold))
                .replace("{field}", rule.getField())
                .replace("{device}", device);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public boolean isEnabled() { return enabled; }
}
