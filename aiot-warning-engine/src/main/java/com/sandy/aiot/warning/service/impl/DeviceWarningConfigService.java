package com.sandy.aiot.warning.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.warning.entity.DeviceWarningConfig;
import com.sandy.aiot.warning.repository.DeviceWarningConfigRepository;
import com.sandy.aiot.warning.rule.WarningRule;
import com.sandy.aiot.warning.service.RuleSetResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Rule set resolver backed by the per-device warning configuration table (rules stored as JSON).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeviceWarningConfigService implements RuleSetResolver {

    private static final TypeReference<List<WarningRule>> RULE_LIST = new TypeReference<>() {};

    private final DeviceWarningConfigRepository configRepository;
    private final ObjectMapper objectMapper;

    @Override
    public List<WarningRule> resolve(String deviceId) {
        if (deviceId == null) return List.of();
        Optional<DeviceWarningConfig> cfg = configRepository.findById(deviceId);
        if (cfg.isEmpty() || !cfg.get().isEnabled()) return List.of();
        return readRules(cfg.get());
    }

    public Optional<DeviceWarningConfig> find(String deviceId) {
        return configRepository.findById(deviceId);
    }

    public List<WarningRule> readRules(DeviceWarningConfig cfg) {
        String json = cfg.getRulesJson();
        if (json == null || json.isBlank()) return List.of();
        try {
            List<WarningRule> rules = objectMapper.readValue(json, RULE_LIST);
            return rules != null ? rules : List.of();
        } catch (JsonProcessingException e) {
            log.error("Unreadable warning rules for deviceId={} error={}", cfg.getDeviceId(), e.getOriginalMessage());
            return List.of();
        }
    }

    public DeviceWarningConfig save(String deviceId, boolean enabled, List<WarningRule> rules) {
        DeviceWarningConfig cfg = configRepository.findById(deviceId)
                .orElseGet(() -> DeviceWarningConfig.builder().deviceId(deviceId).build());
        cfg.setEnabled(enabled);
        try {
            cfg.setRulesJson(objectMapper.writeValueAsString(rules == null ? List.of() : rules));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize warning rules for device " + deviceId, e);
        }
        cfg.setUpdatedAt(LocalDateTime.now());
        DeviceWarningConfig saved = configRepository.save(cfg);
        log.info("Warning config saved deviceId={} enabled={} rules={}", deviceId, enabled, rules == null ? 0 : rules.size());
        return saved;
    }
}
