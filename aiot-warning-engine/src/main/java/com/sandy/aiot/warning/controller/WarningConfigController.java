package com.sandy.aiot.warning.controller;

import com.sandy.aiot.warning.entity.DeviceWarningConfig;
import com.sandy.aiot.warning.rule.RuleConfigurationException;
import com.sandy.aiot.warning.rule.WarningRule;
import com.sandy.aiot.warning.service.ConditionEvaluator;
import com.sandy.aiot.warning.service.impl.DeviceWarningConfigService;
import com.sandy.aiot.warning.vo.ActionResp;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/data/api/warning-configs")
@RequiredArgsConstructor
public class WarningConfigController {

    private final DeviceWarningConfigService configService;
    private final ConditionEvaluator conditionEvaluator;

    @GetMapping("/{deviceId}")
    public ResponseEntity<ConfigResp> get(@PathVariable String deviceId) {
        Optional<DeviceWarningConfig> opt = configService.find(deviceId);
        return opt.map(cfg -> ResponseEntity.ok(toResp(cfg))).orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** Rejects the whole rule set if any condition does not parse. */
    @PutMapping("/{deviceId}")
    public ResponseEntity<ActionResp> put(@PathVariable String deviceId, @RequestBody ConfigReq req) {
        List<WarningRule> rules = req.getRules() != null ? req.getRules() : List.of();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            WarningRule r = rules.get(i);
            if (r.getField() == null || r.getWarningType() == null) {
                errors.add("rule[" + i + "]: field and warningType are required");
                continue;
            }
            try {
                conditionEvaluator.parse(r.getCondition());
            } catch (RuleConfigurationException e) {
                errors.add("rule[" + i + "]: " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            return ResponseEntity.badRequest().body(ActionResp.fail(String.join("; ", errors)));
        }
        configService.save(deviceId, req.isEnabled(), rules);
        return ResponseEntity.ok(ActionResp.ok());
    }

    private ConfigResp toResp(DeviceWarningConfig cfg) {
        ConfigResp r = new ConfigResp();
        r.setDeviceId(cfg.getDeviceId());
        r.setEnabled(cfg.isEnabled());
        r.setRules(configService.readRules(cfg));
        r.setUpdatedAt(cfg.getUpdatedAt());
        return r;
    }

    @Data
    public static class ConfigReq {
        private boolean enabled = true;
        private List<WarningRule> rules;
    }

    @Data
    public static class ConfigResp {
        private String deviceId;
        private boolean enabled;
        private List<WarningRule> rules;
        private LocalDateTime updatedAt;
    }
}
