package com.sandy.aiot.warning.vo;

import com.sandy.aiot.warning.entity.WarningSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Verdict of one rule (or of all rules of one warning kind) for a single observation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleResult {
    private String warningKind;
    private WarningSeverity severity;
    private String measuredValue;
    private String thresholdValue;
    private String message;
    private boolean violated;
}
