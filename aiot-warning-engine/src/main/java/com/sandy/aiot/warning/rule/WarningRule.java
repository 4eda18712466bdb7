package com.sandy.aiot.warning.rule;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One configured threshold rule, e.g.
 * <pre>{"field":"temperature","condition":"&gt; 25","warningType":"temperature_high","severity":"moderate","message":"Temperature too high"}</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WarningRule {
    /** Telemetry field the rule reads. */
    private String field;
    private String condition;
    @JsonAlias({"warning_type", "warningKind", "warning_kind"})
    private String warningType;
    private String severity;
    /** Optional text, may contain {value}, {threshold}, {field}, {device}. */
    private String message;
    /** Optional display threshold; defaults to the condition literal. */
    private String threshold;
}
