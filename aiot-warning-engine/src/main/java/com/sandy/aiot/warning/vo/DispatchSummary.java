package com.sandy.aiot.warning.vo;

import lombok.Data;

/** Counters of one dispatcher pass. */
@Data
public class DispatchSummary {
    private int due;
    private int sent;
    private int failed;
    private int voided;
    /** Claimed by a concurrent pass before this one got to it. */
    private int skipped;
}
