package com.microtrader.execution;

import lombok.Builder;
import lombok.Value;

/** Per-cycle tally of what the coordinator did with the ranked opportunities. */
@Value
@Builder
public class ExecutionSummary {

    int considered;
    int filled;
    int rejected;
    int failed;
    int skipped;

    public static ExecutionSummary empty() {
        return ExecutionSummary.builder().build();
    }
}
