package com.mevshield.engine.cycle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mevshield.common.model.Opportunity;

import java.time.Instant;
import java.util.List;

/** Outcome of one {@link DetectionCycleService#runCycle()} call. */
public record CycleReport(
    @JsonProperty("status") CycleStatus status,
    @JsonProperty("cycleId") String cycleId,              // null when skipped
    @JsonProperty("startedAt") Instant startedAt,
    @JsonProperty("blockReference") long blockReference,
    @JsonProperty("poolsEvaluated") int poolsEvaluated,
    @JsonProperty("stalePools") int stalePools,
    @JsonProperty("opportunities") List<Opportunity> opportunities,
    @JsonProperty("alertsSent") int alertsSent,
    @JsonProperty("error") String error                   // null unless FAILED
) {
    public static CycleReport skipped(Instant at, String reason) {
        return new CycleReport(CycleStatus.SKIPPED, null, at, 0, 0, 0, List.of(), 0, reason);
    }

    public static CycleReport failed(String cycleId, Instant startedAt, String error) {
        return new CycleReport(CycleStatus.FAILED, cycleId, startedAt, 0, 0, 0, List.of(), 0, error);
    }

    public boolean executed() {
        return status != CycleStatus.SKIPPED;
    }
}
