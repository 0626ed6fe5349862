package com.mevshield.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Response to a statistics query against the detection engine. */
public record EngineStats(
    @JsonProperty("opportunitiesDetectedTotal") long opportunitiesDetectedTotal,
    @JsonProperty("alertsSentTotal") long alertsSentTotal,
    @JsonProperty("uptimeHours") double uptimeHours,
    @JsonProperty("activeOpportunityCount") int activeOpportunityCount,
    @JsonProperty("cycleIntervalSeconds") double cycleIntervalSeconds,
    @JsonProperty("cyclesCompletedTotal") long cyclesCompletedTotal,
    @JsonProperty("cyclesFailedTotal") long cyclesFailedTotal,
    @JsonProperty("alertFailuresTotal") long alertFailuresTotal
) {}
