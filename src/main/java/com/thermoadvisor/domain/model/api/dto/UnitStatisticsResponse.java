package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitStatisticsResponse {
    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("total_recommendations")
    private long totalRecommendations;

    @JsonProperty("successful_recommendations")
    private long successfulRecommendations;

    @JsonProperty("success_rate")
    private double successRate;

    @JsonProperty("personalized_bias")
    private double personalizedBias;

    @JsonProperty("explored_contexts")
    private int exploredContexts;

    @JsonProperty("current_epsilon")
    private double currentEpsilon;

    @JsonProperty("last_update")
    private Instant lastUpdate;

    @JsonProperty("monitoring_active")
    private boolean monitoringActive;
}
