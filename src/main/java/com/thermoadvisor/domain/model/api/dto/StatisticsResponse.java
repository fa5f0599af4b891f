package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto con las estadísticas globales del aprendizaje
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsResponse {
    @JsonProperty("total_units")
    private int totalUnits;

    @JsonProperty("total_recommendations")
    private long totalRecommendations;

    @JsonProperty("total_successful")
    private long totalSuccessful;

    @JsonProperty("overall_success_rate")
    private double overallSuccessRate;

    @JsonProperty("explored_contexts")
    private int exploredContexts;

    @JsonProperty("current_epsilon")
    private double currentEpsilon;

    @JsonProperty("uptime_seconds")
    private long uptimeSeconds;
}
