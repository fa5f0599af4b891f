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
public class RecommendationResponse {
    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("action")
    private String action;

    @JsonProperty("adjustment")
    private int adjustment;

    @JsonProperty("current_temperature")
    private double currentTemperature;

    @JsonProperty("recommended_temperature")
    private double recommendedTemperature;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("energy_savings")
    private double energySavings;

    // null cuando es una recomendación de respaldo
    @JsonProperty("context")
    private String context;

    @JsonProperty("exploration_reason")
    private String explorationReason;

    @JsonProperty("fallback")
    private boolean fallback;

    @JsonProperty("timestamp")
    private Instant timestamp;
}
