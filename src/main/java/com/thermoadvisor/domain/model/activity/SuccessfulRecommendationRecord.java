package com.thermoadvisor.domain.model.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//registro de una recomendación sostenida durante toda la ventana
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuccessfulRecommendationRecord {
    @JsonProperty("type")
    @Builder.Default
    private String type = "successful_recommendation";

    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("recommended_temp")
    private double recommendedTemp;

    @JsonProperty("adjustment")
    private int adjustment;

    @JsonProperty("sustained_duration_ms")
    private long sustainedDurationMs;

    @JsonProperty("energy_savings")
    private double energySavings;

    @JsonProperty("context")
    private String context;

    @JsonProperty("timestamp")
    private long timestamp;
}
