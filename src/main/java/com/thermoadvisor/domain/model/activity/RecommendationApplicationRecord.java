package com.thermoadvisor.domain.model.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//registro de una recomendación aplicada por el usuario
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationApplicationRecord {
    @JsonProperty("type")
    @Builder.Default
    private String type = "recommendation_applied";

    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("original_temp")
    private double originalTemp;

    @JsonProperty("recommended_temp")
    private double recommendedTemp;

    @JsonProperty("applied_by")
    private String appliedBy;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("context")
    private String context;

    @JsonProperty("energy_savings")
    private double energySavings;

    @JsonProperty("exploration_reason")
    private String explorationReason;

    @JsonProperty("timestamp")
    private long timestamp;
}
