package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationAppliedRequest {
    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("recommended_temperature")
    private double recommendedTemperature;

    @JsonProperty("applied_by")
    private String appliedBy;
}
