package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto para pedir una recomendación de temperatura para una unidad
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {
    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("outdoor_temperature")
    private Double outdoorTemperature;

    @JsonProperty("current_target")
    private Double currentTarget;

    // opcional
    @JsonProperty("efficiency")
    private EfficiencyData efficiency;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EfficiencyData {
        @JsonProperty("efficiency_score")
        private double efficiencyScore;

        @JsonProperty("level")
        private String level;

        @JsonProperty("power_consumption_watts")
        private double powerConsumptionWatts;
    }
}
