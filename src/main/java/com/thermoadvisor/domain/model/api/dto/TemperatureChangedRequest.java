package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto para informar un cambio manual de la temperatura objetivo
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemperatureChangedRequest {
    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("new_temperature")
    private Double newTemperature;

    @JsonProperty("previous_temperature")
    private Double previousTemperature;

    @JsonProperty("changed_by")
    private String changedBy;
}
