package com.thermoadvisor.domain.model.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//registro de un ajuste manual dentro de la ventana de monitoreo
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualAdjustmentRecord {
    @JsonProperty("type")
    @Builder.Default
    private String type = "manual_adjustment";

    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("recommended_temp")
    private double recommendedTemp;

    @JsonProperty("adjusted_temp")
    private double adjustedTemp;

    @JsonProperty("previous_temp")
    private double previousTemp;

    // milisegundos desde que se armó la ventana
    @JsonProperty("adjustment_time_ms")
    private long adjustmentTimeMs;

    @JsonProperty("changed_by")
    private String changedBy;

    @JsonProperty("adjustment_direction")
    private String adjustmentDirection;

    @JsonProperty("context")
    private String context;

    @JsonProperty("timestamp")
    private long timestamp;

    public static String directionOf(double previousTemp, double newTemp) {
        if (newTemp > previousTemp) return "increase";
        if (newTemp < previousTemp) return "decrease";
        return "none";
    }
}
