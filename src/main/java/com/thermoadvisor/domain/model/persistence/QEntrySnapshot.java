package com.thermoadvisor.domain.model.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//una celda (contexto, acción) de la tabla Q con su contador de visitas
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QEntrySnapshot {
    @JsonProperty("outdoor_band")
    private String outdoorBand;

    @JsonProperty("target_band")
    private String targetBand;

    @JsonProperty("room_category")
    private String roomCategory;

    @JsonProperty("action")
    private String action;

    @JsonProperty("q_value")
    private double value;

    @JsonProperty("visits")
    private int visits;
}
