package com.thermoadvisor.domain.model.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

//estado persistido de una unidad
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnitSnapshot {
    @JsonProperty("q_table")
    private List<QEntrySnapshot> entries;

    @JsonProperty("total_recommendations")
    private long totalRecommendations;

    @JsonProperty("successful_recommendations")
    private long successfulRecommendations;

    @JsonProperty("personalized_bias")
    private double personalizedBias;

    @JsonProperty("last_update")
    private Long lastUpdate;

    @JsonProperty("adaptation_history")
    private List<AdaptationEventSnapshot> adaptationHistory;
}
