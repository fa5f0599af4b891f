package com.thermoadvisor.domain.model.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdaptationEventSnapshot {
    @JsonProperty("timestamp")
    private long timestamp;

    @JsonProperty("adjustment")
    private int adjustment;

    @JsonProperty("reward")
    private double reward;

    @JsonProperty("new_bias")
    private double newBias;
}
