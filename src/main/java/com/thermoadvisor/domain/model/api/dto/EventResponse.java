package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto de respuesta para los eventos y los reinicios de aprendizaje
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventResponse {
    @JsonProperty("unit_id")
    private String unitId;

    @JsonProperty("handled")
    private boolean handled;

    @JsonProperty("message")
    private String message;
}
