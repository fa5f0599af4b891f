package com.thermoadvisor.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto para devolver el estado general del sistema
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatusResponse {
    @JsonProperty("initialized")
    private boolean initialized;

    @JsonProperty("epsilon")
    private double epsilon;

    @JsonProperty("total_units")
    private int totalUnits;

    @JsonProperty("pending_recommendations")
    private int pendingRecommendations;

    @JsonProperty("active_windows")
    private int activeWindows;

    @JsonProperty("accepted_windows")
    private long acceptedWindows;

    @JsonProperty("overridden_windows")
    private long overriddenWindows;

    @JsonProperty("superseded_windows")
    private long supersededWindows;

    @JsonProperty("pending_saves")
    private int pendingSaves;

    @JsonProperty("dropped_saves")
    private long droppedSaves;

    @JsonProperty("activity_logger_available")
    private boolean activityLoggerAvailable;
}
