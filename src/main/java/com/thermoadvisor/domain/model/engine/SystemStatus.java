package com.thermoadvisor.domain.model.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SystemStatus {
    boolean initialized;
    double epsilon;
    int totalUnits;
    int pendingRecommendations;
    int activeWindows;
    long acceptedWindows;
    long overriddenWindows;
    long supersededWindows;
    int pendingSaves;
    long droppedSaves;
    boolean activityLoggerAvailable;
}
