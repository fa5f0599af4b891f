package com.thermoadvisor.domain.model.monitoring;

import com.thermoadvisor.domain.model.Recommendation;

// Destino de las recompensas resueltas por el RewardScheduler
@FunctionalInterface
public interface RewardApplier {
    void applyReward(String unitId, Recommendation recommendation, double reward);
}
