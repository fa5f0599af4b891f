package com.thermoadvisor.domain.model.activity;

/**
 * Registro de actividad del usuario frente a las recomendaciones.
 * Las implementaciones son best-effort: el motor no depende de que el registro funcione.
 */
public interface ActivityLogger {

    void logRecommendationApplication(RecommendationApplicationRecord record);

    void logManualAdjustment(ManualAdjustmentRecord record);

    void logSuccessfulRecommendation(SuccessfulRecommendationRecord record);
}
