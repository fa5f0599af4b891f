package com.thermoadvisor.infrastructure.config;

import com.thermoadvisor.domain.model.RoomCategoryProvider;

import java.util.HashMap;
import java.util.Map;

/**
 * Resuelve la categoría de habitación desde las unidades del site-config.json.
 * Unidades desconocidas (o sin tamaño) caen en la categoría por defecto.
 */
public class SiteConfigurationRoomCategoryProvider implements RoomCategoryProvider {

    private final Map<String, String> categoriesByUnit = new HashMap<>();

    public SiteConfigurationRoomCategoryProvider(RecommendationEngineConfig.SiteConfiguration siteConfiguration) {
        for (RecommendationEngineConfig.UnitConfig unit : siteConfiguration.getUnits()) {
            if (unit.getRoomSize() != null && !unit.getRoomSize().isBlank()) {
                categoriesByUnit.put(unit.getId(), unit.getRoomSize());
            }
        }
    }

    @Override
    public String roomCategory(String unitId) {
        if (unitId == null) {
            return DEFAULT_CATEGORY;
        }
        return categoriesByUnit.getOrDefault(unitId, DEFAULT_CATEGORY);
    }
}
