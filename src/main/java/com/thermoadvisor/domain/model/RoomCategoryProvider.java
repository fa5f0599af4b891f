package com.thermoadvisor.domain.model;

/**
 * Provee la categoría de habitación (tamaño) de una unidad.
 * Debe devolver {@link #DEFAULT_CATEGORY} cuando no tiene datos.
 */
@FunctionalInterface
public interface RoomCategoryProvider {

    String DEFAULT_CATEGORY = "medium";

    String roomCategory(String unitId);

    static RoomCategoryProvider fixed() {
        return unitId -> DEFAULT_CATEGORY;
    }
}
