package com.thermoadvisor.domain.model.learning;

import java.util.Objects;

/**
 * Clave de contexto discreta: (banda exterior, banda objetivo, categoría de habitación).
 * Es inmutable y solo se usa para indexar las tablas de aprendizaje.
 */
public final class ContextKey {
    private final String outdoorBand;
    private final String targetBand;
    private final String roomCategory;

    public ContextKey(String outdoorBand, String targetBand, String roomCategory) {
        this.outdoorBand = Objects.requireNonNull(outdoorBand, "outdoorBand");
        this.targetBand = Objects.requireNonNull(targetBand, "targetBand");
        this.roomCategory = Objects.requireNonNull(roomCategory, "roomCategory");
    }

    public String getOutdoorBand() { return outdoorBand; }
    public String getTargetBand() { return targetBand; }
    public String getRoomCategory() { return roomCategory; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContextKey that = (ContextKey) o;
        return outdoorBand.equals(that.outdoorBand) &&
                targetBand.equals(that.targetBand) &&
                roomCategory.equals(that.roomCategory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outdoorBand, targetBand, roomCategory);
    }

    @Override
    public String toString() {
        return outdoorBand + "/" + targetBand + "/" + roomCategory;
    }
}
