package com.thermoadvisor.domain.model.learning;

import java.util.List;

/**
 * Convierte valores continuos (temperatura exterior, temperatura objetivo) y la
 * categoría de la habitación en una {@link ContextKey}.
 *
 * La función es total: los valores por debajo del primer rango caen en el primer
 * bucket y los valores por encima del último (o NaN) caen en el último.
 */
public class ContextDiscretizer {

    public static final String DEFAULT_ROOM_CATEGORY = "medium";

    private final List<TemperatureRange> outdoorRanges;
    private final List<TemperatureRange> targetRanges;

    public ContextDiscretizer() {
        this(defaultOutdoorRanges(), defaultTargetRanges());
    }

    public ContextDiscretizer(List<TemperatureRange> outdoorRanges, List<TemperatureRange> targetRanges) {
        if (outdoorRanges == null || outdoorRanges.isEmpty() || targetRanges == null || targetRanges.isEmpty()) {
            throw new IllegalArgumentException("Las tablas de rangos no pueden estar vacías");
        }
        this.outdoorRanges = List.copyOf(outdoorRanges);
        this.targetRanges = List.copyOf(targetRanges);
    }

    public ContextKey discretize(double outdoorTemperature, double targetTemperature, String roomCategory) {
        String room = roomCategory == null || roomCategory.isBlank() ? DEFAULT_ROOM_CATEGORY : roomCategory;
        return new ContextKey(
                bandFor(outdoorTemperature, outdoorRanges),
                bandFor(targetTemperature, targetRanges),
                room
        );
    }

    public String outdoorBand(double temperature) {
        return bandFor(temperature, outdoorRanges);
    }

    public String targetBand(double temperature) {
        return bandFor(temperature, targetRanges);
    }

    private static String bandFor(double temperature, List<TemperatureRange> ranges) {
        for (TemperatureRange range : ranges) {
            if (range.contains(temperature)) {
                return range.getLabel();
            }
        }
        // Casos borde: por debajo del mínimo global va al primer bucket, el resto al último
        if (temperature < ranges.get(0).getMin()) {
            return ranges.get(0).getLabel();
        }
        return ranges.get(ranges.size() - 1).getLabel();
    }

    public static List<TemperatureRange> defaultOutdoorRanges() {
        return List.of(
                new TemperatureRange(15, 20, "cool"),
                new TemperatureRange(20, 25, "mild"),
                new TemperatureRange(25, 30, "warm"),
                new TemperatureRange(30, 35, "hot"),
                new TemperatureRange(35, 45, "extreme")
        );
    }

    public static List<TemperatureRange> defaultTargetRanges() {
        return List.of(
                new TemperatureRange(16, 20, "cold"),
                new TemperatureRange(20, 24, "comfortable"),
                new TemperatureRange(24, 28, "warm_indoor")
        );
    }
}
