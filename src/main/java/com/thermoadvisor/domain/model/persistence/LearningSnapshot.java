package com.thermoadvisor.domain.model.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Esquema persistido del aprendizaje: tasa de exploración compartida y
 * el estado de cada unidad (id de unidad → {@link UnitSnapshot}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LearningSnapshot {

    public static final String CURRENT_VERSION = "1.0";

    @JsonProperty("version")
    private String version;

    @JsonProperty("epsilon")
    private Double epsilon;

    // epoch millis del momento en que se tomó el snapshot
    @JsonProperty("timestamp")
    private long timestamp;

    // Secuencia monotónica para descartar snapshots viejos en la cola de reintentos
    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("units")
    private Map<String, UnitSnapshot> units;

    public static LearningSnapshot empty() {
        return LearningSnapshot.builder()
                .version(CURRENT_VERSION)
                .units(new LinkedHashMap<>())
                .build();
    }

    public boolean isEmpty() {
        return units == null || units.isEmpty();
    }
}
