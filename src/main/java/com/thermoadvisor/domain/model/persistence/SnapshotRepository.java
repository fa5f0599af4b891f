package com.thermoadvisor.domain.model.persistence;

import java.io.IOException;
import java.util.Optional;

/**
 * Almacenamiento síncrono de snapshots. Las fallas se propagan como
 * {@link IOException}; la política de reintentos vive en el gateway.
 */
public interface SnapshotRepository {

    Optional<LearningSnapshot> read() throws IOException;

    void write(LearningSnapshot snapshot) throws IOException;
}
