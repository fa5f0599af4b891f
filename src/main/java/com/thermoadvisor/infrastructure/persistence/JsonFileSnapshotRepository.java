package com.thermoadvisor.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.thermoadvisor.domain.model.persistence.LearningSnapshot;
import com.thermoadvisor.domain.model.persistence.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Guarda el snapshot de aprendizaje como JSON en un archivo local.
 * La escritura pasa por un archivo temporal y un move atómico, así que un lector
 * nunca ve un archivo a medio escribir.
 */
public class JsonFileSnapshotRepository implements SnapshotRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileSnapshotRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileSnapshotRepository(Path file) {
        this(file, new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonFileSnapshotRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<LearningSnapshot> read() throws IOException {
        if (!Files.exists(file)) {
            logger.info("No existe aprendizaje persistido en {}", file);
            return Optional.empty();
        }
        return Optional.ofNullable(objectMapper.readValue(file.toFile(), LearningSnapshot.class));
    }

    @Override
    public void write(LearningSnapshot snapshot) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Snapshot {} guardado en {}", snapshot.getSequence(), file);
    }

    public Path getFile() {
        return file;
    }
}
