package com.thermoadvisor.infrastructure.persistence;

import com.thermoadvisor.domain.model.persistence.LearningSnapshot;
import com.thermoadvisor.domain.model.persistence.PersistenceGateway;
import com.thermoadvisor.domain.model.persistence.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gateway asíncrono sobre un {@link SnapshotRepository}.
 *
 * Los guardados se ejecutan en un único thread, en orden. Una escritura fallida se
 * reintenta con backoff exponencial (base, doble en cada intento, con tope) hasta
 * maxRetries veces; después se descarta con un WARN. Un snapshot con secuencia
 * menor a la última escrita nunca pisa al más nuevo.
 */
public class RetryingPersistenceGateway implements PersistenceGateway {

    private static final Logger logger = LoggerFactory.getLogger(RetryingPersistenceGateway.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

    private final SnapshotRepository repository;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final ScheduledExecutorService executor;

    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong lastWrittenSequence = new AtomicLong(Long.MIN_VALUE);

    public RetryingPersistenceGateway(SnapshotRepository repository) {
        this(repository, DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public RetryingPersistenceGateway(SnapshotRepository repository, int maxRetries,
                                      Duration initialBackoff, Duration maxBackoff) {
        this.repository = repository;
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "learning-persistence");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public LearningSnapshot load() {
        try {
            Optional<LearningSnapshot> snapshot = repository.read();
            if (snapshot.isEmpty()) {
                return LearningSnapshot.empty();
            }
            LearningSnapshot loaded = snapshot.get();
            lastWrittenSequence.accumulateAndGet(loaded.getSequence(), Math::max);
            logger.info("Aprendizaje cargado: {} unidades (versión {})",
                    loaded.getUnits() != null ? loaded.getUnits().size() : 0, loaded.getVersion());
            return loaded;
        } catch (IOException | RuntimeException e) {
            logger.warn("No se pudo leer el aprendizaje persistido, se usa un estado vacío: {}", e.getMessage());
            return LearningSnapshot.empty();
        }
    }

    @Override
    public void save(LearningSnapshot snapshot) {
        if (snapshot == null) {
            return;
        }
        pending.incrementAndGet();
        try {
            executor.execute(() -> attempt(snapshot, 0));
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            dropped.incrementAndGet();
            logger.warn("Gateway cerrado, se descarta el snapshot {}", snapshot.getSequence());
        }
    }

    private void attempt(LearningSnapshot snapshot, int retry) {
        if (snapshot.getSequence() < lastWrittenSequence.get()) {
            logger.debug("Snapshot {} obsoleto, ya se escribió el {}", snapshot.getSequence(), lastWrittenSequence.get());
            pending.decrementAndGet();
            return;
        }
        try {
            repository.write(snapshot);
            lastWrittenSequence.accumulateAndGet(snapshot.getSequence(), Math::max);
            pending.decrementAndGet();
        } catch (IOException | RuntimeException e) {
            if (retry >= maxRetries) {
                pending.decrementAndGet();
                dropped.incrementAndGet();
                logger.warn("Se descarta el snapshot {} tras {} reintentos: {}",
                        snapshot.getSequence(), retry, e.getMessage());
                return;
            }
            long delay = backoff(retry).toMillis();
            logger.warn("Falló el guardado del snapshot {} (intento {}), reintento en {} ms: {}",
                    snapshot.getSequence(), retry + 1, delay, e.getMessage());
            try {
                executor.schedule(() -> attempt(snapshot, retry + 1), delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                pending.decrementAndGet();
                dropped.incrementAndGet();
                logger.warn("Gateway cerrado, no se reintenta el snapshot {}", snapshot.getSequence());
            }
        }
    }

    public Duration backoff(int retry) {
        long millis = initialBackoff.toMillis() << Math.min(retry, 30);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    @Override
    public int pendingSaves() {
        return pending.get();
    }

    @Override
    public long droppedSaves() {
        return dropped.get();
    }

    /**
     * Deja terminar las escrituras en curso y descarta los reintentos programados.
     */
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (pending.get() > 0) {
            logger.warn("Se cerró la persistencia con {} guardados pendientes", pending.get());
        }
    }
}
