package com.thermoadvisor.infrastructure.monitor;

import com.thermoadvisor.domain.model.api.dto.StatisticsResponse;
import com.thermoadvisor.domain.model.api.dto.SystemStatusResponse;
import com.thermoadvisor.domain.service.TemperatureRecommendationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Monitor simple que muestra el estado del aprendizaje en la terminal.
 * Se ejecuta cada 5 segundos.
 */
@Component
@ConditionalOnProperty(name = "terminal-monitor.enabled", havingValue = "true", matchIfMissing = false)
public class TerminalStatusMonitor {

    private static final Logger logger = LoggerFactory.getLogger(TerminalStatusMonitor.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final TemperatureRecommendationService recommendationService;

    public TerminalStatusMonitor(TemperatureRecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @Scheduled(fixedRate = 5000) // Cada 5 segundos
    public void displayStatus() {
        try {
            printStatus(recommendationService.getSystemStatus(), recommendationService.getStatistics());
        } catch (Exception e) {
            logger.error("Error al obtener estado del sistema: {}", e.getMessage());
        }
    }

    private void printStatus(SystemStatusResponse status, StatisticsResponse stats) {
        // Limpiar pantalla (funciona en la mayoría de terminales)
        System.out.print("\033[H\033[2J");
        System.out.flush();

        String currentTime = LocalDateTime.now().format(TIME_FORMATTER);
        System.out.println("╔════════════════════════════════════════════════════════════════╗");
        System.out.println("║     MOTOR DE RECOMENDACIONES DE TEMPERATURA - Estado Actual    ║");
        System.out.println("║                    " + currentTime + "                         ║");
        System.out.println("╚════════════════════════════════════════════════════════════════╝");
        System.out.println();

        System.out.println("┌──────────────────────────────────────────────────────────────┐");
        System.out.println("│ APRENDIZAJE                                                  │");
        System.out.println("├──────────────────────────────────────────────────────────────┤");
        System.out.printf("│ Unidades:        %d%n", stats.getTotalUnits());
        System.out.printf("│ Recomendaciones: %d (%d exitosas, %.2f%%)%n",
                stats.getTotalRecommendations(), stats.getTotalSuccessful(), stats.getOverallSuccessRate());
        System.out.printf("│ Contextos:       %d%n", stats.getExploredContexts());
        System.out.printf("│ Epsilon:         %.4f%n", stats.getCurrentEpsilon());
        System.out.println("└──────────────────────────────────────────────────────────────┘");
        System.out.println();

        System.out.println("┌──────────────────────────────────────────────────────────────┐");
        System.out.println("│ MONITOREO                                                    │");
        System.out.println("├──────────────────────────────────────────────────────────────┤");
        System.out.printf("│ Pendientes:      %d%n", status.getPendingRecommendations());
        System.out.printf("│ Ventanas activas: %d%n", status.getActiveWindows());
        System.out.printf("│ Aceptadas / ajustadas / reemplazadas: %d / %d / %d%n",
                status.getAcceptedWindows(), status.getOverriddenWindows(), status.getSupersededWindows());
        System.out.printf("│ Guardados pendientes: %d (descartados: %d)%n",
                status.getPendingSaves(), status.getDroppedSaves());
        System.out.println("└──────────────────────────────────────────────────────────────┘");
        System.out.println();
        System.out.println("Presiona Ctrl+C para salir...");
    }
}
