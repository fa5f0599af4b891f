package com.thermoadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Aplicación principal del motor de recomendaciones de temperatura.
 *
 * Aprende, por unidad de aire acondicionado, qué ajuste de temperatura acepta
 * el usuario en cada contexto (temperatura exterior, objetivo actual y tamaño
 * de la habitación) usando un bandit contextual epsilon-greedy.
 */
@SpringBootApplication
@EnableScheduling
public class TemperatureRecommendationApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemperatureRecommendationApplication.class, args);
    }
}
