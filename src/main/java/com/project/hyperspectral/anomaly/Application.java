package com.project.hyperspectral.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the Spring Boot application. Only bootstraps the app; listen address and
 * port come from {@code server.address} / {@code server.port} (override with
 * {@code --server.port=...} on the command line).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Application.class);
        // The renderer draws with Java2D; never attach to a display.
        app.setHeadless(true);
        app.run(args);
    }
}
