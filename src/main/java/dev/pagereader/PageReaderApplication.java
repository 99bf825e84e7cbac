package dev.pagereader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the page reader service.
 *
 * <p>Exposes {@code POST /fetch} for batch URL reading and {@code GET /health} for liveness probes
 * on port 8000.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PageReaderApplication {
    public static void main(String[] args) {
        SpringApplication.run(PageReaderApplication.class, args);
    }
}
