/**
 * Main application class for LuminaLib
 *
 * Features:
 * - Loads a local .env file before the context starts
 * - Logs the active generation provider and recommendation blend at startup
 * - Entry point for Spring Boot application
 */

package net.luminalib;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import net.luminalib.config.IntelligenceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LuminaLibApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LuminaLibApplication.class);

    private final IntelligenceProperties intelligenceProperties;

    public LuminaLibApplication(IntelligenceProperties intelligenceProperties) {
        this.intelligenceProperties = intelligenceProperties;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(LuminaLibApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("LuminaLib started (generationProvider={}, model={}, recommendationAlpha={}, reviewPolicy={})",
            intelligenceProperties.getGenerationProvider(),
            intelligenceProperties.getGenerationModel(),
            intelligenceProperties.getRecommendationAlpha(),
            intelligenceProperties.getReviewPolicy());
    }

    private static void loadDotEnvFile() {
        try {
            Path envFile = Paths.get(".env");
            if (Files.exists(envFile)) {
                Properties props = new Properties();
                try (InputStream is = Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
