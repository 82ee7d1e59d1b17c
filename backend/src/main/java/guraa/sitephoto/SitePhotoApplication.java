package guraa.sitephoto;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the site photo matcher.
 */
@Slf4j
@SpringBootApplication
@EnableScheduling
public class SitePhotoApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        System.getProperties().putIfAbsent("java.awt.headless", "true");

        SpringApplication.run(SitePhotoApplication.class, args);

        logStartupInfo(Duration.between(startTime, Instant.now()));
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("Site photo matcher started in {}.{}s", startupTime.toSeconds(), String.format("%03d", startupTime.toMillisPart()));
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  OS: {} {}", System.getProperty("os.name"), System.getProperty("os.version"));
        log.info("  Available processors: {}", Runtime.getRuntime().availableProcessors());
        log.info("  JVM Max memory: {} MB", Runtime.getRuntime().maxMemory() / (1024 * 1024));
        log.info("==========================================================");
    }
}
