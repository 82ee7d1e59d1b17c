package guraa.sitephoto.config;

import guraa.sitephoto.service.FileSystemPhotoStore;
import guraa.sitephoto.service.PhotoStore;
import guraa.sitephoto.visual.OpenCvLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.nio.file.Files;

/**
 * Verifies that the application has the necessary resources to run properly
 */
@Configuration
public class StartupCheck {
    private static final Logger logger = LoggerFactory.getLogger(StartupCheck.class);

    @Bean
    public CommandLineRunner checkEnvironment(PhotoStore photoStore, MatchingSettings matchingSettings) {
        return args -> {
            logger.info("Performing startup environment check...");

            MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
            long maxHeapSize = memoryBean.getHeapMemoryUsage().getMax() / (1024 * 1024);
            logger.info("Maximum heap size: {} MB", maxHeapSize);

            if (maxHeapSize < 512) {
                logger.warn("Available heap memory may be too low for decoding large photos. " +
                        "Consider lowering app.matching.max-side or increasing -Xmx.");
            }

            if (photoStore instanceof FileSystemPhotoStore) {
                var root = ((FileSystemPhotoStore) photoStore).getRoot();
                if (!Files.isWritable(root)) {
                    logger.error("Save root is not writable: {}", root);
                } else {
                    long freeSpace = root.toFile().getUsableSpace() / (1024 * 1024);
                    logger.info("Free space under save root {}: {} MB", root, freeSpace);
                    if (freeSpace < 1024) {
                        logger.warn("Low disk space detected under the save root.");
                    }
                }
            }

            if (OpenCvLoader.isAvailable()) {
                logger.info("OpenCV library is available");
            } else {
                logger.error("OpenCV native library is NOT available. Report builds will fail.");
            }

            logger.info("Matching settings: {}", matchingSettings);
            logger.info("Startup environment check completed");
        };
    }
}
