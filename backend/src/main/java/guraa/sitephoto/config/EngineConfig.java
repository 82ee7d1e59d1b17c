package guraa.sitephoto.config;

import guraa.sitephoto.exception.ConfigurationException;
import guraa.sitephoto.service.FileSystemPhotoStore;
import guraa.sitephoto.service.PhotoStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Turns the raw {@link AppProperties} into validated engine values.
 * Any invalid value fails startup with a {@link ConfigurationException}.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public PhaseWindow phaseWindow(AppProperties properties) {
        AppProperties.Phase phase = properties.getPhase();
        PhaseWindow window = PhaseWindow.of(phase.getBeforeHour(), phase.getAfterHour(), phase.getZoneId());
        log.info("Phase window: {}", window);
        return window;
    }

    @Bean
    public MatchingSettings matchingSettings(AppProperties properties) {
        AppProperties.Matching matching = properties.getMatching();
        if (matching.getTimeoutMinutes() <= 0) {
            throw new ConfigurationException("Matching timeout must be positive, got " + matching.getTimeoutMinutes());
        }
        return MatchingSettings.builder()
                .maxSide(matching.getMaxSide())
                .maxFeatures(matching.getMaxFeatures())
                .topK(matching.getTopK())
                .ratio(matching.getRatio())
                .minScore(matching.getMinScore())
                .pairingMode(parsePairingMode(matching.getPairingMode()))
                .allowSharedAfter(matching.isAllowSharedAfter())
                .timeout(Duration.ofMinutes(matching.getTimeoutMinutes()))
                .build()
                .validate();
    }

    @Bean
    public PhotoStore photoStore(AppProperties properties) {
        String saveRoot = properties.getStorage().getSaveRoot();
        if (saveRoot == null || saveRoot.isBlank()) {
            throw new ConfigurationException("Save root is not configured (app.storage.save-root / SAVE_ROOT)");
        }
        Path root;
        try {
            root = Paths.get(saveRoot.trim());
        } catch (InvalidPathException e) {
            throw new ConfigurationException("Save root is not a valid path: " + saveRoot, e);
        }
        FileSystemPhotoStore store = new FileSystemPhotoStore(root);
        try {
            store.createDirectories(Paths.get(""));
        } catch (IOException e) {
            throw new ConfigurationException("Save root cannot be created: " + store.describe(), e);
        }
        log.info("Photo store rooted at {}", store.describe());
        return store;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static PairingMode parsePairingMode(String value) {
        if (value == null || value.isBlank()) {
            return PairingMode.GREEDY;
        }
        try {
            return PairingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown pairing mode: " + value, e);
        }
    }
}
