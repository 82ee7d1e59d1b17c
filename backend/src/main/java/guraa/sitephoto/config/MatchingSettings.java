package guraa.sitephoto.config;

import guraa.sitephoto.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable tuning values for one matching run. Smaller {@code maxSide} and
 * {@code maxFeatures} trade accuracy for speed.
 */
@Value
@Builder(toBuilder = true)
public class MatchingSettings {

    @Builder.Default
    int maxSide = 1600;

    @Builder.Default
    int maxFeatures = 600;

    @Builder.Default
    int topK = 5;

    @Builder.Default
    double ratio = 0.75;

    @Builder.Default
    double minScore = 0.0;

    @Builder.Default
    PairingMode pairingMode = PairingMode.GREEDY;

    @Builder.Default
    boolean allowSharedAfter = false;

    @Builder.Default
    Duration timeout = Duration.ofMinutes(10);

    public static MatchingSettings defaults() {
        return MatchingSettings.builder().build();
    }

    /**
     * Check every knob is usable.
     *
     * @return this, for chaining
     * @throws ConfigurationException if a value is out of range
     */
    public MatchingSettings validate() {
        if (maxSide <= 0) {
            throw new ConfigurationException("Max side must be positive, got " + maxSide);
        }
        if (maxFeatures <= 0) {
            throw new ConfigurationException("Feature cap must be positive, got " + maxFeatures);
        }
        if (topK <= 0) {
            throw new ConfigurationException("Top-K must be positive, got " + topK);
        }
        if (!(ratio > 0.0 && ratio <= 1.0)) {
            throw new ConfigurationException("Ratio threshold must be in (0, 1], got " + ratio);
        }
        if (minScore < 0.0 || minScore > 1.0) {
            throw new ConfigurationException("Minimum score must be in [0, 1], got " + minScore);
        }
        if (pairingMode == null) {
            throw new ConfigurationException("Pairing mode must be set");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("Matching timeout must be positive");
        }
        return this;
    }
}
