package guraa.sitephoto.config;

import guraa.sitephoto.exception.ConfigurationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable hour boundaries for before/after classification, together with the
 * single time zone every capture timestamp is evaluated in.
 */
public final class PhaseWindow {

    private final int beforeHour;
    private final int afterHour;
    private final ZoneId zone;

    private PhaseWindow(int beforeHour, int afterHour, ZoneId zone) {
        this.beforeHour = beforeHour;
        this.afterHour = afterHour;
        this.zone = zone;
    }

    /**
     * Build a window, failing fast on an unusable configuration.
     *
     * @param beforeHour photos taken before this hour are "before" photos
     * @param afterHour photos taken at or after this hour are "after" photos
     * @param zoneId the zone capture instants are converted into
     * @return The window
     * @throws ConfigurationException if the hours are out of range, equal or inverted, or the zone is unknown
     */
    public static PhaseWindow of(int beforeHour, int afterHour, String zoneId) {
        if (beforeHour < 0 || beforeHour > 23 || afterHour < 0 || afterHour > 23) {
            throw new ConfigurationException(String.format(
                    "Phase hours must be within 0-23, got before=%d after=%d", beforeHour, afterHour));
        }
        if (beforeHour >= afterHour) {
            throw new ConfigurationException(String.format(
                    "Before hour (%d) must be earlier than after hour (%d)", beforeHour, afterHour));
        }
        if (zoneId == null || zoneId.isBlank()) {
            throw new ConfigurationException("Phase time zone must be set");
        }
        try {
            return new PhaseWindow(beforeHour, afterHour, ZoneId.of(zoneId.trim()));
        } catch (DateTimeException e) {
            throw new ConfigurationException("Unknown time zone: " + zoneId, e);
        }
    }

    public int getBeforeHour() {
        return beforeHour;
    }

    public int getAfterHour() {
        return afterHour;
    }

    public ZoneId getZone() {
        return zone;
    }

    public LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, zone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhaseWindow)) return false;
        PhaseWindow that = (PhaseWindow) o;
        return beforeHour == that.beforeHour && afterHour == that.afterHour && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(beforeHour, afterHour, zone);
    }

    @Override
    public String toString() {
        return String.format("PhaseWindow[before<%02d:00, after>=%02d:00, zone=%s]", beforeHour, afterHour, zone);
    }
}
