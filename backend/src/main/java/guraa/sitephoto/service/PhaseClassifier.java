package guraa.sitephoto.service;

import guraa.sitephoto.config.PhaseWindow;
import guraa.sitephoto.model.Phase;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Classifies a capture time as before, after or rejected.
 * Photos taken in the mid-day gap between the two boundaries are rejected.
 */
@Component
public class PhaseClassifier {

    /**
     * Classify a local capture time.
     *
     * @param capturedAt Capture time in the window's zone
     * @param window The configured hour boundaries
     * @return BEFORE if hour &lt; beforeHour, AFTER if hour &gt;= afterHour, otherwise REJECTED
     */
    public Phase classify(LocalDateTime capturedAt, PhaseWindow window) {
        int hour = capturedAt.getHour();
        if (hour < window.getBeforeHour()) {
            return Phase.BEFORE;
        }
        if (hour >= window.getAfterHour()) {
            return Phase.AFTER;
        }
        return Phase.REJECTED;
    }

    public Phase classify(Instant capturedAt, PhaseWindow window) {
        return classify(window.toLocal(capturedAt), window);
    }
}
