package guraa.sitephoto.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Answer to an upload: where the photo was stored, or why it was not.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlacementOutcome {

    boolean stored;

    /**
     * Store-relative path of the stored file.
     */
    String storedPath;

    String site;

    String task;

    Phase phase;

    String rejectionReason;

    public static PlacementOutcome stored(String storedPath, String site, String task, Phase phase) {
        return new PlacementOutcome(true, storedPath, site, task, phase, null);
    }

    public static PlacementOutcome rejected(String site, String task, String reason) {
        return new PlacementOutcome(false, null, site, task, Phase.REJECTED, reason);
    }
}
