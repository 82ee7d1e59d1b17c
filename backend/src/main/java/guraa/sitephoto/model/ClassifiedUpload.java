package guraa.sitephoto.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A photo whose site, task and phase are settled and which is ready to be placed.
 */
@Value
@Builder
public class ClassifiedUpload {

    String site;

    String task;

    Phase phase;

    LocalDateTime capturedAt;

    /**
     * Desired file name; a timestamp name is used when absent.
     */
    String fileName;
}
