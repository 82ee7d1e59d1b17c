package guraa.sitephoto.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A photo handed over by the messaging adapter.
 * Every field except the content is optional.
 */
@Value
@Builder
public class IngestRequest {

    byte[] content;

    /**
     * Capture instant; the time of ingestion when absent.
     */
    Instant capturedAt;

    String site;

    String task;

    /**
     * Phase chosen explicitly by the sender, overriding caption words and the time window.
     */
    Phase phase;

    String caption;

    String originalFilename;

    /**
     * Channel-provided unique file id, used in generated file names.
     */
    String uniqueId;
}
