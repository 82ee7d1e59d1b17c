package guraa.sitephoto.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a report renderer needs from one build: the pairing, the photos it
 * refers to, per-photo failures and whether the build actually finished.
 */
@Value
@Builder
public class ReportResult {

    ReportSelector selector;

    ReportStatus status;

    Assignment assignment;

    /**
     * Ranked candidates per before photo id.
     */
    Map<String, List<MatchCandidate>> rankings;

    /**
     * Every photo of the group by id, including failed ones.
     */
    Map<String, Photo> photos;

    List<PhotoFailure> failures;

    Instant startedAt;

    Instant finishedAt;

    /**
     * @return true when the build did not run to the end; the assignment then carries no pairs
     */
    public boolean isIncomplete() {
        return !status.isFinished();
    }
}
