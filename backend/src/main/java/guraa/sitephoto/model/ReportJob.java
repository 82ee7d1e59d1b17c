package guraa.sitephoto.model;

import guraa.sitephoto.service.CancellationToken;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A report build requested through the job API.
 */
@Getter
public class ReportJob {

    private final String jobId = UUID.randomUUID().toString().replace("-", "");
    private final ReportSelector selector;
    private final ReportProgress progress = new ReportProgress();
    private final CancellationToken cancellationToken = new CancellationToken();
    private final Instant createdAt;

    private volatile ReportResult result;
    private volatile String error;
    private volatile Instant finishedAt;

    public ReportJob(ReportSelector selector, Instant createdAt) {
        this.selector = selector;
        this.createdAt = createdAt;
    }

    public void complete(ReportResult result, Instant finishedAt) {
        this.result = result;
        this.finishedAt = finishedAt;
    }

    public void fail(String error, Instant finishedAt) {
        this.error = error;
        this.finishedAt = finishedAt;
        progress.setState("error");
    }

    public boolean isFinished() {
        return finishedAt != null;
    }
}
