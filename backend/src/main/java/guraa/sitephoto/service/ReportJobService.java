package guraa.sitephoto.service;

import guraa.sitephoto.config.AppProperties;
import guraa.sitephoto.exception.ReportNotFoundException;
import guraa.sitephoto.model.ReportJob;
import guraa.sitephoto.model.ReportResult;
import guraa.sitephoto.model.ReportSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs report builds in the background and keeps their progress and results
 * until they expire.
 */
@Slf4j
@Service
public class ReportJobService {

    private final ReportBuildService reportBuildService;
    private final TaskExecutor reportTaskExecutor;
    private final Clock clock;
    private final Duration resultExpiration;

    private final Map<String, ReportJob> jobs = new ConcurrentHashMap<>();

    public ReportJobService(ReportBuildService reportBuildService,
                            @Qualifier("reportTaskExecutor") TaskExecutor reportTaskExecutor,
                            Clock clock,
                            AppProperties properties) {
        this.reportBuildService = reportBuildService;
        this.reportTaskExecutor = reportTaskExecutor;
        this.clock = clock;
        this.resultExpiration = Duration.ofMinutes(properties.getReports().getResultExpirationMinutes());
    }

    /**
     * Queue a report build.
     *
     * @param selector The group to report on
     * @return The job id to poll
     */
    public String startReport(ReportSelector selector) {
        ReportJob job = new ReportJob(selector, clock.instant());
        jobs.put(job.getJobId(), job);
        log.info("Queued report job {} for {}/{}", job.getJobId(), selector.getSite(), selector.getTask());
        try {
            reportTaskExecutor.execute(() -> run(job));
        } catch (TaskRejectedException e) {
            jobs.remove(job.getJobId());
            log.warn("Report job {} rejected, executor is saturated", job.getJobId());
            throw e;
        }
        return job.getJobId();
    }

    public ReportJob getJob(String jobId) {
        ReportJob job = jobs.get(jobId);
        if (job == null) {
            throw new ReportNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Ask a running job to stop. Units already in flight finish; the rest are skipped.
     *
     * @return the job
     */
    public ReportJob cancel(String jobId) {
        ReportJob job = getJob(jobId);
        if (!job.isFinished()) {
            log.info("Cancelling report job {}", jobId);
            job.getCancellationToken().cancel();
        }
        return job;
    }

    /**
     * Drop finished jobs older than the configured expiration.
     */
    @Scheduled(fixedDelayString = "${app.reports.eviction-interval-ms:60000}")
    public void evictExpired() {
        Instant cutoff = clock.instant().minus(resultExpiration);
        int before = jobs.size();
        jobs.values().removeIf(job -> job.isFinished() && job.getFinishedAt().isBefore(cutoff));
        int removed = before - jobs.size();
        if (removed > 0) {
            log.info("Evicted {} expired report jobs", removed);
        }
    }

    int jobCount() {
        return jobs.size();
    }

    private void run(ReportJob job) {
        try {
            ReportResult result = reportBuildService.build(job.getSelector(),
                    reportBuildService.getDefaultSettings(), job.getCancellationToken(), job.getProgress());
            job.complete(result, clock.instant());
        } catch (Exception e) {
            log.error("Report job {} failed: {}", job.getJobId(), e.getMessage(), e);
            job.fail(e.getMessage(), clock.instant());
        }
    }
}
