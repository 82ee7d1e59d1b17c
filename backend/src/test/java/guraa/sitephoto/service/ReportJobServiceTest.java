package guraa.sitephoto.service;

import guraa.sitephoto.config.AppProperties;
import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.exception.ReportNotFoundException;
import guraa.sitephoto.model.Assignment;
import guraa.sitephoto.model.ReportJob;
import guraa.sitephoto.model.ReportProgress;
import guraa.sitephoto.model.ReportResult;
import guraa.sitephoto.model.ReportSelector;
import guraa.sitephoto.model.ReportStatus;
import guraa.sitephoto.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReportJobServiceTest {

    private final ReportSelector selector = new ReportSelector("ALPHA", "grass_cutting", null, null);

    private ReportBuildService buildService;
    private MutableClock clock;
    private AppProperties properties;

    @BeforeEach
    void setUp() {
        buildService = mock(ReportBuildService.class);
        when(buildService.getDefaultSettings()).thenReturn(MatchingSettings.defaults());
        clock = new MutableClock(Instant.parse("2024-05-05T18:00:00Z"));
        properties = new AppProperties();
        properties.getReports().setResultExpirationMinutes(60);
    }

    @Test
    void shouldRunJobAndKeepItsResult() throws Exception {
        // Given
        ReportResult result = result(ReportStatus.COMPLETE);
        when(buildService.build(any(), any(), any(), any())).thenReturn(result);
        ReportJobService service = new ReportJobService(buildService, new SyncTaskExecutor(), clock, properties);

        // When
        String jobId = service.startReport(selector);

        // Then
        ReportJob job = service.getJob(jobId);
        assertTrue(job.isFinished());
        assertSame(result, job.getResult());
        assertNull(job.getError());
    }

    @Test
    void shouldRecordFailureOfWholeBuild() throws Exception {
        when(buildService.build(any(), any(), any(), any())).thenThrow(new IOException("store offline"));
        ReportJobService service = new ReportJobService(buildService, new SyncTaskExecutor(), clock, properties);

        ReportJob job = service.getJob(service.startReport(selector));

        assertTrue(job.isFinished());
        assertEquals("store offline", job.getError());
        assertEquals("error", job.getProgress().getState());
    }

    @Test
    void shouldForgetJobWhenExecutorRejectsIt() {
        // Given: a saturated executor
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        ReportJobService service = new ReportJobService(buildService, saturated, clock, properties);

        // When
        assertThrows(TaskRejectedException.class, () -> service.startReport(selector));
        clock.advance(Duration.ofDays(1));
        service.evictExpired();

        // Then
        assertEquals(0, service.jobCount());
    }

    @Test
    void shouldSignalCancellationToRunningJob() {
        // Given: a queued job that has not started yet
        List<Runnable> queued = new ArrayList<>();
        TaskExecutor deferred = queued::add;
        ReportJobService service = new ReportJobService(buildService, deferred, clock, properties);
        String jobId = service.startReport(selector);

        // When
        ReportJob job = service.cancel(jobId);

        // Then
        assertTrue(job.getCancellationToken().isCancelled());
        assertFalse(job.isFinished());
        assertEquals(1, queued.size());
    }

    @Test
    void shouldFailForUnknownJob() {
        ReportJobService service = new ReportJobService(buildService, new SyncTaskExecutor(), clock, properties);

        assertThrows(ReportNotFoundException.class, () -> service.getJob("nope"));
        assertThrows(ReportNotFoundException.class, () -> service.cancel("nope"));
    }

    @Test
    void shouldEvictOnlyExpiredFinishedJobs() throws Exception {
        // Given
        when(buildService.build(any(), any(), any(), any())).thenReturn(result(ReportStatus.COMPLETE));
        ReportJobService service = new ReportJobService(buildService, new SyncTaskExecutor(), clock, properties);
        String oldJob = service.startReport(selector);
        clock.advance(Duration.ofMinutes(45));
        String newJob = service.startReport(selector);

        // When
        clock.advance(Duration.ofMinutes(30));
        service.evictExpired();

        // Then
        assertEquals(1, service.jobCount());
        assertThrows(ReportNotFoundException.class, () -> service.getJob(oldJob));
        assertNotNull(service.getJob(newJob));
    }

    @Test
    void shouldExposeProgressSnapshot() throws Exception {
        when(buildService.build(any(), any(), any(), any())).thenAnswer(invocation -> {
            ReportProgress progress = invocation.getArgument(3);
            progress.setGroupSize(3, 2);
            progress.finish("done", 2, 1);
            return result(ReportStatus.COMPLETE);
        });
        ReportJobService service = new ReportJobService(buildService, new SyncTaskExecutor(), clock, properties);

        Map<String, Object> snapshot = service.getJob(service.startReport(selector)).getProgress().snapshot();

        assertEquals("done", snapshot.get("state"));
        assertEquals(3, snapshot.get("before"));
        assertEquals(2, snapshot.get("matched"));
    }

    private ReportResult result(ReportStatus status) {
        return ReportResult.builder()
                .selector(selector)
                .status(status)
                .assignment(Assignment.unpaired(List.of(), List.of()))
                .rankings(Map.of())
                .photos(Map.of())
                .failures(List.of())
                .startedAt(clock.instant())
                .finishedAt(clock.instant())
                .build();
    }
}
