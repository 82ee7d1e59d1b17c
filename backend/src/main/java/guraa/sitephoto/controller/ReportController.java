package guraa.sitephoto.controller;

import guraa.sitephoto.model.PairScore;
import guraa.sitephoto.model.ReportJob;
import guraa.sitephoto.model.ReportSelector;
import guraa.sitephoto.service.FastMatchService;
import guraa.sitephoto.service.ReportJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for before/after report jobs and single pair scoring.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReportController {

    private final ReportJobService reportJobService;
    private final FastMatchService fastMatchService;

    /**
     * Start building a report for one site and task.
     *
     * @param selector Site, task and optional inclusive date range
     * @return 202 with the job id
     */
    @PostMapping("/reports")
    public ResponseEntity<Map<String, Object>> startReport(@RequestBody ReportSelector selector) {
        String jobId = reportJobService.startReport(selector);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jobId", jobId);
        response.put("message", "Report build started");
        return ResponseEntity.accepted().body(response);
    }

    /**
     * Progress of a report job, plus its result once it has finished.
     */
    @GetMapping("/reports/{jobId}")
    public Map<String, Object> getReport(@PathVariable String jobId) {
        return describe(reportJobService.getJob(jobId));
    }

    @DeleteMapping("/reports/{jobId}")
    public Map<String, Object> cancelReport(@PathVariable String jobId) {
        return describe(reportJobService.cancel(jobId));
    }

    /**
     * Score one before photo against one after photo.
     *
     * @param body {@code beforeId} and {@code afterId}, both store-relative photo ids
     */
    @PostMapping("/match/score")
    public PairScore scorePair(@RequestBody Map<String, String> body) throws IOException {
        String beforeId = body.get("beforeId");
        String afterId = body.get("afterId");
        if (beforeId == null || beforeId.isBlank() || afterId == null || afterId.isBlank()) {
            throw new IllegalArgumentException("Both beforeId and afterId are required");
        }
        return fastMatchService.scorePair(beforeId, afterId);
    }

    private static Map<String, Object> describe(ReportJob job) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jobId", job.getJobId());
        response.put("selector", job.getSelector());
        response.putAll(job.getProgress().snapshot());
        if (job.getResult() != null) {
            response.put("status", job.getResult().getStatus());
            response.put("result", job.getResult());
        }
        if (job.getError() != null) {
            response.put("error", job.getError());
        }
        return response;
    }
}
