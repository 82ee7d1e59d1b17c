package guraa.sitephoto.controller;

import guraa.sitephoto.exception.StorageFailureException;
import guraa.sitephoto.model.IngestRequest;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.model.PlacementOutcome;
import guraa.sitephoto.service.CaptionHints;
import guraa.sitephoto.service.PhotoCatalog;
import guraa.sitephoto.service.PhotoIngestService;
import guraa.sitephoto.service.SiteRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Controller for photo uploads and the photo catalog.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PhotoController {

    private final PhotoIngestService photoIngestService;
    private final PhotoCatalog photoCatalog;
    private final SiteRegistry siteRegistry;
    private final CaptionHints captionHints;

    /**
     * Upload one photo. It is stored under its month, site, task and phase, or rejected
     * when it falls between the before and after windows.
     *
     * @return 201 with the stored path, or 422 with the rejection reason
     */
    @PostMapping("/photos")
    public ResponseEntity<PlacementOutcome> uploadPhoto(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "capturedAt", required = false) String capturedAt,
            @RequestParam(value = "site", required = false) String site,
            @RequestParam(value = "task", required = false) String task,
            @RequestParam(value = "phase", required = false) String phase,
            @RequestParam(value = "caption", required = false) String caption,
            @RequestParam(value = "uniqueId", required = false) String uniqueId)
            throws IOException, StorageFailureException {

        log.info("Received photo upload: name={}, size={}, site={}, task={}",
                file.getOriginalFilename(), file.getSize(), site, task);

        IngestRequest request = IngestRequest.builder()
                .content(file.getBytes())
                .originalFilename(file.getOriginalFilename())
                .capturedAt(parseInstant(capturedAt))
                .site(site)
                .task(task)
                .phase(parsePhase(phase))
                .caption(caption)
                .uniqueId(uniqueId)
                .build();

        PlacementOutcome outcome = photoIngestService.ingest(request);
        HttpStatus status = outcome.isStored() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(outcome);
    }

    /**
     * @return Months in the store, each with the sites that have photos
     */
    @GetMapping("/catalog")
    public Map<String, List<String>> getCatalog() throws IOException {
        return photoCatalog.listMonthsAndSites();
    }

    @GetMapping("/sites")
    public Map<String, List<String>> getSites() {
        return siteRegistry.getSites();
    }

    /**
     * Register a site and its shortcut at runtime.
     */
    @PostMapping("/sites")
    public ResponseEntity<Map<String, Object>> addSite(@RequestBody Map<String, String> body) {
        String name = body.get("name");
        String shortcut = body.get("shortcut");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Site name is required");
        }

        boolean added = siteRegistry.addSite(name, shortcut);
        Map<String, Object> response = new HashMap<>();
        response.put("site", name.trim().toUpperCase(Locale.ROOT));
        response.put("added", added);
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK).body(response);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("capturedAt must be an ISO-8601 instant: " + value, e);
        }
    }

    private Phase parsePhase(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return captionHints.phaseFromWord(value)
                .or(() -> Phase.fromDirectoryName(value.trim().toLowerCase(Locale.ROOT)))
                .orElseThrow(() -> new IllegalArgumentException("phase must be a before or after word: " + value));
    }
}
