package guraa.sitephoto.service;

import guraa.sitephoto.config.PhaseWindow;
import guraa.sitephoto.exception.StorageFailureException;
import guraa.sitephoto.model.ClassifiedUpload;
import guraa.sitephoto.model.IngestRequest;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.model.PlacementOutcome;
import guraa.sitephoto.util.FileNameUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Entry point for photos arriving from the messaging adapter.
 * Settles site, task and phase, then hands the photo to the storage locator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PhotoIngestService {

    private final PhaseClassifier phaseClassifier;
    private final CaptionHints captionHints;
    private final SiteRegistry siteRegistry;
    private final StorageLocator storageLocator;
    private final PhaseWindow phaseWindow;
    private final Clock clock;

    /**
     * Classify and store one photo.
     *
     * @param request The uploaded photo and whatever hints came with it
     * @return Where it was stored, or why it was rejected
     * @throws StorageFailureException if the photo could not be written
     */
    public PlacementOutcome ingest(IngestRequest request) throws StorageFailureException {
        String caption = request.getCaption() == null ? "" : request.getCaption();
        String site = resolveSite(request.getSite(), caption);
        String task = resolveTask(request.getTask(), caption);

        if (request.getContent() == null || request.getContent().length == 0) {
            log.warn("Rejected empty upload for site {} task {}", site, task);
            return PlacementOutcome.rejected(site, task, "Upload is empty");
        }

        Instant capturedInstant = request.getCapturedAt() != null ? request.getCapturedAt() : clock.instant();
        LocalDateTime capturedAt = phaseWindow.toLocal(capturedInstant);
        Phase phase = resolvePhase(request.getPhase(), caption, capturedAt);

        if (phase == Phase.REJECTED) {
            String reason = String.format(
                    "Captured at %02d:%02d, between %02d:00 and %02d:00; send it as before or after explicitly",
                    capturedAt.getHour(), capturedAt.getMinute(),
                    phaseWindow.getBeforeHour(), phaseWindow.getAfterHour());
            log.info("Rejected photo for site {} task {}: {}", site, task, reason);
            return PlacementOutcome.rejected(site, task, reason);
        }

        ClassifiedUpload upload = ClassifiedUpload.builder()
                .site(site)
                .task(task)
                .phase(phase)
                .capturedAt(capturedAt)
                .fileName(fileNameFor(request, site, task, phase, capturedAt))
                .build();

        Path stored = storageLocator.place(upload, request.getContent());
        String storedPath = FilenameUtils.separatorsToUnix(stored.toString());
        return PlacementOutcome.stored(storedPath, site, task, phase);
    }

    private String resolveSite(String requested, String caption) {
        if (requested != null && !requested.isBlank()) {
            return siteRegistry.resolve(requested)
                    .orElseGet(() -> requested.trim().toUpperCase(Locale.ROOT));
        }
        return captionHints.siteFromText(caption).orElse(SiteRegistry.UNSPECIFIED);
    }

    private String resolveTask(String requested, String caption) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return captionHints.taskFromCaption(caption);
    }

    private Phase resolvePhase(Phase requested, String caption, LocalDateTime capturedAt) {
        if (requested != null && requested != Phase.REJECTED) {
            return requested;
        }
        return captionHints.phaseFromCaption(caption)
                .orElseGet(() -> phaseClassifier.classify(capturedAt, phaseWindow));
    }

    private String fileNameFor(IngestRequest request, String site, String task, Phase phase,
                               LocalDateTime capturedAt) {
        String uniqueId = request.getUniqueId();
        if (uniqueId == null || uniqueId.isBlank()) {
            uniqueId = request.getOriginalFilename() != null
                    ? FilenameUtils.getBaseName(request.getOriginalFilename())
                    : "nofid";
        }
        return String.join("_",
                site.toLowerCase(Locale.ROOT),
                task,
                phase.getDirectoryName(),
                StorageLocator.FILE_TIMESTAMP_FORMAT.format(capturedAt),
                FileNameUtils.safeComponent(uniqueId, "nofid"),
                FileNameUtils.captionSlug(request.getCaption())) + ".jpg";
    }
}
