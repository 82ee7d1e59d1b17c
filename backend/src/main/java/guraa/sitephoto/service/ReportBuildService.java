package guraa.sitephoto.service;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.config.PairingMode;
import guraa.sitephoto.exception.UnreadableImageException;
import guraa.sitephoto.model.Assignment;
import guraa.sitephoto.model.FailureKind;
import guraa.sitephoto.model.FeatureSet;
import guraa.sitephoto.model.MatchCandidate;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.model.Photo;
import guraa.sitephoto.model.PhotoFailure;
import guraa.sitephoto.model.ReportProgress;
import guraa.sitephoto.model.ReportResult;
import guraa.sitephoto.model.ReportSelector;
import guraa.sitephoto.model.ReportStatus;
import guraa.sitephoto.visual.FeatureCache;
import guraa.sitephoto.visual.FeatureExtractor;
import guraa.sitephoto.visual.FeatureMatcher;
import guraa.sitephoto.visual.GreedyPairSelector;
import guraa.sitephoto.visual.OptimalPairSelector;
import guraa.sitephoto.visual.PairSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Builds the before/after assignment of one (site, task) group.
 * Extraction and matching run per photo on the matching executor; pairing starts only
 * after every matching task has finished. Unreadable photos are reported, not fatal.
 */
@Slf4j
@Service
public class ReportBuildService {

    private final PhotoCatalog photoCatalog;
    private final FeatureExtractor featureExtractor;
    private final FeatureMatcher featureMatcher;
    private final GreedyPairSelector greedyPairSelector;
    private final OptimalPairSelector optimalPairSelector;
    private final ExecutorService matchingExecutor;
    private final MatchingSettings defaultSettings;
    private final Clock clock;

    public ReportBuildService(PhotoCatalog photoCatalog,
                              FeatureExtractor featureExtractor,
                              FeatureMatcher featureMatcher,
                              GreedyPairSelector greedyPairSelector,
                              OptimalPairSelector optimalPairSelector,
                              @Qualifier("matchingExecutor") ExecutorService matchingExecutor,
                              MatchingSettings defaultSettings,
                              Clock clock) {
        this.photoCatalog = photoCatalog;
        this.featureExtractor = featureExtractor;
        this.featureMatcher = featureMatcher;
        this.greedyPairSelector = greedyPairSelector;
        this.optimalPairSelector = optimalPairSelector;
        this.matchingExecutor = matchingExecutor;
        this.defaultSettings = defaultSettings;
        this.clock = clock;
    }

    public MatchingSettings getDefaultSettings() {
        return defaultSettings;
    }

    /**
     * Build with the configured settings, without outside cancellation.
     */
    public ReportResult build(ReportSelector selector) throws IOException {
        return build(selector, defaultSettings, new CancellationToken(), new ReportProgress());
    }

    /**
     * Build the assignment for a group.
     *
     * @param selector The group and date range
     * @param settings Tuning values for this run
     * @param token Checked between per-photo units
     * @param progress Updated as units complete
     * @return The result; its status tells a finished build from a cancelled or timed out one
     * @throws IOException If the group cannot be listed from the store
     */
    public ReportResult build(ReportSelector selector, MatchingSettings settings,
                              CancellationToken token, ReportProgress progress) throws IOException {
        Instant startedAt = clock.instant();
        long deadline = System.nanoTime() + settings.getTimeout().toNanos();

        progress.setState("loading");
        List<Photo> photos = photoCatalog.loadGroup(selector);
        Map<String, Photo> photosById = new LinkedHashMap<>();
        photos.forEach(photo -> photosById.put(photo.getId(), photo));
        List<Photo> befores = ofPhase(photos, Phase.BEFORE);
        List<Photo> afters = ofPhase(photos, Phase.AFTER);
        List<String> beforeIds = ids(befores);
        List<String> afterIds = ids(afters);
        progress.setGroupSize(befores.size(), afters.size());

        log.info("Building report for {}/{}: {} before, {} after photos",
                selector.getSite(), selector.getTask(), befores.size(), afters.size());

        Map<String, PhotoFailure> failures = new ConcurrentHashMap<>();
        Map<String, List<MatchCandidate>> rankings = new ConcurrentHashMap<>();
        FeatureCache cache = new FeatureCache();
        CancellationToken stop = new CancellationToken();

        ReportResult.ReportResultBuilder result = ReportResult.builder()
                .selector(selector)
                .photos(photosById)
                .startedAt(startedAt);

        try {
            progress.startStage("preprocess", photos.size());
            runPerPhoto(photos, photo -> extract(photo, cache, settings, failures),
                    token, stop, deadline, progress);

            List<FeatureSet> afterFeatures = afters.stream()
                    .map(cache::get)
                    .flatMap(Optional::stream)
                    .collect(Collectors.toList());

            progress.startStage("matching", befores.size());
            runPerPhoto(befores, photo -> match(photo, cache, afterFeatures, settings, rankings, failures),
                    token, stop, deadline, progress);

            Map<String, List<MatchCandidate>> orderedRankings = new TreeMap<>(rankings);
            Assignment assignment = pairSelectorFor(settings.getPairingMode())
                    .select(orderedRankings, beforeIds, afterIds, settings);

            ReportStatus status = failures.isEmpty() ? ReportStatus.COMPLETE : ReportStatus.PARTIAL;
            progress.finish("done", assignment.getPairCount(),
                    assignment.getUnmatchedBefore().size() + assignment.getUnmatchedAfter().size());
            log.info("Report for {}/{} finished with status {}: {} pairs, {} failures",
                    selector.getSite(), selector.getTask(), status, assignment.getPairCount(), failures.size());

            return result.status(status)
                    .assignment(assignment)
                    .rankings(orderedRankings)
                    .failures(sortedFailures(failures))
                    .finishedAt(clock.instant())
                    .build();
        } catch (CancellationException e) {
            log.warn("Report for {}/{} was cancelled", selector.getSite(), selector.getTask());
            progress.setState("cancelled");
            return incomplete(result, ReportStatus.CANCELLED, beforeIds, afterIds, failures);
        } catch (TimeoutException e) {
            log.warn("Report for {}/{} timed out after {}", selector.getSite(), selector.getTask(),
                    settings.getTimeout());
            progress.setState("timeout");
            return incomplete(result, ReportStatus.TIMED_OUT, beforeIds, afterIds, failures);
        } finally {
            stop.cancel();
            cache.clear();
        }
    }

    PairSelector pairSelectorFor(PairingMode mode) {
        return mode == PairingMode.OPTIMAL ? optimalPairSelector : greedyPairSelector;
    }

    private void extract(Photo photo, FeatureCache cache, MatchingSettings settings,
                         Map<String, PhotoFailure> failures) {
        try {
            cache.getOrLoad(photo, p -> featureExtractor.extract(p.getId(), photoCatalog.readContent(p), settings));
        } catch (UnreadableImageException e) {
            log.warn("Excluding unreadable photo {}: {}", photo.getId(), e.getMessage());
            failures.put(photo.getId(), new PhotoFailure(photo.getId(), FailureKind.UNREADABLE_IMAGE, e.getMessage()));
        } catch (IOException e) {
            log.error("Could not read photo {}: {}", photo.getId(), e.getMessage());
            failures.put(photo.getId(), new PhotoFailure(photo.getId(), FailureKind.READ_ERROR, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Feature extraction failed for photo {}: {}", photo.getId(), e.getMessage(), e);
            failures.put(photo.getId(), new PhotoFailure(photo.getId(), FailureKind.EXTRACTION_ERROR, e.getMessage()));
        }
    }

    private void match(Photo photo, FeatureCache cache, List<FeatureSet> afterFeatures, MatchingSettings settings,
                       Map<String, List<MatchCandidate>> rankings, Map<String, PhotoFailure> failures) {
        Optional<FeatureSet> features = cache.get(photo);
        if (features.isEmpty()) {
            return;
        }
        try {
            rankings.put(photo.getId(), featureMatcher.rank(features.get(), afterFeatures, settings));
        } catch (RuntimeException e) {
            log.error("Matching failed for photo {}: {}", photo.getId(), e.getMessage(), e);
            failures.put(photo.getId(), new PhotoFailure(photo.getId(), FailureKind.MATCHING_ERROR, e.getMessage()));
        }
    }

    /**
     * Run one unit per photo on the matching executor and wait for all of them.
     * Units that have not started yet are skipped once the build is cancelled or stopped.
     */
    private void runPerPhoto(List<Photo> photos, PhotoTask task, CancellationToken token, CancellationToken stop,
                             long deadline, ReportProgress progress) throws TimeoutException {
        List<CompletableFuture<Void>> tasks = new ArrayList<>(photos.size());
        for (Photo photo : photos) {
            tasks.add(CompletableFuture.runAsync(() -> {
                if (token.isCancelled() || stop.isCancelled()) {
                    return;
                }
                task.run(photo);
                progress.stepDone();
            }, matchingExecutor));
        }

        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                    .get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            stop.cancel();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop.cancel();
            throw new CancellationException("Interrupted while waiting for report build");
        } catch (ExecutionException e) {
            stop.cancel();
            throw new IllegalStateException("Report build task failed", e.getCause());
        }
        token.throwIfCancelled();
    }

    private ReportResult incomplete(ReportResult.ReportResultBuilder result, ReportStatus status,
                                    List<String> beforeIds, List<String> afterIds,
                                    Map<String, PhotoFailure> failures) {
        return result.status(status)
                .assignment(Assignment.unpaired(beforeIds, afterIds))
                .rankings(Map.of())
                .failures(sortedFailures(failures))
                .finishedAt(clock.instant())
                .build();
    }

    private static List<Photo> ofPhase(List<Photo> photos, Phase phase) {
        return photos.stream()
                .filter(photo -> photo.getPhase() == phase)
                .sorted(Comparator.comparing(Photo::getId))
                .collect(Collectors.toList());
    }

    private static List<String> ids(List<Photo> photos) {
        return photos.stream().map(Photo::getId).collect(Collectors.toList());
    }

    private static List<PhotoFailure> sortedFailures(Map<String, PhotoFailure> failures) {
        return failures.values().stream()
                .sorted(Comparator.comparing(PhotoFailure::getPhotoId))
                .collect(Collectors.toList());
    }

    @FunctionalInterface
    private interface PhotoTask {
        void run(Photo photo);
    }
}
