package guraa.sitephoto.service;

import guraa.sitephoto.config.AppProperties;
import guraa.sitephoto.config.PhaseWindow;
import guraa.sitephoto.exception.PhotoNotFoundException;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.model.Photo;
import guraa.sitephoto.model.ReportSelector;
import guraa.sitephoto.util.FileNameUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read side of the photo store: lists months and sites, and loads the photos of a group.
 */
@Slf4j
@Service
public class PhotoCatalog {

    private static final Pattern MONTH_DIRECTORY = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern FILE_TIMESTAMP = Pattern.compile("(\\d{8}_\\d{6})");

    private final PhotoStore photoStore;
    private final PhaseWindow phaseWindow;
    private final List<String> knownTasks;

    public PhotoCatalog(PhotoStore photoStore, PhaseWindow phaseWindow, AppProperties properties) {
        this.photoStore = photoStore;
        this.phaseWindow = phaseWindow;
        this.knownTasks = List.copyOf(properties.getTasks());
    }

    /**
     * Months present in the store, each with the sites that have at least one known task directory.
     *
     * @return Month name to site names, both sorted
     * @throws IOException If the store cannot be listed
     */
    public Map<String, List<String>> listMonthsAndSites() throws IOException {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String month : photoStore.list(Paths.get(""))) {
            if (monthOf(month).isEmpty()) {
                continue;
            }
            List<String> sites = new ArrayList<>();
            for (String site : photoStore.list(Paths.get(month))) {
                boolean hasTask = knownTasks.stream()
                        .anyMatch(task -> photoStore.isDirectory(Paths.get(month, site, task)));
                if (hasTask) {
                    sites.add(site);
                }
            }
            if (!sites.isEmpty()) {
                result.put(month, sites);
            }
        }
        return result;
    }

    /**
     * Load every before and after photo of a group, sorted by id.
     *
     * @param selector Site, task and optional date range
     * @return The photos
     * @throws IOException If the store cannot be listed
     */
    public List<Photo> loadGroup(ReportSelector selector) throws IOException {
        String site = FileNameUtils.safeComponent(selector.getSite(), SiteRegistry.UNSPECIFIED);
        String task = FileNameUtils.safeComponent(selector.getTask(), CaptionHints.TASK_GRASS);

        List<Photo> photos = new ArrayList<>();
        for (String month : photoStore.list(Paths.get(""))) {
            Optional<YearMonth> yearMonth = monthOf(month);
            if (yearMonth.isEmpty() || !selector.includesMonth(yearMonth.get())) {
                continue;
            }
            for (Phase phase : List.of(Phase.BEFORE, Phase.AFTER)) {
                Path directory = Paths.get(month, site, task, phase.getDirectoryName());
                for (String name : photoStore.list(directory)) {
                    if (!FileNameUtils.isImageFile(name)) {
                        continue;
                    }
                    Photo photo = describe(directory.resolve(name), site, task, phase);
                    if (selector.includesDate(photo.getCapturedAt().toLocalDate())) {
                        photos.add(photo);
                    }
                }
            }
        }
        photos.sort(Comparator.comparing(Photo::getId));
        log.info("Loaded {} photos for site {} task {}", photos.size(), site, task);
        return photos;
    }

    /**
     * Look up a single stored photo by id.
     *
     * @param photoId Store-relative path
     * @return The photo
     * @throws PhotoNotFoundException If the id does not name a stored before/after photo
     * @throws IOException If the store cannot be read
     */
    public Photo findPhoto(String photoId) throws IOException {
        Path location = Paths.get(photoId).normalize();
        if (location.getNameCount() != 5 || location.startsWith("..") || !photoStore.exists(location)) {
            throw new PhotoNotFoundException(photoId);
        }
        Phase phase = Phase.fromDirectoryName(location.getName(3).toString())
                .orElseThrow(() -> new PhotoNotFoundException(photoId));
        return describe(location, location.getName(1).toString(), location.getName(2).toString(), phase);
    }

    public byte[] readContent(Photo photo) throws IOException {
        return photoStore.read(photo.getLocation());
    }

    private Photo describe(Path location, String site, String task, Phase phase) throws IOException {
        long size = photoStore.size(location);
        var lastModified = photoStore.lastModified(location);
        return Photo.builder()
                .id(FilenameUtils.separatorsToUnix(location.toString()))
                .location(location)
                .site(site)
                .task(task)
                .phase(phase)
                .capturedAt(captureTime(location.getFileName().toString(), phaseWindow.toLocal(lastModified)))
                .versionToken(size + "-" + lastModified.toEpochMilli())
                .build();
    }

    static Optional<YearMonth> monthOf(String directoryName) {
        if (!MONTH_DIRECTORY.matcher(directoryName).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(YearMonth.parse(directoryName));
        } catch (DateTimeParseException e) {
            log.debug("Skipping directory {} that is not a real month", directoryName);
            return Optional.empty();
        }
    }

    /**
     * Capture time from the {@code yyyyMMdd_HHmmss} stamp in generated file names,
     * falling back to the file modification time.
     */
    static LocalDateTime captureTime(String fileName, LocalDateTime fallback) {
        Matcher matcher = FILE_TIMESTAMP.matcher(fileName);
        if (matcher.find()) {
            try {
                return LocalDateTime.parse(matcher.group(1), StorageLocator.FILE_TIMESTAMP_FORMAT);
            } catch (DateTimeParseException e) {
                log.debug("Ignoring malformed timestamp in {}", fileName);
            }
        }
        return fallback;
    }
}
