package guraa.sitephoto.service;

import guraa.sitephoto.exception.StorageFailureException;
import guraa.sitephoto.model.ClassifiedUpload;
import guraa.sitephoto.model.Phase;
import guraa.sitephoto.util.FileNameUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Places photos at their canonical location {@code <YYYY>-<MM>/<site>/<task>/<phase>/<file>}.
 * An existing photo is never replaced: colliding names get a {@code -1}, {@code -2}, ... suffix.
 */
@Slf4j
@Component
public class StorageLocator {

    static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    static final DateTimeFormatter FILE_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final int DEFAULT_LOCK_TIMEOUT_SECONDS = 10;
    private static final int MAX_COLLISION_SUFFIX = 10_000;
    static final int LOCK_STRIPES = 64;

    private final PhotoStore photoStore;
    // A directory always maps to the same stripe; unrelated directories may share one.
    private final ReentrantLock[] directoryLocks = new ReentrantLock[LOCK_STRIPES];

    public StorageLocator(PhotoStore photoStore) {
        this.photoStore = photoStore;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            directoryLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Canonical directory of a photo, relative to the store root.
     *
     * @throws IllegalArgumentException for rejected photos, which are never stored
     */
    public Path directoryFor(LocalDateTime capturedAt, String site, String task, Phase phase) {
        if (phase == null || phase == Phase.REJECTED) {
            throw new IllegalArgumentException("Only before and after photos have a storage location");
        }
        return Paths.get(MONTH_FORMAT.format(capturedAt),
                FileNameUtils.safeComponent(site, SiteRegistry.UNSPECIFIED),
                FileNameUtils.safeComponent(task, CaptionHints.TASK_GRASS),
                phase.getDirectoryName());
    }

    /**
     * Store a photo under a unique name in its canonical directory.
     *
     * @param upload The classified photo
     * @param content The photo bytes
     * @return The store-relative path of the new file
     * @throws StorageFailureException if the photo could not be written; nothing is left behind
     */
    public Path place(ClassifiedUpload upload, byte[] content) throws StorageFailureException {
        Path directory = directoryFor(upload.getCapturedAt(), upload.getSite(), upload.getTask(), upload.getPhase());
        String fileName = upload.getFileName() != null && !upload.getFileName().isBlank()
                ? FileNameUtils.safeFileName(upload.getFileName(), "jpg")
                : FILE_TIMESTAMP_FORMAT.format(upload.getCapturedAt()) + ".jpg";

        ReentrantLock lock = lockFor(directory);
        try {
            if (!lock.tryLock(DEFAULT_LOCK_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new StorageFailureException(fileName, "timed out waiting for directory " + directory, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageFailureException(fileName, "interrupted while waiting for directory " + directory, e);
        }

        try {
            photoStore.createDirectories(directory);
            for (int counter = 0; counter <= MAX_COLLISION_SUFFIX; counter++) {
                String candidate = counter == 0 ? fileName : FileNameUtils.withCounter(fileName, counter);
                Path target = directory.resolve(candidate);
                if (photoStore.exists(target)) {
                    continue;
                }
                try {
                    photoStore.writeNew(target, content);
                    log.info("Stored photo {}", target);
                    return target;
                } catch (FileAlreadyExistsException e) {
                    log.debug("Name {} was taken concurrently, trying next suffix", target);
                }
            }
            throw new StorageFailureException(fileName, "no free name left in " + directory, null);
        } catch (StorageFailureException e) {
            throw e;
        } catch (IOException e) {
            log.error("Failed to store photo {} in {}: {}", fileName, directory, e.getMessage());
            throw new StorageFailureException(fileName, e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(Path directory) {
        return directoryLocks[Math.floorMod(directory.hashCode(), LOCK_STRIPES)];
    }
}
