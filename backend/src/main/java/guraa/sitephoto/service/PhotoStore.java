package guraa.sitephoto.service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Narrow file-system port of the photo store. All paths are relative to the store root.
 */
public interface PhotoStore {

    /**
     * @return Human-readable description of where the store lives
     */
    String describe();

    void createDirectories(Path directory) throws IOException;

    boolean exists(Path path);

    boolean isDirectory(Path path);

    /**
     * Write a new file atomically. Readers never observe a partially written file.
     *
     * @param path Target file
     * @param content File bytes
     * @throws FileAlreadyExistsException if the target exists; it is never replaced
     * @throws IOException if the write fails; nothing is left at the target
     */
    void writeNew(Path path, byte[] content) throws IOException;

    byte[] read(Path path) throws IOException;

    /**
     * @return Names of the direct children of a directory, sorted; empty if the directory is missing
     */
    List<String> list(Path directory) throws IOException;

    long size(Path path) throws IOException;

    Instant lastModified(Path path) throws IOException;
}
