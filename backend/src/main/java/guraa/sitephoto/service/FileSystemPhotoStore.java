package guraa.sitephoto.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Photo store backed by a directory tree on the local file system.
 */
@Slf4j
public class FileSystemPhotoStore implements PhotoStore {

    static final String TEMP_PREFIX = ".upload-";
    static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileSystemPhotoStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public String describe() {
        return root.toString();
    }

    @Override
    public void createDirectories(Path directory) throws IOException {
        Files.createDirectories(resolve(directory));
    }

    @Override
    public boolean exists(Path path) {
        try {
            return Files.exists(resolve(path));
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public boolean isDirectory(Path path) {
        try {
            return Files.isDirectory(resolve(path));
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Writes into a temporary file next to the target and links it into place.
     * A hard link fails when the target exists, so an existing photo is never replaced;
     * where links are unsupported an atomic move is used instead.
     */
    @Override
    public void writeNew(Path path, byte[] content) throws IOException {
        Path target = resolve(path);
        Path directory = target.getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, TEMP_PREFIX, TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.createLink(target, temp);
            } catch (FileAlreadyExistsException e) {
                throw e;
            } catch (UnsupportedOperationException | FileSystemException e) {
                log.debug("Hard link not available for {}, falling back to atomic move: {}", target, e.getMessage());
                if (Files.exists(target)) {
                    throw new FileAlreadyExistsException(target.toString());
                }
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            }
        } finally {
            FileUtils.deleteQuietly(temp.toFile());
        }
    }

    @Override
    public byte[] read(Path path) throws IOException {
        return Files.readAllBytes(resolve(path));
    }

    @Override
    public List<String> list(Path directory) throws IOException {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .map(child -> child.getFileName().toString())
                    .filter(name -> !(name.startsWith(TEMP_PREFIX) && name.endsWith(TEMP_SUFFIX)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public long size(Path path) throws IOException {
        return Files.size(resolve(path));
    }

    @Override
    public Instant lastModified(Path path) throws IOException {
        return Files.getLastModifiedTime(resolve(path)).toInstant();
    }

    private Path resolve(Path relative) throws IOException {
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IOException("Path escapes the photo store: " + relative);
        }
        return resolved;
    }
}
