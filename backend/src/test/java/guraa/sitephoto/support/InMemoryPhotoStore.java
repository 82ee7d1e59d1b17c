package guraa.sitephoto.support;

import guraa.sitephoto.service.PhotoStore;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Photo store kept in memory. Can be told to fail the next writes.
 */
public class InMemoryPhotoStore implements PhotoStore {

    private final Map<Path, byte[]> files = new ConcurrentHashMap<>();
    private final Set<Path> directories = new ConcurrentSkipListSet<>();
    private final AtomicInteger failingWrites = new AtomicInteger();
    private final Instant modified = Instant.parse("2024-05-05T00:00:00Z");

    public void failNextWrites(int count) {
        failingWrites.set(count);
    }

    public int fileCount() {
        return files.size();
    }

    public Set<Path> filePaths() {
        return new TreeSet<>(files.keySet());
    }

    @Override
    public String describe() {
        return "memory";
    }

    @Override
    public void createDirectories(Path directory) {
        Path current = directory.normalize();
        while (current != null && !current.toString().isEmpty()) {
            directories.add(current);
            current = current.getParent();
        }
    }

    @Override
    public boolean exists(Path path) {
        Path p = path.normalize();
        return files.containsKey(p) || directories.contains(p);
    }

    @Override
    public boolean isDirectory(Path path) {
        return directories.contains(path.normalize());
    }

    @Override
    public void writeNew(Path path, byte[] content) throws IOException {
        if (failingWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IOException("Simulated disk failure");
        }
        Path p = path.normalize();
        if (files.putIfAbsent(p, content.clone()) != null) {
            throw new FileAlreadyExistsException(p.toString());
        }
        if (p.getParent() != null) {
            createDirectories(p.getParent());
        }
    }

    @Override
    public byte[] read(Path path) throws IOException {
        byte[] content = files.get(path.normalize());
        if (content == null) {
            throw new NoSuchFileException(path.toString());
        }
        return content.clone();
    }

    @Override
    public List<String> list(Path directory) {
        Path dir = directory.normalize();
        boolean root = dir.toString().isEmpty();
        TreeSet<String> names = new TreeSet<>();
        for (Path p : files.keySet()) {
            childName(dir, root, p, names);
        }
        for (Path p : directories) {
            childName(dir, root, p, names);
        }
        return names.stream().collect(Collectors.toList());
    }

    @Override
    public long size(Path path) throws IOException {
        return read(path).length;
    }

    @Override
    public Instant lastModified(Path path) throws IOException {
        if (!files.containsKey(path.normalize())) {
            throw new NoSuchFileException(path.toString());
        }
        return modified;
    }

    private static void childName(Path dir, boolean root, Path candidate, Set<String> names) {
        Path parent = candidate.getParent() == null ? Paths.get("") : candidate.getParent();
        if (root ? candidate.getNameCount() == 1 : parent.equals(dir)) {
            names.add(candidate.getFileName().toString());
        }
    }
}
