package guraa.sitephoto.visual;

import guraa.sitephoto.model.FeatureSet;
import guraa.sitephoto.model.Photo;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feature sets of one report build, keyed by photo identity and file version.
 * Owned by the build that created it and dropped when the build ends.
 */
public class FeatureCache {

    /**
     * Computes the features of a photo on a cache miss.
     */
    @FunctionalInterface
    public interface Loader {
        FeatureSet load(Photo photo) throws IOException;
    }

    private final ConcurrentHashMap<String, FeatureSet> entries = new ConcurrentHashMap<>();

    /**
     * Return the cached features of a photo, computing them on first use.
     * Two threads missing at once may both compute; the first stored result wins.
     *
     * @throws IOException If the loader fails; nothing is cached in that case
     */
    public FeatureSet getOrLoad(Photo photo, Loader loader) throws IOException {
        FeatureSet cached = entries.get(photo.getCacheKey());
        if (cached != null) {
            return cached;
        }
        FeatureSet loaded = loader.load(photo);
        FeatureSet previous = entries.putIfAbsent(photo.getCacheKey(), loaded);
        return previous != null ? previous : loaded;
    }

    public Optional<FeatureSet> get(Photo photo) {
        return Optional.ofNullable(entries.get(photo.getCacheKey()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
