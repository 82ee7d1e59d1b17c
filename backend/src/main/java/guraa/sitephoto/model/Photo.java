package guraa.sitephoto.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * A photo in the store.
 * The id is the store-relative path with forward slashes; together with the
 * version token it identifies one exact file content for caching.
 */
@Value
@Builder(toBuilder = true)
public class Photo {

    /**
     * Store-relative path, e.g. {@code 2024-05/ALPHA/grass_cutting/before/a.jpg}.
     */
    String id;

    /**
     * Store-relative location of the file.
     */
    @JsonIgnore
    Path location;

    String site;

    String task;

    LocalDateTime capturedAt;

    Phase phase;

    /**
     * Size and modification time of the file when it was listed.
     */
    String versionToken;

    /**
     * @return Key that changes whenever the underlying file changes
     */
    @JsonIgnore
    public String getCacheKey() {
        return id + "@" + versionToken;
    }
}
