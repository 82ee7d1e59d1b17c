package guraa.sitephoto.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Classification of a photo by time of capture.
 */
public enum Phase {
    BEFORE("before"),
    AFTER("after"),
    REJECTED("rejected");

    private final String directoryName;

    Phase(String directoryName) {
        this.directoryName = directoryName;
    }

    /**
     * @return The directory name used for this phase in the store layout
     */
    public String getDirectoryName() {
        return directoryName;
    }

    public static Optional<Phase> fromDirectoryName(String name) {
        return Arrays.stream(values())
                .filter(phase -> phase != REJECTED)
                .filter(phase -> phase.directoryName.equalsIgnoreCase(name))
                .findFirst();
    }
}
