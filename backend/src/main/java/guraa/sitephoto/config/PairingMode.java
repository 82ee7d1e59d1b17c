package guraa.sitephoto.config;

/**
 * How ranked candidates are resolved into before/after pairs.
 */
public enum PairingMode {
    /** Highest global score first, one pass. The default. */
    GREEDY,
    /** Maximum total score assignment (Hungarian algorithm). Slower. */
    OPTIMAL
}
