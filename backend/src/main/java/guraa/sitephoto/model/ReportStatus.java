package guraa.sitephoto.model;

/**
 * Outcome of a report build.
 */
public enum ReportStatus {
    /** Every photo was matched or legitimately left unmatched. */
    COMPLETE,
    /** The build finished but some photos failed and are listed as failures. */
    PARTIAL,
    /** The caller cancelled the build before it finished. */
    CANCELLED,
    /** The build ran past the configured timeout. */
    TIMED_OUT,
    /** The build could not run at all, e.g. the group could not be listed. */
    FAILED;

    public boolean isFinished() {
        return this == COMPLETE || this == PARTIAL;
    }
}
