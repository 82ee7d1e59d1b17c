package guraa.sitephoto.model;

public enum FailureKind {
    UNREADABLE_IMAGE,
    READ_ERROR,
    EXTRACTION_ERROR,
    MATCHING_ERROR
}
