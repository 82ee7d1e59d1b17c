package guraa.sitephoto.exception;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String jobId) {
        super("No report job with id " + jobId);
    }
}
