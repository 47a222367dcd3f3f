package github.sarthakdev143.clip_factory.service;

/**
 * Terminal failure of one job. The message is recorded as the job's {@code error}.
 */
public class JobFailureException extends Exception {

    public static final String NO_VIRAL_SEGMENTS = "No viral segments found";
    public static final String INTERRUPTED_BY_RESTART = "Interrupted by service restart";

    public JobFailureException(String message) {
        super(message);
    }

    public JobFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
