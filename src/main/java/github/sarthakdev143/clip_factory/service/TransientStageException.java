package github.sarthakdev143.clip_factory.service;

/**
 * A retryable failure inside a pipeline stage: an I/O hiccup, a collaborator timeout or a 5xx reply.
 */
public class TransientStageException extends Exception {

    public TransientStageException(String message) {
        super(message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
