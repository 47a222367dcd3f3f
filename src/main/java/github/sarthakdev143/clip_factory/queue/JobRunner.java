package github.sarthakdev143.clip_factory.queue;

/**
 * Runs one admitted job to a terminal state. Implementations should record failures on the job rather
 * than throw; anything thrown is logged by the admission controller and the slot is still released.
 */
@FunctionalInterface
public interface JobRunner {

    void run(String jobId);
}
