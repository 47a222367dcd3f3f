package github.sarthakdev143.clip_factory.store;

import github.sarthakdev143.clip_factory.model.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable job records with a fixed expiry measured from each job's creation time. Every method throws
 * {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface JobStore {

    void create(Job job);

    Optional<Job> get(String jobId);

    /**
     * Applies {@code mutator} to the latest snapshot and writes the result atomically for that job.
     * Returns empty when the job does not exist or has expired.
     */
    Optional<Job> update(String jobId, UnaryOperator<Job> mutator);

    List<Job> findAll();

    boolean isAvailable();
}
