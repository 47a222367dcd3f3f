package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.model.Job;

import java.io.IOException;
import java.util.Optional;

public interface ClipJobService {

    /**
     * Validates the submission, stores a queued job and hands its id to the admission controller.
     *
     * @throws IllegalArgumentException when the submission is invalid; no job is created
     * @throws github.sarthakdev143.clip_factory.store.StoreUnavailableException when the job store is unreachable
     */
    Job submit(ClipSubmission submission) throws IOException;

    Optional<Job> getJob(String jobId);

    boolean isStoreAvailable();
}
