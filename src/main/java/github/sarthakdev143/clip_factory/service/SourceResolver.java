package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.model.JobInput;

import java.nio.file.Path;

public interface SourceResolver {

    /**
     * Makes the job's source available as a local file inside {@code workDir} (or returns the stored upload).
     */
    Path resolve(JobInput input, Path workDir) throws TransientStageException, JobFailureException;
}
