package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobResult;
import github.sarthakdev143.clip_factory.model.PipelineStage;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.store.JobStore;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * Writes a running job's progress to the store. Store outages are retried with the stage retry backoff;
 * when they persist the write fails with {@code Job store unavailable: ...}.
 */
@Component
public class JobProgressRecorder {

    private static final Logger logger = LoggerFactory.getLogger(JobProgressRecorder.class);

    private final JobStore jobStore;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int maxLogLines;

    public JobProgressRecorder(JobStore jobStore, RetryPolicy retryPolicy, Clock clock, ClipFactoryProperties properties) {
        this.jobStore = jobStore;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.maxLogLines = properties.maxLogLines();
    }

    public Job start(String jobId) throws JobFailureException {
        return write(jobId, job -> job.markProcessing(clock.instant())
                .withLog(clock.instant(), "Job started by worker.", maxLogLines));
    }

    public Job enterStage(String jobId, PipelineStage stage) throws JobFailureException {
        return write(jobId, job -> job.withStage(stage)
                .withLog(clock.instant(), stage.label() + " (" + stage.percentage() + "%)", maxLogLines));
    }

    public Job log(String jobId, String message) throws JobFailureException {
        return write(jobId, job -> job.withLog(clock.instant(), message, maxLogLines));
    }

    public Job complete(String jobId, JobResult result, String message) throws JobFailureException {
        return write(jobId, job -> job.withLog(clock.instant(), message, maxLogLines)
                .markCompleted(result, clock.instant()));
    }

    /**
     * Best effort: a failure that cannot be recorded is logged, since the job has nowhere else to report it.
     */
    public void fail(String jobId, String error) {
        try {
            write(jobId, job -> job.status().isTerminal()
                    ? job
                    : job.withLog(clock.instant(), "Job failed: " + error, maxLogLines).markFailed(error, clock.instant()));
        } catch (JobFailureException e) {
            logger.error("Could not record failure of job {} ({}); it stays unresolved until expiry", jobId, error, e);
        }
    }

    private Job write(String jobId, UnaryOperator<Job> mutator) throws JobFailureException {
        long delayMillis = retryPolicy.delayBeforeRetryMillis(1);
        for (int attempt = 1; ; attempt++) {
            try {
                return jobStore.update(jobId, mutator)
                        .orElseThrow(() -> new JobFailureException("Job " + jobId + " no longer exists in the store."));
            } catch (StoreUnavailableException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    throw new JobFailureException("Job store unavailable: " + e.getMessage(), e);
                }
                logger.warn("Job store write for job {} failed (attempt {}/{}): {}",
                        jobId, attempt, retryPolicy.maxAttempts(), e.getMessage());
                retryPolicy.pause(delayMillis, "store write");
                delayMillis = retryPolicy.delayBeforeRetryMillis(attempt + 1);
            }
        }
    }
}
