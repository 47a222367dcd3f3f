package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient stage failures. After the last attempt the transient
 * failure becomes a {@link JobFailureException}.
 */
@Component
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final MeterRegistry meterRegistry;
    private final Sleeper sleeper;

    @Autowired
    public RetryPolicy(ClipFactoryProperties properties, MeterRegistry meterRegistry) {
        this(properties.retry(), meterRegistry, Thread::sleep);
    }

    RetryPolicy(ClipFactoryProperties.Retry retry, MeterRegistry meterRegistry, Sleeper sleeper) {
        if (retry.maxAttempts() < 1) {
            throw new IllegalArgumentException("clip-factory.retry.max-attempts must be at least 1.");
        }
        this.maxAttempts = retry.maxAttempts();
        this.initialDelay = retry.initialDelay();
        this.multiplier = retry.multiplier();
        this.meterRegistry = meterRegistry;
        this.sleeper = sleeper;
    }

    public <T> T execute(String stage, String jobId, StageOperation<T> operation) throws JobFailureException {
        long delayMillis = initialDelay.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.run();
            } catch (TransientStageException e) {
                if (attempt >= maxAttempts) {
                    throw new JobFailureException(
                            stage + " failed after " + attempt + " attempts: " + e.getMessage(), e);
                }
                meterRegistry.counter("clip_factory.stage.retries", "stage", stage).increment();
                logger.warn("Job {} stage '{}' failed (attempt {}/{}): {}. Retrying in {}ms",
                        jobId, stage, attempt, maxAttempts, e.getMessage(), delayMillis);
                pause(delayMillis, stage);
                delayMillis = Math.round(delayMillis * multiplier);
            }
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public long delayBeforeRetryMillis(int retry) {
        return Math.round(initialDelay.toMillis() * Math.pow(multiplier, retry - 1));
    }

    void pause(long delayMillis, String stage) throws JobFailureException {
        try {
            sleeper.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobFailureException("Interrupted while waiting to retry " + stage, e);
        }
    }

    @FunctionalInterface
    public interface StageOperation<T> {
        T run() throws TransientStageException, JobFailureException;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
