package github.sarthakdev143.clip_factory.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent record of one submission. Instances are immutable; every mutation returns a copy so the
 * store can swap whole snapshots atomically.
 */
public record Job(
        String jobId,
        JobStatus status,
        JobInput input,
        CaptionSettings captionSettings,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        int progressPercentage,
        String progressStage,
        List<String> logs,
        JobResult result,
        String error) {

    public static final String COMPLETED_STAGE = "Completed";

    public Job {
        logs = logs == null ? List.of() : List.copyOf(logs);
        captionSettings = captionSettings == null ? CaptionSettings.disabled() : captionSettings;
    }

    public static Job queued(String jobId, JobInput input, CaptionSettings captionSettings, Instant now) {
        return new Job(
                jobId,
                JobStatus.QUEUED,
                input,
                captionSettings,
                now,
                null,
                null,
                0,
                null,
                List.of(formatLogLine(now, "Job " + jobId + " queued.")),
                null,
                null);
    }

    public Job markProcessing(Instant now) {
        requireTransition(JobStatus.PROCESSING);
        return new Job(jobId, JobStatus.PROCESSING, input, captionSettings, createdAt,
                startedAt == null ? now : startedAt, completedAt, progressPercentage, progressStage, logs, result, error);
    }

    public Job withStage(PipelineStage stage) {
        return withProgress(stage.percentage(), stage.label());
    }

    /**
     * Progress never moves backwards; a lower percentage leaves the job unchanged.
     */
    public Job withProgress(int percentage, String stage) {
        if (status != JobStatus.PROCESSING || percentage < progressPercentage) {
            return this;
        }
        int bounded = Math.min(percentage, 100);
        return new Job(jobId, status, input, captionSettings, createdAt, startedAt, completedAt,
                bounded, stage == null ? progressStage : stage, logs, result, error);
    }

    public Job withLog(Instant now, String message, int maxLines) {
        List<String> appended = new ArrayList<>(logs.size() + 1);
        appended.addAll(logs);
        appended.add(formatLogLine(now, message));
        if (maxLines > 0 && appended.size() > maxLines) {
            appended = appended.subList(appended.size() - maxLines, appended.size());
        }
        return new Job(jobId, status, input, captionSettings, createdAt, startedAt, completedAt,
                progressPercentage, progressStage, appended, result, error);
    }

    public Job markCompleted(JobResult jobResult, Instant now) {
        if (jobResult == null) {
            throw new IllegalArgumentException("A completed job requires a result.");
        }
        requireTransition(JobStatus.COMPLETED);
        return new Job(jobId, JobStatus.COMPLETED, input, captionSettings, createdAt, startedAt,
                completedAt == null ? now : completedAt, 100, COMPLETED_STAGE, logs, jobResult, null);
    }

    public Job markFailed(String message, Instant now) {
        requireTransition(JobStatus.FAILED);
        String failure = message == null || message.isBlank() ? "Job failed." : message;
        return new Job(jobId, JobStatus.FAILED, input, captionSettings, createdAt, startedAt,
                completedAt == null ? now : completedAt, progressPercentage, progressStage, logs, null, failure);
    }

    public Instant expiresAt(Duration ttl) {
        return createdAt.plus(ttl);
    }

    private void requireTransition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + status + " to " + next + ".");
        }
    }

    static String formatLogLine(Instant now, String message) {
        return "[" + now + "] " + message;
    }
}
