package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.dto.JobResultResponse;
import github.sarthakdev143.clip_factory.dto.JobStatusResponse;
import github.sarthakdev143.clip_factory.model.ClipResult;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.model.JobResult;
import github.sarthakdev143.clip_factory.model.JobStatus;
import github.sarthakdev143.clip_factory.model.PipelineStage;
import github.sarthakdev143.clip_factory.model.Transcript;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobProjectionTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final JobProjection projection = new JobProjection();

    @Test
    void statusOfRunningJobHasNoError() {
        Job job = queued().markProcessing(NOW).withStage(PipelineStage.ANALYZING);

        JobStatusResponse status = projection.toStatus(job);

        assertThat(status.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(status.progressPercentage()).isEqualTo(50);
        assertThat(status.progressStage()).isEqualTo("AI analysis");
        assertThat(status.startedAt()).isEqualTo(NOW);
        assertThat(status.error()).isNull();
        assertThat(status.logs()).hasSize(1);
    }

    @Test
    void statusOfFailedJobCarriesError() {
        Job job = queued().markProcessing(NOW).markFailed("No viral segments found", NOW);

        assertThat(projection.toStatus(job).error()).isEqualTo("No viral segments found");
    }

    @Test
    void resultIsHiddenUntilCompleted() {
        JobResultResponse pending = projection.toResult(queued().markProcessing(NOW));

        assertThat(pending.result()).isNull();
        assertThat(pending.completedAt()).isNull();
        assertThat(pending.status()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void failedJobHasCompletionTimeButNoResult() {
        JobResultResponse failed = projection.toResult(queued().markFailed("boom", NOW.plusSeconds(5)));

        assertThat(failed.result()).isNull();
        assertThat(failed.completedAt()).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    void completedJobExposesClipsAndTranscript() {
        Transcript transcript = new Transcript("en", List.of());
        ClipResult clip = new ClipResult(1, "/videos/job-1/job-1_clip_1.mp4", "Title", "tt", "ig", "yt");
        Job job = queued().markProcessing(NOW).markCompleted(new JobResult(List.of(clip), transcript), NOW);

        JobResultResponse response = projection.toResult(job);

        assertThat(response.result().clips()).containsExactly(new JobResultResponse.Clip(
                1, "/videos/job-1/job-1_clip_1.mp4", "Title", "tt", "ig", "yt"));
        assertThat(response.result().transcript()).isSameAs(transcript);
        assertThat(response.completedAt()).isEqualTo(NOW);
    }

    private static Job queued() {
        return Job.queued("job-1", JobInput.ofUrl("https://example.com/v"), null, NOW);
    }
}
