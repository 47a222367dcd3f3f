package github.sarthakdev143.clip_factory.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.sarthakdev143.clip_factory.model.JobStatus;
import github.sarthakdev143.clip_factory.model.Transcript;

import java.time.Instant;
import java.util.List;

/**
 * {@code result} is null until the job has completed; {@code status} always carries the current state.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResultResponse(
        String jobId,
        JobStatus status,
        Result result,
        Instant completedAt) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Result(List<Clip> clips, Transcript transcript) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Clip(
            int index,
            String videoUrl,
            String title,
            String descriptionTiktok,
            String descriptionInstagram,
            String descriptionYoutube) {
    }
}
