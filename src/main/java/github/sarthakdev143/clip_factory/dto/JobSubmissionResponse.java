package github.sarthakdev143.clip_factory.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.sarthakdev143.clip_factory.model.JobStatus;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobSubmissionResponse(
        String jobId,
        JobStatus status) {
}
