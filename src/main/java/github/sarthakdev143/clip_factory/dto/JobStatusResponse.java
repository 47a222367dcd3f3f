package github.sarthakdev143.clip_factory.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.sarthakdev143.clip_factory.model.JobStatus;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobStatusResponse(
        String jobId,
        JobStatus status,
        int progressPercentage,
        String progressStage,
        List<String> logs,
        Instant createdAt,
        Instant startedAt,
        String error) {

    public JobStatusResponse {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
