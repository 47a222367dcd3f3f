package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.dto.JobResultResponse;
import github.sarthakdev143.clip_factory.dto.JobStatusResponse;
import github.sarthakdev143.clip_factory.model.ClipResult;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobResult;
import github.sarthakdev143.clip_factory.model.JobStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Read-side mapping from a stored job snapshot to the polled JSON shapes. Pure; never touches the store.
 */
@Component
public class JobProjection {

    public JobStatusResponse toStatus(Job job) {
        return new JobStatusResponse(
                job.jobId(),
                job.status(),
                job.progressPercentage(),
                job.progressStage(),
                job.logs(),
                job.createdAt(),
                job.startedAt(),
                job.status() == JobStatus.FAILED ? job.error() : null);
    }

    public JobResultResponse toResult(Job job) {
        JobResult result = job.status() == JobStatus.COMPLETED ? job.result() : null;
        return new JobResultResponse(
                job.jobId(),
                job.status(),
                result == null ? null : new JobResultResponse.Result(toClips(result.clips()), result.transcript()),
                job.status().isTerminal() ? job.completedAt() : null);
    }

    private List<JobResultResponse.Clip> toClips(List<ClipResult> clips) {
        return clips.stream()
                .map(clip -> new JobResultResponse.Clip(
                        clip.index(),
                        clip.videoUrl(),
                        clip.title(),
                        clip.descriptionTiktok(),
                        clip.descriptionInstagram(),
                        clip.descriptionYoutube()))
                .toList();
    }
}
