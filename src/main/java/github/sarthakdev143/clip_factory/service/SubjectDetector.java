package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.tracking.FrameDetections;

import java.nio.file.Path;
import java.util.List;

public interface SubjectDetector {

    /**
     * Per-frame subject boxes for {@code clip}. Frames without detections may be omitted.
     */
    List<FrameDetections> detect(Path clip, Path workDir) throws TransientStageException, JobFailureException;
}
