package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.model.VideoInfo;

import java.nio.file.Path;

public interface MediaProbe {

    VideoInfo probe(Path video) throws TransientStageException, JobFailureException;
}
