package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.model.Transcript;

import java.nio.file.Path;

public interface Transcriber {

    Transcript transcribe(Path source, Path workDir) throws TransientStageException, JobFailureException;
}
