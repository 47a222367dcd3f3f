package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.ViralSegment;

import java.util.List;

public interface ContentAnalyzer {

    /**
     * Returns candidate segments in the collaborator's order. The list may contain unusable entries;
     * callers filter them.
     */
    List<ViralSegment> analyze(Transcript transcript, String apiKey) throws TransientStageException, JobFailureException;
}
