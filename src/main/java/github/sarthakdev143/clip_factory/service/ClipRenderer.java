package github.sarthakdev143.clip_factory.service;

import github.sarthakdev143.clip_factory.model.VideoInfo;
import github.sarthakdev143.clip_factory.tracking.CropWindow;

import java.nio.file.Path;
import java.util.List;

public interface ClipRenderer {

    int OUTPUT_WIDTH = 1080;
    int OUTPUT_HEIGHT = 1920;

    /**
     * Cuts {@code [startSec, endSec)} out of the source into a standalone file.
     */
    void extractSegment(Path source, double startSec, double endSec, Path output)
            throws TransientStageException, JobFailureException;

    /**
     * Renders the vertical clip following {@code trajectory}, one crop window per frame, with the
     * segment's audio. When {@code captionFile} is not null its subtitles are burned in.
     */
    void renderVertical(Path segment, VideoInfo info, List<CropWindow> trajectory, Path captionFile, Path output)
            throws TransientStageException, JobFailureException;
}
