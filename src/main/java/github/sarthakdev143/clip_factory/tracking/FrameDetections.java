package github.sarthakdev143.clip_factory.tracking;

import java.util.List;

public record FrameDetections(int frameIndex, List<Detection> detections) {

    public FrameDetections {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }
}
