package github.sarthakdev143.clip_factory.tracking;

/**
 * How a detection is scored when deciding who is the most plausible active speaker on a frame.
 */
public enum ActiveSpeakerSignal {
    AREA,
    CONFIDENCE,
    AREA_CONFIDENCE;

    public double score(Detection detection) {
        return switch (this) {
            case AREA -> detection.area();
            case CONFIDENCE -> detection.confidence();
            case AREA_CONFIDENCE -> detection.area() * Math.max(detection.confidence(), 0.0);
        };
    }
}
