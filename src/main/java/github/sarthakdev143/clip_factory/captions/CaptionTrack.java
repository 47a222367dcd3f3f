package github.sarthakdev143.clip_factory.captions;

/**
 * A rendered subtitle document plus whether it had to fall back to sentence-level timing.
 */
public record CaptionTrack(String document, int eventCount, boolean degradedToSegmentTiming) {

    public boolean isEmpty() {
        return eventCount == 0;
    }
}
