package github.sarthakdev143.clip_factory.model;

public record VideoInfo(int width, int height, double fps, double durationSec) {

    public VideoInfo {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Video dimensions must be positive.");
        }
        fps = fps > 0 ? fps : 30.0;
    }
}
