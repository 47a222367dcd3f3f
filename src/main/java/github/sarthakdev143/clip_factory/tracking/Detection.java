package github.sarthakdev143.clip_factory.tracking;

/**
 * One detected subject box in source-frame pixels. {@code trackId} stays the same when the detector
 * re-identifies the same person on a later frame.
 */
public record Detection(String trackId, double x, double y, double width, double height, double confidence) {

    public Detection {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Detection box must have non-negative size.");
        }
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }
}
