package github.sarthakdev143.clip_factory.tracking;

/**
 * Region of the source frame shown for one output frame. In letterbox mode the window spans the whole
 * source frame and the renderer pads it into the vertical canvas.
 */
public record CropWindow(int x, int y, int width, int height, FramingMode mode) {

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public boolean samePlacement(CropWindow other) {
        return other != null
                && other.x == x
                && other.y == y
                && other.width == width
                && other.height == height
                && other.mode == mode;
    }
}
