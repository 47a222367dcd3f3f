package github.sarthakdev143.clip_factory.tracking;

/**
 * Moves a fixed-size vertical crop toward the tracked subject with an exponential low-pass filter,
 * then nudges it so the subject box stays inside the crop's inner safe region and the crop stays inside
 * the source frame.
 */
public class SmoothedCameraman {

    private final int frameWidth;
    private final int frameHeight;
    private final int cropWidth;
    private final int cropHeight;
    private final double gain;
    private final double safeZoneMargin;

    private boolean positioned;
    private double centerX;
    private double centerY;

    public SmoothedCameraman(
            int frameWidth,
            int frameHeight,
            int cropWidth,
            int cropHeight,
            double gain,
            double safeZoneMargin) {
        if (cropWidth > frameWidth || cropHeight > frameHeight) {
            throw new IllegalArgumentException("Crop must fit inside the source frame.");
        }
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.cropWidth = cropWidth;
        this.cropHeight = cropHeight;
        this.gain = Math.max(0.0, Math.min(gain, 1.0));
        this.safeZoneMargin = safeZoneMargin;
    }

    public boolean isPositioned() {
        return positioned;
    }

    /**
     * Places the crop on the subject without smoothing; used for the first lock of a clip.
     */
    public CropWindow lockOn(Detection subject) {
        centerX = subject.centerX();
        centerY = subject.centerY();
        positioned = true;
        applySafeZone(subject);
        return current();
    }

    public CropWindow follow(Detection subject) {
        if (!positioned) {
            return lockOn(subject);
        }
        centerX += gain * (subject.centerX() - centerX);
        centerY += gain * (subject.centerY() - centerY);
        applySafeZone(subject);
        return current();
    }

    public CropWindow current() {
        if (!positioned) {
            return centered(frameWidth, frameHeight, cropWidth, cropHeight);
        }
        int left = (int) Math.round(clamp(centerX - cropWidth / 2.0, 0, frameWidth - cropWidth));
        int top = (int) Math.round(clamp(centerY - cropHeight / 2.0, 0, frameHeight - cropHeight));
        return new CropWindow(left, top, cropWidth, cropHeight, FramingMode.SINGLE_SUBJECT);
    }

    public double centerX() {
        return centerX;
    }

    public double centerY() {
        return centerY;
    }

    private void applySafeZone(Detection subject) {
        centerX = safeAxis(centerX, cropWidth, subject.x(), subject.right(), frameWidth);
        centerY = safeAxis(centerY, cropHeight, subject.y(), subject.bottom(), frameHeight);
    }

    private double safeAxis(double center, int cropSize, double subjectStart, double subjectEnd, int frameSize) {
        double margin = cropSize * safeZoneMargin;
        double safeSize = cropSize - 2 * margin;
        double start = center - cropSize / 2.0;

        if (subjectEnd - subjectStart > safeSize) {
            start = (subjectStart + subjectEnd) / 2.0 - cropSize / 2.0;
        } else if (subjectStart < start + margin) {
            start = subjectStart - margin;
        } else if (subjectEnd > start + cropSize - margin) {
            start = subjectEnd - cropSize + margin;
        }

        start = clamp(start, 0, frameSize - cropSize);
        return start + cropSize / 2.0;
    }

    static CropWindow centered(int frameWidth, int frameHeight, int cropWidth, int cropHeight) {
        return new CropWindow(
                (frameWidth - cropWidth) / 2,
                (frameHeight - cropHeight) / 2,
                cropWidth,
                cropHeight,
                FramingMode.SINGLE_SUBJECT);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }
}
