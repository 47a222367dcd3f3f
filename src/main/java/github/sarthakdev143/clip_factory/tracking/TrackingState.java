package github.sarthakdev143.clip_factory.tracking;

/**
 * Per-clip tracker state. Created for one clip's frames and discarded afterwards.
 */
class TrackingState {

    final SmoothedCameraman cameraman;
    final SpeakerTracker speakerTracker;
    private final int modeStabilizationFrames;

    FramingMode mode;
    private FramingMode pendingMode;
    private int pendingModeFrames;
    CropWindow lastWindow;

    TrackingState(SmoothedCameraman cameraman, SpeakerTracker speakerTracker, int modeStabilizationFrames) {
        this.cameraman = cameraman;
        this.speakerTracker = speakerTracker;
        this.modeStabilizationFrames = modeStabilizationFrames;
    }

    /**
     * Applies the same consecutive-frame rule as speaker switching to single/letterbox changes.
     */
    FramingMode resolveMode(FramingMode desired) {
        if (mode == null) {
            mode = desired;
            return mode;
        }
        if (desired == mode) {
            pendingMode = null;
            pendingModeFrames = 0;
            return mode;
        }
        if (desired == pendingMode) {
            pendingModeFrames++;
        } else {
            pendingMode = desired;
            pendingModeFrames = 1;
        }
        if (pendingModeFrames >= modeStabilizationFrames) {
            mode = desired;
            pendingMode = null;
            pendingModeFrames = 0;
        }
        return mode;
    }
}
