package github.sarthakdev143.clip_factory.tracking;

import java.time.Duration;

public record TrackerSettings(
        Duration smoothingTimeConstant,
        int stabilizationFrames,
        int cooldownFrames,
        double farApartRatio,
        double safeZoneMargin,
        ActiveSpeakerSignal activeSpeakerSignal) {

    public static final int DEFAULT_STABILIZATION_FRAMES = 15;
    public static final int DEFAULT_COOLDOWN_FRAMES = 30;

    public TrackerSettings {
        smoothingTimeConstant = smoothingTimeConstant == null ? Duration.ofMillis(500) : smoothingTimeConstant;
        if (smoothingTimeConstant.isNegative()) {
            throw new IllegalArgumentException("smoothingTimeConstant must not be negative.");
        }
        if (stabilizationFrames < 1) {
            throw new IllegalArgumentException("stabilizationFrames must be at least 1.");
        }
        if (cooldownFrames < 0) {
            throw new IllegalArgumentException("cooldownFrames must not be negative.");
        }
        if (farApartRatio <= 0) {
            throw new IllegalArgumentException("farApartRatio must be positive.");
        }
        if (safeZoneMargin < 0 || safeZoneMargin >= 0.5) {
            throw new IllegalArgumentException("safeZoneMargin must be in [0, 0.5).");
        }
        activeSpeakerSignal = activeSpeakerSignal == null ? ActiveSpeakerSignal.AREA_CONFIDENCE : activeSpeakerSignal;
    }

    public static TrackerSettings defaults() {
        return new TrackerSettings(
                Duration.ofMillis(500),
                DEFAULT_STABILIZATION_FRAMES,
                DEFAULT_COOLDOWN_FRAMES,
                1.0,
                0.1,
                ActiveSpeakerSignal.AREA_CONFIDENCE);
    }

    /**
     * Per-frame gain of the exponential low-pass filter for the given frame rate.
     */
    public double smoothingGain(double fps) {
        double tauSeconds = smoothingTimeConstant.toNanos() / 1_000_000_000.0;
        if (tauSeconds <= 0 || fps <= 0) {
            return 1.0;
        }
        return 1.0 - Math.exp(-1.0 / (fps * tauSeconds));
    }
}
