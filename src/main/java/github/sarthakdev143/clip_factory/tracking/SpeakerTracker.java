package github.sarthakdev143.clip_factory.tracking;

import java.util.HashMap;
import java.util.Map;

/**
 * Hysteresis over the per-frame "who is speaking" signal. Each identity runs a small state machine
 * (idle, candidate, stabilized, cooldown); the framing target changes only after a challenger has led for
 * {@code stabilizationFrames} consecutive frames, and never during the {@code cooldownFrames} after a change.
 */
public class SpeakerTracker {

    private final int stabilizationFrames;
    private final int cooldownFrames;
    private final Map<String, TrackedSpeaker> speakers = new HashMap<>();
    private String activeSpeakerId;
    private int switchCount;

    public SpeakerTracker(int stabilizationFrames, int cooldownFrames) {
        if (stabilizationFrames < 1) {
            throw new IllegalArgumentException("stabilizationFrames must be at least 1.");
        }
        if (cooldownFrames < 0) {
            throw new IllegalArgumentException("cooldownFrames must not be negative.");
        }
        this.stabilizationFrames = stabilizationFrames;
        this.cooldownFrames = cooldownFrames;
    }

    /**
     * Feeds one frame's leading identity (or {@code null} when nobody is detected) and returns the framing target.
     */
    public String observe(String leadingSpeakerId) {
        if (activeSpeakerId == null) {
            if (leadingSpeakerId != null) {
                activate(leadingSpeakerId);
            }
            return activeSpeakerId;
        }

        TrackedSpeaker active = speaker(activeSpeakerId);
        if (active.state == SpeakerState.COOLDOWN) {
            active.counter--;
            if (active.counter <= 0) {
                active.state = SpeakerState.STABILIZED;
                active.counter = 0;
            }
            resetCandidatesExcept(null);
            return activeSpeakerId;
        }

        if (leadingSpeakerId == null || leadingSpeakerId.equals(activeSpeakerId)) {
            resetCandidatesExcept(null);
            return activeSpeakerId;
        }

        resetCandidatesExcept(leadingSpeakerId);
        TrackedSpeaker challenger = speaker(leadingSpeakerId);
        if (challenger.state == SpeakerState.CANDIDATE) {
            challenger.counter++;
        } else {
            challenger.state = SpeakerState.CANDIDATE;
            challenger.counter = 1;
        }

        if (challenger.counter >= stabilizationFrames) {
            active.state = SpeakerState.IDLE;
            active.counter = 0;
            activate(leadingSpeakerId);
            switchCount++;
        }
        return activeSpeakerId;
    }

    public String activeSpeaker() {
        return activeSpeakerId;
    }

    public SpeakerState stateOf(String speakerId) {
        TrackedSpeaker tracked = speakers.get(speakerId);
        return tracked == null ? SpeakerState.IDLE : tracked.state;
    }

    /**
     * Number of target changes after the first acquisition.
     */
    public int switchCount() {
        return switchCount;
    }

    private void activate(String speakerId) {
        TrackedSpeaker next = speaker(speakerId);
        activeSpeakerId = speakerId;
        if (cooldownFrames > 0) {
            next.state = SpeakerState.COOLDOWN;
            next.counter = cooldownFrames;
        } else {
            next.state = SpeakerState.STABILIZED;
            next.counter = 0;
        }
        resetCandidatesExcept(null);
    }

    private void resetCandidatesExcept(String keepId) {
        for (Map.Entry<String, TrackedSpeaker> entry : speakers.entrySet()) {
            TrackedSpeaker tracked = entry.getValue();
            if (tracked.state == SpeakerState.CANDIDATE && !entry.getKey().equals(keepId)) {
                tracked.state = SpeakerState.IDLE;
                tracked.counter = 0;
            }
        }
    }

    private TrackedSpeaker speaker(String speakerId) {
        return speakers.computeIfAbsent(speakerId, ignored -> new TrackedSpeaker());
    }

    private static final class TrackedSpeaker {
        private SpeakerState state = SpeakerState.IDLE;
        private int counter;
    }
}
