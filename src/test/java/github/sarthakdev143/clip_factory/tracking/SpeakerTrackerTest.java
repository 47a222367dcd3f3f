package github.sarthakdev143.clip_factory.tracking;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeakerTrackerTest {

    @Test
    void firstLeadingSpeakerIsLockedImmediatelyAndEntersCooldown() {
        SpeakerTracker tracker = new SpeakerTracker(15, 30);

        assertThat(tracker.observe(null)).isNull();
        assertThat(tracker.observe("a")).isEqualTo("a");
        assertThat(tracker.stateOf("a")).isEqualTo(SpeakerState.COOLDOWN);
        assertThat(tracker.switchCount()).isZero();
    }

    @Test
    void challengerNeedsFifteenConsecutiveFramesAfterCooldown() {
        SpeakerTracker tracker = new SpeakerTracker(15, 30);
        tracker.observe("a");

        List<String> targets = new ArrayList<>();
        for (int frame = 1; frame <= 60; frame++) {
            targets.add(tracker.observe("b"));
        }

        // frames 1-30 are cooldown, 31-45 build the candidate; the switch lands on frame 45
        assertThat(targets.subList(0, 44)).containsOnly("a");
        assertThat(targets.get(44)).isEqualTo("b");
        assertThat(tracker.stateOf("b")).isEqualTo(SpeakerState.COOLDOWN);
        assertThat(tracker.stateOf("a")).isEqualTo(SpeakerState.IDLE);
        assertThat(tracker.switchCount()).isEqualTo(1);
    }

    @Test
    void candidateProgressResetsWhenActiveSpeakerLeadsAgain() {
        SpeakerTracker tracker = new SpeakerTracker(15, 0);
        tracker.observe("a");

        for (int frame = 0; frame < 14; frame++) {
            tracker.observe("b");
        }
        assertThat(tracker.stateOf("b")).isEqualTo(SpeakerState.CANDIDATE);

        tracker.observe("a");
        assertThat(tracker.stateOf("b")).isEqualTo(SpeakerState.IDLE);

        for (int frame = 0; frame < 14; frame++) {
            assertThat(tracker.observe("b")).isEqualTo("a");
        }
        assertThat(tracker.observe("b")).isEqualTo("b");
    }

    @Test
    void signalTogglingEveryFrameNeverSwitches() {
        SpeakerTracker tracker = new SpeakerTracker(15, 30);
        for (int frame = 0; frame < 1000; frame++) {
            tracker.observe(frame % 2 == 0 ? "a" : "b");
        }

        assertThat(tracker.activeSpeaker()).isEqualTo("a");
        assertThat(tracker.switchCount()).isZero();
    }

    @Test
    void switchesAreAtLeastStabilizationPlusCooldownApart() {
        SpeakerTracker tracker = new SpeakerTracker(15, 30);
        List<Integer> switchFrames = new ArrayList<>();
        String previous = null;
        for (int frame = 0; frame < 600; frame++) {
            // the loudest speaker flips every 20 frames
            String leading = (frame / 20) % 2 == 0 ? "a" : "b";
            String active = tracker.observe(leading);
            if (previous != null && !active.equals(previous)) {
                switchFrames.add(frame);
            }
            previous = active;
        }

        assertThat(switchFrames).isNotEmpty();
        for (int index = 1; index < switchFrames.size(); index++) {
            assertThat(switchFrames.get(index) - switchFrames.get(index - 1)).isGreaterThanOrEqualTo(45);
        }
    }

    @Test
    void missingDetectionsDoNotAdvanceChallengers() {
        SpeakerTracker tracker = new SpeakerTracker(3, 0);
        tracker.observe("a");
        tracker.observe("b");
        tracker.observe("b");
        tracker.observe(null);
        tracker.observe("b");

        assertThat(tracker.activeSpeaker()).isEqualTo("a");
    }

    @Test
    void rejectsInvalidWindows() {
        assertThatThrownBy(() -> new SpeakerTracker(0, 30)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpeakerTracker(15, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
